// This file is part of the FunElim Compiler (fec).
//
// The FunElim Compiler is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The FunElim Compiler is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the FunElim Compiler. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package funelim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * Abstracts the recursive calls of a right-hand side as induction hypotheses.
 * Every call to a function of the block which reaches its decreasing argument
 * gives rise to a hypothesis stating that the graph of the callee relates the
 * call's arguments to its result. Hypotheses are collected up to structural
 * equality, keeping the first occurrence.
 *
 * @author David J. Pearce
 *
 */
public class RecursiveCalls {
	/**
	 * Name given to each induction hypothesis.
	 */
	public static final String HYPOTHESIS = "Hind";

	private final Recursion.Descriptor recursion;
	private final Set<String> userObligations;
	private final List<Prototype> prototypes;
	private final boolean substitute;

	/**
	 * Construct a resolver for the calls of a given block.
	 *
	 * @param recursion       The recursion of the block, or <code>null</code>.
	 * @param userObligations Constants standing for proof obligations, which are
	 *                        never treated as calls.
	 * @param prototypes      The functions of the block.
	 * @param substitute      Whether references to the block's functions in
	 *                        obligations are replaced by the functions
	 *                        themselves.
	 */
	public RecursiveCalls(Recursion.Descriptor recursion, Set<String> userObligations, List<Prototype> prototypes,
			boolean substitute) {
		this.recursion = recursion;
		this.userObligations = userObligations;
		this.prototypes = prototypes;
		this.substitute = substitute;
	}

	/**
	 * Abstract the recursive calls of a term living in a context of a given
	 * length.
	 *
	 * @param length
	 * @param term
	 * @return
	 */
	public Hypotheses abstractCalls(int length, Term term) {
		Resolver resolver = new Resolver(length);
		Pair<Map<Term, Integer>, Term> r = resolver.apply(0, new LinkedHashMap<>(), term);
		return clean(r.first(), r.second());
	}

	/**
	 * The induction hypotheses of a term, bound innermost last, together with
	 * the term lifted over them.
	 */
	public static class Hypotheses {
		private final Context context;
		private final Term term;

		public Hypotheses(Context context, Term term) {
			this.context = context;
			this.term = term;
		}

		public Context context() {
			return context;
		}

		public int count() {
			return context.size();
		}

		public Term term() {
			return term;
		}

		@Override
		public String toString() {
			return context + " |- " + term;
		}
	}

	/**
	 * A call recognised against a prototype. When the call is partial, the
	 * signature binds the missing arguments.
	 */
	public static class Call {
		private final Prototype prototype;
		private final int[] filter;
		private final Context signature;
		private final List<Term> arguments;
		private final List<Term> rest;

		public Call(Prototype prototype, int[] filter, Context signature, List<Term> arguments, List<Term> rest) {
			this.prototype = prototype;
			this.filter = filter;
			this.signature = signature;
			this.arguments = arguments;
			this.rest = rest;
		}

		public Prototype prototype() {
			return prototype;
		}

		public int[] filter() {
			return filter;
		}

		public Context signature() {
			return signature;
		}

		public List<Term> arguments() {
			return arguments;
		}

		/**
		 * Arguments beyond those of the function itself.
		 *
		 * @return
		 */
		public List<Term> rest() {
			return rest;
		}
	}

	/**
	 * Recognise an application of a given head to some arguments as a call to
	 * one of the prototypes.
	 *
	 * @param head
	 * @param args
	 * @return
	 */
	public Optional<Call> findRecursiveCall(Term head, List<Term> args) {
		for (Prototype proto : prototypes) {
			Pair<Term, List<Term>> fn = Terms.decomposeApp(proto.function());
			Term f = fn.first();
			List<Term> fargs = fn.second();
			int nhyps = proto.signature().extendedRelList(0).size() + fargs.size();
			if (f.equals(head)) {
				Boolean applied = isAppliedToStructuralArgument(f, args.size());
				if (applied == null || applied) {
					if (nhyps <= args.size()) {
						return Optional.of(new Call(proto, proto.filter(), Context.EMPTY, args.subList(0, nhyps),
								args.subList(nhyps, args.size())));
					} else {
						Context sign = substituteArguments(args.subList(fargs.size(), args.size()),
								proto.signature());
						List<Term> nargs = new ArrayList<>(Terms.lift(sign.size(), args));
						nargs.addAll(sign.extendedRelList(0));
						return Optional.of(new Call(proto, proto.filter(), sign, nargs, Collections.emptyList()));
					}
				}
			} else if (proto.alias() != null) {
				Term alias = Terms.head(proto.alias().function());
				if (Terms.head(alias).equals(head)) {
					return Optional.of(new Call(proto, proto.alias().filter(), Context.EMPTY, args,
							Collections.emptyList()));
				}
			}
		}
		return Optional.empty();
	}

	private Boolean isAppliedToStructuralArgument(Term f, int arguments) {
		if (f instanceof Term.Const && recursion instanceof Recursion.Guarded) {
			Recursion.Guarded g = (Recursion.Guarded) recursion;
			return g.isAppliedToStructuralArgument(((Term.Const) f).name(), arguments);
		}
		return null;
	}

	private boolean isUserObligation(Term f) {
		return f instanceof Term.Const && userObligations.contains(((Term.Const) f).name());
	}

	/**
	 * Instantiate the outermost assumptions of a signature with given arguments,
	 * returning the remaining signature.
	 *
	 * @param args
	 * @param sign
	 * @return
	 */
	public static Context substituteArguments(List<Term> args, Context sign) {
		int i = 0;
		while (i < args.size()) {
			Anomaly.check(!sign.isEmpty(), "more arguments than the signature binds", args, sign);
			Declaration d = sign.get(sign.size());
			Term v = d.isDefinition() ? d.value() : args.get(i++);
			sign = sign.take(sign.size() - 1).subst1(v);
		}
		return sign;
	}

	/**
	 * Traverses a term collecting hypotheses. The occurrence counter orders
	 * hypotheses by discovery.
	 */
	private class Resolver {
		private final int length;
		private final List<Term> functions;
		private int occurrence;

		public Resolver(int length) {
			this.length = length;
			this.functions = new ArrayList<>();
			for (Prototype p : prototypes) {
				functions.add(p.function());
			}
		}

		public Pair<Map<Term, Integer>, Term> apply(int n, Map<Term, Integer> hyps, Term c) {
			if (c instanceof Term.Lambda) {
				Term.Lambda l = (Term.Lambda) c;
				Map<Term, Integer> inner = apply(n + 1, new LinkedHashMap<>(), l.body()).first();
				inner = map(inner, ty -> new Term.Product(l.name(), l.type(), ty));
				return new Pair<>(union(hyps, inner), c);
			} else if (c instanceof Term.LetIn) {
				Term.LetIn l = (Term.LetIn) c;
				Map<Term, Integer> outer = apply(n, hyps, l.value()).first();
				Map<Term, Integer> inner = apply(n + 1, new LinkedHashMap<>(), l.body()).first();
				inner = map(inner, ty -> new Term.LetIn(l.name(), l.value(), l.type(), ty));
				return new Pair<>(union(outer, inner), c);
			} else if (c instanceof Term.Product && Terms.noccurn(1, ((Term.Product) c).body())) {
				Term.Product p = (Term.Product) c;
				Pair<Map<Term, Integer>, Term> d = apply(n, hyps, p.type());
				Pair<Map<Term, Integer>, Term> b = apply(n, d.first(), Terms.subst1(Terms.PROP, p.body()));
				return new Pair<>(b.first(), new Term.Product(p.name(), d.second(), Terms.lift(1, b.second())));
			} else if (c instanceof Term.Case) {
				Term.Case k = (Term.Case) c;
				Pair<Map<Term, Integer>, Term> d = apply(n, hyps, k.discriminee());
				Map<Term, Integer> nhyps = d.first();
				for (Term br : k.branches()) {
					nhyps = apply(n, nhyps, br).first();
				}
				Term ncase = new Term.Case(k.predicate(), d.second(), k.branches());
				return new Pair<>(nhyps, Terms.substnl(functions, length + 1, ncase));
			} else if (c instanceof Term.Proj) {
				Term.Proj p = (Term.Proj) c;
				Pair<Map<Term, Integer>, Term> r = apply(n, hyps, p.operand());
				return new Pair<>(r.first(), new Term.Proj(p.projection(), r.second()));
			} else {
				return applyCall(n, hyps, c);
			}
		}

		private Pair<Map<Term, Integer>, Term> applyCall(int n, Map<Term, Integer> hyps, Term c) {
			Pair<Term, List<Term>> app = Terms.decomposeApp(c);
			Term f = app.first();
			List<Term> args = app.second();
			if (isUserObligation(f)) {
				Term nc = substitute ? Terms.substnl(functions, length + n, c) : c;
				return new Pair<>(hyps, nc);
			}
			for (Term arg : args) {
				hyps = apply(n, hyps, arg).first();
			}
			Optional<Call> call = findRecursiveCall(f, args);
			if (!call.isPresent()) {
				return new Pair<>(hyps, c);
			}
			Call rc = call.get();
			Context sign = rc.signature();
			List<Term> fargs = Computation.filterArguments(rc.filter(), rc.arguments());
			Term result = Terms.itMkLambdaOrLetIn(Terms.applist(f, rc.arguments()), sign);
			Term graph = new Term.Rel(rc.prototype().index() + 1 + length + n + sign.size());
			Term value = Terms.applist(Terms.lift(sign.size(), result), sign.extendedRelList(0));
			Term hyp = Terms.itMkProdOrLetIn(Terms.applist(Terms.applist(graph, fargs), value), sign);
			hyps = union(hyps, Collections.singletonMap(hyp, occurrence++));
			return new Pair<>(hyps, Terms.applist(result, rc.rest()));
		}
	}

	private static Map<Term, Integer> map(Map<Term, Integer> hyps, java.util.function.Function<Term, Term> fn) {
		Map<Term, Integer> r = new LinkedHashMap<>();
		for (Map.Entry<Term, Integer> e : hyps.entrySet()) {
			r.merge(fn.apply(e.getKey()), e.getValue(), Math::min);
		}
		return r;
	}

	private static Map<Term, Integer> union(Map<Term, Integer> left, Map<Term, Integer> right) {
		Map<Term, Integer> r = new LinkedHashMap<>(left);
		for (Map.Entry<Term, Integer> e : right.entrySet()) {
			r.merge(e.getKey(), e.getValue(), Math::min);
		}
		return r;
	}

	/**
	 * Remove hypotheses subsumed by others, and bind the remainder in order of
	 * occurrence.
	 *
	 * @param hyps
	 * @param term
	 * @return
	 */
	private static Hypotheses clean(Map<Term, Integer> hyps, Term term) {
		Map<Term, Integer> kept = new LinkedHashMap<>();
		Map<Term, Integer> underContext = new LinkedHashMap<>();
		for (Map.Entry<Term, Integer> e : hyps.entrySet()) {
			if (e.getKey() instanceof Term.Product || e.getKey() instanceof Term.LetIn) {
				underContext.put(e.getKey(), e.getValue());
			} else {
				kept.put(e.getKey(), e.getValue());
			}
		}
		for (Map.Entry<Term, Integer> e : underContext.entrySet()) {
			Pair<Context, Term> p = Terms.decomposeProdAssum(e.getKey());
			int len = p.first().size();
			Term concl = p.second();
			if (!(Terms.noccurBetween(1, len, concl) && kept.containsKey(Terms.lift(-len, concl)))) {
				kept.put(e.getKey(), e.getValue());
			}
		}
		List<Map.Entry<Term, Integer>> elems = new ArrayList<>(kept.entrySet());
		elems.sort((x, y) -> Integer.compare(x.getValue(), y.getValue()));
		Context ctx = Context.EMPTY;
		for (int i = 0; i != elems.size(); ++i) {
			ctx = ctx.push(new Declaration(HYPOTHESIS, Terms.lift(i, elems.get(i).getKey())));
		}
		return new Hypotheses(ctx, Terms.lift(ctx.size(), term));
	}
}
