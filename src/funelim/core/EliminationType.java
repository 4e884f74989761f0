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
import java.util.Arrays;
import java.util.List;

import funelim.core.Computation.Header;
import funelim.core.Computation.NodeKind;
import funelim.core.Statements.Group;
import funelim.core.Statements.Statement;
import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * <p>
 * Synthesises the type of the elimination principle of a function from the
 * induction scheme of its graph. The scheme quantifies over one predicate per
 * relation of the graph, then one method per constructor, and concludes that
 * every relation implies its predicate.
 * </p>
 * <p>
 * When the graph has a single relation which functions define, the predicate's
 * argument standing for the function's result is instantiated by the function
 * itself, and the proof of the relation is dropped. Otherwise, the conclusion is
 * a conjunction over those relations, and the predicates of refinements are
 * defined in terms of the predicate of the computation they refine.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class EliminationType {
	private static final boolean DEBUG = false;

	private final Logic logic;
	private final RecursiveCalls resolver;

	/**
	 * Construct a synthesiser.
	 *
	 * @param logic
	 * @param resolver Recognises recursive calls in refined objects. This should
	 *                 not substitute user obligations.
	 */
	public EliminationType(Logic logic, RecursiveCalls resolver) {
		this.logic = logic;
		this.resolver = resolver;
	}

	/**
	 * Compute the type of the elimination principle.
	 *
	 * @param block  The name of the graph's inductive block
	 * @param groups The statements of each relation in the block
	 * @param sign   The signature of the main function
	 * @param app    The main function applied to its signature
	 * @param scheme The type of the graph's induction scheme
	 * @return
	 */
	public Principle compute(String block, List<Group> groups, Context sign, Term app, Term scheme) {
		Pair<Context, Term> d = Terms.decomposeProdAssum(scheme);
		Context ctx = d.first();
		Term arity = d.second();
		int leninds = groups.size();
		int lenrealinds = 0;
		for (Group g : groups) {
			if (g.header().kind().isRegularOrNestedRecursive()) {
				lenrealinds++;
			}
		}
		Context newctx;
		Term newarity;
		if (lenrealinds == 1) {
			// Drop the relation's arguments and its proof
			newctx = ctx.skip(sign.size() + 2);
			newarity = Terms.itMkProdOrLetIn(Terms.substl(Arrays.asList(Terms.PROP, app), arity), sign);
		} else {
			newctx = ctx;
			newarity = cleanConjunction(arity, groups, 0);
		}
		Context cleared = clearInductiveAssumptions(block, newctx);
		if (leninds == 1) {
			return new Principle(Terms.itMkProdOrLetIn(newarity, cleared), cleared.size());
		}
		int nmethods = newctx.size() - leninds;
		Context methods = cleared.take(nmethods);
		Context preds = cleared.skip(nmethods);
		Declaration ppred = preds.get(preds.size());
		// Remaining predicates, innermost first
		ArrayList<Declaration> newpreds = new ArrayList<>();
		for (int i = 1; i < preds.size(); ++i) {
			newpreds.add(predicate(i, groups, preds.get(i), groups.get(leninds - i)));
		}
		// Refinements have no methods of their own
		List<Statement> all = new ArrayList<>();
		for (Group g : groups) {
			all.addAll(g.statements());
		}
		List<Declaration> rest = methods.toList();
		ArrayList<Declaration> kept = new ArrayList<>();
		int skipped = 0;
		for (Statement s : all) {
			if (s.kind() == NodeKind.REFINE && !rest.isEmpty()) {
				rest = Context.of(rest.subList(1, rest.size())).subst1(Terms.PROP).toList();
				skipped++;
			} else if (s.constructor() == null) {
				continue;
			} else if (rest.isEmpty()) {
				throw new Anomaly("more statements than declarations while computing eliminator", s);
			} else {
				kept.add(rest.get(0));
				rest = rest.subList(1, rest.size());
			}
		}
		kept.addAll(rest);
		Context result = Context.EMPTY.push(ppred);
		for (int i = newpreds.size() - 1; i >= 0; --i) {
			result = result.push(newpreds.get(i));
		}
		for (Declaration m : kept) {
			result = result.push(m);
		}
		int undefined = 0;
		for (Declaration p : newpreds) {
			if (!p.isDefinition()) {
				undefined++;
			}
		}
		Term type = Terms.itMkProdOrLetIn(Terms.lift(-skipped, newarity), result);
		if (DEBUG) {
			System.err.println("ELIMINATOR " + type + " (" + skipped + " refinements skipped)");
		}
		return new Principle(type, kept.size() + undefined + 1);
	}

	/**
	 * Clean the conjunction concluding a combined scheme, one conjunct for each
	 * relation which functions define.
	 *
	 * @param arity
	 * @param groups
	 * @param i
	 * @return
	 */
	private Term cleanConjunction(Term arity, List<Group> groups, int i) {
		if (i == groups.size()) {
			return arity;
		}
		Group g = groups.get(i);
		if (!g.header().kind().isRegularOrNestedRecursive()) {
			return cleanConjunction(arity, groups, i + 1);
		}
		Term[] conj = logic.destConj(arity);
		if (conj != null) {
			return logic.mkConj(cleanConjunct(conj[0], g.header()), cleanConjunction(conj[1], groups, i + 1));
		}
		return cleanConjunction(cleanConjunct(arity, g.header()), groups, i + 1);
	}

	private static Term cleanConjunct(Term conjunct, Header header) {
		Pair<Context, Term> d = Terms.decomposeProdAssum(conjunct);
		Context ctx = d.first().skip(2);
		Term fn = Terms.applist(header.function(), header.signature().extendedRelList(0));
		return Terms.itMkProdOrLetIn(Terms.substl(Arrays.asList(Terms.PROP, fn), d.second()), ctx);
	}

	/**
	 * Remove the graph hypotheses from the types of a context. These are the
	 * premises whose conclusion is one of the relations of the block.
	 *
	 * @param block
	 * @param ctx
	 * @return
	 */
	public static Context clearInductiveAssumptions(String block, Context ctx) {
		return ctx.map((depth, t) -> clear(block, t));
	}

	private static Term clear(String block, Term term) {
		if (term instanceof Term.Product) {
			Term.Product p = (Term.Product) term;
			if (isInductiveAssumption(block, p.type())) {
				Anomaly.check(!Terms.dependent(new Term.Rel(1), p.body()), "dependent graph hypothesis", term);
				return clear(block, Terms.subst1(Terms.PROP, p.body()));
			}
			Term body = clear(block, p.body());
			return body == p.body() ? term : new Term.Product(p.name(), p.type(), body);
		} else if (term instanceof Term.LetIn) {
			Term.LetIn l = (Term.LetIn) term;
			Term body = clear(block, l.body());
			return body == l.body() ? term : new Term.LetIn(l.name(), l.value(), l.type(), body);
		}
		return term;
	}

	private static boolean isInductiveAssumption(String block, Term type) {
		Term head = Terms.head(Terms.decomposeProdAssum(type).second());
		return head instanceof Term.Ind && ((Term.Ind) head).block().equals(block);
	}

	/**
	 * Define the predicate of a refinement in terms of the predicate of the
	 * computation it refines. The refined argument is related to the refined
	 * object by an equality, along which the patterns depending on it are
	 * transported. Other blocks keep their predicate abstract.
	 *
	 * @param i      The position of the predicate, innermost first
	 * @param groups
	 * @param decl
	 * @param group
	 * @return
	 */
	private Declaration predicate(int i, List<Group> groups, Declaration decl, Group group) {
		Header header = group.header();
		if (header.kind() != NodeKind.REFINE) {
			return decl;
		}
		Context sign = header.signature();
		int signlen = sign.size();
		Term arity = header.arity();
		Context ctx = sign.push(new Declaration(Syntax.ANONYMOUS, arity));
		ArrayList<Refined> argsinfo = new ArrayList<>();
		for (Pair<Term, Integer> p : header.arguments()) {
			int idx = signlen - p.second() + 1;
			Term ty = Terms.lift(idx, sign.get(idx - 1).type());
			argsinfo.add(new Refined(idx, ty, Terms.lift(1, p.first()), new Term.Rel(idx)));
		}
		Anomaly.check(argsinfo.size() <= 1, "multiple refined arguments", header);
		int lenargs = argsinfo.size();
		ArrayList<Term> pargs = new ArrayList<>();
		ArrayList<Pair<Term, Term>> subst = new ArrayList<>();
		if (lenargs == 0) {
			pargs.addAll(Terms.lift(1, header.patterns()));
		} else {
			Refined info = argsinfo.get(0);
			List<Term> pats = header.patterns();
			for (int k = pats.size() - 1; k >= 0; --k) {
				Term t = pats.get(k);
				Term rel = Terms.lift(lenargs, info.rel);
				Term tty = Terms.lift(lenargs + 1, typeOfRel(t, sign));
				if (Terms.dependent(rel, tty)) {
					Term tr, tp;
					if (Terms.isRel(info.object)) {
						tr = Terms.lift(lenargs + 1, t);
						tp = Terms.lift(lenargs + 3, t);
					} else {
						tr = transport(Terms.lift(lenargs, info.type), rel, Terms.lift(lenargs, info.object),
								new Term.Rel(1), Terms.lift(lenargs + 1, t), tty);
						tp = transport(Terms.lift(lenargs + 2, info.type), Terms.lift(2, rel), new Term.Rel(2),
								new Term.Rel(1), Terms.lift(lenargs + 3, t), Terms.lift(2, tty));
					}
					pargs.add(0, tr);
					subst.add(0, new Pair<>(rel, tp));
				} else {
					pargs.add(0, Terms.replaceTerm(Terms.lift(lenargs, info.object), rel,
							Terms.lift(lenargs + 1, t)));
				}
			}
		}
		// Transport the result along the equality of each refined argument
		Term result = new Term.Rel(lenargs + 1);
		Term pred = Terms.lift(1 + 2 * lenargs, arity);
		for (Refined info : argsinfo) {
			int idx = info.index + 2 * lenargs;
			if (Terms.dependent(new Term.Rel(idx), pred)) {
				Term eqty = logic.mkEq(Terms.lift(lenargs + 1, info.type), new Term.Rel(1),
						Terms.lift(lenargs + 1, info.rel));
				Term npred = Terms.lift(1, Terms.replaceTerm(new Term.Rel(idx), new Term.Rel(1), pred));
				for (Pair<Term, Term> s : subst) {
					npred = Terms.replaceTerm(s.first(), s.second(), npred);
				}
				Term motive = new Term.Lambda("refine", Terms.lift(lenargs, info.type),
						new Term.Lambda("refine_eq", eqty, npred));
				result = Terms.applist(logic.eqElim(), Terms.lift(lenargs, info.type), Terms.lift(lenargs, info.rel),
						motive, result, Terms.lift(lenargs, info.object), new Term.Rel(1));
			}
			pred = Terms.subst1(info.object, pred);
		}
		int ppath = group.index() + 1 - position(groups, header.path().tail());
		Term papp = Terms.applist(Terms.lift(1 + signlen + lenargs, new Term.Rel(ppath)), pargs);
		papp = Terms.applist(papp, result);
		// Recursive calls in the refined objects become hypotheses
		Context indhyps = Context.EMPTY;
		for (Pair<Term, Integer> arg : header.arguments()) {
			Term c = Terms.nfBeta(Terms.lift(1, arg.first()));
			Context hyps = resolver.abstractCalls(signlen, c).context();
			indhyps = hyps.liftn(-(i - 1), signlen + 2).push(indhyps);
		}
		Term body = Terms.itMkProdOrClean(Terms.lift(indhyps.size(), papp), indhyps.lift(lenargs));
		for (int k = argsinfo.size() - 1; k >= 0; --k) {
			Refined info = argsinfo.get(k);
			body = new Term.Product("Heq", logic.mkEq(info.type, info.object, info.rel), body);
		}
		Term value = Terms.itMkLambdaOrLetIn(body, ctx);
		Term type = Terms.itMkProdOrLetIn(logic.sort(), ctx);
		return new Declaration(decl.name(), value, type);
	}

	private Term transport(Term type, Term x, Term y, Term eq, Term c, Term cty) {
		Term motive = new Term.Lambda("abs", type,
				Terms.replaceTerm(Terms.lift(1, x), new Term.Rel(1), Terms.lift(1, cty)));
		return Terms.applist(logic.eqCase(), type, x, motive, c, y, eq);
	}

	/**
	 * Determine the (one-based) position of the block with a given path.
	 *
	 * @param groups
	 * @param path
	 * @return
	 */
	private static int position(List<Group> groups, Path path) {
		for (int i = 0; i != groups.size(); ++i) {
			if (groups.get(i).header().path().equals(path)) {
				return i + 1;
			}
		}
		throw new Anomaly("no block for path " + path, groups);
	}

	private static Term typeOfRel(Term term, Context ctx) {
		if (term instanceof Term.Rel) {
			return ctx.typeOf(((Term.Rel) term).index());
		}
		return Terms.PROP;
	}

	/**
	 * A refined argument of a refinement's signature, together with the object it
	 * was refined from.
	 */
	private static class Refined {
		private final int index;
		private final Term type;
		private final Term object;
		private final Term rel;

		public Refined(int index, Term type, Term object, Term rel) {
			this.index = index;
			this.type = type;
			this.object = object;
			this.rel = rel;
		}
	}

	/**
	 * The type of an elimination principle, together with the number of
	 * arguments it expects before the function's own arguments.
	 */
	public static class Principle {
		private final Term type;
		private final int arity;

		public Principle(Term type, int arity) {
			this.type = type;
			this.arity = arity;
		}

		public Term type() {
			return type;
		}

		public int arity() {
			return arity;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Principle) {
				Principle p = (Principle) o;
				return p.type.equals(type) && p.arity == arity;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return type.hashCode() ^ arity;
		}

		@Override
		public String toString() {
			return type + " [" + arity + "]";
		}
	}
}
