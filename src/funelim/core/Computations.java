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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import funelim.core.Computation.Alias;
import funelim.core.Computation.Block;
import funelim.core.Computation.Header;
import funelim.core.Computation.Nested;
import funelim.core.Computation.NodeKind;
import funelim.core.Splitting.RightHandSide;
import funelim.core.Splitting.Where;
import funelim.core.Syntax.Term;
import funelim.util.AbstractFunction;
import funelim.util.AbstractTransformer;
import funelim.util.Pair;

/**
 * Flattens specialised splitting trees into the computations they perform. Each
 * leaf gives one computation, whilst where clauses and refinements give nested
 * lists of computations. Flattening a block of functions then yields one
 * header per function, where clause and refinement, each with its own
 * computations.
 *
 * @author David J. Pearce
 *
 */
public class Computations {
	private static final boolean DEBUG = false;

	private final Compilation compilation;

	public Computations(Compilation compilation) {
		this.compilation = compilation;
	}

	/**
	 * Flatten the trees of a block of functions. The first block returned
	 * describes the first function; nested blocks follow their parent, depth
	 * first.
	 *
	 * @param alias       The alias of the block's main function, or
	 *                    <code>null</code>
	 * @param definitions The (specialised) definitions of the block
	 * @return
	 */
	public List<Block> allComputations(Alias alias, List<Definition> definitions) {
		List<Block> blocks = new ArrayList<>();
		for (Definition d : definitions) {
			Splitting.Program p = d.program();
			NodeKind kind = NodeKind.of(p);
			List<Computation> comps = computations(d.problem(), d.function(), alias, kind, d.splitting());
			Header top = new Header(d.function(), new int[0], alias, Path.of(p.id()), p.signature(), p.arity(),
					d.problem().arguments(), Collections.emptyList(), kind, false);
			List<Block> rest = new ArrayList<>();
			List<Computation> flat = flatten(comps, rest);
			blocks.add(new Block(top, flat));
			blocks.addAll(rest);
		}
		if (DEBUG) {
			for (Block b : blocks) {
				System.err.println("BLOCK " + b);
			}
		}
		return blocks;
	}

	/**
	 * Flatten the tree of a single function.
	 *
	 * @param prob
	 * @param function
	 * @param alias
	 * @param kind
	 * @param split
	 * @return
	 */
	public List<Computation> computations(Problem prob, Term function, Alias alias, NodeKind kind,
			Splitting split) {
		return new Flattener(Collections.emptyList()).apply(split,
				new Environment(prob, function, alias, kind, false));
	}

	private static List<Computation> flatten(List<Computation> comps, List<Block> rest) {
		List<Computation> flat = new ArrayList<>();
		for (Computation c : comps) {
			flat.add(c.flat());
			for (Nested n : c.nested()) {
				List<Block> nrest = new ArrayList<>();
				List<Computation> nextlevel = flatten(n.computations(), nrest);
				Header h = new Header(n.function(), n.filter(), n.alias(), n.path(), n.context(), n.arity(),
						n.patterns(), n.arguments(), c.kind(), c.isCut());
				rest.add(new Block(h, nextlevel));
				rest.addAll(nrest);
			}
		}
		return flat;
	}

	private static class Environment {
		private final Problem problem;
		private final Term function;
		private final Alias alias;
		private final NodeKind kind;
		private final boolean cut;

		public Environment(Problem problem, Term function, Alias alias, NodeKind kind, boolean cut) {
			this.problem = problem;
			this.function = function;
			this.alias = alias;
			this.kind = kind;
			this.cut = cut;
		}

		public Environment with(Problem problem, boolean cut) {
			return new Environment(problem, function, alias, kind, cut);
		}
	}

	/**
	 * Records that applications of a function (restricted to some arguments) are
	 * to be replaced by applications of another term.
	 */
	private static class Substitution {
		private final Term function;
		private final int[] filter;
		private final Term replacement;

		public Substitution(Term function, int[] filter, Term replacement) {
			this.function = function;
			this.filter = filter;
			this.replacement = replacement;
		}

		public Term apply(Term term) {
			return new AbstractTransformer() {
				@Override
				public Term apply(int depth, Term t) {
					if (t instanceof Term.App && ((Term.App) t).head().equals(function)) {
						Term[] args = apply(depth, ((Term.App) t).arguments());
						if (depth == 0) {
							return Terms.applist(replacement,
									Computation.filterArguments(filter, Arrays.asList(args)));
						}
						return args == ((Term.App) t).arguments() ? t : new Term.App(function, args);
					} else if (t.equals(function)) {
						return depth == 0 ? replacement : t;
					}
					return super.apply(depth, t);
				}
			}.apply(0, term);
		}
	}

	private class Flattener extends AbstractFunction<Environment, List<Computation>> {
		/**
		 * Alias substitutions in force, most recent first.
		 */
		private final List<Substitution> fsubst;

		public Flattener(List<Substitution> fsubst) {
			this.fsubst = fsubst;
		}

		@Override
		public List<Computation> apply(Splitting.Compute split, Environment env) {
			Problem lhs = split.lhs();
			List<Term> inst = new ArrayList<>();
			List<Nested> wheres = new ArrayList<>();
			// Outermost where clause first
			for (int i = split.wheres().size() - 1; i >= 0; --i) {
				Where w = split.wheres().get(i);
				Term lhsterm = Terms.substl(inst, w.term());
				Pair<Term, List<Term>> app = Terms.decomposeApp(lhsterm);
				Term term = app.first();
				Alias alias = null;
				List<Substitution> wsubst = new ArrayList<>(fsubst);
				Optional<Compilation.Entry> entry = lookup(w.path());
				if (entry.isPresent()) {
					Pair<Term, List<Term>> e = Terms.decomposeApp(entry.get().term());
					int[] filter = matchArguments(Terms.arguments(w.term()), e.second());
					for (Substitution s : fsubst) {
						if (s.function.equals(e.first()) && Arrays.equals(s.filter, filter)) {
							compilation.warn("ambiguous where clause " + entry.get().name() + " for " + e.first());
						}
					}
					wsubst.add(0, new Substitution(e.first(), filter, term));
					alias = new Alias(e.first(), filter, entry.get().name(), entry.get().splitting());
				}
				List<Term> args = new ArrayList<>();
				for (Term arg : app.second()) {
					if (arg instanceof Term.Rel) {
						break;
					}
					args.add(arg);
				}
				Term subterm = Terms.applist(term, args);
				Pair<Problem, List<Term>> smash = w.problem().smash();
				Problem wsmash = smash.first();
				List<Computation> comps = new Flattener(wsubst).apply(w.splitting(),
						new Environment(wsmash, subterm, null, NodeKind.REGULAR, false));
				int[] filter = compilation.isEmpty() ? new int[] { args.size() } : new int[] { 0 };
				wheres.add(0, new Nested(subterm, filter, alias, w.originalPath(), wsmash.source(),
						Terms.substl(smash.second(), w.arity()), wsmash.arguments(), Collections.emptyList(), comps));
				inst.add(0, lhsterm);
			}
			Problem ctx = Problem.compose(lhs, env.problem);
			RightHandSide rhs = split.rhs();
			if (rhs instanceof RightHandSide.Program) {
				Term c = Terms.nfBeta(Terms.substl(inst, ((RightHandSide.Program) rhs).term()));
				// Oldest substitution first
				for (int i = fsubst.size() - 1; i >= 0; --i) {
					c = fsubst.get(i).apply(c);
				}
				rhs = new RightHandSide.Program(c);
			}
			Term type = Terms.substl(inst, split.type());
			return Collections.singletonList(new Computation(ctx.source(), env.function, env.alias, ctx.arguments(),
					type, NodeKind.WHERE, env.cut, rhs, wheres));
		}

		@Override
		public List<Computation> apply(Splitting.Split split, Environment env) {
			List<Computation> r = new ArrayList<>();
			for (Splitting s : split.branches()) {
				if (s != null) {
					r.addAll(apply(s, env));
				}
			}
			return r;
		}

		@Override
		public List<Computation> apply(Splitting.Mapping split, Environment env) {
			return apply(split.body(), env);
		}

		@Override
		public List<Computation> apply(Splitting.RecValid split, Environment env) {
			return apply(split.body(), env.with(env.problem, false));
		}

		@Override
		public List<Computation> apply(Splitting.Refined split, Environment env) {
			Splitting.Refinement info = split.info();
			Problem s = Problem.compose(split.lhs(), env.problem);
			List<Term> refined = Problem.compose(info.newProblemToLhs(), s).arguments();
			int[] filter = new int[] { Terms.arguments(info.function()).size() };
			Alias alias = null;
			Optional<Compilation.Entry> entry = compilation.lookup(info.placeholder());
			if (entry.isPresent()) {
				Pair<Term, List<Term>> e = Terms.decomposeApp(entry.get().term());
				alias = new Alias(e.first(), matchArguments(info.arguments(), e.second()), entry.get().name(),
						entry.get().splitting());
			}
			List<Pair<Term, Integer>> arguments = Collections
					.singletonList(new Pair<>(info.newProblemToLhs().apply(info.object()), info.argument()));
			List<Computation> comps = apply(split.body(),
					new Environment(info.newProblem(), info.function(), null, NodeKind.REGULAR, true));
			Nested nested = new Nested(info.function(), filter, alias, info.path(), info.newProblem().source(),
					info.newType(), refined, arguments, comps);
			return Collections.singletonList(new Computation(split.lhs().source(), env.function, env.alias,
					s.arguments(), info.returnType(), NodeKind.REFINE, true,
					new RightHandSide.Program(info.application()), Collections.singletonList(nested)));
		}

		@Override
		public List<Computation> apply(Splitting.Valid split, Environment env) {
			List<Computation> r = new ArrayList<>();
			for (Splitting.Valid.Branch b : split.branches()) {
				Problem prob = Problem.compose(b.problem(), env.problem);
				r.addAll(apply(b.body(), env.with(prob, false)));
			}
			return r;
		}

		private Optional<Compilation.Entry> lookup(Path path) {
			if (!path.isEmpty() && path.head() instanceof Path.Placeholder) {
				return compilation.lookup(((Path.Placeholder) path.head()).id());
			}
			return Optional.empty();
		}
	}

	/**
	 * Determine the positions at which two argument lists agree. The length of
	 * the second list is always included, such that the arguments of a call
	 * beyond the second list are kept when filtering.
	 *
	 * @param left
	 * @param right
	 * @return
	 */
	public static int[] matchArguments(List<Term> left, List<Term> right) {
		List<Integer> r = new ArrayList<>();
		for (int i = 0; i < right.size(); ++i) {
			if (i < left.size() && left.get(i).equals(right.get(i))) {
				r.add(i);
			}
		}
		r.add(right.size());
		int[] positions = new int[r.size()];
		for (int i = 0; i != positions.length; ++i) {
			positions[i] = r.get(i);
		}
		return positions;
	}
}
