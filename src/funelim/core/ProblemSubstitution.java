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
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import funelim.core.Recursion.Relevance;
import funelim.core.Splitting.Program;
import funelim.core.Splitting.Refinement;
import funelim.core.Splitting.RightHandSide;
import funelim.core.Splitting.Where;
import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Pattern;
import funelim.core.Syntax.Term;
import funelim.util.AbstractFunction;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * Specialises a splitting tree for a given recursion protocol. The bindings
 * through which a function refers to itself (and its siblings) are cut out of
 * every context of the tree, and each reference to them is replaced by the
 * corresponding function. The result is a tree over the function's own
 * signature, from which equations can be read off.
 *
 * @author David J. Pearce
 *
 */
public class ProblemSubstitution extends AbstractFunction<ProblemSubstitution.Environment, Splitting> {
	private static final boolean DEBUG = false;

	private final Compilation compilation;

	public ProblemSubstitution(Compilation compilation) {
		this.compilation = compilation;
	}

	/**
	 * Specialise a tree according to the recursion of its function. Structurally
	 * recursive trees have their recursive bindings replaced as given, trees
	 * defined by well-founded recursion are specialised at their recursion
	 * markers, and non-recursive trees are left as is.
	 *
	 * @param program   The function being defined
	 * @param recursion The recursion of the block, or <code>null</code>
	 * @param function  The function as a term
	 * @param cut       The problem cutting the recursive bindings out of the
	 *                  tree's root context
	 * @param recs      The recursive bindings to replace
	 * @param split     The tree
	 * @return
	 */
	public Splitting updateSplit(Program program, Recursion.Descriptor recursion, Term function, Problem cut,
			RecSubst recs, Splitting split) {
		if (recursion instanceof Recursion.Guarded) {
			return apply(split, new Environment(cut, recs, program, function, Path.of(program.id())));
		} else if (recursion instanceof Recursion.Logical) {
			return apply(split, new Environment(cut, RecSubst.EMPTY, program, function, Path.EMPTY));
		} else {
			return split;
		}
	}

	/**
	 * The information threaded down the tree.
	 */
	public static class Environment {
		private final Problem cut;
		private final RecSubst subst;
		private final Program program;
		private final Term function;
		private final Path path;

		public Environment(Problem cut, RecSubst subst, Program program, Term function, Path path) {
			this.cut = cut;
			this.subst = subst;
			this.program = program;
			this.function = function;
			this.path = path;
		}

		public Environment with(Problem cut) {
			return new Environment(cut, subst, program, function, path);
		}

		public Environment with(Path path) {
			return new Environment(cut, subst, program, function, path);
		}
	}

	// ============================================================
	// Tree nodes
	// ============================================================

	@Override
	public Splitting apply(Splitting.Compute split, Environment env) {
		Problem lhs = split.lhs();
		Pair<Problem, Problem> p = substRec(env.cut, env.subst, lhs);
		Problem subst = p.first();
		Problem nlhs = p.second();
		Problem progctx = lhs.extend(Splitting.whereContext(split.wheres()));
		Problem substprog = substRec(env.cut, env.subst, progctx).first();
		boolean logical = env.subst.relevance() == Relevance.LOGICAL;
		List<Where> nwheres = new ArrayList<>();
		// Outermost where clause first
		for (int i = split.wheres().size() - 1; i >= 0; --i) {
			Where w = split.wheres().get(i);
			Context wcontext = Splitting.whereContext(nwheres);
			Term term = subst.liftOver(wcontext).apply(w.term());
			Term type = subst.apply(w.type());
			Program program = w.program();
			RecSubst s = env.subst;
			if (program.recursion() instanceof Recursion.Structural) {
				// Calls to the where clause go to the clause itself
				int delta = w.problem().source().size() - lhs.source().size();
				s = s.push(program.id(), null, Terms.lift(delta, w.term()));
				program = program.withRecursion(null);
			}
			Problem cut = cutProblem(s, w.problem().source());
			Problem wsubst = substRec(w.problem(), s, w.problem()).first();
			Term wterm = Terms.lift(cut.source().size() - lhs.source().size(), w.term());
			Term arity = wsubst.apply(w.arity());
			program = program.withSignature(cut.target(), wsubst.apply(program.arity()));
			Splitting body = apply(w.splitting(), new Environment(cut, s, program, wterm, w.path()));
			Path path = w.path();
			if (logical) {
				int ev = compilation.fresh();
				compilation.record(ev, term, w.id() + "_unfold_eq", body);
				term = Terms.applist(new Term.Evar(ev, w.originalPath().toIdentifier()),
						nlhs.source().extendedRelList(wcontext.size()));
				path = path.tail().push(ev);
			}
			nwheres.add(0, new Where(program, w.program(), path, w.originalPath(), Problem.identity(cut.target()),
					arity, term, type, body, nlhs.source().size()));
		}
		return new Splitting.Compute(nlhs, nwheres, substprog.apply(split.type()), map(substprog, split.rhs()));
	}

	@Override
	public Splitting apply(Splitting.Split split, Environment env) {
		Pair<Problem, Problem> p = substRec(env.cut, env.subst, split.lhs());
		Problem subst = p.first();
		Splitting[] branches = new Splitting[split.branches().length];
		for (int i = 0; i != branches.length; ++i) {
			Splitting b = split.branches()[i];
			branches[i] = b == null ? null : apply(b, env);
		}
		return new Splitting.Split(p.second(), subst.applyVariable(split.variable()), subst.apply(split.type()),
				branches);
	}

	@Override
	public Splitting apply(Splitting.Mapping split, Environment env) {
		Problem lhs = substRec(env.cut, env.subst, split.lhs()).second();
		return new Splitting.Mapping(lhs, apply(split.body(), env));
	}

	@Override
	public Splitting apply(Splitting.RecValid split, Environment env) {
		Splitting body = split.body();
		if (body instanceof Splitting.Valid && ((Splitting.Valid) body).branches().size() == 1) {
			Recursion r = env.program.recursion();
			if (!(r instanceof Recursion.WellFounded)) {
				throw new Anomaly("well-founded marker on a program without well-founded recursion", env.program);
			}
			Splitting.Valid.Branch branch = ((Splitting.Valid) body).branches().get(0);
			// Recursive calls drop the accessibility proof
			RecSubst s = env.subst.push(split.id(), -1, Terms.lift(1, env.function));
			Problem cut = cutProblem(s, branch.problem().source());
			Splitting rest = apply(branch.body(),
					new Environment(cut, s, env.program, env.function, recursivePath(split, env)));
			if (branch.inverse() != null) {
				return new Splitting.Mapping(branch.inverse(), rest);
			}
			return rest;
		}
		return new Splitting.RecValid(split.id(), apply(body, env.with(recursivePath(split, env))));
	}

	/**
	 * Determine the path below a well-founded marker. The marker is named after
	 * the recursive binder, whereas paths are rooted at the program being
	 * defined.
	 *
	 * @param split
	 * @param env
	 * @return
	 */
	private static Path recursivePath(Splitting.RecValid split, Environment env) {
		if (env.path.isEmpty()) {
			return Path.of(env.program.id());
		}
		return env.path.push(split.id());
	}

	@Override
	public Splitting apply(Splitting.Refined split, Environment env) {
		Refinement info = split.info();
		RecSubst s = env.subst;
		Pair<Problem, Problem> p = substRec(env.cut, s, split.lhs());
		Problem subst = p.first();
		Problem revctx = substRec(cutProblem(s, info.reverseContext().target()), s, info.reverseContext()).second();
		Problem cutnewprob = cutProblem(s, info.newProblem().target());
		Pair<Problem, Problem> np = substRec(cutnewprob, s, info.newProblem());
		Problem newProblemToLhs = substRec(cutProblem(s, info.newProblemToLhs().target()), s,
				info.newProblemToLhs()).second();
		boolean logical = s.relevance() == Relevance.LOGICAL;
		int ev = logical ? compilation.fresh() : info.placeholder();
		Path path = (env.path.isEmpty() ? Path.of(env.program.id()) : env.path).push(ev);
		Term function;
		List<Term> arguments = new ArrayList<>();
		int argument;
		if (logical) {
			// Recursive bindings are no longer in scope
			int refarg = 0;
			List<Term> args = info.arguments();
			for (int i = 0; i != args.size(); ++i) {
				Term c = args.get(i);
				if (i == info.argument()) {
					refarg = arguments.size();
				}
				if (c instanceof Term.Rel) {
					Declaration d = split.lhs().source().get(((Term.Rel) c).index());
					if (d.name() != null && s.contains(d.name())) {
						continue;
					}
				}
				arguments.add(subst.apply(c));
			}
			function = new Term.Evar(ev, path.toIdentifier());
			argument = refarg;
		} else {
			List<Term> args = new ArrayList<>();
			for (Term c : info.arguments()) {
				args.add(subst.apply(c));
			}
			int n = Math.min(s.size(), args.size());
			function = Terms.applist(subst.apply(info.function()), args.subList(0, n));
			arguments.addAll(args.subList(n, args.size()));
			argument = info.argument() - s.size();
		}
		Refinement ninfo = new Refinement(info.id(), subst.apply(info.object()), subst.apply(info.objectType()),
				subst.apply(info.returnType()), argument, path, ev, function, arguments, revctx, np.second(),
				newProblemToLhs, np.first().apply(info.newType()));
		Splitting body = apply(split.body(), env.with(cutnewprob).with(path));
		if (logical) {
			compilation.record(ev, subst.apply(info.application()), info.id() + "_unfold_eq", body);
		}
		if (DEBUG) {
			System.err.println("REFINED " + ninfo + " AT " + path);
		}
		return new Splitting.Refined(p.second(), ninfo, body);
	}

	@Override
	public Splitting apply(Splitting.Valid split, Environment env) {
		Problem lhs = substRec(env.cut, env.subst, split.lhs()).second();
		List<Splitting.Valid.Branch> branches = new ArrayList<>();
		for (Splitting.Valid.Branch b : split.branches()) {
			branches.add(b.with(apply(b.body(), env)));
		}
		return new Splitting.Valid(lhs, split.type(), branches);
	}

	private static RightHandSide map(Problem subst, RightHandSide rhs) {
		if (rhs instanceof RightHandSide.Program) {
			return new RightHandSide.Program(subst.apply(((RightHandSide.Program) rhs).term()));
		} else {
			return new RightHandSide.Empty(subst.applyVariable(((RightHandSide.Empty) rhs).variable()));
		}
	}

	// ============================================================
	// Problems
	// ============================================================

	/**
	 * Eta-expand a function over the binders of a type, omitting one argument.
	 * The argument is given by its (one-based) position, or <code>-1</code> for
	 * the last one. When no position is given, the function is returned as is.
	 *
	 * @param dropped
	 * @param function
	 * @param type
	 * @return
	 */
	public static Term mapProto(Integer dropped, Term function, Term type) {
		if (dropped == null) {
			return function;
		}
		Context lctx = Terms.decomposeProdAssum(type).first();
		List<Term> args = Terms.relList(0, lctx.size());
		List<Term> kept = new ArrayList<>();
		if (dropped == -1) {
			Anomaly.check(!args.isEmpty(), "no argument to drop", type);
			kept.addAll(args.subList(0, args.size() - 1));
		} else {
			Anomaly.check(dropped > 0 && dropped <= args.size(), "invalid argument to drop", dropped, type);
			kept.addAll(args.subList(0, dropped - 1));
			kept.addAll(args.subList(dropped, args.size()));
		}
		return Terms.itMkLambdaOrLetIn(Terms.applist(Terms.lift(lctx.size(), function), kept), lctx);
	}

	/**
	 * Cut the recursive bindings out of a context. That is, from a context
	 * <code>D, rec, D'</code> build the problem
	 * <code>D, rec, D' |- ps : D, D'[rec := f]</code> where <code>f</code> is the
	 * replacement for <code>rec</code>.
	 *
	 * @param subst
	 * @param ctx
	 * @return
	 */
	public static Problem cutProblem(RecSubst subst, Context ctx) {
		List<Pattern> patterns = new ArrayList<>();
		Context cut = Context.EMPTY;
		List<Term> subs = new ArrayList<>();
		int i = ctx.size();
		for (Declaration d : ctx) {
			Optional<RecSubst.Entry> e = d.name() == null ? Optional.empty() : subst.lookup(d.name());
			if (e.isPresent()) {
				Term term = mapProto(e.get().dropped(), e.get().replacement(), d.type());
				subs.add(0, Terms.substl(subs, term));
			} else {
				final List<Term> s = new ArrayList<>(subs);
				cut = cut.push(d.map(t -> Terms.substl(s, t)));
				patterns.add(0, new Pattern.Variable(i));
				List<Term> nsubs = new ArrayList<>();
				nsubs.add(new Term.Rel(1));
				nsubs.addAll(Terms.lift(1, subs));
				subs = nsubs;
			}
			i = i - 1;
		}
		return new Problem(ctx, patterns.toArray(new Pattern[patterns.size()]), cut);
	}

	/**
	 * Substitute the recursive bindings of a problem's source by their
	 * replacements. Returns the substitution, from the reduced source to the
	 * original one, together with the problem from the reduced source to the
	 * target of the given cut.
	 *
	 * @param cut
	 * @param subst
	 * @param lhs
	 * @return
	 */
	public static Pair<Problem, Problem> substRec(Problem cut, RecSubst subst, Problem lhs) {
		Problem acc = Problem.identity(lhs.source());
		for (RecSubst.Entry e : subst) {
			OptionalInt rel = acc.source().lookup(e.id());
			if (rel.isPresent()) {
				int r = rel.getAsInt();
				Term replacement = Problem.compose(acc, lhs).apply(e.replacement());
				Term fk = mapProto(e.dropped(), replacement, acc.source().typeOf(r));
				acc = Problem.compose(Problem.single(acc.source(), r, fk), acc);
			}
		}
		Problem csubst = Problem.compose(Problem.compose(acc, lhs), cut);
		return new Pair<>(acc, csubst);
	}

	/**
	 * The bindings through which a block of functions refers to itself, each
	 * replaced by the function of the same name.
	 *
	 * @param ids
	 * @return
	 */
	public static RecSubst selfReferences(List<String> ids) {
		RecSubst r = RecSubst.EMPTY;
		List<String> rev = new ArrayList<>(ids);
		Collections.reverse(rev);
		for (String id : rev) {
			r = r.push(id, null, new Term.Const(id));
		}
		return r;
	}
}
