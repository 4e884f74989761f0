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

import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Pattern;
import funelim.core.Syntax.Term;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * A matching problem <code>source |- patterns : target</code>. Each pattern is
 * typed in the source context, and there is exactly one pattern per
 * declaration of the target context. Patterns are stored innermost first, so
 * <code>patterns[0]</code> is the value given to <code>#1</code> of the target.
 * A problem can therefore be read as a substitution taking terms living in the
 * target into the source.
 *
 * @author David J. Pearce
 *
 */
public class Problem {
	private final Context source;
	private final Pattern[] patterns;
	private final Context target;

	public Problem(Context source, Pattern[] patterns, Context target) {
		Anomaly.check(patterns.length == target.size(), "pattern count does not match target", source,
				Arrays.toString(patterns), target);
		this.source = source;
		this.patterns = patterns;
		this.target = target;
	}

	public Context source() {
		return source;
	}

	public Pattern[] patterns() {
		return patterns;
	}

	public Context target() {
		return target;
	}

	/**
	 * Get the terms denoted by the patterns, innermost first.
	 *
	 * @return
	 */
	public List<Term> patternTerms() {
		ArrayList<Term> r = new ArrayList<>();
		for (Pattern p : patterns) {
			r.add(p.toTerm());
		}
		return r;
	}

	/**
	 * Get the terms denoted by the patterns, outermost first. These are the
	 * arguments to which a function over the target is applied.
	 *
	 * @return
	 */
	public List<Term> arguments() {
		ArrayList<Term> r = new ArrayList<>();
		for (int i = patterns.length - 1; i >= 0; --i) {
			r.add(patterns[i].toTerm());
		}
		return r;
	}

	/**
	 * Map a term living in the target into the source.
	 *
	 * @param term
	 * @return
	 */
	public Term apply(Term term) {
		return Terms.substl(patternTerms(), term);
	}

	/**
	 * Map a term living under <code>depth</code> extra binders inside the target.
	 *
	 * @param depth
	 * @param term
	 * @return
	 */
	public Term apply(int depth, Term term) {
		return Terms.substnl(patternTerms(), depth, term);
	}

	/**
	 * Map a variable of the target, which must be sent to a variable of the
	 * source.
	 *
	 * @param rel
	 * @return
	 */
	public int applyVariable(int rel) {
		Term t = apply(new Term.Rel(rel));
		if (t instanceof Term.Rel) {
			return ((Term.Rel) t).index();
		}
		throw new Anomaly("variable #" + rel + " is not mapped to a variable", t, this);
	}

	/**
	 * Instantiate a pattern of the target with the patterns of this problem.
	 *
	 * @param pattern
	 * @return
	 */
	public Pattern specialize(Pattern pattern) {
		if (pattern instanceof Pattern.Variable) {
			int i = ((Pattern.Variable) pattern).index();
			Anomaly.check(i <= patterns.length, "pattern variable out of range", pattern, this);
			return patterns[i - 1];
		} else if (pattern instanceof Pattern.Constructor) {
			Pattern.Constructor c = (Pattern.Constructor) pattern;
			Pattern[] args = new Pattern[c.arguments().length];
			for (int i = 0; i != args.length; ++i) {
				args[i] = specialize(c.arguments()[i]);
			}
			return new Pattern.Constructor(apply(c.constructor()), args);
		} else {
			return new Pattern.Inaccessible(apply(((Pattern.Inaccessible) pattern).term()));
		}
	}

	/**
	 * The identity problem on a given context.
	 *
	 * @param ctx
	 * @return
	 */
	public static Problem identity(Context ctx) {
		Pattern[] ps = new Pattern[ctx.size()];
		for (int i = 0; i != ps.length; ++i) {
			ps[i] = new Pattern.Variable(i + 1);
		}
		return new Problem(ctx, ps, ctx);
	}

	/**
	 * Compose <code>first : A -> B</code> with <code>second : B -> C</code> to
	 * give a problem <code>A -> C</code>.
	 *
	 * @param first
	 * @param second
	 * @return
	 */
	public static Problem compose(Problem first, Problem second) {
		Anomaly.check(first.target.size() == second.source.size(), "cannot compose problems", first, second);
		Pattern[] ps = new Pattern[second.patterns.length];
		for (int i = 0; i != ps.length; ++i) {
			ps[i] = first.specialize(second.patterns[i]);
		}
		return new Problem(first.source, ps, second.target);
	}

	/**
	 * Construct the problem substituting a term for the variable <code>x</code>
	 * of a context, i.e. <code>ctx[x := t] |- ps : ctx</code>. The term must not
	 * refer to <code>x</code> or anything declared inside it.
	 *
	 * @param ctx
	 * @param x
	 * @param t
	 * @return
	 */
	public static Problem single(Context ctx, int x, Term t) {
		if (t.equals(new Term.Rel(x))) {
			return identity(ctx);
		} else if (!Terms.noccurBetween(1, x, t)) {
			throw new Anomaly("cannot substitute for #" + x + " a term depending on it", t, ctx);
		}
		// Remove x, substituting t into the declarations inside it
		Term value = Terms.lift(-x, t);
		Context outer = ctx.skip(x);
		Context inner = ctx.take(x - 1).subst1(value);
		Context substctx = outer.push(inner);
		Pattern[] ps = new Pattern[ctx.size()];
		for (int k = 1; k <= ps.length; ++k) {
			if (k == x) {
				ps[k - 1] = new Pattern.Inaccessible(Terms.lift(-1, t));
			} else if (k > x) {
				ps[k - 1] = new Pattern.Variable(k - 1);
			} else {
				ps[k - 1] = new Pattern.Variable(k);
			}
		}
		return new Problem(substctx, ps, ctx);
	}

	/**
	 * Extend the source of this problem with further (innermost) declarations.
	 *
	 * @param delta
	 * @return
	 */
	public Problem extend(Context delta) {
		Pattern[] ps = new Pattern[patterns.length];
		for (int i = 0; i != ps.length; ++i) {
			ps[i] = lift(delta.size(), patterns[i]);
		}
		return new Problem(source.push(delta), ps, target);
	}

	/**
	 * Extend this problem <code>G |- ps : D</code> over a telescope
	 * <code>D |- delta</code>, giving <code>G, delta[ps] |- ps' : D, delta</code>.
	 *
	 * @param delta
	 * @return
	 */
	public Problem liftOver(Context delta) {
		final int n = delta.size();
		Context mapped = delta.map((depth, t) -> apply(depth, t));
		Pattern[] ps = new Pattern[patterns.length + n];
		for (int i = 0; i != n; ++i) {
			ps[i] = new Pattern.Variable(i + 1);
		}
		for (int i = 0; i != patterns.length; ++i) {
			ps[i + n] = lift(n, patterns[i]);
		}
		return new Problem(source.push(mapped), ps, target.push(delta));
	}

	/**
	 * Remove the definitions from the target of this problem. Returns the
	 * resulting problem together with the substitution (innermost first) taking
	 * each variable of the original target to a term in the smashed target.
	 *
	 * @return
	 */
	public Pair<Problem, List<Term>> smash() {
		List<Term> subst = new ArrayList<>();
		List<Pattern> pats = new ArrayList<>();
		Context smashed = Context.EMPTY;
		for (Declaration decl : target) {
			if (decl.isDefinition()) {
				Term value = Terms.substl(subst, decl.value());
				subst.add(0, value);
				pats = lift(1, pats);
			} else {
				smashed = smashed.push(decl.map(t -> Terms.substl(subst, t)));
				List<Term> nsubst = new ArrayList<>();
				nsubst.add(new Term.Rel(1));
				nsubst.addAll(Terms.lift(1, subst));
				subst.clear();
				subst.addAll(nsubst);
				pats = lift(1, pats);
				pats.add(0, new Pattern.Variable(1));
			}
		}
		Problem projection = new Problem(target, pats.toArray(new Pattern[pats.size()]), smashed);
		return new Pair<>(compose(this, projection), subst);
	}

	public static Pattern lift(int n, Pattern pattern) {
		if (n == 0) {
			return pattern;
		} else if (pattern instanceof Pattern.Variable) {
			return new Pattern.Variable(((Pattern.Variable) pattern).index() + n);
		} else if (pattern instanceof Pattern.Constructor) {
			Pattern.Constructor c = (Pattern.Constructor) pattern;
			Pattern[] args = new Pattern[c.arguments().length];
			for (int i = 0; i != args.length; ++i) {
				args[i] = lift(n, c.arguments()[i]);
			}
			return new Pattern.Constructor(Terms.lift(n, c.constructor()), args);
		} else {
			return new Pattern.Inaccessible(Terms.lift(n, ((Pattern.Inaccessible) pattern).term()));
		}
	}

	private static List<Pattern> lift(int n, List<Pattern> patterns) {
		ArrayList<Pattern> r = new ArrayList<>();
		for (Pattern p : patterns) {
			r.add(lift(n, p));
		}
		return r;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Problem) {
			Problem p = (Problem) o;
			return p.source.equals(source) && Arrays.equals(p.patterns, patterns) && p.target.equals(target);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return source.hashCode() ^ Arrays.hashCode(patterns) ^ target.hashCode();
	}

	@Override
	public String toString() {
		String r = source + " |- ";
		for (int i = patterns.length - 1; i >= 0; --i) {
			if (i != patterns.length - 1) {
				r += ", ";
			}
			r += patterns[i];
		}
		return r + " : " + target;
	}
}
