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

import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.util.AbstractTransformer;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * Operations on terms with de Bruijn indices. Indices are one-based, so
 * <code>#1</code> refers to the innermost binder in scope. All operations are
 * pure: they return new terms (sharing unchanged subterms) and never mutate
 * their arguments.
 *
 * @author David J. Pearce
 *
 */
public class Terms {

	/**
	 * Lift all free indices of a term by <code>n</code>.
	 *
	 * @param n
	 * @param term
	 * @return
	 */
	public static Term lift(int n, Term term) {
		return liftn(n, 1, term);
	}

	/**
	 * Lift by <code>n</code> every free index greater than or equal to
	 * <code>k</code>. A negative lift which would take an index below
	 * <code>k</code> is an anomaly, since it means a variable escaped its scope.
	 *
	 * @param n
	 * @param k
	 * @param term
	 * @return
	 */
	public static Term liftn(int n, int k, Term term) {
		if (n == 0) {
			return term;
		}
		return new AbstractTransformer() {
			@Override
			protected Term apply(int depth, Term.Rel t) {
				int i = t.index();
				if (i >= k + depth) {
					Anomaly.check(i + n >= k + depth, "index escapes its scope", t, term);
					return new Term.Rel(i + n);
				}
				return t;
			}
		}.apply(0, term);
	}

	/**
	 * Lift every term in a list by a given amount.
	 *
	 * @param n
	 * @param terms
	 * @return
	 */
	public static List<Term> lift(int n, List<Term> terms) {
		ArrayList<Term> r = new ArrayList<>();
		for (Term t : terms) {
			r.add(lift(n, t));
		}
		return r;
	}

	/**
	 * Substitute in parallel <code>values[0]</code>, ...,
	 * <code>values[k-1]</code> for <code>#(n+1)</code>, ..., <code>#(n+k)</code>.
	 * Values are lifted by <code>n</code> (plus the binders crossed), and indices
	 * beyond <code>n+k</code> are shifted down by <code>k</code>.
	 *
	 * @param values
	 * @param n
	 * @param term
	 * @return
	 */
	public static Term substnl(List<Term> values, int n, Term term) {
		final int k = values.size();
		if (k == 0) {
			return term;
		}
		return new AbstractTransformer() {
			@Override
			protected Term apply(int depth, Term.Rel t) {
				int i = t.index();
				int base = n + depth;
				if (i <= base) {
					return t;
				} else if (i <= base + k) {
					return lift(base, values.get(i - base - 1));
				} else {
					return new Term.Rel(i - k);
				}
			}
		}.apply(0, term);
	}

	public static Term substl(List<Term> values, Term term) {
		return substnl(values, 0, term);
	}

	public static Term subst1(Term value, Term term) {
		return substnl(Collections.singletonList(value), 0, term);
	}

	public static Term substnl(Term[] values, int n, Term term) {
		return substnl(Arrays.asList(values), n, term);
	}

	/**
	 * Check that no index in the range <code>n</code> (inclusive) to
	 * <code>n+m</code> (exclusive) occurs free in a term.
	 *
	 * @param n
	 * @param m
	 * @param term
	 * @return
	 */
	public static boolean noccurBetween(int n, int m, Term term) {
		final boolean[] found = new boolean[1];
		new AbstractTransformer() {
			@Override
			protected Term apply(int depth, Term.Rel t) {
				int i = t.index() - depth;
				if (i >= n && i < n + m) {
					found[0] = true;
				}
				return t;
			}
		}.apply(0, term);
		return !found[0];
	}

	public static boolean noccurn(int n, Term term) {
		return noccurBetween(n, 1, term);
	}

	/**
	 * Check whether a given subterm occurs in a term, where the subterm is lifted
	 * whenever a binder is crossed.
	 *
	 * @param sub
	 * @param term
	 * @return
	 */
	public static boolean dependent(Term sub, Term term) {
		final boolean[] found = new boolean[1];
		new AbstractTransformer() {
			@Override
			public Term apply(int depth, Term t) {
				if (found[0]) {
					return t;
				} else if (t.equals(lift(depth, sub))) {
					found[0] = true;
					return t;
				} else if (t instanceof Term.App) {
					// Partial applications are subterms too
					Term.App app = (Term.App) t;
					Term[] args = app.arguments();
					for (int i = 1; i < args.length; ++i) {
						Term prefix = new Term.App(app.head(), Arrays.copyOf(args, i));
						if (prefix.equals(lift(depth, sub))) {
							found[0] = true;
							return t;
						}
					}
				}
				return super.apply(depth, t);
			}
		}.apply(0, term);
		return found[0];
	}

	/**
	 * Replace every occurrence of <code>from</code> in a term by <code>to</code>,
	 * lifting both when crossing binders.
	 *
	 * @param from
	 * @param to
	 * @param term
	 * @return
	 */
	public static Term replaceTerm(Term from, Term to, Term term) {
		return new AbstractTransformer() {
			@Override
			public Term apply(int depth, Term t) {
				if (t.equals(lift(depth, from))) {
					return lift(depth, to);
				}
				return super.apply(depth, t);
			}
		}.apply(0, term);
	}

	/**
	 * Split a term into its head and the (possibly empty) list of arguments it
	 * is applied to.
	 *
	 * @param term
	 * @return
	 */
	public static Pair<Term, List<Term>> decomposeApp(Term term) {
		if (term instanceof Term.App) {
			Term.App app = (Term.App) term;
			return new Pair<>(app.head(), Arrays.asList(app.arguments()));
		}
		return new Pair<>(term, Collections.emptyList());
	}

	public static Term head(Term term) {
		return decomposeApp(term).first();
	}

	public static List<Term> arguments(Term term) {
		return decomposeApp(term).second();
	}

	/**
	 * Apply a term to a list of arguments, returning the term itself for an
	 * empty list.
	 *
	 * @param head
	 * @param arguments
	 * @return
	 */
	public static Term applist(Term head, List<Term> arguments) {
		if (arguments.isEmpty()) {
			return head;
		}
		return new Term.App(head, Syntax.toArray(arguments));
	}

	public static Term applist(Term head, Term... arguments) {
		return applist(head, Arrays.asList(arguments));
	}

	/**
	 * Compute the list <code>#(n+m), ..., #(n+1)</code>, i.e. references to the
	 * <code>m</code> innermost variables above <code>n</code>, outermost first.
	 *
	 * @param n
	 * @param m
	 * @return
	 */
	public static List<Term> relList(int n, int m) {
		ArrayList<Term> r = new ArrayList<>();
		for (int i = m; i > 0; --i) {
			r.add(new Term.Rel(n + i));
		}
		return r;
	}

	/**
	 * Strip the leading products and let-ins of a term, returning them as a
	 * context together with the remaining conclusion.
	 *
	 * @param term
	 * @return
	 */
	public static Pair<Context, Term> decomposeProdAssum(Term term) {
		Context ctx = Context.EMPTY;
		while (true) {
			if (term instanceof Term.Product) {
				Term.Product p = (Term.Product) term;
				ctx = ctx.push(new Declaration(p.name(), p.type()));
				term = p.body();
			} else if (term instanceof Term.LetIn) {
				Term.LetIn l = (Term.LetIn) term;
				ctx = ctx.push(new Declaration(l.name(), l.value(), l.type()));
				term = l.body();
			} else {
				return new Pair<>(ctx, term);
			}
		}
	}

	public static Term mkProdOrLetIn(Declaration decl, Term body) {
		if (decl.isDefinition()) {
			return new Term.LetIn(decl.name(), decl.value(), decl.type(), body);
		}
		return new Term.Product(decl.name(), decl.type(), body);
	}

	public static Term mkLambdaOrLetIn(Declaration decl, Term body) {
		if (decl.isDefinition()) {
			return new Term.LetIn(decl.name(), decl.value(), decl.type(), body);
		}
		return new Term.Lambda(decl.name(), decl.type(), body);
	}

	/**
	 * Close a term over every binding of a context, innermost first.
	 *
	 * @param term
	 * @param ctx
	 * @return
	 */
	public static Term itMkProdOrLetIn(Term term, Context ctx) {
		for (int i = 1; i <= ctx.size(); ++i) {
			term = mkProdOrLetIn(ctx.get(i), term);
		}
		return term;
	}

	public static Term itMkLambdaOrLetIn(Term term, Context ctx) {
		for (int i = 1; i <= ctx.size(); ++i) {
			term = mkLambdaOrLetIn(ctx.get(i), term);
		}
		return term;
	}

	/**
	 * Close a term over a context, dropping bindings which the body does not
	 * depend on.
	 *
	 * @param term
	 * @param ctx
	 * @return
	 */
	public static Term itMkProdOrClear(Term term, Context ctx) {
		for (int i = 1; i <= ctx.size(); ++i) {
			Declaration decl = ctx.get(i);
			if (noccurn(1, term)) {
				term = subst1(PROP, term);
			} else {
				term = mkProdOrLetIn(decl, term);
			}
		}
		return term;
	}

	/**
	 * Close a term over a context of hypotheses. Assumptions are always kept,
	 * whilst definitions the body does not depend on are dropped.
	 *
	 * @param term
	 * @param ctx
	 * @return
	 */
	public static Term itMkProdOrClean(Term term, Context ctx) {
		for (int i = 1; i <= ctx.size(); ++i) {
			Declaration decl = ctx.get(i);
			if (decl.isDefinition() && noccurn(1, term)) {
				term = subst1(PROP, term);
			} else {
				term = mkProdOrLetIn(decl, term);
			}
		}
		return term;
	}

	/**
	 * Close a term over a context, inlining definitions rather than binding
	 * them.
	 *
	 * @param term
	 * @param ctx
	 * @return
	 */
	public static Term itMkProdOrSubst(Term term, Context ctx) {
		for (int i = 1; i <= ctx.size(); ++i) {
			Declaration decl = ctx.get(i);
			if (decl.isDefinition()) {
				term = subst1(decl.value(), term);
			} else {
				term = mkProdOrLetIn(decl, term);
			}
		}
		return term;
	}

	/**
	 * Reduce every beta redex in a term.
	 *
	 * @param term
	 * @return
	 */
	public static Term nfBeta(Term term) {
		return BETA.apply(0, term);
	}

	private static final AbstractTransformer BETA = new AbstractTransformer() {
		@Override
		protected Term apply(int depth, Term.App term) {
			Term head = apply(depth, term.head());
			Term[] args = apply(depth, term.arguments());
			int i = 0;
			while (i < args.length && head instanceof Term.Lambda) {
				head = apply(depth, subst1(args[i++], ((Term.Lambda) head).body()));
			}
			if (i == 0 && head == term.head() && args == term.arguments()) {
				return term;
			} else if (i == args.length) {
				return head;
			} else {
				return new Term.App(head, Arrays.copyOfRange(args, i, args.length));
			}
		}
	};

	/**
	 * Check whether a term is a variable reference.
	 *
	 * @param term
	 * @return
	 */
	public static boolean isRel(Term term) {
		return term instanceof Term.Rel;
	}

	public static final Term PROP = new Term.Sort(Term.Sort.Kind.PROP);
}
