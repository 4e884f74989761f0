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

import funelim.core.Recursion.Relevance;
import funelim.core.Splitting.RightHandSide;
import funelim.core.Syntax.Term;
import funelim.util.Anomaly;
import funelim.util.Pair;

/**
 * A leaf computation extracted from a splitting tree: in a given context, the
 * function applied to the patterns computes the right-hand side. Where clauses
 * and refinements of the leaf give rise to nested computations.
 *
 * @author David J. Pearce
 *
 */
public class Computation {

	public enum NodeKind {
		REGULAR, REFINE, WHERE, NESTED, NESTED_RECURSIVE;

		public boolean isRegularOrNested() {
			return this == REGULAR || this == NESTED || this == NESTED_RECURSIVE;
		}

		public boolean isRegularOrNestedRecursive() {
			return this == REGULAR || this == NESTED_RECURSIVE;
		}

		public static NodeKind of(Splitting.Program program) {
			Recursion r = program.recursion();
			if (r instanceof Recursion.Structural) {
				Recursion.Decreasing d = ((Recursion.Structural) r).decreasing();
				if (d.kind() == Recursion.Decreasing.Kind.NESTED) {
					return d.argument() != null ? NESTED_RECURSIVE : NESTED;
				}
			}
			return REGULAR;
		}
	}

	private final Context context;
	private final Term function;
	private final Alias alias;
	private final List<Term> patterns;
	private final Term type;
	private final NodeKind kind;
	private final boolean cut;
	private final RightHandSide rhs;
	private final List<Nested> nested;

	public Computation(Context context, Term function, Alias alias, List<Term> patterns, Term type, NodeKind kind,
			boolean cut, RightHandSide rhs, List<Nested> nested) {
		this.context = context;
		this.function = function;
		this.alias = alias;
		this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
		this.type = type;
		this.kind = kind;
		this.cut = cut;
		this.rhs = rhs;
		this.nested = Collections.unmodifiableList(new ArrayList<>(nested));
	}

	public Context context() {
		return context;
	}

	public Term function() {
		return function;
	}

	/**
	 * Get the alias under which this computation's function is known, or
	 * <code>null</code> if it has none.
	 *
	 * @return
	 */
	public Alias alias() {
		return alias;
	}

	/**
	 * The patterns, outermost first, i.e. the arguments of the function.
	 *
	 * @return
	 */
	public List<Term> patterns() {
		return patterns;
	}

	public Term type() {
		return type;
	}

	public NodeKind kind() {
		return kind;
	}

	/**
	 * Determine whether this computation lies below a refinement, in which case
	 * its graph constructor does not recurse through the enclosing relation.
	 *
	 * @return
	 */
	public boolean isCut() {
		return cut;
	}

	public RightHandSide rhs() {
		return rhs;
	}

	public List<Nested> nested() {
		return nested;
	}

	/**
	 * Forget the nested computations, as happens when flattening.
	 *
	 * @return
	 */
	public Computation flat() {
		return new Computation(context, function, alias, patterns, type, kind, cut, rhs, Collections.emptyList());
	}

	@Override
	public String toString() {
		return context + " |- " + Terms.applist(function, patterns) + " := " + rhs + " [" + kind
				+ (cut ? ", cut" : "") + "]";
	}

	/**
	 * Selects some arguments of a call by position. Positions are increasing;
	 * arguments beyond the last position are all kept.
	 *
	 * @param filter
	 * @param arguments
	 * @return
	 */
	public static List<Term> filterArguments(int[] filter, List<Term> arguments) {
		ArrayList<Term> r = new ArrayList<>();
		int f = 0;
		for (int i = 0; i != arguments.size(); ++i) {
			if (f == filter.length) {
				r.addAll(arguments.subList(i, arguments.size()));
				break;
			} else if (i == filter[f]) {
				r.add(arguments.get(i));
				f = f + 1;
			} else if (i > filter[f]) {
				throw new Anomaly("argument filter is not increasing", Arrays.toString(filter));
			}
		}
		return r;
	}

	/**
	 * A function reference which is replaced by another term after
	 * specialisation, e.g. a where clause replaced by its implementation. The
	 * name is that of the lemma unfolding the alias.
	 */
	public static class Alias {
		private final Term function;
		private final int[] filter;
		private final String name;
		private final Splitting splitting;

		public Alias(Term function, int[] filter, String name, Splitting splitting) {
			this.function = function;
			this.filter = filter;
			this.name = name;
			this.splitting = splitting;
		}

		public Term function() {
			return function;
		}

		public int[] filter() {
			return filter;
		}

		public String name() {
			return name;
		}

		public Splitting splitting() {
			return splitting;
		}

		@Override
		public String toString() {
			return function + Arrays.toString(filter) + " as " + name;
		}
	}

	/**
	 * The computations of a where clause or the continuation of a refinement.
	 */
	public static class Nested {
		private final Term function;
		private final int[] filter;
		private final Alias alias;
		private final Path path;
		private final Context context;
		private final Term arity;
		private final List<Term> patterns;
		private final List<Pair<Term, Integer>> arguments;
		private final List<Computation> computations;

		public Nested(Term function, int[] filter, Alias alias, Path path, Context context, Term arity,
				List<Term> patterns, List<Pair<Term, Integer>> arguments, List<Computation> computations) {
			this.function = function;
			this.filter = filter;
			this.alias = alias;
			this.path = path;
			this.context = context;
			this.arity = arity;
			this.patterns = patterns;
			this.arguments = arguments;
			this.computations = computations;
		}

		public Term function() {
			return function;
		}

		public int[] filter() {
			return filter;
		}

		public Alias alias() {
			return alias;
		}

		public Path path() {
			return path;
		}

		public Context context() {
			return context;
		}

		public Term arity() {
			return arity;
		}

		public List<Term> patterns() {
			return patterns;
		}

		/**
		 * The refined objects, each with the argument position at which the
		 * refinement binds it.
		 *
		 * @return
		 */
		public List<Pair<Term, Integer>> arguments() {
			return arguments;
		}

		public List<Computation> computations() {
			return computations;
		}
	}

	/**
	 * Describes one function of a flattened block: the function itself, a where
	 * clause, or the continuation of a refinement. Each header gives rise to one
	 * inductive type of the graph.
	 */
	public static class Header {
		private final Term function;
		private final int[] filter;
		private final Alias alias;
		private final Path path;
		private final Context signature;
		private final Term arity;
		private final List<Term> patterns;
		private final List<Pair<Term, Integer>> arguments;
		private final NodeKind kind;
		private final boolean cut;

		public Header(Term function, int[] filter, Alias alias, Path path, Context signature, Term arity,
				List<Term> patterns, List<Pair<Term, Integer>> arguments, NodeKind kind, boolean cut) {
			this.function = function;
			this.filter = filter;
			this.alias = alias;
			this.path = path;
			this.signature = signature;
			this.arity = arity;
			this.patterns = patterns;
			this.arguments = arguments;
			this.kind = kind;
			this.cut = cut;
		}

		public Term function() {
			return function;
		}

		public int[] filter() {
			return filter;
		}

		public Alias alias() {
			return alias;
		}

		public Path path() {
			return path;
		}

		public Context signature() {
			return signature;
		}

		public Term arity() {
			return arity;
		}

		public List<Term> patterns() {
			return patterns;
		}

		public List<Pair<Term, Integer>> arguments() {
			return arguments;
		}

		public NodeKind kind() {
			return kind;
		}

		public boolean isCut() {
			return cut;
		}

		/**
		 * The continuation of a refinement only carries proofs.
		 *
		 * @return
		 */
		public Relevance relevance() {
			return kind == NodeKind.REFINE ? Relevance.LOGICAL : Relevance.COMPUTATIONAL;
		}

		/**
		 * Replace the function of this header by its alias, if it has one.
		 *
		 * @return
		 */
		public Header resolveAlias() {
			if (alias == null) {
				return this;
			}
			return new Header(alias.function(), alias.filter(), null, path, signature, arity, patterns, arguments,
					kind, cut);
		}

		@Override
		public String toString() {
			return path.toIdentifier() + " : " + Terms.itMkProdOrLetIn(arity, signature) + " [" + kind + "]";
		}
	}

	/**
	 * A header together with the (flattened) computations defining it.
	 */
	public static class Block {
		private final Header header;
		private final List<Computation> computations;

		public Block(Header header, List<Computation> computations) {
			this.header = header;
			this.computations = Collections.unmodifiableList(new ArrayList<>(computations));
		}

		public Header header() {
			return header;
		}

		public List<Computation> computations() {
			return computations;
		}

		@Override
		public String toString() {
			return header + " " + computations;
		}
	}
}
