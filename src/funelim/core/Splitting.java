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

/**
 * A splitting tree represents the case tree of a function defined by dependent
 * pattern matching. Every node (except for <code>RecValid</code>) carries a
 * matching problem <code>lhs</code> relating the variables in scope at that
 * node to the context of the enclosing function.
 *
 * @author David J. Pearce
 *
 */
public abstract class Splitting {

	private Splitting() {
	}

	/**
	 * Get the matching problem of this node, or <code>null</code> for a node
	 * which has none.
	 *
	 * @return
	 */
	public abstract Problem lhs();

	/**
	 * Find the problem at the root of a tree, looking through any recursion
	 * markers.
	 *
	 * @param tree
	 * @return
	 */
	public static Problem rootProblem(Splitting tree) {
		while (tree instanceof RecValid) {
			tree = ((RecValid) tree).body();
		}
		return tree.lhs();
	}

	/**
	 * A leaf of the tree, where the right-hand side is given. The where clauses
	 * are ordered as a context (i.e. innermost first), and both the type and the
	 * right-hand side live in the leaf context extended with them.
	 */
	public static final class Compute extends Splitting {
		private final Problem lhs;
		private final List<Where> wheres;
		private final Term type;
		private final RightHandSide rhs;

		public Compute(Problem lhs, List<Where> wheres, Term type, RightHandSide rhs) {
			this.lhs = lhs;
			this.wheres = Collections.unmodifiableList(new ArrayList<>(wheres));
			this.type = type;
			this.rhs = rhs;
		}

		public Compute(Problem lhs, Term type, RightHandSide rhs) {
			this(lhs, Collections.emptyList(), type, rhs);
		}

		@Override
		public Problem lhs() {
			return lhs;
		}

		public List<Where> wheres() {
			return wheres;
		}

		public Term type() {
			return type;
		}

		public RightHandSide rhs() {
			return rhs;
		}

		@Override
		public String toString() {
			return lhs + " := " + rhs + (wheres.isEmpty() ? "" : " where " + wheres);
		}
	}

	/**
	 * A case split on a variable of the node's context. A missing branch denotes
	 * a case which is impossible.
	 */
	public static final class Split extends Splitting {
		private final Problem lhs;
		private final int variable;
		private final Term type;
		private final Splitting[] branches;

		public Split(Problem lhs, int variable, Term type, Splitting... branches) {
			this.lhs = lhs;
			this.variable = variable;
			this.type = type;
			this.branches = branches;
		}

		@Override
		public Problem lhs() {
			return lhs;
		}

		public int variable() {
			return variable;
		}

		public Term type() {
			return type;
		}

		public Splitting[] branches() {
			return branches;
		}

		@Override
		public String toString() {
			return lhs + " split #" + variable + " " + Arrays.toString(branches);
		}
	}

	/**
	 * Re-indexes its subtree with a given problem.
	 */
	public static final class Mapping extends Splitting {
		private final Problem lhs;
		private final Splitting body;

		public Mapping(Problem lhs, Splitting body) {
			this.lhs = lhs;
			this.body = body;
		}

		@Override
		public Problem lhs() {
			return lhs;
		}

		public Splitting body() {
			return body;
		}

		@Override
		public String toString() {
			return "mapping " + lhs + " in " + body;
		}
	}

	/**
	 * Marks the point from which recursive calls are made through a given
	 * binding.
	 */
	public static final class RecValid extends Splitting {
		private final String id;
		private final Splitting body;

		public RecValid(String id, Splitting body) {
			this.id = id;
			this.body = body;
		}

		@Override
		public Problem lhs() {
			return null;
		}

		public String id() {
			return id;
		}

		public Splitting body() {
			return body;
		}

		@Override
		public String toString() {
			return "rec " + id + " " + body;
		}
	}

	/**
	 * Computes an intermediate value, which the subtree then matches on.
	 */
	public static final class Refined extends Splitting {
		private final Problem lhs;
		private final Refinement info;
		private final Splitting body;

		public Refined(Problem lhs, Refinement info, Splitting body) {
			this.lhs = lhs;
			this.info = info;
			this.body = body;
		}

		@Override
		public Problem lhs() {
			return lhs;
		}

		public Refinement info() {
			return info;
		}

		public Splitting body() {
			return body;
		}

		@Override
		public String toString() {
			return lhs + " with " + info + " => " + body;
		}
	}

	/**
	 * A node with several alternative continuations sharing the same problem.
	 */
	public static final class Valid extends Splitting {
		private final Problem lhs;
		private final Term type;
		private final List<Branch> branches;

		public Valid(Problem lhs, Term type, List<Branch> branches) {
			this.lhs = lhs;
			this.type = type;
			this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
		}

		@Override
		public Problem lhs() {
			return lhs;
		}

		public Term type() {
			return type;
		}

		public List<Branch> branches() {
			return branches;
		}

		@Override
		public String toString() {
			return lhs + " valid " + branches;
		}

		/**
		 * One alternative of a valid node. The problem relates the alternative's
		 * context to the node's context, and the optional inverse maps back.
		 */
		public static final class Branch {
			private final Term goal;
			private final List<Term> arguments;
			private final Problem problem;
			private final Problem inverse;
			private final Splitting body;

			public Branch(Term goal, List<Term> arguments, Problem problem, Problem inverse, Splitting body) {
				this.goal = goal;
				this.arguments = arguments;
				this.problem = problem;
				this.inverse = inverse;
				this.body = body;
			}

			public Term goal() {
				return goal;
			}

			public List<Term> arguments() {
				return arguments;
			}

			public Problem problem() {
				return problem;
			}

			/**
			 * Get the inverse problem, or <code>null</code> if there is none.
			 *
			 * @return
			 */
			public Problem inverse() {
				return inverse;
			}

			public Splitting body() {
				return body;
			}

			public Branch with(Splitting body) {
				return new Branch(goal, arguments, problem, inverse, body);
			}

			@Override
			public String toString() {
				return problem + " => " + body;
			}
		}
	}

	/**
	 * The right-hand side of a leaf: either a program, or the variable whose
	 * type is empty.
	 */
	public static abstract class RightHandSide {

		public static final class Program extends RightHandSide {
			private final Term term;

			public Program(Term term) {
				this.term = term;
			}

			public Term term() {
				return term;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Program && ((Program) o).term.equals(term);
			}

			@Override
			public int hashCode() {
				return term.hashCode();
			}

			@Override
			public String toString() {
				return term.toString();
			}
		}

		public static final class Empty extends RightHandSide {
			private final int variable;

			public Empty(int variable) {
				this.variable = variable;
			}

			public int variable() {
				return variable;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Empty && ((Empty) o).variable == variable;
			}

			@Override
			public int hashCode() {
				return variable;
			}

			@Override
			public String toString() {
				return "!#" + variable;
			}
		}
	}

	/**
	 * Describes a program: its name, its signature (the context of its
	 * arguments), its result type in that signature and how it recurses.
	 */
	public static final class Program {
		private final String id;
		private final Context signature;
		private final Term arity;
		private final Recursion recursion;

		public Program(String id, Context signature, Term arity, Recursion recursion) {
			this.id = id;
			this.signature = signature;
			this.arity = arity;
			this.recursion = recursion;
		}

		public String id() {
			return id;
		}

		public Context signature() {
			return signature;
		}

		public Term arity() {
			return arity;
		}

		/**
		 * Get the recursion of this program, or <code>null</code> if it is not
		 * recursive.
		 *
		 * @return
		 */
		public Recursion recursion() {
			return recursion;
		}

		public Program withRecursion(Recursion recursion) {
			return new Program(id, signature, arity, recursion);
		}

		public Program withSignature(Context signature, Term arity) {
			return new Program(id, signature, arity, recursion);
		}

		/**
		 * The type of this program, i.e. its arity closed over its signature.
		 *
		 * @return
		 */
		public Term type() {
			return Terms.itMkProdOrLetIn(arity, signature);
		}

		@Override
		public String toString() {
			return id + " : " + type();
		}
	}

	/**
	 * An auxiliary definition local to a leaf. The problem relates the where
	 * clause's own context to the leaf context, whilst the term denotes the
	 * clause as seen from the leaf.
	 */
	public static final class Where {
		private final Program program;
		private final Program originalProgram;
		private final Path path;
		private final Path originalPath;
		private final Problem problem;
		private final Term arity;
		private final Term term;
		private final Term type;
		private final Splitting splitting;
		private final int contextLength;

		public Where(Program program, Program originalProgram, Path path, Path originalPath, Problem problem,
				Term arity, Term term, Term type, Splitting splitting, int contextLength) {
			this.program = program;
			this.originalProgram = originalProgram;
			this.path = path;
			this.originalPath = originalPath;
			this.problem = problem;
			this.arity = arity;
			this.term = term;
			this.type = type;
			this.splitting = splitting;
			this.contextLength = contextLength;
		}

		public String id() {
			return program.id();
		}

		public Program program() {
			return program;
		}

		public Program originalProgram() {
			return originalProgram;
		}

		public Path path() {
			return path;
		}

		public Path originalPath() {
			return originalPath;
		}

		public Problem problem() {
			return problem;
		}

		public Term arity() {
			return arity;
		}

		public Term term() {
			return term;
		}

		public Term type() {
			return type;
		}

		public Splitting splitting() {
			return splitting;
		}

		public int contextLength() {
			return contextLength;
		}

		/**
		 * The declaration binding this where clause in the leaf context.
		 *
		 * @return
		 */
		public Declaration toDeclaration() {
			return new Declaration(id(), term, type);
		}

		@Override
		public String toString() {
			return id() + " : " + type + " := " + term;
		}
	}

	/**
	 * Bind a list of where clauses (innermost first) as local definitions.
	 *
	 * @param wheres
	 * @return
	 */
	public static Context whereContext(List<Where> wheres) {
		Context ctx = Context.EMPTY;
		for (int i = wheres.size() - 1; i >= 0; --i) {
			ctx = ctx.push(wheres.get(i).toDeclaration());
		}
		return ctx;
	}

	/**
	 * Describes a refinement step. The object is the value being matched on, the
	 * witness is produced by applying the function to the arguments, and the new
	 * problem relates the context of the subtree (which binds the witness at the
	 * given argument position) to the original one.
	 */
	public static final class Refinement {
		private final String id;
		private final Term object;
		private final Term objectType;
		private final Term returnType;
		private final int argument;
		private final Path path;
		private final int placeholder;
		private final Term function;
		private final List<Term> arguments;
		private final Problem reverseContext;
		private final Problem newProblem;
		private final Problem newProblemToLhs;
		private final Term newType;

		public Refinement(String id, Term object, Term objectType, Term returnType, int argument, Path path,
				int placeholder, Term function, List<Term> arguments, Problem reverseContext, Problem newProblem,
				Problem newProblemToLhs, Term newType) {
			this.id = id;
			this.object = object;
			this.objectType = objectType;
			this.returnType = returnType;
			this.argument = argument;
			this.path = path;
			this.placeholder = placeholder;
			this.function = function;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.reverseContext = reverseContext;
			this.newProblem = newProblem;
			this.newProblemToLhs = newProblemToLhs;
			this.newType = newType;
		}

		public String id() {
			return id;
		}

		public Term object() {
			return object;
		}

		public Term objectType() {
			return objectType;
		}

		public Term returnType() {
			return returnType;
		}

		public int argument() {
			return argument;
		}

		public Path path() {
			return path;
		}

		public int placeholder() {
			return placeholder;
		}

		public Term function() {
			return function;
		}

		public List<Term> arguments() {
			return arguments;
		}

		/**
		 * The application producing the refined value.
		 *
		 * @return
		 */
		public Term application() {
			return Terms.applist(function, arguments);
		}

		public Problem reverseContext() {
			return reverseContext;
		}

		public Problem newProblem() {
			return newProblem;
		}

		public Problem newProblemToLhs() {
			return newProblemToLhs;
		}

		public Term newType() {
			return newType;
		}

		@Override
		public String toString() {
			return id + " := " + application();
		}
	}
}
