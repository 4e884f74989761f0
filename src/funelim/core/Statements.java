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

import funelim.core.Computation.Alias;
import funelim.core.Computation.Block;
import funelim.core.Computation.Header;
import funelim.core.Computation.NodeKind;
import funelim.core.Splitting.RightHandSide;
import funelim.core.Syntax.Term;

/**
 * Builds, for each leaf computation of a block of functions, the equation it
 * satisfies and the constructor of the graph relation witnessing it.
 *
 * @author David J. Pearce
 *
 */
public class Statements {
	private static final boolean DEBUG = false;

	private final Logic logic;
	private final RecursiveCalls resolver;
	private final Term function;

	/**
	 * Construct a builder for the statements of a block.
	 *
	 * @param logic    The logical constants to use
	 * @param resolver Resolves recursive calls into induction hypotheses
	 * @param function The main function of the block
	 */
	public Statements(Logic logic, RecursiveCalls resolver, Term function) {
		this.logic = logic;
		this.resolver = resolver;
		this.function = function;
	}

	/**
	 * Build the statements of every block. The headers of the resulting groups
	 * have their aliases resolved.
	 *
	 * @param blocks
	 * @return
	 */
	public List<Group> build(List<Block> blocks) {
		ArrayList<Group> groups = new ArrayList<>();
		for (int i = 0; i != blocks.size(); ++i) {
			Block b = blocks.get(i);
			Header h = b.header();
			int[] filter = h.alias() != null ? h.alias().filter() : h.filter();
			ArrayList<Statement> stmts = new ArrayList<>();
			for (Computation c : b.computations()) {
				stmts.add(statement(blocks.size(), i, filter, c));
			}
			groups.add(new Group(i, h.resolveAlias(), stmts));
		}
		if (DEBUG) {
			for (Group g : groups) {
				System.err.println("GROUP " + g);
			}
		}
		return groups;
	}

	/**
	 * Build the statement of one computation in the <code>i</code>th block of
	 * <code>n</code>.
	 *
	 * @param n
	 * @param i
	 * @param filter The arguments of the block's function kept by its relation
	 * @param c
	 * @return
	 */
	public Statement statement(int n, int i, int[] filter, Computation c) {
		Alias alias = c.alias();
		Term head;
		String unfold;
		if (alias != null) {
			head = alias.function();
			unfold = "rewrite " + alias.name();
		} else {
			head = c.function();
			unfold = c.function().equals(function) ? "reflexivity || unfold " + function : "idtac";
		}
		Term call = Terms.applist(head, c.patterns());
		Context ctx = c.context();
		RightHandSide rhs = c.rhs();
		if (rhs instanceof RightHandSide.Empty) {
			Term body = Terms.itMkProdOrLetIn(logic.mkImpossibleCall(c.type(), call), ctx);
			return new Statement(c.kind(), unfold, body, null);
		}
		Term value = Terms.nfBeta(((RightHandSide.Program) rhs).term());
		Term body = Terms.itMkProdOrLetIn(logic.mkEq(c.type(), call, value), ctx);
		// Constructor of the graph
		int len = ctx.size();
		RecursiveCalls.Hypotheses hyps = resolver.abstractCalls(len, value);
		int hypslen = hyps.count();
		Term relation = new Term.Rel(len + (n - i) + hypslen);
		if (!c.isCut()) {
			List<Term> args = Terms.lift(hypslen, Terms.arguments(c.function()));
			relation = Terms.applist(relation, Computation.filterArguments(filter, args));
		}
		List<Term> args = new ArrayList<>(Terms.lift(hypslen, c.patterns()));
		args.add(hyps.term());
		Term constructor = Terms.itMkProdOrClear(
				Terms.itMkProdOrClean(Terms.applist(relation, args), hyps.context()), ctx);
		return new Statement(c.kind(), unfold, body, constructor);
	}

	/**
	 * Construct the graph relation of a block from its statements.
	 *
	 * @param groups
	 * @return
	 */
	public InductiveBlock graph(List<Group> groups) {
		ArrayList<InductiveBlock.Body> bodies = new ArrayList<>();
		for (Group g : groups) {
			Header h = g.header();
			Term arity = Terms.itMkProdOrLetIn(new Term.Product(Syntax.ANONYMOUS, h.arity(), logic.sort()),
					h.signature());
			ArrayList<String> names = new ArrayList<>();
			ArrayList<Term> constructors = new ArrayList<>();
			for (int j = 0; j != g.statements().size(); ++j) {
				Statement s = g.statements().get(j);
				if (s.constructor() != null) {
					names.add(g.constructorName(j));
					constructors.add(s.constructor());
				}
			}
			bodies.add(new InductiveBlock.Body(g.inductiveName(), arity, names, constructors));
		}
		return new InductiveBlock(groups.get(0).inductiveName(), bodies);
	}

	/**
	 * The equation of a computation, and its graph constructor when it has a
	 * right-hand side.
	 */
	public static class Statement {
		private final NodeKind kind;
		private final String unfold;
		private final Term body;
		private final Term constructor;

		public Statement(NodeKind kind, String unfold, Term body, Term constructor) {
			this.kind = kind;
			this.unfold = unfold;
			this.body = body;
			this.constructor = constructor;
		}

		public NodeKind kind() {
			return kind;
		}

		/**
		 * The proof step which unfolds the function in the equation.
		 *
		 * @return
		 */
		public String unfold() {
			return unfold;
		}

		public Term body() {
			return body;
		}

		/**
		 * The type of the graph constructor, or <code>null</code> for an
		 * impossible computation.
		 *
		 * @return
		 */
		public Term constructor() {
			return constructor;
		}

		public boolean isImpossible() {
			return constructor == null;
		}

		@Override
		public String toString() {
			return body + (constructor != null ? " | " + constructor : "");
		}
	}

	/**
	 * The statements of one block.
	 */
	public static class Group {
		private final int index;
		private final Header header;
		private final List<Statement> statements;

		public Group(int index, Header header, List<Statement> statements) {
			this.index = index;
			this.header = header;
			this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
		}

		public int index() {
			return index;
		}

		public Header header() {
			return header;
		}

		public List<Statement> statements() {
			return statements;
		}

		public String inductiveName() {
			return header.path().toIdentifier() + "_ind";
		}

		public String equationName(int j) {
			return header.path().toIdentifier() + "_equation_" + (j + 1);
		}

		public String constructorName(int j) {
			String kind = statements.get(j).kind() == NodeKind.REFINE ? "_refinement_" : "_equation_";
			return inductiveName() + kind + (j + 1);
		}

		@Override
		public String toString() {
			String r = header.toString();
			for (Statement s : statements) {
				r += "\n  " + s;
			}
			return r;
		}
	}
}
