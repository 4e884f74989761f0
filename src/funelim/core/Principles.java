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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import funelim.core.Computation.Alias;
import funelim.core.Computation.Block;
import funelim.core.Statements.Group;
import funelim.core.Statements.Statement;
import funelim.core.Syntax.Term;
import funelim.util.ProofFailure;

/**
 * Derives the equations, graph and elimination principle of a block of
 * functions, declaring each of them in a kernel.
 *
 * @author David J. Pearce
 *
 */
public class Principles {
	private static final boolean DEBUG = false;

	public static class Options {
		public static final Options DEFAULT = new Options(true, false);

		private final boolean withInduction;
		private final boolean transparent;

		/**
		 *
		 * @param withInduction Declare the graph and the principles over it
		 * @param transparent   Make the function transparent again once everything
		 *                      has been declared
		 */
		public Options(boolean withInduction, boolean transparent) {
			this.withInduction = withInduction;
			this.transparent = transparent;
		}

		public boolean withInduction() {
			return withInduction;
		}

		public boolean transparent() {
			return transparent;
		}
	}

	private final Kernel kernel;
	private final Logic logic;
	private final Options options;
	private final PrintStream warnings;

	public Principles(Kernel kernel) {
		this(kernel, Logic.DEFAULT, Options.DEFAULT, System.err);
	}

	public Principles(Kernel kernel, Logic logic, Options options, PrintStream warnings) {
		this.kernel = kernel;
		this.logic = logic;
		this.options = options;
		this.warnings = warnings;
	}

	public Derivation derive(List<Definition> definitions, Recursion.Descriptor recursion) {
		return derive(definitions, recursion, null);
	}

	/**
	 * Derive everything for a block of functions. The first definition is the
	 * main function of the block.
	 *
	 * @param definitions The function and its mutual or nested siblings
	 * @param recursion   How the block recurses, or <code>null</code> when it does
	 *                    not
	 * @param alias       The function which the main function unfolds to, or
	 *                    <code>null</code>
	 * @return
	 */
	public Derivation derive(List<Definition> definitions, Recursion.Descriptor recursion, Alias alias) {
		Definition main = definitions.get(0);
		String base = main.program().id();
		Term function = main.function();
		// Specialise
		ArrayList<Splitting> trees = new ArrayList<>();
		ArrayList<String> ids = new ArrayList<>();
		Set<String> obligations = new LinkedHashSet<>();
		for (Definition d : definitions) {
			trees.add(d.splitting());
			ids.add(d.program().id());
			obligations.addAll(d.userObligations());
		}
		Compilation compilation = new Compilation(warnings, trees);
		ProblemSubstitution substitution = new ProblemSubstitution(compilation);
		RecSubst recs = ProblemSubstitution.selfReferences(ids);
		ArrayList<Definition> specialised = new ArrayList<>();
		for (Definition d : definitions) {
			Problem cut = ProblemSubstitution.cutProblem(recs, Splitting.rootProblem(d.splitting()).target());
			specialised.add(d.withSplitting(
					substitution.updateSplit(d.program(), recursion, d.function(), cut, recs, d.splitting())));
		}
		// Flatten
		List<Block> blocks = new Computations(compilation).allComputations(alias, specialised);
		List<Prototype> prototypes = Prototype.of(blocks);
		Statements statements = new Statements(logic, new RecursiveCalls(recursion, obligations, prototypes, true),
				function);
		List<Group> groups = statements.build(blocks);
		// Equations
		ArrayList<Derivation.Lemma> equations = new ArrayList<>();
		for (Group g : groups) {
			for (int j = 0; j != g.statements().size(); ++j) {
				Statement s = g.statements().get(j);
				String name = g.equationName(j);
				ProofStrategy strategy = ProofStrategy.equation(s.unfold(), base, !compilation.isEmpty());
				boolean proved = attempt(name, s.body(), strategy);
				if (s.isImpossible()) {
					kernel.declareInstance(name, logic.impossibleCall(), Collections.emptyList());
				} else {
					kernel.addRewriteRule(base, name);
				}
				equations.add(new Derivation.Lemma(name, s.body(), strategy, proved));
			}
		}
		kernel.setOpaque(function);
		if (alias != null) {
			kernel.setOpaque(alias.function());
		}
		if (!options.withInduction()) {
			return new Derivation(equations, null, null, null, 0);
		}
		// Graph
		InductiveBlock graph = statements.graph(groups);
		kernel.declareInductive(graph);
		for (InductiveBlock.Body body : graph.bodies()) {
			for (String constructor : body.constructorNames()) {
				kernel.addHint(base, constructor);
			}
		}
		// Functional induction
		Context sign = main.program().signature();
		Term fn = alias != null ? alias.function() : function;
		Term app = Terms.applist(fn, Terms.relList(0, sign.size()));
		String indid = base + "_ind_fun";
		Term statement = inductionStatement(graph.name(), groups);
		boolean proved = attempt(indid, statement, ProofStrategy.induction(base));
		Derivation.Lemma induction = new Derivation.Lemma(indid, statement, ProofStrategy.induction(base), proved);
		kernel.addHint(base, indid);
		// Elimination
		String scheme;
		ArrayList<Integer> inductives = new ArrayList<>();
		if (groups.size() == 1) {
			scheme = base + "_ind" + suffix();
			inductives.add(0);
		} else {
			scheme = base + "_ind_comb";
			for (Group g : groups) {
				if (g.header().kind().isRegularOrNestedRecursive()) {
					inductives.add(g.index());
				}
			}
		}
		Term schemety = kernel.scheme(scheme, graph, inductives);
		RecursiveCalls resolver = new RecursiveCalls(recursion, obligations, prototypes, false);
		EliminationType.Principle principle = new EliminationType(logic, resolver).compute(graph.name(), groups,
				sign, app, schemety);
		String elimid = base + "_elim";
		ProofStrategy elimtac = ProofStrategy.elimination(scheme, graph.name());
		proved = attempt(elimid, principle.type(), elimtac);
		Derivation.Lemma elimination = new Derivation.Lemma(elimid, principle.type(), elimtac, proved);
		kernel.declareInstance("FunctionalElimination_" + base, logic.functionalElimination(),
				Arrays.asList(function, principle.type(), logic.numeral(principle.arity()), new Term.Const(elimid)));
		kernel.declareInstance("FunctionalInduction_" + base, logic.functionalInduction(),
				Arrays.asList(function, statement, new Term.Const(indid)));
		if (options.transparent()) {
			kernel.setTransparent(function);
			if (alias != null) {
				kernel.setTransparent(alias.function());
			}
		}
		if (DEBUG) {
			System.err.println(graph);
			System.err.println(elimination);
		}
		return new Derivation(equations, graph, induction, elimination, principle.arity());
	}

	/**
	 * The statement that each function of the block inhabits its graph,
	 * conjoined over the functions whose relations are regular or nested.
	 *
	 * @param block
	 * @param groups
	 * @return
	 */
	public Term inductionStatement(String block, List<Group> groups) {
		Term r = null;
		for (int i = groups.size() - 1; i >= 0; --i) {
			Group g = groups.get(i);
			if (groups.size() == 1 || g.header().kind().isRegularOrNested()) {
				Context sign = g.header().signature();
				List<Term> args = sign.extendedRelList(0);
				ArrayList<Term> indargs = new ArrayList<>(args);
				indargs.add(Terms.applist(g.header().function(), args));
				Term stmt = Terms.itMkProdOrSubst(Terms.applist(new Term.Ind(block, g.index()), indargs), sign);
				r = r == null ? stmt : logic.mkConj(stmt, r);
			}
		}
		return r;
	}

	private String suffix() {
		switch (((Term.Sort) logic.sort()).kind()) {
		case PROP:
			return "_ind";
		case SET:
			return "_rec";
		default:
			return "_rect";
		}
	}

	/**
	 * Attempt to prove a lemma, leaving it open when its strategy fails.
	 *
	 * @param name
	 * @param statement
	 * @param strategy
	 * @return Whether the proof went through
	 */
	private boolean attempt(String name, Term statement, ProofStrategy strategy) {
		try {
			kernel.prove(name, statement, strategy);
			return true;
		} catch (ProofFailure e) {
			warnings.println("warning: could not prove " + name + " (" + e.getMessage() + "), leaving it open");
			kernel.admit(name, statement);
			return false;
		}
	}
}
