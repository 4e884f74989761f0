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
package funelim.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import funelim.core.Compilation;
import funelim.core.Computation.Block;
import funelim.core.Computation.NodeKind;
import funelim.core.Computations;
import funelim.core.Definition;
import funelim.core.InductiveBlock;
import funelim.core.Logic;
import funelim.core.Problem;
import funelim.core.ProblemSubstitution;
import funelim.core.Prototype;
import funelim.core.RecSubst;
import funelim.core.Recursion;
import funelim.core.RecursiveCalls;
import funelim.core.Splitting;
import funelim.core.Statements;
import funelim.core.Statements.Group;
import funelim.core.Statements.Statement;
import funelim.core.Syntax.Term;
import funelim.io.Parser;

/**
 * Tests for the equations and graph constructors built from the leaves of a
 * function.
 *
 * @author David J. Pearce
 *
 */
public class StatementTests {

	@Test
	public void test_identity_01() {
		List<Group> groups = groups(Definitions.identity(), null);
		assertEquals(1, groups.size());
		Group g = groups.get(0);
		assertEquals(1, g.statements().size());
		Statement s = g.statements().get(0);
		check("forall (n : nat), eq nat (f #1) #1", s.body());
		check("forall (n : nat), #2 #1 #1", s.constructor());
		assertEquals("reflexivity || unfold f", s.unfold());
		assertFalse(s.isImpossible());
	}

	@Test
	public void test_identity_02() {
		Group g = groups(Definitions.identity(), null).get(0);
		assertEquals("f_ind", g.inductiveName());
		assertEquals("f_equation_1", g.equationName(0));
		assertEquals("f_ind_equation_1", g.constructorName(0));
	}

	@Test
	public void test_structural_01() {
		List<Group> groups = groups(Definitions.structural(), Definitions.structuralRecursion());
		assertEquals(1, groups.size());
		List<Statement> stmts = groups.get(0).statements();
		assertEquals(2, stmts.size());
		check("eq nat (f O) O", stmts.get(0).body());
		check("forall (n : nat), eq nat (f (S #1)) (f #1)", stmts.get(1).body());
	}

	@Test
	public void test_structural_02() {
		// The recursive call becomes an induction hypothesis
		List<Statement> stmts = groups(Definitions.structural(), Definitions.structuralRecursion()).get(0)
				.statements();
		check("#1 O O", stmts.get(0).constructor());
		check("forall (n : nat), forall (Hind : #2 #1 (f #1)), #3 (S #2) (f #2)", stmts.get(1).constructor());
	}

	@Test
	public void test_structural_03() {
		Statements statements = statements(Definitions.structural(), Definitions.structuralRecursion());
		InductiveBlock graph = statements.graph(groups(Definitions.structural(), Definitions.structuralRecursion()));
		assertEquals("f_ind", graph.name());
		assertEquals(1, graph.size());
		InductiveBlock.Body body = graph.get(0);
		assertEquals("f_ind", body.name());
		check("forall (n : nat), forall (_ : nat), Prop", body.arity());
		assertEquals(Arrays.asList("f_ind_equation_1", "f_ind_equation_2"), body.constructorNames());
		assertEquals(2, body.constructors().size());
	}

	@Test
	public void test_impossible_01() {
		Group g = groups(Definitions.impossible(), null).get(0);
		Statement s = g.statements().get(0);
		assertTrue(s.isImpossible());
		assertNull(s.constructor());
		check("forall (x : False), ImpossibleCall nat (f #1)", s.body());
	}

	@Test
	public void test_impossible_02() {
		// Impossible computations have no constructor
		Definition d = Definitions.impossible();
		InductiveBlock graph = statements(d, null).graph(groups(d, null));
		assertTrue(graph.get(0).constructors().isEmpty());
		assertTrue(graph.get(0).constructorNames().isEmpty());
		check("forall (x : False), forall (_ : nat), Prop", graph.get(0).arity());
	}

	@Test
	public void test_refined_01() {
		List<Group> groups = groups(Definitions.refined(), null);
		assertEquals(2, groups.size());
		Statement s = groups.get(0).statements().get(0);
		assertEquals(NodeKind.REFINE, s.kind());
		check("forall (n : nat), eq nat (f #1) (f_clause_1 #1 (g #1))", s.body());
		check("forall (n : nat), forall (Hind : #2 #1 (g #1) (f_clause_1 #1 (g #1))), #4 #2 (f_clause_1 #2 (g #2))",
				s.constructor());
		assertEquals("f_ind_refinement_1", groups.get(0).constructorName(0));
	}

	@Test
	public void test_refined_02() {
		Group g = groups(Definitions.refined(), null).get(1);
		Statement s = g.statements().get(0);
		assertEquals("f_refinement_1_ind", g.inductiveName());
		assertEquals("f_refinement_1_equation_1", g.equationName(0));
		assertEquals("f_refinement_1_ind_equation_1", g.constructorName(0));
		assertEquals("idtac", s.unfold());
		check("forall (n : nat), forall (m : nat), eq nat (f_clause_1 #2 #1) #1", s.body());
		check("forall (n : nat), forall (m : nat), #3 #2 #1 #1", s.constructor());
	}

	@Test
	public void test_refined_03() {
		Definition d = Definitions.refined();
		InductiveBlock graph = statements(d, null).graph(groups(d, null));
		assertEquals("f_ind", graph.name());
		assertEquals(2, graph.size());
		assertEquals("f_refinement_1_ind", graph.get(1).name());
		check("forall (n : nat), forall (m : nat), forall (_ : nat), Prop", graph.get(1).arity());
		assertEquals(Collections.singletonList("f_ind_refinement_1"), graph.get(0).constructorNames());
	}

	private static void check(String expected, Term actual) {
		assertEquals(Parser.parse(expected), actual);
	}

	private static List<Group> groups(Definition d, Recursion.Descriptor recursion) {
		return statements(d, recursion).build(blocks(d, recursion));
	}

	private static Statements statements(Definition d, Recursion.Descriptor recursion) {
		List<Prototype> protos = Prototype.of(blocks(d, recursion));
		RecursiveCalls resolver = new RecursiveCalls(recursion, d.userObligations(), protos, true);
		return new Statements(Logic.DEFAULT, resolver, d.function());
	}

	private static List<Block> blocks(Definition d, Recursion.Descriptor recursion) {
		Compilation compilation = new Compilation(System.err, d.splitting());
		RecSubst recs = ProblemSubstitution.selfReferences(Collections.singletonList(d.program().id()));
		Problem cut = ProblemSubstitution.cutProblem(recs, Splitting.rootProblem(d.splitting()).target());
		Splitting tree = new ProblemSubstitution(compilation).updateSplit(d.program(), recursion, d.function(), cut,
				recs, d.splitting());
		return new Computations(compilation).allComputations(null, Collections.singletonList(d.withSplitting(tree)));
	}
}
