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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import funelim.core.Definition;
import funelim.core.Derivation;
import funelim.core.InductiveBlock;
import funelim.core.Logic;
import funelim.core.Principles;
import funelim.core.ProofStrategy;
import funelim.core.Recursion;
import funelim.core.Syntax.Term;
import funelim.io.Parser;

/**
 * Tests for what is declared to the kernel when deriving the principles of a
 * function.
 *
 * @author David J. Pearce
 *
 */
public class PrinciplesTests {
	private static final Term F = new Term.Const("f");

	@Test
	public void test_0x0001() {
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.structural(),
				Definitions.structuralRecursion());
		assertEquals(2, d.equations().size());
		assertEquals("f_equation_1", d.equations().get(0).name());
		assertEquals("f_equation_2", d.equations().get(1).name());
		assertTrue(d.equations().get(0).isProved());
		assertTrue(d.equations().get(1).isProved());
		assertEquals(Parser.parse("forall (n : nat), eq nat (f (S #1)) (f #1)"), kernel.proved().get("f_equation_2"));
		assertEquals(Arrays.asList("f:f_equation_1", "f:f_equation_2"), kernel.rewrites());
		assertTrue(kernel.admitted().isEmpty());
	}

	@Test
	public void test_0x0002() {
		RecordingKernel kernel = new RecordingKernel();
		derive(kernel, Principles.Options.DEFAULT, Definitions.structural(), Definitions.structuralRecursion());
		assertEquals(ProofStrategy.equation("reflexivity || unfold f", "f", false), kernel.strategy("f_equation_1"));
		assertEquals(ProofStrategy.induction("f"), kernel.strategy("f_ind_fun"));
		assertEquals(ProofStrategy.elimination("f_ind_ind", "f_ind"), kernel.strategy("f_elim"));
		assertEquals("intros; funind f; try typeclasses eauto with f", kernel.strategy("f_ind_fun").toString());
	}

	@Test
	public void test_0x0003() {
		// Graph, hints and induction lemma
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.structural(),
				Definitions.structuralRecursion());
		assertEquals(1, kernel.inductives().size());
		assertTrue(kernel.inductives().get(0) == d.graph());
		assertEquals(Arrays.asList("f:f_ind_equation_1", "f:f_ind_equation_2", "f:f_ind_fun"), kernel.hints());
		assertEquals("f_ind_fun", d.induction().name());
		assertEquals(Parser.parse("forall (n : nat), f_ind@0 #1 (f #1)"), d.induction().statement());
	}

	@Test
	public void test_0x0004() {
		// Instances of the functional induction and elimination classes
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.structural(),
				Definitions.structuralRecursion());
		assertEquals("FunctionalElimination", kernel.instanceClass("FunctionalElimination_f"));
		List<Term> elim = kernel.instance("FunctionalElimination_f");
		assertEquals(Arrays.asList(F, d.elimination().statement(), Parser.parse("S (S (S O))"),
				new Term.Const("f_elim")), elim);
		assertEquals("FunctionalInduction", kernel.instanceClass("FunctionalInduction_f"));
		assertEquals(Arrays.asList(F, d.induction().statement(), new Term.Const("f_ind_fun")),
				kernel.instance("FunctionalInduction_f"));
	}

	@Test
	public void test_0x0005() {
		// The function stays opaque by default
		RecordingKernel kernel = new RecordingKernel();
		derive(kernel, Principles.Options.DEFAULT, Definitions.identity(), null);
		assertEquals(Collections.singleton(F), kernel.opaque());
	}

	@Test
	public void test_0x0006() {
		RecordingKernel kernel = new RecordingKernel();
		derive(kernel, new Principles.Options(true, true), Definitions.identity(), null);
		assertTrue(kernel.opaque().isEmpty());
	}

	@Test
	public void test_0x0007() {
		// Only the equations
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, new Principles.Options(false, false), Definitions.structural(),
				Definitions.structuralRecursion());
		assertEquals(2, d.equations().size());
		assertNull(d.graph());
		assertNull(d.induction());
		assertNull(d.elimination());
		assertEquals(0, d.eliminationArity());
		assertTrue(kernel.inductives().isEmpty());
		assertTrue(kernel.hints().isEmpty());
		assertNull(kernel.instance("FunctionalElimination_f"));
		assertEquals(Collections.singleton(F), kernel.opaque());
	}

	@Test
	public void test_0x0008() {
		// A failed proof leaves the lemma open and carries on
		RecordingKernel kernel = new RecordingKernel("f_equation_2");
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Principles p = new Principles(kernel, Logic.DEFAULT, Principles.Options.DEFAULT, new PrintStream(out));
		Derivation d = p.derive(Collections.singletonList(Definitions.structural()),
				Definitions.structuralRecursion());
		String warnings = out.toString();
		assertTrue(warnings.startsWith("warning: could not prove f_equation_2 ("));
		assertTrue(warnings.trim().endsWith("leaving it open"));
		assertTrue(d.equations().get(0).isProved());
		assertFalse(d.equations().get(1).isProved());
		assertEquals(Parser.parse("forall (n : nat), eq nat (f (S #1)) (f #1)"), kernel.admitted().get("f_equation_2"));
		assertFalse(kernel.proved().containsKey("f_equation_2"));
		// The rest is derived regardless
		assertTrue(d.elimination().isProved());
		assertEquals(Arrays.asList("f:f_equation_1", "f:f_equation_2"), kernel.rewrites());
	}

	@Test
	public void test_0x0009() {
		RecordingKernel kernel = new RecordingKernel("f_elim", "f_ind_fun");
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Principles p = new Principles(kernel, Logic.DEFAULT, Principles.Options.DEFAULT, new PrintStream(out));
		Derivation d = p.derive(Collections.singletonList(Definitions.identity()), null);
		assertFalse(d.induction().isProved());
		assertFalse(d.elimination().isProved());
		assertTrue(kernel.admitted().containsKey("f_ind_fun"));
		assertTrue(kernel.admitted().containsKey("f_elim"));
		assertEquals(2, out.toString().split("\n").length);
		// Instances still refer to the open lemmas
		assertEquals(new Term.Const("f_elim"), kernel.instance("FunctionalElimination_f").get(3));
	}

	@Test
	public void test_0x000A() {
		// Impossible equations are declared as instances rather than rewrite rules
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.impossible(), null);
		assertEquals("ImpossibleCall", kernel.instanceClass("f_equation_1"));
		assertTrue(kernel.instance("f_equation_1").isEmpty());
		assertTrue(kernel.rewrites().isEmpty());
		assertEquals(Arrays.asList("f:f_ind_fun"), kernel.hints());
		assertTrue(d.graph().get(0).constructors().isEmpty());
	}

	@Test
	public void test_0x000B() {
		// Refinements get equations of their own
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.refined(), null);
		assertEquals(2, d.equations().size());
		assertEquals("f_equation_1", d.equations().get(0).name());
		assertEquals("f_refinement_1_equation_1", d.equations().get(1).name());
		assertEquals(ProofStrategy.equation("idtac", "f", false), d.equations().get(1).strategy());
		assertEquals(Arrays.asList("f:f_ind_refinement_1", "f:f_refinement_1_ind_equation_1", "f:f_ind_fun"),
				kernel.hints());
		// Only the function itself inhabits its graph
		assertEquals(Parser.parse("forall (n : nat), f_ind@0 #1 (f #1)"), d.induction().statement());
	}

	@Test
	public void test_0x000C() {
		// Well-founded recursion
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.wellFounded(false),
				Definitions.logicalRecursion());
		assertEquals(1, d.equations().size());
		check("forall (n : nat), eq nat (f #1) (f O)", d.equations().get(0).statement());
		InductiveBlock graph = d.graph();
		assertEquals(1, graph.size());
		assertEquals(Arrays.asList("f_ind_equation_1"), graph.get(0).constructorNames());
		check("forall (n : nat), forall (Hind : #2 O (f O)), #3 #2 (f O)", graph.get(0).constructors().get(0));
		assertEquals(Arrays.asList("f:f_equation_1"), kernel.rewrites());
	}

	@Test
	public void test_0x000D() {
		// An inverse mapping changes nothing that is derived
		Derivation d = derive(new RecordingKernel(), Principles.Options.DEFAULT, Definitions.wellFounded(true),
				Definitions.logicalRecursion());
		Derivation e = derive(new RecordingKernel(), Principles.Options.DEFAULT, Definitions.wellFounded(false),
				Definitions.logicalRecursion());
		assertEquals(e.equations().get(0).statement(), d.equations().get(0).statement());
		assertEquals(e.graph().get(0).constructors(), d.graph().get(0).constructors());
		assertEquals(e.elimination().statement(), d.elimination().statement());
	}

	@Test
	public void test_0x000E() {
		// Where clauses get equations and a relation of their own
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.where(), null);
		assertEquals(2, d.equations().size());
		assertEquals("f_equation_1", d.equations().get(0).name());
		assertEquals("f_g_equation_1", d.equations().get(1).name());
		check("forall (n : nat), eq nat (f #1) (f_g #1 (S #1))", d.equations().get(0).statement());
		check("forall (n : nat), forall (m : nat), eq nat (f_g #2 #1) #1", d.equations().get(1).statement());
		assertEquals(ProofStrategy.equation("reflexivity || unfold f", "f", false), d.equations().get(0).strategy());
		assertEquals(ProofStrategy.equation("idtac", "f", false), d.equations().get(1).strategy());
		InductiveBlock graph = d.graph();
		assertEquals(2, graph.size());
		assertEquals("f_ind", graph.get(0).name());
		assertEquals("f_g_ind", graph.get(1).name());
		check("forall (n : nat), forall (Hind : #2 #1 (S #1) (f_g #1 (S #1))), #4 #2 (f_g #2 (S #2))",
				graph.get(0).constructors().get(0));
		assertEquals(Arrays.asList("f_g_ind_equation_1"), graph.get(1).constructorNames());
		check("forall (n : nat), forall (m : nat), #3 #2 #1 #1", graph.get(1).constructors().get(0));
		check("forall (n : nat), f_ind@0 #1 (f #1)", d.induction().statement());
	}

	@Test
	public void test_0x000F() {
		// Mutual recursion gives one relation per function
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.mutual(), Definitions.mutualRecursion());
		assertEquals(3, d.equations().size());
		assertEquals("g_equation_1", d.equations().get(2).name());
		check("eq nat (f O) O", d.equations().get(0).statement());
		check("forall (n : nat), eq nat (f (S #1)) (g #1)", d.equations().get(1).statement());
		check("forall (n : nat), eq nat (g #1) (f #1)", d.equations().get(2).statement());
		InductiveBlock graph = d.graph();
		assertEquals(2, graph.size());
		assertEquals("g_ind", graph.get(1).name());
		check("#2 O O", graph.get(0).constructors().get(0));
		check("forall (n : nat), forall (Hind : #2 #1 (g #1)), #4 (S #2) (g #2)", graph.get(0).constructors().get(1));
		check("forall (n : nat), forall (Hind : #3 #1 (f #1)), #3 #2 (f #2)", graph.get(1).constructors().get(0));
		check("and (forall (n : nat), f_ind@0 #1 (f #1)) (forall (n : nat), f_ind@1 #1 (g #1))",
				d.induction().statement());
		assertEquals(Arrays.asList(0, 1), kernel.schemes().get("f_ind_comb"));
	}

	@Test
	public void test_0x0010() {
		logicalRefinement("f");
	}

	@Test
	public void test_0x0011() {
		// The recursive binder need not be named after the function
		logicalRefinement("rec");
	}

	private static void logicalRefinement(String rec) {
		RecordingKernel kernel = new RecordingKernel();
		Derivation d = derive(kernel, Principles.Options.DEFAULT, Definitions.logicalRefinement(rec),
				Definitions.logicalRecursion());
		assertEquals(2, d.equations().size());
		assertEquals("f_refinement_8_equation_1", d.equations().get(1).name());
		// The fresh placeholder is shown by the name of its definition
		assertEquals("forall (n : nat), eq nat (f #1) (?f_refinement_8 #1 (g #1))",
				d.equations().get(0).statement().toString());
		assertEquals("forall (n : nat), forall (m : nat), eq nat (?f_refinement_8 #2 #1) (f #1)",
				d.equations().get(1).statement().toString());
		assertEquals(ProofStrategy.equation("idtac", "f", false), d.equations().get(1).strategy());
		InductiveBlock graph = d.graph();
		assertEquals(2, graph.size());
		assertEquals("f_refinement_8_ind", graph.get(1).name());
		assertEquals("forall (n : nat), forall (Hind : #2 #1 (g #1) (?f_refinement_8 #1 (g #1))), "
				+ "#4 #2 (?f_refinement_8 #2 (g #2))", graph.get(0).constructors().get(0).toString());
		check("forall (n : nat), forall (m : nat), forall (Hind : #4 #1 (f #1)), #4 #3 #2 (f #2)",
				graph.get(1).constructors().get(0));
		check("forall (n : nat), f_ind@0 #1 (f #1)", d.induction().statement());
	}

	private static void check(String expected, Term actual) {
		assertEquals(Parser.parse(expected), actual);
	}

	private static Derivation derive(RecordingKernel kernel, Principles.Options options, Definition d,
			Recursion.Descriptor recursion) {
		return derive(kernel, options, Collections.singletonList(d), recursion);
	}

	private static Derivation derive(RecordingKernel kernel, Principles.Options options, List<Definition> ds,
			Recursion.Descriptor recursion) {
		ByteArrayOutputStream warnings = new ByteArrayOutputStream();
		Principles p = new Principles(kernel, Logic.DEFAULT, options, new PrintStream(warnings));
		Derivation r = p.derive(ds, recursion);
		assertEquals("", warnings.toString());
		return r;
	}
}
