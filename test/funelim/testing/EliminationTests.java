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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import funelim.core.Context;
import funelim.core.Definition;
import funelim.core.Derivation;
import funelim.core.EliminationType;
import funelim.core.Logic;
import funelim.core.Principles;
import funelim.core.Recursion;
import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.io.Parser;
import funelim.util.Anomaly;

/**
 * Tests for the type of the elimination principle, computed from the graph's
 * induction scheme.
 *
 * @author David J. Pearce
 *
 */
public class EliminationTests {

	/**
	 * The arity counts the predicate along with the one method.
	 */
	@Test
	public void test_0x0001() {
		Derivation d = derive(Definitions.identity(), null);
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), forall (_ : forall (n : nat), #2 #1 #1), forall (n : nat), #3 #1 (f #1)",
				d.elimination().statement());
		assertEquals(2, d.eliminationArity());
	}

	/**
	 * The arity counts the predicate along with the two methods.
	 */
	@Test
	public void test_0x0002() {
		// The graph hypothesis is dropped, its induction hypothesis kept
		Derivation d = derive(Definitions.structural(), Definitions.structuralRecursion());
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), forall (_ : #1 O O), forall (_ : forall (n : nat), forall (_ : #3 #1 (f #1)), #4 (S #2) (f #2)), forall (n : nat), #4 #1 (f #1)",
				d.elimination().statement());
		assertEquals(3, d.eliminationArity());
	}

	@Test
	public void test_0x0003() {
		// The predicate of the refinement is defined by that of the function
		Derivation d = derive(Definitions.refined(), null);
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), "
				+ "let P' : forall (n : nat), forall (m : nat), forall (_ : nat), Prop := "
				+ "fun (n : nat) (m : nat) (_ : nat) => forall (Heq : eq nat (g #3) #2), #5 #4 #2 in "
				+ "forall (_ : forall (n : nat), forall (m : nat), #3 #2 #1 #1), forall (n : nat), #4 #1 (f #1)",
				d.elimination().statement());
		assertEquals(2, d.eliminationArity());
	}

	@Test
	public void test_0x0004() {
		// No methods at all
		Derivation d = derive(Definitions.impossible(), null);
		check("forall (P : forall (x : False), forall (_ : nat), Prop), forall (x : False), #2 #1 (f #1)",
				d.elimination().statement());
		assertEquals(1, d.eliminationArity());
	}

	@Test
	public void test_0x0005() {
		Derivation d = derive(Definitions.wellFounded(false), Definitions.logicalRecursion());
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), "
				+ "(forall (n : nat), #2 O (f O) -> #2 #1 (f O)) -> forall (n : nat), #2 #1 (f #1)",
				d.elimination().statement());
		assertEquals(2, d.eliminationArity());
	}

	@Test
	public void test_0x0006() {
		// The where clause keeps its own predicate and method
		Derivation d = derive(Definitions.where(), null);
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), "
				+ "forall (Q : forall (n : nat), forall (m : nat), forall (_ : nat), Prop), "
				+ "(forall (n : nat), #2 #1 (S #1) (f_g #1 (S #1)) -> #3 #1 (f_g #1 (S #1))) -> "
				+ "(forall (n : nat), forall (m : nat), #3 #2 #1 #1) -> forall (n : nat), #3 #1 (f #1)",
				d.elimination().statement());
		assertEquals(4, d.eliminationArity());
	}

	@Test
	public void test_0x0007() {
		// One conjunct per function
		Derivation d = derive(new RecordingKernel(), Logic.DEFAULT, Definitions.mutual(),
				Definitions.mutualRecursion());
		check("forall (P : forall (n : nat), forall (_ : nat), Prop), "
				+ "forall (Q : forall (n : nat), forall (_ : nat), Prop), #2 O O -> "
				+ "(forall (n : nat), #2 #1 (g #1) -> #3 (S #1) (g #1)) -> "
				+ "(forall (n : nat), #3 #1 (f #1) -> #2 #1 (f #1)) -> "
				+ "and (forall (n : nat), #3 #1 (f #1)) (forall (n : nat), #2 #1 (g #1))",
				d.elimination().statement());
		assertEquals(5, d.eliminationArity());
	}

	@Test
	public void test_0x0008() {
		// The refinement's predicate is defined, recording the refined value
		for (String rec : Arrays.asList("f", "rec")) {
			Derivation d = derive(Definitions.logicalRefinement(rec), Definitions.logicalRecursion());
			check("forall (P : forall (n : nat), forall (_ : nat), Prop), "
					+ "let P' : forall (n : nat), forall (m : nat), forall (_ : nat), Prop := "
					+ "fun (n : nat) (m : nat) (_ : nat) => forall (Heq : eq nat (g #3) #2), #5 #4 #2 in "
					+ "(forall (n : nat), forall (m : nat), #4 #1 (f #1) -> #3 #2 #1 (f #1)) -> "
					+ "forall (n : nat), #3 #1 (f #1)", d.elimination().statement());
			assertEquals(2, d.eliminationArity());
		}
	}

	@Test
	public void test_clear_01() {
		Context ctx = Context.of(new Declaration("P", Parser.parse("nat -> Prop")),
				new Declaration(null,
						Parser.parse("forall (n : nat), forall (H : g_ind@0 #1), forall (_ : #3 #2), #4 (S #3)")));
		Context cleared = EliminationType.clearInductiveAssumptions("g_ind", ctx);
		assertEquals(Parser.parse("forall (n : nat), forall (_ : #2 #1), #3 (S #2)"), cleared.get(1).type());
		assertEquals(ctx.get(2), cleared.get(2));
	}

	@Test
	public void test_clear_02() {
		// Relations of other blocks are left alone
		Context ctx = Context.of(new Declaration(null,
				Parser.parse("forall (n : nat), forall (H : h_ind@0 #1), eq nat #2 #2")));
		assertEquals(ctx, EliminationType.clearInductiveAssumptions("g_ind", ctx));
	}

	@Test(expected = Anomaly.class)
	public void test_clear_03() {
		Context ctx = Context.of(new Declaration(null,
				Parser.parse("forall (n : nat), forall (H : g_ind@0 #1), eq (g_ind@0 #2) #1 #1")));
		EliminationType.clearInductiveAssumptions("g_ind", ctx);
	}

	@Test
	public void test_scheme_01() {
		RecordingKernel kernel = new RecordingKernel();
		derive(kernel, Logic.DEFAULT, Definitions.structural(), Definitions.structuralRecursion());
		assertEquals(Collections.singletonList(0), kernel.schemes().get("f_ind_ind"));
	}

	@Test
	public void test_scheme_02() {
		RecordingKernel kernel = new RecordingKernel();
		derive(kernel, Logic.DEFAULT, Definitions.refined(), null);
		assertEquals(Collections.singletonList(0), kernel.schemes().get("f_ind_comb"));
	}

	@Test
	public void test_scheme_03() {
		Logic logic = Logic.DEFAULT.withSort(Term.Sort.Kind.SET);
		RecordingKernel kernel = new RecordingKernel(logic);
		derive(kernel, logic, Definitions.identity(), null);
		assertEquals(Collections.singletonList(0), kernel.schemes().get("f_ind_rec"));
	}

	private static void check(String expected, Term actual) {
		assertEquals(Parser.parse(expected), actual);
	}

	private static Derivation derive(Definition d, Recursion.Descriptor recursion) {
		return derive(new RecordingKernel(), Logic.DEFAULT, d, recursion);
	}

	private static Derivation derive(RecordingKernel kernel, Logic logic, Definition d,
			Recursion.Descriptor recursion) {
		return derive(kernel, logic, Collections.singletonList(d), recursion);
	}

	private static Derivation derive(RecordingKernel kernel, Logic logic, List<Definition> ds,
			Recursion.Descriptor recursion) {
		ByteArrayOutputStream warnings = new ByteArrayOutputStream();
		Principles p = new Principles(kernel, logic, Principles.Options.DEFAULT, new PrintStream(warnings));
		Derivation r = p.derive(ds, recursion);
		assertEquals("", warnings.toString());
		return r;
	}
}
