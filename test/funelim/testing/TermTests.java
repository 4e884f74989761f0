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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import funelim.core.Context;
import funelim.core.Syntax.Term;
import funelim.core.TermSpace;
import funelim.core.Terms;
import funelim.io.Parser;
import funelim.util.Anomaly;

/**
 * Tests for the basic operations on terms, i.e. lifting and substitution. The
 * algebraic laws are checked exhaustively over small term spaces.
 *
 * @author David J. Pearce
 *
 */
public class TermTests {

	// ==============================================================
	// Term Spaces
	// ==============================================================

	@Test
	public void test_space_01() {
		assertEquals(2, count(new TermSpace(1, 1, 0)));
	}

	@Test
	public void test_space_02() {
		assertEquals(14, count(new TermSpace(1, 1, 1)));
	}

	@Test
	public void test_space_03() {
		assertEquals(30, count(new TermSpace(2, 1, 1)));
	}

	@Test
	public void test_space_04() {
		assertEquals(52, count(new TermSpace(2, 2, 1)));
	}

	@Test
	public void test_evar_01() {
		// Names are for display only
		Term named = new Term.Evar(8, "f_refinement_8", new Term.Rel(1));
		assertEquals(new Term.Evar(8, new Term.Rel(1)), named);
		assertEquals("?f_refinement_8[#1]", named.toString());
		assertEquals("f_refinement_8", ((Term.Evar) Terms.lift(1, named)).name());
	}

	// ==============================================================
	// Substitution Laws
	// ==============================================================

	@Test
	public void test_lift_01() {
		for (Term t : new TermSpace(2, 2, 2)) {
			assertEquals(t, Terms.lift(0, t));
		}
	}

	@Test
	public void test_lift_02() {
		for (Term t : new TermSpace(2, 2, 2)) {
			for (int n = 0; n != 3; ++n) {
				for (int m = 0; m != 3; ++m) {
					assertEquals(Terms.lift(m + n, t), Terms.lift(m, Terms.lift(n, t)));
				}
			}
		}
	}

	@Test
	public void test_lift_03() {
		for (Term t : new TermSpace(2, 2, 2)) {
			assertTrue(Terms.noccurn(1, Terms.lift(1, t)));
		}
	}

	@Test
	public void test_subst_01() {
		Term v = new Term.Const("v");
		for (Term t : new TermSpace(2, 2, 2)) {
			assertEquals(t, Terms.subst1(v, Terms.lift(1, t)));
		}
	}

	@Test
	public void test_subst_02() {
		// Substituting an index for itself changes nothing
		for (Term t : new TermSpace(2, 2, 2)) {
			assertEquals(t, Terms.subst1(new Term.Rel(1), Terms.liftn(1, 2, t)));
		}
	}

	@Test
	public void test_subst_03() {
		// Raw indices count the binder
		Term t = parse("fun (x : a) => f x #2 #3");
		Term r = Terms.substl(Arrays.asList(parse("b"), parse("g #1")), t);
		assertEquals(parse("fun (x : a) => f x b (g #2)"), r);
	}

	@Test(expected = Anomaly.class)
	public void test_lift_invalid_01() {
		Terms.lift(-1, new Term.Rel(1));
	}

	// ==============================================================
	// Other Operations
	// ==============================================================

	@Test
	public void test_beta_01() {
		assertEquals(parse("b"), Terms.nfBeta(parse("(fun (x : a) => x) b")));
	}

	@Test
	public void test_beta_02() {
		assertEquals(parse("f b c"), Terms.nfBeta(parse("(fun (x : a) => f x) b c")));
	}

	@Test
	public void test_beta_03() {
		assertEquals(parse("fun (y : a) => g b"), Terms.nfBeta(parse("fun (y : a) => (fun (x : a) => g x) b")));
	}

	@Test
	public void test_dependent_01() {
		assertTrue(Terms.dependent(parse("f #1"), parse("g (f #1 b)")));
		assertTrue(Terms.dependent(parse("f #1"), parse("fun (x : a) => f #2")));
		assertFalse(Terms.dependent(parse("f #1"), parse("fun (x : a) => f #1")));
	}

	@Test
	public void test_replace_01() {
		Term t = Terms.replaceTerm(parse("f #1"), parse("c"), parse("g (f #1) (fun (x : a) => f #2)"));
		assertEquals(parse("g c (fun (x : a) => c)"), t);
	}

	@Test
	public void test_relList_01() {
		assertEquals(Arrays.asList(new Term.Rel(4), new Term.Rel(3)), Terms.relList(2, 2));
	}

	@Test
	public void test_prodOrClear_01() {
		Context ctx = Parser.parseContext("(n : nat) (m : nat)");
		// m is dropped, n is kept
		Term t = Terms.itMkProdOrClear(parse("P #2"), ctx);
		assertEquals(parse("forall (n : nat), P n"), t);
	}

	@Test
	public void test_prodOrSubst_01() {
		Context ctx = Parser.parseContext("(n : nat) (m : nat := S n)");
		Term t = Terms.itMkProdOrSubst(parse("P #1"), ctx);
		assertEquals(parse("forall (n : nat), P (S n)"), t);
	}

	@Test
	public void test_prodOrLetIn_01() {
		Context ctx = Parser.parseContext("(n : nat) (m : nat := S n)");
		Term t = Terms.itMkProdOrLetIn(parse("P #1"), ctx);
		assertEquals(parse("forall (n : nat), let m : nat := S n in P m"), t);
	}

	@Test
	public void test_context_01() {
		Context ctx = Parser.parseContext("(A : Type) (x : A) (y : A)");
		assertEquals(3, ctx.size());
		assertEquals(parse("#3"), ctx.typeOf(1));
		assertEquals(parse("#3"), ctx.typeOf(2));
		assertEquals(Arrays.asList(new Term.Rel(3), new Term.Rel(2), new Term.Rel(1)), ctx.extendedRelList(0));
	}

	private static Term parse(String text) {
		return Parser.parse(text);
	}

	private static int count(Iterable<Term> space) {
		int n = 0;
		for (Term t : space) {
			n = n + 1;
		}
		return n;
	}
}
