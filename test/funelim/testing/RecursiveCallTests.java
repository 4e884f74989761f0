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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import funelim.core.Context;
import funelim.core.Prototype;
import funelim.core.Recursion;
import funelim.core.Recursion.Decreasing;
import funelim.core.Recursion.Relevance;
import funelim.core.RecursiveCalls;
import funelim.core.RecursiveCalls.Hypotheses;
import funelim.core.Syntax.Term;
import funelim.io.Parser;

/**
 * Tests for abstracting the recursive calls of a right-hand side into induction
 * hypotheses.
 *
 * @author David J. Pearce
 *
 */
public class RecursiveCallTests {
	private static final Term F = new Term.Const("f");
	private static final Term NAT = new Term.Const("nat");

	// f : forall (n : nat), nat, recursing on n
	private static final List<Prototype> PROTOTYPES = Collections.singletonList(new Prototype(F, new int[0], null, 0,
			Parser.parseContext("(n : nat)"), NAT, Relevance.COMPUTATIONAL));

	private static final RecursiveCalls RESOLVER = new RecursiveCalls(Recursion.Guarded.of("f", Decreasing.mutual(0)),
			Collections.singleton("f_obligation_1"), PROTOTYPES, true);

	@Test
	public void test_0x0001() {
		Hypotheses h = RESOLVER.abstractCalls(1, parse("S (f #1)"));
		assertEquals(1, h.count());
		assertEquals(parse("#2 #1 (f #1)"), h.context().get(1).type());
		assertEquals(RecursiveCalls.HYPOTHESIS, h.context().get(1).name());
		assertEquals(parse("S (f #2)"), h.term());
	}

	@Test
	public void test_0x0002() {
		// The same call twice gives a single hypothesis
		Hypotheses h = RESOLVER.abstractCalls(1, parse("plus (f #1) (f #1)"));
		assertEquals(1, h.count());
		assertEquals(parse("#2 #1 (f #1)"), h.context().get(1).type());
	}

	@Test
	public void test_0x0003() {
		// Hypotheses are bound in order of occurrence
		Hypotheses h = RESOLVER.abstractCalls(1, parse("plus (f #1) (f O)"));
		assertEquals(2, h.count());
		assertEquals(parse("#2 #1 (f #1)"), h.context().get(2).type());
		assertEquals(parse("#3 O (f O)"), h.context().get(1).type());
		assertEquals(parse("plus (f #3) (f O)"), h.term());
	}

	@Test
	public void test_0x0004() {
		// A call under a binder gives a quantified hypothesis
		Hypotheses h = RESOLVER.abstractCalls(1, parse("fun (x : nat) => f x"));
		assertEquals(1, h.count());
		assertEquals(parse("forall (x : nat), #3 #1 (f #1)"), h.context().get(1).type());
	}

	@Test
	public void test_0x0005() {
		// Unapplied functions do not reach their decreasing argument
		Hypotheses h = RESOLVER.abstractCalls(1, parse("map f #1"));
		assertEquals(0, h.count());
		assertEquals(parse("map f #1"), h.term());
	}

	@Test
	public void test_0x0006() {
		// Obligations are not calls
		Hypotheses h = RESOLVER.abstractCalls(1, parse("f_obligation_1 (f #1)"));
		assertEquals(0, h.count());
	}

	@Test
	public void test_0x0007() {
		Hypotheses h = RESOLVER.abstractCalls(1, parse("g #1"));
		assertEquals(0, h.count());
		assertEquals(Context.EMPTY, h.context());
	}

	@Test
	public void test_0x0008() {
		// Calls in the arguments of calls
		Hypotheses h = RESOLVER.abstractCalls(1, parse("f (f #1)"));
		assertEquals(2, h.count());
		assertEquals(parse("#2 #1 (f #1)"), h.context().get(2).type());
		assertEquals(parse("#3 (f #2) (f (f #2))"), h.context().get(1).type());
	}

	@Test
	public void test_find_01() {
		Optional<RecursiveCalls.Call> c = RESOLVER.findRecursiveCall(F, Arrays.asList(parse("O"), parse("x")));
		assertTrue(c.isPresent());
		assertEquals(Arrays.asList(parse("O")), c.get().arguments());
		assertEquals(Arrays.asList(parse("x")), c.get().rest());
	}

	@Test
	public void test_find_02() {
		assertFalse(RESOLVER.findRecursiveCall(parse("g"), Arrays.asList(parse("O"))).isPresent());
		assertFalse(RESOLVER.findRecursiveCall(F, Collections.emptyList()).isPresent());
	}

	@Test
	public void test_substitute_01() {
		Context sign = Parser.parseContext("(A : Type) (x : A) (y : A)");
		Context rest = RecursiveCalls.substituteArguments(Arrays.asList(parse("nat")), sign);
		assertEquals(Parser.parseContext("(x : nat) (y : nat)"), rest);
	}

	private static Term parse(String text) {
		return Parser.parse(text);
	}
}
