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

/**
 * A proof script recommended to the host for discharging a generated
 * statement, as a sequence of tactic steps run one after the other.
 *
 * @author David J. Pearce
 *
 */
public class ProofStrategy {
	private final List<String> steps;

	public ProofStrategy(String... steps) {
		this(Arrays.asList(steps));
	}

	public ProofStrategy(List<String> steps) {
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}

	public List<String> steps() {
		return steps;
	}

	/**
	 * The strategy proving an equation of a function.
	 *
	 * @param unfold   The step unfolding the function
	 * @param base     The name of the function's rewrite base
	 * @param unfolded Whether where clauses were given unfolding lemmas
	 * @return
	 */
	public static ProofStrategy equation(String unfold, String base, boolean unfolded) {
		List<String> steps = new ArrayList<>();
		steps.add("intros");
		steps.add(unfold);
		steps.add("solve_equation " + base);
		if (unfolded) {
			steps.add("try autorewrite with " + base + "_where");
		}
		steps.add("reflexivity");
		return new ProofStrategy(steps);
	}

	/**
	 * The strategy proving that a function inhabits its graph.
	 *
	 * @param base
	 * @return
	 */
	public static ProofStrategy induction(String base) {
		return new ProofStrategy("intros", "funind " + base, "try typeclasses eauto with " + base);
	}

	/**
	 * The strategy proving the elimination principle from the graph's scheme.
	 *
	 * @param scheme
	 * @param inductive
	 * @return
	 */
	public static ProofStrategy elimination(String scheme, String inductive) {
		return new ProofStrategy("intros", "apply " + scheme, "eapply " + inductive);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ProofStrategy && ((ProofStrategy) o).steps.equals(steps);
	}

	@Override
	public int hashCode() {
		return steps.hashCode();
	}

	@Override
	public String toString() {
		return String.join("; ", steps);
	}
}
