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

import funelim.core.Syntax.Term;

/**
 * Everything derived for a block of functions. The graph, induction statement
 * and eliminator are <code>null</code> when induction principles were not
 * requested.
 *
 * @author David J. Pearce
 *
 */
public class Derivation {
	private final List<Lemma> equations;
	private final InductiveBlock graph;
	private final Lemma induction;
	private final Lemma elimination;
	private final int eliminationArity;

	public Derivation(List<Lemma> equations, InductiveBlock graph, Lemma induction, Lemma elimination,
			int eliminationArity) {
		this.equations = Collections.unmodifiableList(new ArrayList<>(equations));
		this.graph = graph;
		this.induction = induction;
		this.elimination = elimination;
		this.eliminationArity = eliminationArity;
	}

	public List<Lemma> equations() {
		return equations;
	}

	public InductiveBlock graph() {
		return graph;
	}

	public Lemma induction() {
		return induction;
	}

	public Lemma elimination() {
		return elimination;
	}

	/**
	 * The number of arguments the eliminator expects before those of the
	 * function.
	 *
	 * @return
	 */
	public int eliminationArity() {
		return eliminationArity;
	}

	/**
	 * A lemma handed to the kernel, with whether its proof went through.
	 */
	public static class Lemma {
		private final String name;
		private final Term statement;
		private final ProofStrategy strategy;
		private final boolean proved;

		public Lemma(String name, Term statement, ProofStrategy strategy, boolean proved) {
			this.name = name;
			this.statement = statement;
			this.strategy = strategy;
			this.proved = proved;
		}

		public String name() {
			return name;
		}

		public Term statement() {
			return statement;
		}

		public ProofStrategy strategy() {
			return strategy;
		}

		public boolean isProved() {
			return proved;
		}

		@Override
		public String toString() {
			return name + " : " + statement + (proved ? "" : " (admitted)");
		}
	}
}
