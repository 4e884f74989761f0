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
import funelim.util.Anomaly;

/**
 * A block of mutually inductive relations. Within a constructor type, the
 * <code>i</code>th relation of a block of <code>n</code> is referred to as
 * <code>#(n-i)</code> outside the constructor's own binders. Outside the
 * block, it is referred to as <code>Ind(name, i)</code>.
 *
 * @author David J. Pearce
 *
 */
public class InductiveBlock {
	private final String name;
	private final List<Body> bodies;

	public InductiveBlock(String name, List<Body> bodies) {
		Anomaly.check(!bodies.isEmpty(), "empty inductive block", name);
		this.name = name;
		this.bodies = Collections.unmodifiableList(new ArrayList<>(bodies));
	}

	public String name() {
		return name;
	}

	public List<Body> bodies() {
		return bodies;
	}

	public int size() {
		return bodies.size();
	}

	public Body get(int i) {
		return bodies.get(i);
	}

	@Override
	public String toString() {
		String r = "Inductive";
		for (int i = 0; i != bodies.size(); ++i) {
			r += (i == 0 ? " " : "\nwith ") + bodies.get(i);
		}
		return r;
	}

	public static class Body {
		private final String name;
		private final Term arity;
		private final List<String> constructorNames;
		private final List<Term> constructors;

		public Body(String name, Term arity, List<String> constructorNames, List<Term> constructors) {
			Anomaly.check(constructorNames.size() == constructors.size(), "constructor names do not match", name);
			this.name = name;
			this.arity = arity;
			this.constructorNames = Collections.unmodifiableList(new ArrayList<>(constructorNames));
			this.constructors = Collections.unmodifiableList(new ArrayList<>(constructors));
		}

		public String name() {
			return name;
		}

		public Term arity() {
			return arity;
		}

		public List<String> constructorNames() {
			return constructorNames;
		}

		public List<Term> constructors() {
			return constructors;
		}

		@Override
		public String toString() {
			String r = name + " : " + arity + " :=";
			for (int i = 0; i != constructors.size(); ++i) {
				r += "\n| " + constructorNames.get(i) + " : " + constructors.get(i);
			}
			return r;
		}
	}
}
