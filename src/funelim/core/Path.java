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

import java.util.Arrays;

import funelim.util.Anomaly;

/**
 * Locates a nested computation (a where clause or a refinement) within the
 * definition of a function. A path is a sequence of elements, most recent
 * first, and is used to generate the names of lemmas and inductive types.
 *
 * @author David J. Pearce
 *
 */
public class Path {
	public static final Path EMPTY = new Path();

	private final Element[] elements;

	public Path(Element... elements) {
		this.elements = elements;
	}

	public static Path of(String id) {
		return new Path(new Ident(id));
	}

	public int size() {
		return elements.length;
	}

	public boolean isEmpty() {
		return elements.length == 0;
	}

	/**
	 * Get the most recent element of this path.
	 *
	 * @return
	 */
	public Element head() {
		Anomaly.check(elements.length > 0, "empty path has no head");
		return elements[0];
	}

	/**
	 * Get this path without its most recent element.
	 *
	 * @return
	 */
	public Path tail() {
		Anomaly.check(elements.length > 0, "empty path has no tail");
		return new Path(Arrays.copyOfRange(elements, 1, elements.length));
	}

	public Path push(Element element) {
		Element[] es = new Element[elements.length + 1];
		es[0] = element;
		System.arraycopy(elements, 0, es, 1, elements.length);
		return new Path(es);
	}

	public Path push(String id) {
		return push(new Ident(id));
	}

	public Path push(int placeholder) {
		return push(new Placeholder(placeholder));
	}

	/**
	 * Render this path as an identifier. The oldest element names the function,
	 * and each subsequent element adds a suffix.
	 *
	 * @return
	 */
	public String toIdentifier() {
		if (elements.length == 0 || !(elements[elements.length - 1] instanceof Ident)) {
			throw new Anomaly("path does not start with an identifier", this);
		}
		String r = ((Ident) elements[elements.length - 1]).name;
		for (int i = elements.length - 2; i >= 0; --i) {
			Element e = elements[i];
			if (e instanceof Ident) {
				r += "_" + ((Ident) e).name;
			} else {
				r += "_refinement_" + ((Placeholder) e).id;
			}
		}
		return r;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Path && Arrays.equals(((Path) o).elements, elements);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(elements);
	}

	@Override
	public String toString() {
		return Arrays.toString(elements);
	}

	public interface Element {

	}

	public static class Ident implements Element {
		private final String name;

		public Ident(String name) {
			this.name = name;
		}

		public String name() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Ident && ((Ident) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static class Placeholder implements Element {
		private final int id;

		public Placeholder(int id) {
			this.id = id;
		}

		public int id() {
			return id;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Placeholder && ((Placeholder) o).id == id;
		}

		@Override
		public int hashCode() {
			return id;
		}

		@Override
		public String toString() {
			return "?" + id;
		}
	}
}
