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
import java.util.Iterator;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.BiFunction;

import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.util.Anomaly;

/**
 * A typing context, represented as a telescope of declarations. Declarations
 * are indexed from the innermost outwards, such that <code>get(1)</code>
 * returns the declaration referred to by <code>#1</code>. The type of each
 * declaration lives in the context formed by the declarations outside it.
 *
 * @author David J. Pearce
 *
 */
public class Context implements Iterable<Declaration> {
	public static final Context EMPTY = new Context();

	/**
	 * Declarations stored innermost first.
	 */
	private final Declaration[] declarations;

	private Context(Declaration... declarations) {
		this.declarations = declarations;
	}

	/**
	 * Construct a context from declarations given outermost first, as they would
	 * be written down.
	 *
	 * @param declarations
	 * @return
	 */
	public static Context of(Declaration... declarations) {
		Declaration[] ds = new Declaration[declarations.length];
		for (int i = 0; i != ds.length; ++i) {
			ds[i] = declarations[declarations.length - i - 1];
		}
		return new Context(ds);
	}

	public static Context of(List<Declaration> declarations) {
		return of(declarations.toArray(new Declaration[declarations.size()]));
	}

	public int size() {
		return declarations.length;
	}

	public boolean isEmpty() {
		return declarations.length == 0;
	}

	/**
	 * Get the declaration referred to by a given de Bruijn index.
	 *
	 * @param rel
	 * @return
	 */
	public Declaration get(int rel) {
		if (rel < 1 || rel > declarations.length) {
			throw new Anomaly("unbound de Bruijn index #" + rel, this);
		}
		return declarations[rel - 1];
	}

	/**
	 * Get the type of the declaration referred to by a given index, as seen from
	 * the inside of this context.
	 *
	 * @param rel
	 * @return
	 */
	public Term typeOf(int rel) {
		return Terms.lift(rel, get(rel).type());
	}

	/**
	 * Extend this context with a new innermost declaration.
	 *
	 * @param decl
	 * @return
	 */
	public Context push(Declaration decl) {
		Declaration[] ds = new Declaration[declarations.length + 1];
		ds[0] = decl;
		System.arraycopy(declarations, 0, ds, 1, declarations.length);
		return new Context(ds);
	}

	/**
	 * Extend this context with a telescope living inside it.
	 *
	 * @param inner
	 * @return
	 */
	public Context push(Context inner) {
		if (inner.isEmpty()) {
			return this;
		}
		Declaration[] ds = Arrays.copyOf(inner.declarations, inner.size() + declarations.length);
		System.arraycopy(declarations, 0, ds, inner.size(), declarations.length);
		return new Context(ds);
	}

	/**
	 * Drop the <code>n</code> innermost declarations.
	 *
	 * @param n
	 * @return
	 */
	public Context skip(int n) {
		Anomaly.check(n >= 0 && n <= declarations.length, "cannot skip " + n + " declarations", this);
		return new Context(Arrays.copyOfRange(declarations, n, declarations.length));
	}

	/**
	 * Keep only the <code>n</code> innermost declarations.
	 *
	 * @param n
	 * @return
	 */
	public Context take(int n) {
		Anomaly.check(n >= 0 && n <= declarations.length, "cannot take " + n + " declarations", this);
		return new Context(Arrays.copyOf(declarations, n));
	}

	/**
	 * Find the innermost declaration with a given name, returning its index.
	 *
	 * @param name
	 * @return
	 */
	public OptionalInt lookup(String name) {
		for (int i = 0; i != declarations.length; ++i) {
			if (name.equals(declarations[i].name())) {
				return OptionalInt.of(i + 1);
			}
		}
		return OptionalInt.empty();
	}

	/**
	 * Apply a function to the types and values of each declaration. The function
	 * is given the number of declarations of this context lying outside the one
	 * being transformed.
	 *
	 * @param fn
	 * @return
	 */
	public Context map(BiFunction<Integer, Term, Term> fn) {
		final int n = declarations.length;
		Declaration[] ds = new Declaration[n];
		boolean changed = false;
		for (int i = 0; i != n; ++i) {
			final int depth = n - i - 1;
			ds[i] = declarations[i].map(t -> fn.apply(depth, t));
			changed |= ds[i] != declarations[i];
		}
		return changed ? new Context(ds) : this;
	}

	/**
	 * Lift by <code>n</code> the indices of this context which escape it by at
	 * least <code>k</code>.
	 *
	 * @param n
	 * @param k
	 * @return
	 */
	public Context liftn(int n, int k) {
		return map((depth, t) -> Terms.liftn(n, k + depth + 1, t));
	}

	public Context lift(int n) {
		return liftn(n, 0);
	}

	/**
	 * Substitute a term for the variable immediately outside this telescope,
	 * shifting other escaping indices down by one.
	 *
	 * @param value
	 * @return
	 */
	public Context subst1(Term value) {
		return map((depth, t) -> Terms.substnl(java.util.Collections.singletonList(value), depth, t));
	}

	/**
	 * Compute references to the assumptions of this context (skipping
	 * definitions), outermost first, each lifted by <code>n</code>.
	 *
	 * @param n
	 * @return
	 */
	public List<Term> extendedRelList(int n) {
		ArrayList<Term> r = new ArrayList<>();
		for (int i = declarations.length; i > 0; --i) {
			if (!declarations[i - 1].isDefinition()) {
				r.add(new Term.Rel(n + i));
			}
		}
		return r;
	}

	/**
	 * Get the declarations of this context outermost first.
	 *
	 * @return
	 */
	public List<Declaration> toList() {
		ArrayList<Declaration> r = new ArrayList<>();
		for (int i = declarations.length - 1; i >= 0; --i) {
			r.add(declarations[i]);
		}
		return r;
	}

	@Override
	public Iterator<Declaration> iterator() {
		return toList().iterator();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Context && Arrays.equals(((Context) o).declarations, declarations);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(declarations);
	}

	@Override
	public String toString() {
		String r = "";
		for (int i = declarations.length - 1; i >= 0; --i) {
			if (i != declarations.length - 1) {
				r += " ";
			}
			r += declarations[i];
		}
		return r;
	}
}
