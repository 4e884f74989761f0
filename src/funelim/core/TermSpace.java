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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import funelim.core.Syntax.Term;
import jmodelgen.core.Domain;
import jmodelgen.core.Domains;

/**
 * Provides machinery for representing and working with the space of all terms
 * up to a given depth, over a fixed number of de Bruijn indices and constants.
 * Some numbers:
 *
 * <pre>
 * |T{1,1,0}| = 2
 * |T{1,1,1}| = 14
 * |T{2,1,1}| = 30
 * |T{2,2,1}| = 52
 * </pre>
 *
 * @author David J. Pearce
 *
 */
public class TermSpace implements Iterable<Term> {
	/**
	 * The set of all possible constant names. These never clash with the names
	 * given to binders.
	 */
	public static final String[] CONSTANT_NAMES = { "a", "b", "c", "d", "e" };

	/**
	 * The maximum de Bruijn index which can be used.
	 */
	private final int maxIndex;

	/**
	 * The number of distinct constants which can be used.
	 */
	private final int maxConstants;

	/**
	 * The maximum nesting of compound terms.
	 */
	private final int maxDepth;

	/**
	 * The parameter names here coincide with those in the definition of a term
	 * space.
	 *
	 * @param i The maximum de Bruijn index.
	 * @param c The number of distinct constants.
	 * @param d The maximum nesting of compound terms.
	 */
	public TermSpace(int i, int c, int d) {
		this.maxIndex = i;
		this.maxConstants = c;
		this.maxDepth = d;
	}

	public Domain.Big<Term> domain() {
		Domain.Small<Integer> indices = Domains.Int(1, maxIndex);
		Domain.Small<String> constants = Domains.Finite(Arrays.copyOfRange(CONSTANT_NAMES, 0, maxConstants));
		return Syntax.toBigDomain(maxDepth, indices, constants);
	}

	/**
	 * Iterate every term of this space.
	 */
	@Override
	public Iterator<Term> iterator() {
		final Domain.Big<Term> domain = domain();
		final BigInteger size = domain.bigSize();
		return new Iterator<Term>() {
			private BigInteger index = BigInteger.ZERO;

			@Override
			public boolean hasNext() {
				return index.compareTo(size) < 0;
			}

			@Override
			public Term next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				Term t = domain.get(index);
				index = index.add(BigInteger.ONE);
				return t;
			}
		};
	}

	@Override
	public String toString() {
		return "T{" + maxIndex + "," + maxConstants + "," + maxDepth + "}";
	}
}
