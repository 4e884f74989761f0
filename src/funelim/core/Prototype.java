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
import java.util.List;

import funelim.core.Computation.Alias;
import funelim.core.Computation.Block;
import funelim.core.Computation.Header;
import funelim.core.Recursion.Relevance;
import funelim.core.Syntax.Term;

/**
 * Catalogue entry for one function of a block, against which recursive calls
 * are recognised. The index is the position of the function's graph relative
 * to the last function of the block, such that the graph of a prototype with
 * index <code>i</code> is bound at <code>#(i+1)</code> outside the constructor
 * context.
 *
 * @author David J. Pearce
 *
 */
public class Prototype {
	private final Term function;
	private final int[] filter;
	private final Alias alias;
	private final int index;
	private final Context signature;
	private final Term arity;
	private final Relevance relevance;

	public Prototype(Term function, int[] filter, Alias alias, int index, Context signature, Term arity,
			Relevance relevance) {
		this.function = function;
		this.filter = filter;
		this.alias = alias;
		this.index = index;
		this.signature = signature;
		this.arity = arity;
		this.relevance = relevance;
	}

	public Term function() {
		return function;
	}

	/**
	 * The positions of the arguments of a call which are passed to the graph.
	 *
	 * @return
	 */
	public int[] filter() {
		return filter;
	}

	/**
	 * Get the alias of this function, or <code>null</code>.
	 *
	 * @return
	 */
	public Alias alias() {
		return alias;
	}

	public int index() {
		return index;
	}

	public Context signature() {
		return signature;
	}

	public Term arity() {
		return arity;
	}

	public Relevance relevance() {
		return relevance;
	}

	/**
	 * Build the catalogue for a list of flattened blocks.
	 *
	 * @param blocks
	 * @return
	 */
	public static List<Prototype> of(List<Block> blocks) {
		ArrayList<Prototype> protos = new ArrayList<>();
		final int n = blocks.size();
		for (int i = 0; i != n; ++i) {
			Header h = blocks.get(i).header();
			protos.add(new Prototype(h.function(), h.filter(), h.alias(), n - i - 1, h.signature(), h.arity(),
					h.relevance()));
		}
		return protos;
	}

	@Override
	public String toString() {
		return function + "@" + index;
	}
}
