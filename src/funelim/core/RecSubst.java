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
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import funelim.core.Recursion.Relevance;
import funelim.core.Syntax.Term;

/**
 * Maps the names of recursive bindings to the terms replacing them. An entry
 * may additionally drop one argument of every call (e.g. the accessibility
 * proof of a well-founded call), in which case it is logical. Entries are kept
 * most recent first.
 *
 * @author David J. Pearce
 *
 */
public class RecSubst implements Iterable<RecSubst.Entry> {
	public static final RecSubst EMPTY = new RecSubst(Collections.emptyList());

	private final List<Entry> entries;

	private RecSubst(List<Entry> entries) {
		this.entries = entries;
	}

	public static RecSubst of(Entry... entries) {
		RecSubst r = EMPTY;
		for (int i = entries.length - 1; i >= 0; --i) {
			r = r.push(entries[i]);
		}
		return r;
	}

	public RecSubst push(Entry entry) {
		ArrayList<Entry> es = new ArrayList<>();
		es.add(entry);
		es.addAll(entries);
		return new RecSubst(Collections.unmodifiableList(es));
	}

	public RecSubst push(String id, Integer dropped, Term replacement) {
		return push(new Entry(id, dropped, replacement));
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Optional<Entry> lookup(String id) {
		for (Entry e : entries) {
			if (e.id.equals(id)) {
				return Optional.of(e);
			}
		}
		return Optional.empty();
	}

	public boolean contains(String id) {
		return lookup(id).isPresent();
	}

	/**
	 * A substitution is logical when any of its entries is.
	 *
	 * @return
	 */
	public Relevance relevance() {
		for (Entry e : entries) {
			if (e.relevance() == Relevance.LOGICAL) {
				return Relevance.LOGICAL;
			}
		}
		return Relevance.COMPUTATIONAL;
	}

	@Override
	public Iterator<Entry> iterator() {
		return entries.iterator();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

	public static class Entry {
		private final String id;
		private final Integer dropped;
		private final Term replacement;

		public Entry(String id, Integer dropped, Term replacement) {
			this.id = id;
			this.dropped = dropped;
			this.replacement = replacement;
		}

		public String id() {
			return id;
		}

		/**
		 * The (one-based) position of the argument to drop, <code>-1</code> for
		 * the last argument, or <code>null</code> to keep all arguments.
		 *
		 * @return
		 */
		public Integer dropped() {
			return dropped;
		}

		public Term replacement() {
			return replacement;
		}

		public Relevance relevance() {
			return dropped == null ? Relevance.COMPUTATIONAL : Relevance.LOGICAL;
		}

		@Override
		public String toString() {
			return id + " := " + replacement + (dropped == null ? "" : " \\ " + dropped);
		}
	}
}
