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

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import funelim.core.Syntax.Term;
import funelim.util.AbstractFunction;

/**
 * State shared by the passes of a single derivation: the supply of fresh
 * placeholders, and the table recording, for each placeholder allocated when
 * specialising a tree, the term it stands for together with the name of its
 * unfolding lemma and the specialised tree defining it. A compilation is
 * created for one function (with its siblings) and discarded afterwards.
 *
 * @author David J. Pearce
 *
 */
public class Compilation {
	private final Map<Integer, Entry> placeholders = new LinkedHashMap<>();
	private final PrintStream warnings;
	private int next;

	/**
	 * Create a compilation whose fresh placeholders do not clash with those
	 * occurring in the given trees.
	 *
	 * @param warnings
	 * @param trees
	 */
	public Compilation(PrintStream warnings, List<Splitting> trees) {
		this.warnings = warnings;
		int max = 0;
		for (Splitting tree : trees) {
			max = Math.max(max, MAX_PLACEHOLDER.apply(tree, null));
		}
		this.next = max + 1;
	}

	public Compilation(PrintStream warnings, Splitting tree) {
		this(warnings, Collections.singletonList(tree));
	}

	/**
	 * Allocate a fresh placeholder.
	 *
	 * @return
	 */
	public int fresh() {
		return next++;
	}

	public void record(int placeholder, Term term, String name, Splitting splitting) {
		placeholders.put(placeholder, new Entry(term, name, splitting));
	}

	public Optional<Entry> lookup(int placeholder) {
		return Optional.ofNullable(placeholders.get(placeholder));
	}

	/**
	 * Determine whether any placeholder has been recorded. When so, the where
	 * clauses of the function have been specialised and equations may need to
	 * unfold them.
	 *
	 * @return
	 */
	public boolean isEmpty() {
		return placeholders.isEmpty();
	}

	public void warn(String msg) {
		warnings.println("warning: " + msg);
	}

	public PrintStream warnings() {
		return warnings;
	}

	public static class Entry {
		private final Term term;
		private final String name;
		private final Splitting splitting;

		public Entry(Term term, String name, Splitting splitting) {
			this.term = term;
			this.name = name;
			this.splitting = splitting;
		}

		public Term term() {
			return term;
		}

		public String name() {
			return name;
		}

		public Splitting splitting() {
			return splitting;
		}

		@Override
		public String toString() {
			return name + " := " + term;
		}
	}

	/**
	 * Find the largest placeholder mentioned by a tree.
	 */
	private static final AbstractFunction<Void, Integer> MAX_PLACEHOLDER = new AbstractFunction<Void, Integer>() {
		@Override
		public Integer apply(Splitting.Compute split, Void input) {
			int max = 0;
			for (Splitting.Where w : split.wheres()) {
				max = Math.max(max, apply(w.splitting(), null));
				max = Math.max(max, max(w.path()));
			}
			return max;
		}

		@Override
		public Integer apply(Splitting.Split split, Void input) {
			int max = 0;
			for (Splitting s : split.branches()) {
				if (s != null) {
					max = Math.max(max, apply(s, null));
				}
			}
			return max;
		}

		@Override
		public Integer apply(Splitting.Mapping split, Void input) {
			return apply(split.body(), null);
		}

		@Override
		public Integer apply(Splitting.RecValid split, Void input) {
			return apply(split.body(), null);
		}

		@Override
		public Integer apply(Splitting.Refined split, Void input) {
			return Math.max(split.info().placeholder(), apply(split.body(), null));
		}

		@Override
		public Integer apply(Splitting.Valid split, Void input) {
			int max = 0;
			for (Splitting.Valid.Branch b : split.branches()) {
				max = Math.max(max, apply(b.body(), null));
			}
			return max;
		}

		private int max(Path path) {
			int max = 0;
			while (!path.isEmpty()) {
				if (path.head() instanceof Path.Placeholder) {
					max = Math.max(max, ((Path.Placeholder) path.head()).id());
				}
				path = path.tail();
			}
			return max;
		}
	};
}
