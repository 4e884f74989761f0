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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes how a function recurses. A single program either recurses
 * structurally on one of its arguments or by well-founded recursion, whilst a
 * group of mutually defined functions is described as a whole by a
 * {@link Descriptor}.
 *
 * @author David J. Pearce
 *
 */
public abstract class Recursion {

	/**
	 * Distinguishes recursion whose calls carry computational content from
	 * recursion which only contributes proofs (e.g. well-founded recursion, or a
	 * refinement whose witness is abstracted away).
	 */
	public enum Relevance {
		COMPUTATIONAL, LOGICAL
	}

	/**
	 * Identifies the decreasing argument of a structurally recursive function.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Decreasing {
		public enum Kind {
			MUTUAL, NESTED
		}

		private final Kind kind;
		private final Integer argument;

		private Decreasing(Kind kind, Integer argument) {
			this.kind = kind;
			this.argument = argument;
		}

		/**
		 * A function which is part of a mutual block, decreasing on a given
		 * (zero-based) argument.
		 *
		 * @param argument
		 * @return
		 */
		public static Decreasing mutual(int argument) {
			return new Decreasing(Kind.MUTUAL, argument);
		}

		/**
		 * A nested function, optionally decreasing on a given argument.
		 *
		 * @param argument
		 * @return
		 */
		public static Decreasing nested(Integer argument) {
			return new Decreasing(Kind.NESTED, argument);
		}

		public Kind kind() {
			return kind;
		}

		/**
		 * Get the decreasing argument, or <code>null</code> for a nested function
		 * without one.
		 *
		 * @return
		 */
		public Integer argument() {
			return argument;
		}

		/**
		 * Determine whether a call with a given number of arguments reaches the
		 * decreasing argument.
		 *
		 * @param arguments
		 * @return
		 */
		public boolean isAppliedTo(int arguments) {
			return argument == null || arguments > argument;
		}

		@Override
		public String toString() {
			return kind.toString().toLowerCase() + (argument == null ? "" : "(" + argument + ")");
		}
	}

	/**
	 * Structural recursion of a single program.
	 */
	public static class Structural extends Recursion {
		private final Decreasing decreasing;

		public Structural(Decreasing decreasing) {
			this.decreasing = decreasing;
		}

		public Decreasing decreasing() {
			return decreasing;
		}

		@Override
		public String toString() {
			return "struct " + decreasing;
		}
	}

	/**
	 * Well-founded recursion of a single program. The identifier names the
	 * binding through which recursive calls are made.
	 */
	public static class WellFounded extends Recursion {
		private final String id;

		public WellFounded(String id) {
			this.id = id;
		}

		public String id() {
			return id;
		}

		@Override
		public String toString() {
			return "wf " + id;
		}
	}

	/**
	 * Describes the recursion of a group of functions.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Descriptor {

	}

	/**
	 * A group of structurally recursive functions, each with its decreasing
	 * argument.
	 */
	public static class Guarded extends Descriptor {
		private final Map<String, Decreasing> functions;

		public Guarded(Map<String, Decreasing> functions) {
			this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
		}

		public static Guarded of(String id, Decreasing decreasing) {
			return new Guarded(Collections.singletonMap(id, decreasing));
		}

		public Map<String, Decreasing> functions() {
			return functions;
		}

		/**
		 * Determine whether a call to a given function with a given number of
		 * arguments reaches its decreasing argument. Returns <code>null</code>
		 * when the function is not part of this group.
		 *
		 * @param function
		 * @param arguments
		 * @return
		 */
		public Boolean isAppliedToStructuralArgument(String function, int arguments) {
			Decreasing d = functions.get(function);
			return d == null ? null : d.isAppliedTo(arguments);
		}
	}

	/**
	 * A function defined by well-founded recursion.
	 */
	public static class Logical extends Descriptor {
		private final String id;

		public Logical(String id) {
			this.id = id;
		}

		public String id() {
			return id;
		}
	}
}
