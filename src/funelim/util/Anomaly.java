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
package funelim.util;

import java.io.PrintStream;

/**
 * Signals a broken invariant inside the compiler itself (e.g. a de Bruijn index
 * escaping its context, or more computations than graph constructors). An
 * anomaly is never a problem with the user's definition and is never recovered
 * from: it aborts the whole derivation.
 *
 * @author David J. Pearce
 *
 */
public class Anomaly extends RuntimeException {
	/**
	 * The objects being manipulated when the invariant was found broken.
	 */
	private final Object[] context;

	public Anomaly(String msg, Object... context) {
		super(msg);
		this.context = context;
	}

	public Anomaly(String msg, Throwable cause, Object... context) {
		super(msg, cause);
		this.context = context;
	}

	/**
	 * Get the objects recorded alongside this anomaly.
	 *
	 * @return
	 */
	public Object[] context() {
		return context;
	}

	@Override
	public String getMessage() {
		StringBuilder sb = new StringBuilder(super.getMessage());
		for (Object o : context) {
			sb.append("\n  in: ");
			sb.append(o);
		}
		return sb.toString();
	}

	/**
	 * Output this anomaly to a given output stream.
	 */
	public void outputAnomaly(PrintStream output) {
		output.println("anomaly: " + getMessage());
	}

	/**
	 * Check a given invariant, raising an anomaly when it does not hold.
	 *
	 * @param condition
	 * @param msg
	 * @param context
	 */
	public static void check(boolean condition, String msg, Object... context) {
		if (!condition) {
			throw new Anomaly(msg, context);
		}
	}

	public static final long serialVersionUID = 1l;
}
