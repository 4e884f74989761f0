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

/**
 * Thrown by a host kernel when the proof strategy recommended for a generated
 * statement does not close it. Unlike an {@link Anomaly}, this is recoverable:
 * the statement is still valid, only its automatic proof is missing.
 *
 * @author David J. Pearce
 *
 */
public class ProofFailure extends RuntimeException {
	private final String lemma;

	public ProofFailure(String lemma, String msg) {
		super(msg);
		this.lemma = lemma;
	}

	public ProofFailure(String lemma, String msg, Throwable cause) {
		super(msg, cause);
		this.lemma = lemma;
	}

	/**
	 * The name of the lemma whose proof failed.
	 *
	 * @return
	 */
	public String lemma() {
		return lemma;
	}

	public static final long serialVersionUID = 1l;
}
