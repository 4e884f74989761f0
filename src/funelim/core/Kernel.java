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

import java.util.List;

import funelim.core.Syntax.Term;
import funelim.util.ProofFailure;

/**
 * The proof environment into which derived statements are declared. Each
 * declaration must be visible to those following it.
 *
 * @author David J. Pearce
 *
 */
public interface Kernel {

	/**
	 * Prove and declare a lemma.
	 *
	 * @param name      The name of the lemma
	 * @param statement Its statement
	 * @param strategy  The proof to attempt
	 * @throws ProofFailure if the strategy does not prove the statement
	 */
	public void prove(String name, Term statement, ProofStrategy strategy) throws ProofFailure;

	/**
	 * Declare a lemma whose proof is left open.
	 *
	 * @param name
	 * @param statement
	 */
	public void admit(String name, Term statement);

	public void declareInductive(InductiveBlock block);

	/**
	 * Generate the (non-dependent) induction scheme of some relations of a
	 * declared block, combining them into one when there are several. Returns
	 * the scheme's type.
	 *
	 * @param name        The name of the scheme
	 * @param block       The declared block
	 * @param inductives  The indices of the relations to combine
	 * @return
	 */
	public Term scheme(String name, InductiveBlock block, List<Integer> inductives);

	public void setOpaque(Term function);

	public void setTransparent(Term function);

	public void addRewriteRule(String base, String lemma);

	public void addHint(String base, String name);

	/**
	 * Declare a constant as an instance of a type class.
	 *
	 * @param name
	 * @param cls
	 * @param arguments The arguments of the class
	 */
	public void declareInstance(String name, String cls, List<Term> arguments);
}
