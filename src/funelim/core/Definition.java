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
import java.util.LinkedHashSet;
import java.util.Set;

import funelim.core.Splitting.Program;
import funelim.core.Syntax.Term;

/**
 * A function definition as handed over by the front end: the program, the
 * constant implementing it, the problem relating its splitting tree's root to
 * its signature, the tree itself and the names of the proof obligations it
 * generated.
 *
 * @author David J. Pearce
 *
 */
public class Definition {
	private final Program program;
	private final Term function;
	private final Problem problem;
	private final Splitting splitting;
	private final Set<String> userObligations;

	public Definition(Program program, Term function, Problem problem, Splitting splitting,
			Set<String> userObligations) {
		this.program = program;
		this.function = function;
		this.problem = problem;
		this.splitting = splitting;
		this.userObligations = Collections.unmodifiableSet(new LinkedHashSet<>(userObligations));
	}

	/**
	 * Construct a definition whose function is the constant named after the
	 * program, and whose tree is rooted at the program's signature.
	 *
	 * @param program
	 * @param splitting
	 */
	public Definition(Program program, Splitting splitting) {
		this(program, new Term.Const(program.id()), Problem.identity(program.signature()), splitting,
				Collections.emptySet());
	}

	public Program program() {
		return program;
	}

	public Term function() {
		return function;
	}

	public Problem problem() {
		return problem;
	}

	public Splitting splitting() {
		return splitting;
	}

	public Set<String> userObligations() {
		return userObligations;
	}

	public Definition withSplitting(Splitting splitting) {
		return new Definition(program, function, problem, splitting, userObligations);
	}

	@Override
	public String toString() {
		return program + " := " + splitting;
	}
}
