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

import funelim.core.Syntax.Term;

/**
 * The logical constants of the host which generated statements refer to, and
 * the sort in which graphs are defined.
 *
 * @author David J. Pearce
 *
 */
public class Logic {
	public static final Logic DEFAULT = new Logic("eq", "and", "ImpossibleCall", "eq_rect_r", "eq_elim",
			Term.Sort.Kind.PROP, "FunctionalInduction", "FunctionalElimination", "O", "S");

	private final String eq;
	private final String conj;
	private final String impossibleCall;
	private final String eqCase;
	private final String eqElim;
	private final Term.Sort.Kind sort;
	private final String functionalInduction;
	private final String functionalElimination;
	private final String zero;
	private final String succ;

	public Logic(String eq, String conj, String impossibleCall, String eqCase, String eqElim, Term.Sort.Kind sort,
			String functionalInduction, String functionalElimination, String zero, String succ) {
		this.eq = eq;
		this.conj = conj;
		this.impossibleCall = impossibleCall;
		this.eqCase = eqCase;
		this.eqElim = eqElim;
		this.sort = sort;
		this.functionalInduction = functionalInduction;
		this.functionalElimination = functionalElimination;
		this.zero = zero;
		this.succ = succ;
	}

	/**
	 * Get a logic identical to this one, except that graphs are defined in a
	 * given sort.
	 *
	 * @param sort
	 * @return
	 */
	public Logic withSort(Term.Sort.Kind sort) {
		return new Logic(eq, conj, impossibleCall, eqCase, eqElim, sort, functionalInduction,
				functionalElimination, zero, succ);
	}

	public Term sort() {
		return new Term.Sort(sort);
	}

	public boolean isPropositional() {
		return sort == Term.Sort.Kind.PROP;
	}

	public Term mkEq(Term type, Term lhs, Term rhs) {
		return Terms.applist(new Term.Const(eq), type, lhs, rhs);
	}

	public Term mkConj(Term lhs, Term rhs) {
		return Terms.applist(new Term.Const(conj), lhs, rhs);
	}

	/**
	 * Check whether a term is a conjunction, returning its two sides or
	 * <code>null</code>.
	 *
	 * @param term
	 * @return
	 */
	public Term[] destConj(Term term) {
		if (term instanceof Term.App) {
			Term.App app = (Term.App) term;
			if (app.head().equals(new Term.Const(conj)) && app.size() == 2) {
				return app.arguments();
			}
		}
		return null;
	}

	/**
	 * The statement that a given call cannot happen.
	 *
	 * @param type
	 * @param call
	 * @return
	 */
	public Term mkImpossibleCall(Term type, Term call) {
		return Terms.applist(new Term.Const(impossibleCall), type, call);
	}

	public String impossibleCall() {
		return impossibleCall;
	}

	/**
	 * Transport along an equality, with arguments
	 * <code>A x P (px : P x) y (e : y = x)</code>.
	 *
	 * @return
	 */
	public Term eqCase() {
		return new Term.Const(eqCase);
	}

	/**
	 * Dependent elimination of an equality, whose predicate also abstracts the
	 * equality proof.
	 *
	 * @return
	 */
	public Term eqElim() {
		return new Term.Const(eqElim);
	}

	public String functionalInduction() {
		return functionalInduction;
	}

	public String functionalElimination() {
		return functionalElimination;
	}

	/**
	 * Construct the unary natural number denoting a given integer.
	 *
	 * @param n
	 * @return
	 */
	public Term numeral(int n) {
		Term r = new Term.Const(zero);
		for (int i = 0; i != n; ++i) {
			r = new Term.App(new Term.Const(succ), r);
		}
		return r;
	}
}
