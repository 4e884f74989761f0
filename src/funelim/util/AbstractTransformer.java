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

import funelim.core.Syntax;
import funelim.core.Syntax.Term;

/**
 * A generic rewriter over terms which tracks the number of binders crossed on
 * the way down. By default every term is rebuilt from its transformed children,
 * and the original object is returned when no child changed. Transformations
 * such as lifting and substitution override only the cases they care about.
 *
 * @author David J. Pearce
 *
 */
public abstract class AbstractTransformer {

	/**
	 * Apply this transformer to a given term.
	 *
	 * @param depth The number of binders crossed since the root of the
	 *              transformation.
	 * @param term  The term being transformed.
	 * @return
	 */
	public Term apply(int depth, Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_rel:
			return apply(depth, (Term.Rel) term);
		case Syntax.TERM_var:
		case Syntax.TERM_const:
		case Syntax.TERM_ind:
		case Syntax.TERM_sort:
			return term;
		case Syntax.TERM_app:
			return apply(depth, (Term.App) term);
		case Syntax.TERM_lambda:
			return apply(depth, (Term.Lambda) term);
		case Syntax.TERM_product:
			return apply(depth, (Term.Product) term);
		case Syntax.TERM_letin:
			return apply(depth, (Term.LetIn) term);
		case Syntax.TERM_case:
			return apply(depth, (Term.Case) term);
		case Syntax.TERM_proj:
			return apply(depth, (Term.Proj) term);
		case Syntax.TERM_evar:
			return apply(depth, (Term.Evar) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	protected Term apply(int depth, Term.Rel term) {
		return term;
	}

	protected Term apply(int depth, Term.App term) {
		Term head = apply(depth, term.head());
		Term[] arguments = apply(depth, term.arguments());
		if (head == term.head() && arguments == term.arguments()) {
			return term;
		}
		return new Term.App(head, arguments);
	}

	protected Term apply(int depth, Term.Lambda term) {
		Term type = apply(depth, term.type());
		Term body = apply(depth + 1, term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Lambda(term.name(), type, body);
	}

	protected Term apply(int depth, Term.Product term) {
		Term type = apply(depth, term.type());
		Term body = apply(depth + 1, term.body());
		if (type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.Product(term.name(), type, body);
	}

	protected Term apply(int depth, Term.LetIn term) {
		Term value = apply(depth, term.value());
		Term type = apply(depth, term.type());
		Term body = apply(depth + 1, term.body());
		if (value == term.value() && type == term.type() && body == term.body()) {
			return term;
		}
		return new Term.LetIn(term.name(), value, type, body);
	}

	protected Term apply(int depth, Term.Case term) {
		Term predicate = apply(depth, term.predicate());
		Term discriminee = apply(depth, term.discriminee());
		Term[] branches = apply(depth, term.branches());
		if (predicate == term.predicate() && discriminee == term.discriminee() && branches == term.branches()) {
			return term;
		}
		return new Term.Case(predicate, discriminee, branches);
	}

	protected Term apply(int depth, Term.Proj term) {
		Term operand = apply(depth, term.operand());
		if (operand == term.operand()) {
			return term;
		}
		return new Term.Proj(term.projection(), operand);
	}

	protected Term apply(int depth, Term.Evar term) {
		Term[] instance = apply(depth, term.instance());
		if (instance == term.instance()) {
			return term;
		}
		return new Term.Evar(term.id(), term.name(), instance);
	}

	/**
	 * Apply this transformer to every term in an array, returning the original
	 * array if nothing changed.
	 *
	 * @param depth
	 * @param terms
	 * @return
	 */
	protected Term[] apply(int depth, Term[] terms) {
		Term[] nTerms = terms;
		for (int i = 0; i != terms.length; ++i) {
			Term t = terms[i];
			Term n = apply(depth, t);
			if (t != n && nTerms == terms) {
				nTerms = terms.clone();
			}
			nTerms[i] = n;
		}
		return nTerms;
	}
}
