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
package funelim.testing;

import java.util.ArrayList;
import java.util.List;

import funelim.core.Context;
import funelim.core.InductiveBlock;
import funelim.core.Logic;
import funelim.core.Syntax.Declaration;
import funelim.core.Syntax.Term;
import funelim.core.Terms;
import funelim.util.Pair;

/**
 * Computes the non-dependent induction scheme of an inductive block, in the
 * shape a kernel generates it. There is one predicate for each relation of the
 * block, followed by one method for each constructor. Every premise of a
 * constructor which is itself in the block gains a hypothesis about the
 * corresponding predicate.
 *
 * @author David J. Pearce
 *
 */
public class Schemes {

	/**
	 * Construct the scheme of some relations of a block, conjoining their
	 * conclusions when there are several.
	 *
	 * @param logic
	 * @param block
	 * @param inductives
	 * @return
	 */
	public static Term minimality(Logic logic, InductiveBlock block, List<Integer> inductives) {
		final int n = block.size();
		// Inductives of the block, as substituted into constructors
		ArrayList<Term> relations = new ArrayList<>();
		for (int k = n - 1; k >= 0; --k) {
			relations.add(new Term.Ind(block.name(), k));
		}
		Context ctx = Context.EMPTY;
		for (int k = 0; k != n; ++k) {
			ctx = ctx.push(new Declaration("P" + k, block.get(k).arity()));
		}
		int methods = 0;
		for (int k = 0; k != n; ++k) {
			for (Term c : block.get(k).constructors()) {
				ctx = ctx.push(new Declaration(null, method(block.name(), n, methods, Terms.substl(relations, c))));
				methods = methods + 1;
			}
		}
		Term conclusion = null;
		for (int i = inductives.size() - 1; i >= 0; --i) {
			Term t = conclusion(block, methods, inductives.get(i));
			conclusion = conclusion == null ? t : logic.mkConj(t, conclusion);
		}
		return Terms.itMkProdOrLetIn(conclusion, ctx);
	}

	private static Term method(String name, int n, int previous, Term constructor) {
		Pair<Context, Term> d = Terms.decomposeProdAssum(constructor);
		List<Declaration> decls = d.first().toList();
		ArrayList<Declaration> result = new ArrayList<>();
		int[] position = new int[decls.size()];
		for (int t = 0; t != decls.size(); ++t) {
			final List<Term> values = renaming(position, t, result.size());
			Declaration decl = decls.get(t).map(x -> Terms.substl(values, x));
			position[t] = result.size();
			result.add(decl);
			Term hyp = decl.isDefinition() ? null : hypothesis(name, n, previous, result.size(), decl.type());
			if (hyp != null) {
				result.add(new Declaration(null, hyp));
			}
		}
		List<Term> values = renaming(position, decls.size(), result.size());
		Pair<Term, List<Term>> concl = Terms.decomposeApp(Terms.substl(values, d.second()));
		int k = ((Term.Ind) concl.first()).index();
		Term body = Terms.applist(new Term.Rel(result.size() + previous + n - k), concl.second());
		return Terms.itMkProdOrLetIn(body, Context.of(result));
	}

	// Maps the first t declarations of a constructor to their positions amongst
	// the method's first size ones.
	private static List<Term> renaming(int[] position, int t, int size) {
		ArrayList<Term> values = new ArrayList<>();
		for (int r = 1; r <= t; ++r) {
			values.add(new Term.Rel(size - position[t - r]));
		}
		return values;
	}

	private static Term hypothesis(String name, int n, int previous, int size, Term type) {
		Pair<Context, Term> d = Terms.decomposeProdAssum(Terms.lift(1, type));
		Pair<Term, List<Term>> app = Terms.decomposeApp(d.second());
		if (!(app.first() instanceof Term.Ind) || !((Term.Ind) app.first()).block().equals(name)) {
			return null;
		}
		int k = ((Term.Ind) app.first()).index();
		Term p = new Term.Rel(size + d.first().size() + previous + n - k);
		return Terms.itMkProdOrLetIn(Terms.applist(p, app.second()), d.first());
	}

	private static Term conclusion(InductiveBlock block, int methods, int k) {
		Context args = Terms.decomposeProdAssum(block.get(k).arity()).first();
		int len = args.size();
		Term relation = Terms.applist(new Term.Ind(block.name(), k), args.extendedRelList(0));
		Term body = Terms.applist(new Term.Rel(1 + len + methods + block.size() - k), args.extendedRelList(1));
		return Terms.itMkProdOrLetIn(new Term.Product("H", relation, body), args);
	}
}
