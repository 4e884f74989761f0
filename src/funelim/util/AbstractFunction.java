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

import funelim.core.Splitting;

/**
 * A function over splitting trees, parameterised by an input threaded down the
 * tree. Every kind of node has its own abstract case, so that a new kind of
 * node must be handled by every implementation.
 *
 * @author David J. Pearce
 *
 * @param <T> The input type
 * @param <R> The result type
 */
public abstract class AbstractFunction<T, R> {

	public R apply(Splitting split, T input) {
		if (split instanceof Splitting.Compute) {
			return apply((Splitting.Compute) split, input);
		} else if (split instanceof Splitting.Split) {
			return apply((Splitting.Split) split, input);
		} else if (split instanceof Splitting.Mapping) {
			return apply((Splitting.Mapping) split, input);
		} else if (split instanceof Splitting.RecValid) {
			return apply((Splitting.RecValid) split, input);
		} else if (split instanceof Splitting.Refined) {
			return apply((Splitting.Refined) split, input);
		} else if (split instanceof Splitting.Valid) {
			return apply((Splitting.Valid) split, input);
		} else {
			throw new IllegalArgumentException("Invalid splitting encountered: " + split);
		}
	}

	public abstract R apply(Splitting.Compute split, T input);

	public abstract R apply(Splitting.Split split, T input);

	public abstract R apply(Splitting.Mapping split, T input);

	public abstract R apply(Splitting.RecValid split, T input);

	public abstract R apply(Splitting.Refined split, T input);

	public abstract R apply(Splitting.Valid split, T input);
}
