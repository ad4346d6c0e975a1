/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.nxn.cube.alg;

import com.hellblazer.nxn.cube.model.Cube;

import java.util.List;

/**
 * A cube algorithm: a face, slice or whole cube move, or a sequence of algorithms. Algorithms are immutable values;
 * playing one mutates the cube.
 *
 * @author hal.hildebrand
 */
public sealed interface Alg permits FaceAlg, SliceAlg, WholeCubeAlg, SeqAlg {

    /**
     * Apply the algorithm to the cube, one atomic move at a time.
     */
    void play(Cube cube);

    /**
     * @return the algorithm that undoes this one
     */
    Alg inverse();

    /**
     * @return this algorithm repeated {@code n} times; a negative count repeats the inverse
     */
    Alg times(int n);

    /**
     * @return the atomic moves of this algorithm, without no-op moves
     */
    List<Alg> flatten();

    default Alg prime() {
        return inverse();
    }

    default int count() {
        return flatten().size();
    }
}
