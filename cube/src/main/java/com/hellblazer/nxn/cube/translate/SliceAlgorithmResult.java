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

package com.hellblazer.nxn.cube.translate;

import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.alg.SliceAlg;
import com.hellblazer.nxn.cube.model.SliceName;
import com.hellblazer.nxn.geometry.Point;

/**
 * One inner slice path from a source face to a target face.
 *
 * @param slice       the slice that connects the faces
 * @param sliceIndex  1-based index of the layer holding the target coordinate
 * @param n           signed quarter turns, in the slice's reference face direction
 * @param sourceCoord where the content must start on the source face for this path
 * @author hal.hildebrand
 */
public record SliceAlgorithmResult(SliceName slice, int sliceIndex, int n, Point sourceCoord) {

    /**
     * @return the move of the single layer holding the coordinate
     */
    public SliceAlg alg() {
        return SliceAlg.single(slice, sliceIndex, n);
    }

    /**
     * @return the same turn applied to every inner layer
     */
    public SliceAlg wholeSliceAlg() {
        return SliceAlg.whole(slice, n);
    }

    @Override
    public String toString() {
        return alg() + " from " + sourceCoord + " (" + Algs.normalizeTurns(n) + ")";
    }
}
