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

import com.hellblazer.nxn.cube.alg.WholeCubeAlg;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.geometry.Point;

import java.util.List;

/**
 * The answer to "which content lands on {@code targetCoord} of {@code targetFace}, and which move brings it there".
 *
 * @param targetFace        the face receiving the content
 * @param sourceFace        the face the content comes from
 * @param targetCoord       the center coordinate on the target
 * @param sourceCoord       the center coordinate on the source for the whole cube rotation, and for the first slice
 *                          path
 * @param wholeCubeRotation the whole cube rotation carrying {@code sourceCoord} onto {@code targetCoord}
 * @param sliceAlgorithms   one slice path for adjacent faces, two for opposite faces
 * @author hal.hildebrand
 */
public record TranslationResult(FaceName targetFace, FaceName sourceFace, Point targetCoord, Point sourceCoord,
                                WholeCubeAlg wholeCubeRotation, List<SliceAlgorithmResult> sliceAlgorithms) {

    public TranslationResult {
        sliceAlgorithms = List.copyOf(sliceAlgorithms);
    }

    public SliceAlgorithmResult firstSliceAlgorithm() {
        return sliceAlgorithms.get(0);
    }
}
