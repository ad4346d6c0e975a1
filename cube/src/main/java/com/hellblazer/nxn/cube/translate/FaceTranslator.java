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
import com.hellblazer.nxn.cube.alg.WholeCubeAlg;
import com.hellblazer.nxn.cube.layout.CoordinateGeometry;
import com.hellblazer.nxn.cube.layout.CubeTopology;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import com.hellblazer.nxn.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Translates center coordinates between faces. For a target position it computes where the content must start on a
 * source face and which whole cube rotation or inner slice turn delivers it.
 *
 * @author hal.hildebrand
 */
public final class FaceTranslator {
    private static final Logger log = LoggerFactory.getLogger(FaceTranslator.class);

    private final CoordinateGeometry geometry;

    public FaceTranslator(CoordinateGeometry geometry) {
        this.geometry = geometry;
    }

    public CoordinateGeometry geometry() {
        return geometry;
    }

    /**
     * @throws IllegalArgumentException if the faces are the same or the coordinate is off the center grid
     */
    public TranslationResult translate(FaceName targetFace, FaceName sourceFace, Point targetCoord) {
        if (targetFace == sourceFace) {
            throw new IllegalArgumentException("Cannot translate " + targetFace + " onto itself");
        }
        targetCoord.checkInside(geometry.centerSize());
        var axes = CoordinateGeometry.axesBetween(sourceFace, targetFace);
        if (axes.isEmpty()) {
            throw new IllegalStateException("No whole cube axis connects " + sourceFace + " and " + targetFace);
        }
        var paths = new ArrayList<SliceAlgorithmResult>(axes.size());
        for (var axis : axes) {
            int turns = CoordinateGeometry.wholeCubeTurns(axis, sourceFace, targetFace).getAsInt();
            var slice = SliceName.of(axis);
            var source = geometry.rotateCenter(targetFace, targetCoord, axis, -turns);
            if (source.face() != sourceFace) {
                throw new IllegalStateException(
                "Rotation " + axis + " by " + turns + " does not connect " + sourceFace + " to " + targetFace);
            }
            int index = geometry.sliceIndexOf(slice, targetFace, targetCoord);
            paths.add(new SliceAlgorithmResult(slice, index, Algs.normalizeTurns(turns * slice.axisSign()),
                                               source.point()));
        }
        var axis = axes.get(0);
        var rotation = new WholeCubeAlg(axis, Algs.normalizeTurns(
        CoordinateGeometry.wholeCubeTurns(axis, sourceFace, targetFace).getAsInt()));
        var result = new TranslationResult(targetFace, sourceFace, targetCoord, paths.get(0).sourceCoord(), rotation,
                                           paths);
        log.trace("Translated {}", result);
        return result;
    }

    /**
     * Follow the slice walk from a source coordinate to the coordinate its content reaches on the target. This is
     * the inverse of the slice half of {@link #translate(FaceName, FaceName, Point)}.
     */
    public Point translateTargetFromSource(FaceName sourceFace, FaceName targetFace, Point sourceCoord,
                                           SliceName slice) {
        if (sourceFace == targetFace) {
            throw new IllegalArgumentException("Cannot translate " + sourceFace + " onto itself");
        }
        if (!CubeTopology.crosses(slice, sourceFace) || !CubeTopology.crosses(slice, targetFace)) {
            throw new IllegalArgumentException(slice + " does not connect " + sourceFace + " and " + targetFace);
        }
        return geometry.createWalkingInfo(slice).getTransform(sourceFace, targetFace).apply(sourceCoord);
    }
}
