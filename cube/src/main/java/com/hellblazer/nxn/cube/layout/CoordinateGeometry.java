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

package com.hellblazer.nxn.cube.layout;

import com.hellblazer.nxn.cube.model.Axis;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.geometry.TransformType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Size dependent geometry of a cube: slice walks, face to face transforms and slice indices of center cells. All
 * results are derived from the face frames and the cubie coordinates of the cube; nothing is tabulated per face
 * pair.
 *
 * @author hal.hildebrand
 */
public final class CoordinateGeometry {
    private static final Logger log = LoggerFactory.getLogger(CoordinateGeometry.class);

    private final Cube                        cube;
    private final Map<SliceName, WalkingInfo> walks = new EnumMap<>(SliceName.class);

    public CoordinateGeometry(Cube cube) {
        this.cube = cube;
    }

    /**
     * @return the number of clockwise quarter turns about the axis that carry the source face's slot onto the
     * target's, or empty when no turn about this axis does
     */
    public static OptionalInt wholeCubeTurns(Axis axis, FaceName source, FaceName target) {
        var normal = source.normal();
        for (int turns = 1; turns < 4; turns++) {
            normal = normal.rotateClockwise(axis.vector());
            if (normal.equals(target.normal()) && !normal.equals(source.normal())) {
                return OptionalInt.of(turns);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return the axes whose whole cube rotations carry source onto target, in axis order
     */
    public static List<Axis> axesBetween(FaceName source, FaceName target) {
        var result = new ArrayList<Axis>(2);
        for (var axis : Axis.values()) {
            if (wholeCubeTurns(axis, source, target).isPresent()) {
                result.add(axis);
            }
        }
        return result;
    }

    public Cube cube() {
        return cube;
    }

    public int centerSize() {
        return cube.centerSize();
    }

    public WalkingInfo createWalkingInfo(SliceName slice) {
        return walks.computeIfAbsent(slice, s -> createWalkingInfo(s, CubeTopology.cycleOrder(s).get(0)));
    }

    /**
     * Walk the slice starting at any face it crosses. Different starts produce the same transforms.
     */
    public WalkingInfo createWalkingInfo(SliceName slice, FaceName start) {
        var cycle = CubeTopology.cycleOrder(slice, start);
        var inward = slice.reference().normal().negate();
        var result = new ArrayList<FaceWalk>(4);
        for (int j = 0; j < 4; j++) {
            var face = cycle.get(j);
            var previous = cycle.get(Math.floorMod(j - 1, 4));
            var entry = previous.normal();
            boolean horizontal = Math.abs(entry.dot(face.up())) == 1;
            boolean slotInverted = horizontal ? entry.equals(face.up()) : entry.equals(face.right());
            boolean indexInverted = horizontal ? !inward.equals(face.right()) : !inward.equals(face.up());
            result.add(new FaceWalk(face, previous, horizontal, slotInverted, indexInverted));
        }
        var info = new WalkingInfo(slice, centerSize(), result);
        log.trace("Created {}", info);
        return info;
    }

    /**
     * How (row, col) transforms under the whole cube rotation that carries {@code source} onto {@code target}. For
     * opposite faces the first of the two valid axes, in axis order, is used.
     *
     * @return the transform, or empty for the same face
     */
    public Optional<TransformType> deriveTransformType(FaceName source, FaceName target) {
        if (source == target) {
            return Optional.empty();
        }
        var axis = axesBetween(source, target).get(0);
        int turns = wholeCubeTurns(axis, source, target).getAsInt();
        int n = cube.size();
        var type = TransformType.classify(n, p -> rotateFull(source, p, axis, turns).point());
        return Optional.of(type.orElseThrow(
        () -> new IllegalStateException("Rotation " + axis + turns + " mirrors " + source + " onto " + target)));
    }

    /**
     * @return where the content of a center cell lands after a whole cube rotation
     */
    public FacePoint rotateCenter(FaceName face, Point center, Axis axis, int quarterTurns) {
        center.checkInside(centerSize());
        var full = rotateFull(face, new Point(center.row() + 1, center.col() + 1), axis, quarterTurns);
        return new FacePoint(full.face(), new Point(full.point().row() - 1, full.point().col() - 1));
    }

    /**
     * @return the 1-based slice index of the layer containing a center cell
     */
    public int sliceIndexOf(SliceName slice, FaceName face, Point center) {
        if (!CubeTopology.crosses(slice, face)) {
            throw new IllegalArgumentException(slice + " does not cross " + face);
        }
        center.checkInside(centerSize());
        var cubie = cube.cubie(face, center.row() + 1, center.col() + 1);
        return cube.sliceIndex(slice, cube.layer(slice.axis(), cubie));
    }

    /**
     * The center cells of {@code sideFace} that lie in one layer parallel to {@code layerFace}.
     *
     * @param layerSliceIndex 0 for the layer closest to {@code layerFace}
     */
    public List<Point> iterateOrthogonalFaceCenterPieces(FaceName layerFace, FaceName sideFace,
                                                         int layerSliceIndex) {
        if (!layerFace.isAdjacent(sideFace)) {
            throw new IllegalArgumentException(sideFace + " is not adjacent to " + layerFace);
        }
        int n = centerSize();
        if (layerSliceIndex < 0 || layerSliceIndex >= n) {
            throw new IllegalArgumentException("Layer slice index " + layerSliceIndex + " outside [0, " + n + ")");
        }
        var toward = layerFace.normal();
        var result = new ArrayList<Point>(n);
        for (int i = 0; i < n; i++) {
            if (toward.equals(sideFace.up())) {
                result.add(new Point(n - 1 - layerSliceIndex, i));
            } else if (toward.equals(sideFace.up().negate())) {
                result.add(new Point(layerSliceIndex, i));
            } else if (toward.equals(sideFace.right())) {
                result.add(new Point(i, n - 1 - layerSliceIndex));
            } else {
                result.add(new Point(i, layerSliceIndex));
            }
        }
        return result;
    }

    private FacePoint rotateFull(FaceName face, Point full, Axis axis, int quarterTurns) {
        var cubie = cube.cubie(face, full.row(), full.col()).rotateClockwise(axis.vector(), quarterTurns);
        var normal = face.normal().rotateClockwise(axis.vector(), quarterTurns);
        int slot = cube.slotOf(cubie, normal);
        return new FacePoint(cube.faceOfSlot(slot), new Point(cube.rowOfSlot(slot), cube.colOfSlot(slot)));
    }
}
