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

import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.geometry.TransformType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CoordinateGeometryTest {

    @ParameterizedTest
    @ValueSource(ints = { 3, 4, 5, 6, 7 })
    public void testPositiveSliceTurnAdvancesOneFaceAlongTheWalk(int size) {
        var cube = new Cube(size);
        var geometry = new CoordinateGeometry(cube);
        int n = cube.centerSize();
        for (var slice : SliceName.values()) {
            var walks = geometry.createWalkingInfo(slice).walks();
            for (int index = 0; index < n; index++) {
                for (int slot = 0; slot < n; slot++) {
                    for (int j = 0; j < 4; j++) {
                        var from = walks.get(j);
                        var to = walks.get((j + 1) % 4);
                        var sticker = cube.face(from.face()).centerSlice(from.computePoint(n, index, slot)).sticker();
                        cube.rotateSlice(slice, index + 1, index + 1, 1);
                        var arrived = cube.face(to.face()).centerSlice(to.computePoint(n, index, slot)).sticker();
                        cube.rotateSlice(slice, index + 1, index + 1, -1);
                        assertSame(sticker, arrived,
                                   slice + " index " + index + " slot " + slot + " " + from.face() + "->" + to.face());
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 3, 4, 5, 6 })
    public void testWalkStartDoesNotChangeTransforms(int size) {
        var geometry = new CoordinateGeometry(new Cube(size));
        for (var slice : SliceName.values()) {
            var reference = geometry.createWalkingInfo(slice);
            for (var start : CubeTopology.cycleOrder(slice)) {
                var other = geometry.createWalkingInfo(slice, start);
                assertEquals(start, other.walks().get(0).face());
                for (var a : CubeTopology.cycleOrder(slice)) {
                    for (var b : CubeTopology.cycleOrder(slice)) {
                        assertEquals(reference.getTransform(a, b), other.getTransform(a, b));
                    }
                }
            }
        }
    }

    @Property
    @Label("Transforms along a slice compose")
    void compositionConsistency(@ForAll @IntRange(min = 3, max = 8) int size, @ForAll SliceName slice,
                                @ForAll @IntRange(min = 0, max = 3) int a, @ForAll @IntRange(min = 0, max = 3) int b,
                                @ForAll @IntRange(min = 0, max = 3) int c) {
        var geometry = new CoordinateGeometry(new Cube(size));
        var info = geometry.createWalkingInfo(slice);
        var cycle = CubeTopology.cycleOrder(slice);
        var ab = info.getTransform(cycle.get(a), cycle.get(b));
        var bc = info.getTransform(cycle.get(b), cycle.get(c));
        var ac = info.getTransform(cycle.get(a), cycle.get(c));
        int n = geometry.centerSize();
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                var p = new Point(row, col);
                assertEquals(ac.apply(p), bc.apply(ab.apply(p)));
            }
        }
    }

    @Test
    public void testDeriveTransformType() {
        var geometry = new CoordinateGeometry(new Cube(4));
        assertEquals(Optional.empty(), geometry.deriveTransformType(FaceName.F, FaceName.F));
        assertEquals(TransformType.IDENTITY, geometry.deriveTransformType(FaceName.F, FaceName.U).orElseThrow());
        assertEquals(TransformType.IDENTITY, geometry.deriveTransformType(FaceName.F, FaceName.R).orElseThrow());
        assertEquals(TransformType.IDENTITY, geometry.deriveTransformType(FaceName.F, FaceName.L).orElseThrow());
        assertEquals(TransformType.ROT_180, geometry.deriveTransformType(FaceName.U, FaceName.B).orElseThrow());
        for (var source : FaceName.values()) {
            for (var target : FaceName.values()) {
                var type = geometry.deriveTransformType(source, target);
                assertEquals(source == target, type.isEmpty());
                if (source.isAdjacent(target)) {
                    assertEquals(type.orElseThrow().inverse(),
                                 geometry.deriveTransformType(target, source).orElseThrow());
                }
            }
        }
    }

    @Test
    public void testSliceIndexOf() {
        var geometry = new CoordinateGeometry(new Cube(5));
        assertEquals(1, geometry.sliceIndexOf(SliceName.M, FaceName.F, new Point(0, 0)));
        assertEquals(3, geometry.sliceIndexOf(SliceName.M, FaceName.F, new Point(2, 2)));
        assertEquals(3, geometry.sliceIndexOf(SliceName.M, FaceName.B, new Point(0, 0)));
        assertEquals(1, geometry.sliceIndexOf(SliceName.E, FaceName.R, new Point(0, 2)));
        assertEquals(1, geometry.sliceIndexOf(SliceName.S, FaceName.U, new Point(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> geometry.sliceIndexOf(SliceName.S, FaceName.F,
                                                                                 new Point(0, 0)));
    }

    @Test
    public void testOrthogonalCenterPieces() {
        var geometry = new CoordinateGeometry(new Cube(5));
        assertEquals(List.of(new Point(2, 0), new Point(2, 1), new Point(2, 2)),
                     geometry.iterateOrthogonalFaceCenterPieces(FaceName.U, FaceName.F, 0));
        assertEquals(List.of(new Point(1, 0), new Point(1, 1), new Point(1, 2)),
                     geometry.iterateOrthogonalFaceCenterPieces(FaceName.D, FaceName.F, 1));
        assertEquals(List.of(new Point(0, 2), new Point(1, 2), new Point(2, 2)),
                     geometry.iterateOrthogonalFaceCenterPieces(FaceName.R, FaceName.F, 0));
        assertEquals(List.of(new Point(0, 0), new Point(1, 0), new Point(2, 0)),
                     geometry.iterateOrthogonalFaceCenterPieces(FaceName.L, FaceName.F, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> geometry.iterateOrthogonalFaceCenterPieces(FaceName.F, FaceName.B, 0));
    }
}
