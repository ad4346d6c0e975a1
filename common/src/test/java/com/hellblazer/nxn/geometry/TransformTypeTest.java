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

package com.hellblazer.nxn.geometry;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid transform tests")
class TransformTypeTest {

    @Test
    void clockwiseMovesTopLeftToTopRight() {
        assertEquals(new Point(3, 3), TransformType.ROT_90_CW.apply(new Point(3, 0), 4));
        assertEquals(new Point(0, 0), TransformType.ROT_90_CCW.apply(new Point(3, 0), 4));
        assertEquals(new Point(0, 3), TransformType.ROT_180.apply(new Point(3, 0), 4));
    }

    @Test
    void classifyRecognizesRotations() {
        assertEquals(TransformType.ROT_90_CW,
                     TransformType.classify(5, p -> TransformType.ROT_90_CW.apply(p, 5)).orElseThrow());
        assertTrue(TransformType.classify(3, p -> new Point(p.col(), p.row())).isEmpty(), "transpose is a mirror");
    }

    @Property
    @Label("Inverse undoes the transform")
    void inverseUndoes(@ForAll TransformType type, @ForAll @IntRange(min = 1, max = 9) int size,
                       @ForAll @IntRange(min = 0, max = 8) int row, @ForAll @IntRange(min = 0, max = 8) int col) {
        Assume.that(row < size && col < size);
        var p = new Point(row, col);
        assertEquals(p, type.inverse().apply(type.apply(p, size), size));
    }

    @Property
    @Label("Composition adds quarter turns")
    void compositionAddsTurns(@ForAll TransformType a, @ForAll TransformType b,
                              @ForAll @IntRange(min = 0, max = 5) int row,
                              @ForAll @IntRange(min = 0, max = 5) int col) {
        var p = new Point(row, col);
        assertEquals(b.apply(a.apply(p, 6), 6), a.andThen(b).apply(p, 6));
    }
}
