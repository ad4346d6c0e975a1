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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BlockTest {

    @Test
    public void testNormalization() {
        var block = Block.of(3, 4, 1, 2);
        assertEquals(new Point(1, 2), block.start());
        assertEquals(new Point(3, 4), block.end());
        assertEquals(3, block.rows());
        assertEquals(3, block.cols());
        assertEquals(9, block.size());
        assertEquals(9, block.cells().size());
    }

    @Test
    public void testRotation() {
        // a 1x2 block on the bottom row of a 3x3 grid turns into a column on the left
        var block = Block.of(0, 0, 0, 1);
        var rotated = block.rotateClockwise(1, 3);
        assertEquals(Block.of(1, 0, 2, 0), rotated);
        assertEquals(block, rotated.rotateClockwise(-1, 3));
        assertFalse(block.rowsOverlap(rotated));
        assertTrue(block.colsOverlap(rotated));
    }

    @Test
    public void testContainsAndOverlap() {
        var block = Block.of(1, 1, 2, 3);
        assertTrue(block.contains(new Point(2, 3)));
        assertFalse(block.contains(new Point(0, 1)));
        assertTrue(block.overlaps(Block.of(new Point(2, 2))));
        assertFalse(block.overlaps(Block.of(new Point(0, 0))));
        assertTrue(block.isInside(4));
        assertFalse(block.isInside(3));
    }
}
