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

import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CubeTopologyTest {

    @Test
    public void testOppositeAndAdjacent() {
        assertEquals(FaceName.B, CubeTopology.opposite(FaceName.F));
        assertEquals(FaceName.D, CubeTopology.opposite(FaceName.U));
        assertEquals(FaceName.R, CubeTopology.opposite(FaceName.L));
        assertTrue(CubeTopology.isAdjacent(FaceName.F, FaceName.U));
        assertFalse(CubeTopology.isAdjacent(FaceName.F, FaceName.B));
        assertFalse(CubeTopology.isAdjacent(FaceName.F, FaceName.F));
    }

    @Test
    public void testReferenceFaces() {
        assertEquals(FaceName.L, CubeTopology.referenceFace(SliceName.M));
        assertEquals(FaceName.D, CubeTopology.referenceFace(SliceName.E));
        assertEquals(FaceName.F, CubeTopology.referenceFace(SliceName.S));
    }

    @Test
    public void testCycleOrderFollowsContentFlow() {
        // M turns like L, so content flows from U down onto F
        assertEquals(List.of(FaceName.F, FaceName.D, FaceName.B, FaceName.U), CubeTopology.cycleOrder(SliceName.M));
        assertEquals(List.of(FaceName.R, FaceName.B, FaceName.L, FaceName.F), CubeTopology.cycleOrder(SliceName.E));
        assertEquals(List.of(FaceName.U, FaceName.R, FaceName.D, FaceName.L), CubeTopology.cycleOrder(SliceName.S));
        assertEquals(List.of(FaceName.B, FaceName.U, FaceName.F, FaceName.D),
                     CubeTopology.cycleOrder(SliceName.M, FaceName.B));
        assertThrows(IllegalArgumentException.class, () -> CubeTopology.cycleOrder(SliceName.M, FaceName.L));
    }

    @Test
    public void testSliceCuts() {
        for (var face : List.of(FaceName.F, FaceName.U, FaceName.B, FaceName.D)) {
            assertEquals(SliceCut.COL, CubeTopology.doesSliceCutRowsOrColumns(SliceName.M, face));
        }
        for (var face : List.of(FaceName.F, FaceName.R, FaceName.B, FaceName.L)) {
            assertEquals(SliceCut.ROW, CubeTopology.doesSliceCutRowsOrColumns(SliceName.E, face));
        }
        assertEquals(SliceCut.COL, CubeTopology.doesSliceCutRowsOrColumns(SliceName.S, FaceName.L));
        assertEquals(SliceCut.COL, CubeTopology.doesSliceCutRowsOrColumns(SliceName.S, FaceName.R));
        assertEquals(SliceCut.ROW, CubeTopology.doesSliceCutRowsOrColumns(SliceName.S, FaceName.U));
        assertEquals(SliceCut.ROW, CubeTopology.doesSliceCutRowsOrColumns(SliceName.S, FaceName.D));
        assertThrows(IllegalArgumentException.class,
                     () -> CubeTopology.doesSliceCutRowsOrColumns(SliceName.M, FaceName.R));
    }

    @Test
    public void testSlicesBetween() {
        assertEquals(List.of(SliceName.M), CubeTopology.slicesBetween(FaceName.F, FaceName.U));
        assertEquals(List.of(SliceName.E), CubeTopology.slicesBetween(FaceName.F, FaceName.R));
        assertEquals(List.of(SliceName.S), CubeTopology.slicesBetween(FaceName.U, FaceName.R));
        assertEquals(List.of(SliceName.E, SliceName.M), CubeTopology.slicesBetween(FaceName.F, FaceName.B));
        assertThrows(IllegalArgumentException.class, () -> CubeTopology.slicesBetween(FaceName.F, FaceName.F));
    }
}
