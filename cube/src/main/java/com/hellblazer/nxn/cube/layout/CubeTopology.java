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

import java.util.ArrayList;
import java.util.List;

/**
 * Size independent facts about the cube: face adjacency, slice reference faces, slice cycles and how slices cross
 * faces. Everything is derived from the face frames in {@link FaceName}.
 *
 * @author hal.hildebrand
 */
public final class CubeTopology {

    private CubeTopology() {
    }

    public static FaceName opposite(FaceName face) {
        return face.opposite();
    }

    public static boolean isAdjacent(FaceName a, FaceName b) {
        return a.isAdjacent(b);
    }

    public static FaceName referenceFace(SliceName slice) {
        return slice.reference();
    }

    /**
     * The four faces crossed by the slice, in the order content flows through them when the slice turns positively
     * (like its reference face). The cycle starts at F for M, R for E and U for S.
     */
    public static List<FaceName> cycleOrder(SliceName slice) {
        var start = switch (slice) {
            case M -> FaceName.F;
            case E -> FaceName.R;
            case S -> FaceName.U;
        };
        return cycleOrder(slice, start);
    }

    /**
     * @param start a face crossed by the slice
     * @return the content flow cycle of the slice starting at {@code start}
     */
    public static List<FaceName> cycleOrder(SliceName slice, FaceName start) {
        if (!crosses(slice, start)) {
            throw new IllegalArgumentException(slice + " does not cross " + start);
        }
        var turn = slice.reference().normal();
        var cycle = new ArrayList<FaceName>(4);
        var normal = start.normal();
        for (int i = 0; i < 4; i++) {
            cycle.add(FaceName.ofNormal(normal));
            normal = normal.rotateClockwise(turn);
        }
        return cycle;
    }

    public static boolean crosses(SliceName slice, FaceName face) {
        return face.normal().dot(slice.axis().vector()) == 0;
    }

    /**
     * @return whether the slice index selects a row or a column on the face
     * @throws IllegalArgumentException if the slice does not cross the face
     */
    public static SliceCut doesSliceCutRowsOrColumns(SliceName slice, FaceName face) {
        if (!crosses(slice, face)) {
            throw new IllegalArgumentException(slice + " does not cross " + face);
        }
        return Math.abs(face.right().dot(slice.axis().vector())) == 1 ? SliceCut.COL : SliceCut.ROW;
    }

    /**
     * @return the slices whose cycle contains both faces, in name order: one for adjacent faces, two for opposite
     * faces
     */
    public static List<SliceName> slicesBetween(FaceName a, FaceName b) {
        if (a == b) {
            throw new IllegalArgumentException("No slice between " + a + " and itself");
        }
        var result = new ArrayList<SliceName>(2);
        for (var slice : SliceName.values()) {
            if (crosses(slice, a) && crosses(slice, b)) {
                result.add(slice);
            }
        }
        return result;
    }
}
