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
package com.hellblazer.nxn.solver.commutator;

import com.hellblazer.nxn.cube.layout.SliceCut;
import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Face;
import com.hellblazer.nxn.geometry.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete row or column of a face's center grid.
 *
 * @author hal.hildebrand
 */
public record CenterLine(SliceCut orientation, int index, int gridSize) {

    public CenterLine {
        if (index < 0 || index >= gridSize) {
            throw new IllegalArgumentException("Line " + index + " outside grid of size " + gridSize);
        }
    }

    public static CenterLine row(int index, int gridSize) {
        return new CenterLine(SliceCut.ROW, index, gridSize);
    }

    public static CenterLine col(int index, int gridSize) {
        return new CenterLine(SliceCut.COL, index, gridSize);
    }

    /**
     * @return every row, then every column
     */
    public static List<CenterLine> all(int gridSize) {
        var lines = new ArrayList<CenterLine>(2 * gridSize);
        for (int i = 0; i < gridSize; i++) {
            lines.add(row(i, gridSize));
        }
        for (int i = 0; i < gridSize; i++) {
            lines.add(col(i, gridSize));
        }
        return lines;
    }

    public Block block() {
        if (orientation == SliceCut.ROW) {
            return Block.of(index, 0, index, gridSize - 1);
        }
        return Block.of(0, index, gridSize - 1, index);
    }

    /**
     * @return true for the middle line of an odd grid, which no face turn moves to another line
     */
    public boolean isMiddle() {
        return gridSize % 2 == 1 && index == gridSize / 2;
    }

    public int countColor(Face face, Color color) {
        int count = 0;
        for (var cell : block().cells()) {
            if (face.centerColor(cell) == color) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return (orientation == SliceCut.ROW ? "row " : "col ") + index;
    }
}
