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
import com.hellblazer.nxn.geometry.Point;

/**
 * One face of a slice walk. Within the face, the slot counts cells away from the entry edge and the index counts
 * slice layers away from the slice's reference face. The point function is one of eight closed forms, selected by
 * the entry edge orientation and by whether slot and index run against the face's row and column order.
 *
 * @param face          the face
 * @param enteredFrom   the previous face in the content flow, whose shared edge content enters through
 * @param horizontal    true when the entry edge is the top or bottom edge
 * @param slotInverted  true when slot 0 is at the highest row (or column)
 * @param indexInverted true when index 0 is at the highest column (or row)
 * @author hal.hildebrand
 */
public record FaceWalk(FaceName face, FaceName enteredFrom, boolean horizontal, boolean slotInverted,
                       boolean indexInverted) {

    /**
     * @param n     center grid size
     * @param index 0-based slice index
     * @param slot  0-based slot along the strip
     */
    public Point computePoint(int n, int index, int slot) {
        int s = slotInverted ? n - 1 - slot : slot;
        int i = indexInverted ? n - 1 - index : index;
        return horizontal ? new Point(s, i) : new Point(i, s);
    }

    /**
     * @return {index, slot} of a center point, the inverse of {@link #computePoint(int, int, int)}
     */
    public int[] indexAndSlot(int n, Point p) {
        int s = horizontal ? p.row() : p.col();
        int i = horizontal ? p.col() : p.row();
        return new int[] { indexInverted ? n - 1 - i : i, slotInverted ? n - 1 - s : s };
    }
}
