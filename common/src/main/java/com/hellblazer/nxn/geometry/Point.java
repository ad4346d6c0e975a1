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

/**
 * A cell coordinate on a square grid, row 0 at the bottom and column 0 at the left.
 *
 * @author hal.hildebrand
 */
public record Point(int row, int col) {

    public static Point of(int row, int col) {
        return new Point(row, col);
    }

    public boolean isInside(int size) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    public Point checkInside(int size) {
        if (!isInside(size)) {
            throw new IllegalArgumentException(this + " is outside a grid of size " + size);
        }
        return this;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
