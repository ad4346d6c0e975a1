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

import java.util.ArrayList;
import java.util.List;

/**
 * An axis aligned rectangle of grid cells, inclusive of both corners. Always normalized so that {@code start} is
 * the lower left corner.
 *
 * @author hal.hildebrand
 */
public record Block(Point start, Point end) {

    public Block {
        if (start.row() > end.row() || start.col() > end.col()) {
            var s = new Point(Math.min(start.row(), end.row()), Math.min(start.col(), end.col()));
            var e = new Point(Math.max(start.row(), end.row()), Math.max(start.col(), end.col()));
            start = s;
            end = e;
        }
    }

    public static Block of(Point cell) {
        return new Block(cell, cell);
    }

    public static Block of(int r1, int c1, int r2, int c2) {
        return new Block(new Point(r1, c1), new Point(r2, c2));
    }

    public int rows() {
        return end.row() - start.row() + 1;
    }

    public int cols() {
        return end.col() - start.col() + 1;
    }

    public int size() {
        return rows() * cols();
    }

    public boolean contains(Point p) {
        return p.row() >= start.row() && p.row() <= end.row() && p.col() >= start.col() && p.col() <= end.col();
    }

    public boolean isInside(int gridSize) {
        return start.isInside(gridSize) && end.isInside(gridSize);
    }

    /**
     * @return the cells of the block, row by row
     */
    public List<Point> cells() {
        var cells = new ArrayList<Point>(size());
        for (int r = start.row(); r <= end.row(); r++) {
            for (int c = start.col(); c <= end.col(); c++) {
                cells.add(new Point(r, c));
            }
        }
        return cells;
    }

    public Block transform(TransformType type, int gridSize) {
        return new Block(type.apply(start, gridSize), type.apply(end, gridSize));
    }

    public Block rotateClockwise(int quarterTurns, int gridSize) {
        return transform(TransformType.ofClockwiseTurns(quarterTurns), gridSize);
    }

    public boolean rowsOverlap(Block other) {
        return start.row() <= other.end.row() && other.start.row() <= end.row();
    }

    public boolean colsOverlap(Block other) {
        return start.col() <= other.end.col() && other.start.col() <= end.col();
    }

    public boolean overlaps(Block other) {
        return rowsOverlap(other) && colsOverlap(other);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + "]";
    }
}
