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

package com.hellblazer.nxn.cube.model;

import com.hellblazer.nxn.geometry.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * A face of the cube. A face is a fixed spatial slot: moves change the stickers shown on it, never its identity.
 * Center coordinates run over the (N-2)x(N-2) inner grid, row 0 at the bottom and column 0 at the left as seen
 * from outside.
 *
 * @author hal.hildebrand
 */
public final class Face {

    private final Cube     cube;
    private final FaceName name;

    Face(Cube cube, FaceName name) {
        this.cube = cube;
        this.name = name;
    }

    public FaceName name() {
        return name;
    }

    public Cube cube() {
        return cube;
    }

    public int centerSize() {
        return cube.centerSize();
    }

    /**
     * The nominal color of the face: the fixed middle sticker on odd cubes, otherwise the first center sticker (or
     * the first corner sticker on a 2x2). Solvers needing a stable answer on even cubes use face trackers.
     */
    public Color color() {
        int n = cube.size();
        if (n == 2) {
            return cube.sticker(name, 0, 0).color();
        }
        if (cube.isOdd()) {
            return cube.sticker(name, n / 2, n / 2).color();
        }
        return cube.sticker(name, 1, 1).color();
    }

    public Face opposite() {
        return cube.face(name.opposite());
    }

    public boolean isAdjacent(Face other) {
        return name.isAdjacent(other.name);
    }

    public List<Face> adjacentFaces() {
        var result = new ArrayList<Face>(4);
        for (var other : FaceName.values()) {
            if (name.isAdjacent(other)) {
                result.add(cube.face(other));
            }
        }
        return result;
    }

    public List<Edge> edges() {
        return cube.edges().stream().filter(e -> e.contains(name)).toList();
    }

    public List<Corner> corners() {
        return cube.corners().stream().filter(c -> c.contains(name)).toList();
    }

    public CenterSlice centerSlice(int row, int col) {
        return centerSlice(new Point(row, col));
    }

    public CenterSlice centerSlice(Point point) {
        return new CenterSlice(this, point.checkInside(centerSize()));
    }

    public Color centerColor(Point point) {
        return centerSlice(point).color();
    }

    /**
     * @return all center slices, row by row from the bottom
     */
    public List<CenterSlice> centerSlices() {
        int n = centerSize();
        var result = new ArrayList<CenterSlice>(n * n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                result.add(new CenterSlice(this, new Point(r, c)));
            }
        }
        return result;
    }

    public int countCenterColor(Color color) {
        int count = 0;
        for (var slice : centerSlices()) {
            if (slice.color() == color) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return true when every center sticker has the same color; trivially true without centers
     */
    public boolean isCenterMonochrome() {
        var slices = centerSlices();
        return slices.stream().allMatch(s -> s.color() == slices.get(0).color());
    }

    public boolean isCenterSolved(Color color) {
        return countCenterColor(color) == centerSize() * centerSize();
    }

    Sticker centerSticker(Point point) {
        return cube.sticker(name, point.row() + 1, point.col() + 1);
    }

    @Override
    public String toString() {
        return name.name();
    }
}
