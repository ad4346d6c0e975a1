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

import com.hellblazer.nxn.geometry.Point3i;

/**
 * The six faces of a cube. Each face carries its frame: the outward normal and the right and up directions of a
 * viewer looking at the face from outside, with {@code right x up == normal}.
 *
 * @author hal.hildebrand
 */
public enum FaceName {
    U(Point3i.UNIT_Y, Point3i.UNIT_X, Point3i.UNIT_Z.negate()),
    D(Point3i.UNIT_Y.negate(), Point3i.UNIT_X, Point3i.UNIT_Z),
    F(Point3i.UNIT_Z, Point3i.UNIT_X, Point3i.UNIT_Y),
    B(Point3i.UNIT_Z.negate(), Point3i.UNIT_X.negate(), Point3i.UNIT_Y),
    L(Point3i.UNIT_X.negate(), Point3i.UNIT_Z, Point3i.UNIT_Y),
    R(Point3i.UNIT_X, Point3i.UNIT_Z.negate(), Point3i.UNIT_Y);

    private final Point3i normal;
    private final Point3i right;
    private final Point3i up;

    FaceName(Point3i normal, Point3i right, Point3i up) {
        this.normal = normal;
        this.right = right;
        this.up = up;
    }

    public static FaceName ofNormal(Point3i normal) {
        for (var face : values()) {
            if (face.normal.equals(normal)) {
                return face;
            }
        }
        throw new IllegalArgumentException("Not a face normal: " + normal);
    }

    public Point3i normal() {
        return normal;
    }

    public Point3i right() {
        return right;
    }

    public Point3i up() {
        return up;
    }

    public FaceName opposite() {
        return ofNormal(normal.negate());
    }

    public boolean isAdjacent(FaceName other) {
        return normal.dot(other.normal) == 0;
    }
}
