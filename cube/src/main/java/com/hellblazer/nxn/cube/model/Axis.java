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
 * Whole cube rotation axes. {@code X} turns like R, {@code Y} like U and {@code Z} like F.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X(Point3i.UNIT_X), Y(Point3i.UNIT_Y), Z(Point3i.UNIT_Z);

    private final Point3i vector;

    Axis(Point3i vector) {
        this.vector = vector;
    }

    /**
     * @return the axis parallel to the signed unit vector
     */
    public static Axis parallelTo(Point3i unit) {
        for (var axis : values()) {
            if (Math.abs(axis.vector.dot(unit)) == 1) {
                return axis;
            }
        }
        throw new IllegalArgumentException("Not a unit axis: " + unit);
    }

    public Point3i vector() {
        return vector;
    }

    /**
     * @return the face a positive whole cube rotation about this axis turns like
     */
    public FaceName face() {
        return FaceName.ofNormal(vector);
    }
}
