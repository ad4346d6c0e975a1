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

import java.util.Objects;

/**
 * Immutable 3D point with integer coordinates.
 * Used for cubie positions (in doubled coordinates, so that every cubie center is integral) and for the unit
 * vectors of face frames.
 *
 * @author hal.hildebrand
 */
public final class Point3i {

    public static final Point3i UNIT_X = new Point3i(1, 0, 0);
    public static final Point3i UNIT_Y = new Point3i(0, 1, 0);
    public static final Point3i UNIT_Z = new Point3i(0, 0, 1);

    /** X coordinate */
    public final int x;

    /** Y coordinate */
    public final int y;

    /** Z coordinate */
    public final int z;

    /**
     * Create a new 3D integer point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public Point3i(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Create a point at the origin (0, 0, 0).
     *
     * @return Point at origin
     */
    public static Point3i origin() {
        return new Point3i(0, 0, 0);
    }

    /**
     * Add another point to this point.
     *
     * @param other Point to add
     * @return New point with summed coordinates
     */
    public Point3i add(Point3i other) {
        return new Point3i(x + other.x, y + other.y, z + other.z);
    }

    /**
     * Subtract another point from this point.
     *
     * @param other Point to subtract
     * @return New point with subtracted coordinates
     */
    public Point3i subtract(Point3i other) {
        return new Point3i(x - other.x, y - other.y, z - other.z);
    }

    /**
     * Multiply this point by a scalar.
     *
     * @param scalar Scalar multiplier
     * @return New point with scaled coordinates
     */
    public Point3i multiply(int scalar) {
        return new Point3i(x * scalar, y * scalar, z * scalar);
    }

    public Point3i negate() {
        return new Point3i(-x, -y, -z);
    }

    public int dot(Point3i other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Point3i cross(Point3i other) {
        return new Point3i(y * other.z - z * other.y, z * other.x - x * other.z, x * other.y - y * other.x);
    }

    /**
     * @return true if this point is one of the six signed unit vectors
     */
    public boolean isUnitAxis() {
        return Math.abs(x) + Math.abs(y) + Math.abs(z) == 1;
    }

    /**
     * Rotate this point a quarter turn clockwise, as seen looking at the origin from the tip of the axis.
     *
     * @param axis a signed unit vector
     * @return the rotated point
     */
    public Point3i rotateClockwise(Point3i axis) {
        if (!axis.isUnitAxis()) {
            throw new IllegalArgumentException("Not a unit axis: " + axis);
        }
        // -90 degrees about the axis: v' = -(a x v) + a (a . v)
        return axis.cross(this).negate().add(axis.multiply(axis.dot(this)));
    }

    /**
     * Rotate this point by a number of clockwise quarter turns about the axis. Negative counts turn
     * counterclockwise.
     *
     * @param axis         a signed unit vector
     * @param quarterTurns number of clockwise quarter turns
     * @return the rotated point
     */
    public Point3i rotateClockwise(Point3i axis, int quarterTurns) {
        var result = this;
        for (int i = 0; i < Math.floorMod(quarterTurns, 4); i++) {
            result = result.rotateClockwise(axis);
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3i other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("Point3i(%d, %d, %d)", x, y, z);
    }
}
