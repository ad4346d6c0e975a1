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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Point3i integer 3D point class.
 *
 * @author hal.hildebrand
 */
public class Point3iTest {

    @Test
    public void testConstruction() {
        var point = new Point3i(1, 2, 3);
        assertEquals(1, point.x);
        assertEquals(2, point.y);
        assertEquals(3, point.z);
    }

    @Test
    public void testArithmetic() {
        var p1 = new Point3i(1, 2, 3);
        var p2 = new Point3i(4, 5, 6);
        assertEquals(new Point3i(5, 7, 9), p1.add(p2));
        assertEquals(new Point3i(3, 3, 3), p2.subtract(p1));
        assertEquals(new Point3i(2, 4, 6), p1.multiply(2));
        assertEquals(new Point3i(-1, -2, -3), p1.negate());
        assertEquals(32, p1.dot(p2));
    }

    @Test
    public void testCrossIsRightHanded() {
        assertEquals(Point3i.UNIT_Z, Point3i.UNIT_X.cross(Point3i.UNIT_Y));
        assertEquals(Point3i.UNIT_X, Point3i.UNIT_Y.cross(Point3i.UNIT_Z));
        assertEquals(Point3i.UNIT_Y, Point3i.UNIT_Z.cross(Point3i.UNIT_X));
    }

    @Test
    public void testClockwiseRotation() {
        // Looking down from +z, x rotates clockwise onto -y
        assertEquals(Point3i.UNIT_Y.negate(), Point3i.UNIT_X.rotateClockwise(Point3i.UNIT_Z));
        assertEquals(Point3i.UNIT_X, Point3i.UNIT_Y.rotateClockwise(Point3i.UNIT_Z));
        // The axis itself is fixed
        assertEquals(Point3i.UNIT_Z, Point3i.UNIT_Z.rotateClockwise(Point3i.UNIT_Z));
        // Clockwise from +x carries +z onto +y
        assertEquals(Point3i.UNIT_Y, Point3i.UNIT_Z.rotateClockwise(Point3i.UNIT_X));
    }

    @Test
    public void testQuarterTurnCounts() {
        var p = new Point3i(3, -1, 2);
        assertEquals(p, p.rotateClockwise(Point3i.UNIT_Y, 4));
        assertEquals(p, p.rotateClockwise(Point3i.UNIT_Y, 0));
        assertEquals(p.rotateClockwise(Point3i.UNIT_Y, 3), p.rotateClockwise(Point3i.UNIT_Y, -1));
        assertEquals(p.rotateClockwise(Point3i.UNIT_Y.negate()), p.rotateClockwise(Point3i.UNIT_Y, -1));
    }

    @Test
    public void testRejectsNonUnitAxis() {
        assertThrows(IllegalArgumentException.class, () -> Point3i.UNIT_X.rotateClockwise(new Point3i(1, 1, 0)));
    }

    @Test
    public void testEqualsAndHashCode() {
        var p1 = new Point3i(1, 2, 3);
        var p2 = new Point3i(1, 2, 3);
        var p3 = new Point3i(1, 2, 4);

        assertEquals(p1, p2);
        assertNotEquals(p1, p3);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertEquals("Point3i(1, 2, 3)", p1.toString());
    }
}
