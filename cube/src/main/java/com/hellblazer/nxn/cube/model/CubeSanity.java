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

import java.util.EnumMap;

/**
 * Consistency checks over the whole cube.
 *
 * @author hal.hildebrand
 */
public final class CubeSanity {

    private CubeSanity() {
    }

    /**
     * @throws IllegalStateException unless every color appears exactly N*N times
     */
    public static void checkColorCounts(Cube cube) {
        var counts = new EnumMap<Color, Integer>(Color.class);
        for (var color : cube.snapshotColors()) {
            counts.merge(color, 1, Integer::sum);
        }
        int expected = cube.size() * cube.size();
        for (var color : Color.values()) {
            int count = counts.getOrDefault(color, 0);
            if (count != expected) {
                throw new IllegalStateException(
                "Color " + color + " appears " + count + " times, expected " + expected + " on " + cube);
            }
        }
    }

    /**
     * @return true when every face's center grid is monochrome
     */
    public static boolean areCentersMonochrome(Cube cube) {
        return cube.faces().stream().allMatch(Face::isCenterMonochrome);
    }
}
