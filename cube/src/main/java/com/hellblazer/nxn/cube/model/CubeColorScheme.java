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
import java.util.EnumSet;
import java.util.Map;

/**
 * A color scheme: the color of every face of a solved cube. Two face to color assignments describe the same scheme
 * when they differ only by a whole cube orientation, that is when opposite colors agree and the colors around one
 * corner keep their handedness.
 *
 * @author hal.hildebrand
 */
public final class CubeColorScheme {

    /** Blue, orange and yellow meet at one corner */
    public static final CubeColorScheme BOY = new CubeColorScheme(
    Map.of(FaceName.F, Color.BLUE, FaceName.L, Color.ORANGE, FaceName.U, Color.YELLOW, FaceName.R, Color.RED,
           FaceName.B, Color.GREEN, FaceName.D, Color.WHITE));

    private final Map<FaceName, Color> colors = new EnumMap<>(FaceName.class);
    private final Map<Color, FaceName> faces  = new EnumMap<>(Color.class);

    public CubeColorScheme(Map<FaceName, Color> colors) {
        if (!isBijection(colors)) {
            throw new IllegalArgumentException("Color scheme must use every color exactly once: " + colors);
        }
        this.colors.putAll(colors);
        colors.forEach((face, color) -> faces.put(color, face));
    }

    public static boolean isBijection(Map<FaceName, Color> assignment) {
        return assignment.size() == 6 && assignment.keySet().containsAll(EnumSet.allOf(FaceName.class))
        && EnumSet.copyOf(assignment.values()).size() == 6;
    }

    public Color color(FaceName face) {
        return colors.get(face);
    }

    public Color opposite(Color color) {
        return colors.get(faces.get(color).opposite());
    }

    /**
     * @return true when the assignment is this scheme seen from some orientation of the cube
     */
    public boolean isSameScheme(Map<FaceName, Color> assignment) {
        if (!isBijection(assignment)) {
            return false;
        }
        var facesOf = new EnumMap<Color, FaceName>(Color.class);
        assignment.forEach((face, color) -> facesOf.put(color, face));
        for (var face : FaceName.values()) {
            if (assignment.get(face.opposite()) != opposite(assignment.get(face))) {
                return false;
            }
        }
        return handedness(facesOf.get(color(FaceName.F)), facesOf.get(color(FaceName.L)),
                          facesOf.get(color(FaceName.U))) == handedness(FaceName.F, FaceName.L, FaceName.U);
    }

    private static int handedness(FaceName a, FaceName b, FaceName c) {
        return a.normal().dot(b.normal().cross(c.normal()));
    }

    public Map<FaceName, Color> asMap() {
        return new EnumMap<>(colors);
    }

    @Override
    public String toString() {
        return "CubeColorScheme" + colors;
    }
}
