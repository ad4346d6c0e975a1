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
package com.hellblazer.nxn.solver.tracker;

import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.Face;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A tracker whose face is the first face satisfying a predicate. Used for every face of an odd cube, keyed by the
 * middle center color, and for the faces of an even cube that follow from the marked trackers.
 *
 * @author hal.hildebrand
 */
public final class SimpleFaceTracker implements FaceTracker {

    private final Cube            cube;
    private final Color           color;
    private final Predicate<Face> predicate;
    private final String          description;

    public SimpleFaceTracker(Cube cube, Color color, Predicate<Face> predicate, String description) {
        this.cube = cube;
        this.color = color;
        this.predicate = predicate;
        this.description = description;
    }

    /**
     * A tracker following the face whose middle center has the color. Only meaningful on odd cubes.
     */
    public static SimpleFaceTracker byCenterColor(Cube cube, Color color) {
        if (!cube.isOdd()) {
            throw new IllegalArgumentException("Center color tracking needs an odd cube: " + cube);
        }
        return new SimpleFaceTracker(cube, color, f -> f.color() == color, "center " + color);
    }

    /**
     * A tracker following the face opposite another tracker's face.
     */
    public static SimpleFaceTracker oppositeOf(Cube cube, FaceTracker other, Color color) {
        return new SimpleFaceTracker(cube, color, f -> other.face().opposite().name() == f.name(),
                                     "opposite " + other.color());
    }

    @Override
    public Color color() {
        return color;
    }

    @Override
    public Face face() {
        return cube.findFace(predicate)
                   .orElseThrow(() -> new IllegalStateException("No face matches tracker " + this + " on " + cube));
    }

    @Override
    public <R> R match(Function<SimpleFaceTracker, R> simple, Function<MarkedFaceTracker, R> marked) {
        return simple.apply(this);
    }

    @Override
    public void cleanup() {
        // nothing placed on the cube
    }

    @Override
    public String toString() {
        return "SimpleFaceTracker{" + color + ", " + description + "}";
    }
}
