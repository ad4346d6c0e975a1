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
import com.hellblazer.nxn.cube.model.Face;

import java.util.function.Function;

/**
 * Tracks which face should end up with a given color. On odd cubes the fixed middle center decides; even cubes have
 * no fixed center, so a tracker either follows a tagged sticker or derives its face from the other trackers.
 *
 * @author hal.hildebrand
 */
public sealed interface FaceTracker permits SimpleFaceTracker, MarkedFaceTracker {

    Color color();

    /**
     * @return the face the tracker currently designates
     * @throws IllegalStateException if the tracker cannot locate its face
     */
    Face face();

    /**
     * Exhaustive dispatch over the tracker variants.
     */
    <R> R match(Function<SimpleFaceTracker, R> simple, Function<MarkedFaceTracker, R> marked);

    /**
     * Release whatever the tracker placed on the cube.
     */
    void cleanup();

    default boolean isOn(Face face) {
        return face().name() == face.name();
    }
}
