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

import com.hellblazer.nxn.cube.model.CenterSlice;
import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.Face;
import com.hellblazer.nxn.cube.model.TagKind;
import com.hellblazer.nxn.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * A tracker that tags one center sticker with its own key and designates whatever face that sticker is on.
 *
 * @author hal.hildebrand
 */
public final class MarkedFaceTracker implements FaceTracker {
    private static final Logger     log = LoggerFactory.getLogger(MarkedFaceTracker.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final Cube  cube;
    private final Color color;
    private final long  id;

    /**
     * Tag a center sticker of the face, preferring one that already shows the color.
     */
    public MarkedFaceTracker(Cube cube, Color color, Face face) {
        this.cube = cube;
        this.color = color;
        this.id = IDS.incrementAndGet();
        mark(face);
    }

    public long id() {
        return id;
    }

    @Override
    public Color color() {
        return color;
    }

    @Override
    public Face face() {
        return marked().face();
    }

    /**
     * @return the center slice carrying the tag
     */
    public CenterSlice marked() {
        for (var face : cube.faces()) {
            for (var slice : face.centerSlices()) {
                if (slice.sticker().hasTag(TagKind.FACE_TRACKER, id)) {
                    return slice;
                }
            }
        }
        throw new IllegalStateException("Tracker " + this + " lost its sticker on " + cube);
    }

    /**
     * Move the tag to a sticker of the given face, wherever the tagged sticker has traveled.
     */
    public void restoreToPhysicalFace(Face face) {
        removeTag();
        mark(face);
    }

    @Override
    public <R> R match(Function<SimpleFaceTracker, R> simple, Function<MarkedFaceTracker, R> marked) {
        return marked.apply(this);
    }

    @Override
    public void cleanup() {
        removeTag();
    }

    private void mark(Face face) {
        int middle = face.centerSize() / 2;
        var slice = face.centerSlices()
                        .stream()
                        .filter(s -> s.color() == color)
                        .findFirst()
                        .orElse(face.centerSlice(new Point(middle, middle)));
        slice.sticker().tag(TagKind.FACE_TRACKER, id, color);
        log.trace("Tracker {} marked {}", id, slice);
    }

    private void removeTag() {
        for (var face : cube.faces()) {
            for (var slice : face.centerSlices()) {
                slice.sticker().removeTag(TagKind.FACE_TRACKER, id);
            }
        }
    }

    @Override
    public String toString() {
        return "MarkedFaceTracker{" + id + ", " + color + "}";
    }
}
