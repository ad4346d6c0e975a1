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
import com.hellblazer.nxn.cube.model.CubeColorScheme;
import com.hellblazer.nxn.cube.model.Face;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owns the six face trackers of a cube and answers which color each face is being solved to. The assignment is
 * always a bijection onto the six colors forming the same scheme as the solved cube.
 * <p>
 * On an odd cube every tracker follows its middle center. On an even cube the trackers are seeded by majority: the
 * face holding the most centers of one color is marked with that color and its opposite face gets the opposite
 * color; the best remaining face and color are marked the same way; the last pair is whichever assignment keeps the
 * scheme valid.
 *
 * @author hal.hildebrand
 */
public final class TrackerHolder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrackerHolder.class);

    private final Cube                 cube;
    private final CubeColorScheme      scheme;
    private final List<FaceTracker>    trackers;
    private       Map<FaceName, Color> cachedColors;
    private       long                 cachedCounter = -1;
    private       Map<FaceName, Color> frozenColors;
    private       int                  frozenDepth;
    private       int                  preserveDepth;

    public TrackerHolder(Cube cube) {
        this(cube, CubeColorScheme.BOY);
    }

    /**
     * @throws IllegalArgumentException if the cube has no center grid
     * @throws IllegalStateException    if the seeded trackers do not form a valid scheme
     */
    public TrackerHolder(Cube cube, CubeColorScheme scheme) {
        if (cube.size() < 3) {
            throw new IllegalArgumentException("Face tracking needs center pieces: " + cube);
        }
        this.cube = cube;
        this.scheme = scheme;
        this.trackers = Collections.unmodifiableList(cube.isOdd() ? oddTrackers() : evenTrackers());
        try {
            var colors = getFaceColors();
            if (!scheme.isSameScheme(colors)) {
                throw new IllegalStateException("Trackers " + colors + " do not form scheme " + scheme);
            }
            log.debug("Trackers for {}: {}", cube, colors);
        } catch (IllegalStateException e) {
            cleanup();
            throw e;
        }
    }

    public Cube cube() {
        return cube;
    }

    public List<FaceTracker> trackers() {
        return trackers;
    }

    public FaceTracker tracker(Color color) {
        return trackers.stream()
                       .filter(t -> t.color() == color)
                       .findFirst()
                       .orElseThrow(() -> new IllegalArgumentException("No tracker for " + color));
    }

    /**
     * @return the color each face is being solved to, cached until the cube next changes
     * @throws IllegalStateException if two trackers designate the same face
     */
    public Map<FaceName, Color> getFaceColors() {
        if (frozenColors != null) {
            return frozenColors;
        }
        if (cachedColors != null && cachedCounter == cube.modifyCounter()) {
            return cachedColors;
        }
        var colors = new EnumMap<FaceName, Color>(FaceName.class);
        for (var tracker : trackers) {
            var face = tracker.face().name();
            var previous = colors.put(face, tracker.color());
            if (previous != null) {
                throw new IllegalStateException(
                "Trackers for " + previous + " and " + tracker.color() + " both designate " + face);
            }
        }
        cachedColors = Collections.unmodifiableMap(colors);
        cachedCounter = cube.modifyCounter();
        return cachedColors;
    }

    public Color faceColor(FaceName face) {
        return getFaceColors().get(face);
    }

    /**
     * @return true when every sticker of the edge or corner shows the color of the face it sits on
     */
    public boolean partMatchFaces(Part part) {
        var colors = getFaceColors();
        return part.stickers().stream().allMatch(s -> colors.get(s.face()) == s.sticker().color());
    }

    /**
     * @return true when every face's center grid shows its tracker color
     */
    public boolean allFacesSolved() {
        return getFaceColors().entrySet()
                              .stream()
                              .allMatch(e -> cube.face(e.getKey()).isCenterSolved(e.getValue()));
    }

    /**
     * Open a scope after which every tracker designates the same face as when the scope was opened, whatever the
     * moves played inside did to the tagged stickers.
     */
    public PreservePhysicalFaces preservePhysicalFaces() {
        var snapshot = new HashMap<FaceTracker, FaceName>();
        for (var tracker : trackers) {
            snapshot.put(tracker, tracker.face().name());
        }
        preserveDepth++;
        return new PreservePhysicalFaces(snapshot);
    }

    public boolean isPreservingPhysicalFaces() {
        return preserveDepth > 0;
    }

    /**
     * Open a scope during which {@link #getFaceColors()} answers the assignment at the time the scope was opened.
     */
    public FrozenFaceColors frozenFaceColors() {
        var snapshot = getFaceColors();
        frozenDepth++;
        frozenColors = snapshot;
        return new FrozenFaceColors();
    }

    /**
     * Remove every tag the trackers placed on the cube.
     */
    public void cleanup() {
        for (var tracker : trackers) {
            tracker.cleanup();
        }
        invalidate();
    }

    @Override
    public void close() {
        cleanup();
    }

    private void invalidate() {
        cachedColors = null;
        cachedCounter = -1;
    }

    private List<FaceTracker> oddTrackers() {
        var result = new ArrayList<FaceTracker>(6);
        for (var name : FaceName.values()) {
            result.add(SimpleFaceTracker.byCenterColor(cube, cube.face(name).color()));
        }
        return result;
    }

    private List<FaceTracker> evenTrackers() {
        var result = new ArrayList<FaceTracker>(6);
        var faces = EnumSet.allOf(FaceName.class);
        var colors = EnumSet.allOf(Color.class);

        var first = mostCommon(faces, colors);
        var t1 = new MarkedFaceTracker(cube, first.color, cube.face(first.face));
        var t2 = SimpleFaceTracker.oppositeOf(cube, t1, scheme.opposite(first.color));
        result.add(t1);
        result.add(t2);
        faces.remove(first.face);
        faces.remove(first.face.opposite());
        colors.remove(t1.color());
        colors.remove(t2.color());

        var second = mostCommon(faces, colors);
        var t3 = new MarkedFaceTracker(cube, second.color, cube.face(second.face));
        var t4 = SimpleFaceTracker.oppositeOf(cube, t3, scheme.opposite(second.color));
        result.add(t3);
        result.add(t4);
        colors.remove(t3.color());
        colors.remove(t4.color());

        var c5 = colors.iterator().next();
        var c6 = scheme.opposite(c5);
        var placed = List.<FaceTracker>of(t1, t2, t3, t4);
        var t5 = new SimpleFaceTracker(cube, c5, f -> completesScheme(placed, f, c5, c6), "scheme " + c5);
        result.add(t5);
        result.add(SimpleFaceTracker.oppositeOf(cube, t5, c6));
        return result;
    }

    private boolean completesScheme(List<FaceTracker> placed, Face face, Color color, Color opposite) {
        var assignment = new EnumMap<FaceName, Color>(FaceName.class);
        for (var tracker : placed) {
            assignment.put(tracker.face().name(), tracker.color());
        }
        if (assignment.containsKey(face.name()) || assignment.containsKey(face.name().opposite())) {
            return false;
        }
        assignment.put(face.name(), color);
        assignment.put(face.name().opposite(), opposite);
        return scheme.isSameScheme(assignment);
    }

    private FaceColor mostCommon(Set<FaceName> faces, Set<Color> colors) {
        FaceColor best = null;
        int bestCount = -1;
        for (var face : faces) {
            for (var color : colors) {
                int count = cube.face(face).countCenterColor(color);
                if (count > bestCount) {
                    best = new FaceColor(face, color);
                    bestCount = count;
                }
            }
        }
        log.trace("Most common {} with {} centers", best, bestCount);
        return best;
    }

    private record FaceColor(FaceName face, Color color) {
    }

    /**
     * Restores every tracker's face on close.
     */
    public final class PreservePhysicalFaces implements AutoCloseable {
        private final Map<FaceTracker, FaceName> snapshot;

        private PreservePhysicalFaces(Map<FaceTracker, FaceName> snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public void close() {
            preserveDepth--;
            for (var tracker : trackers) {
                var face = cube.face(snapshot.get(tracker));
                tracker.match(simple -> null, marked -> {
                    if (marked.face().name() != face.name()) {
                        marked.restoreToPhysicalFace(face);
                    }
                    return null;
                });
            }
            invalidate();
        }
    }

    /**
     * Releases the pinned assignment on close.
     */
    public final class FrozenFaceColors implements AutoCloseable {

        private FrozenFaceColors() {
        }

        @Override
        public void close() {
            if (--frozenDepth == 0) {
                frozenColors = null;
            }
        }
    }
}
