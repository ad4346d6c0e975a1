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

import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.TagKind;
import com.hellblazer.nxn.cube.operator.Operator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FaceTrackerTest {

    @Test
    public void testMarkedTrackerFollowsSticker() {
        var cube = new Cube(4);
        var tracker = new MarkedFaceTracker(cube, Color.BLUE, cube.face(FaceName.F));
        assertEquals(FaceName.F, tracker.face().name());
        assertEquals(Color.BLUE, tracker.marked().color());

        new Operator(cube).play(Algs.X);
        // X turns like R: the front comes up on top
        assertEquals(FaceName.U, tracker.face().name());

        tracker.restoreToPhysicalFace(cube.face(FaceName.F));
        assertEquals(FaceName.F, tracker.face().name());
        long tagged = cube.faces()
                          .stream()
                          .flatMap(f -> f.centerSlices().stream())
                          .filter(s -> s.sticker().hasTag(TagKind.FACE_TRACKER, tracker.id()))
                          .count();
        assertEquals(1, tagged);

        tracker.cleanup();
        assertThrows(IllegalStateException.class, tracker::face);
    }

    @Test
    public void testMarkedTrackersHaveDistinctKeys() {
        var cube = new Cube(4);
        var a = new MarkedFaceTracker(cube, Color.BLUE, cube.face(FaceName.F));
        var b = new MarkedFaceTracker(cube, Color.GREEN, cube.face(FaceName.B));
        assertNotEquals(a.id(), b.id());
        a.cleanup();
        assertEquals(FaceName.B, b.face().name());
    }

    @Test
    public void testSimpleTrackers() {
        var cube = new Cube(5);
        var red = SimpleFaceTracker.byCenterColor(cube, Color.RED);
        var orange = SimpleFaceTracker.oppositeOf(cube, red, Color.ORANGE);
        assertEquals(FaceName.R, red.face().name());
        assertEquals(FaceName.L, orange.face().name());
        assertEquals("simple", red.match(s -> "simple", m -> "marked"));

        new Operator(cube).play(Algs.Y);
        // Y turns like U: the right face moves to the front
        assertEquals(FaceName.F, red.face().name());
        assertEquals(FaceName.B, orange.face().name());
        assertTrue(red.isOn(cube.face(FaceName.F)));

        assertThrows(IllegalArgumentException.class, () -> SimpleFaceTracker.byCenterColor(new Cube(4), Color.RED));
    }
}
