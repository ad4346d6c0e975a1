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
package com.hellblazer.nxn.solver.centers;

import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.CubeColorScheme;
import com.hellblazer.nxn.cube.model.CubeSanity;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.operator.OperationAbortedException;
import com.hellblazer.nxn.cube.operator.Operator;
import com.hellblazer.nxn.geometry.Block;
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.solver.commutator.BlockCommutatorEngine;
import com.hellblazer.nxn.solver.tracker.TrackerHolder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CenterReductionSolverTest {

    @Test
    public void testSolvedThreeByThreeNeedsNoMoves() {
        var cube = new Cube(3);
        var op = new Operator(cube);
        op.play(Algs.parse(""));
        var solver = new CenterReductionSolver(op);
        assertTrue(solver.solved());
        assertFalse(solver.solve());
        assertEquals(0, op.historySize());
    }

    @Test
    public void testThreeByThreeCentersAreAlwaysReduced() {
        var cube = new Cube(3);
        var op = new Operator(cube);
        op.play(Algs.scramble(3, 99));
        int played = op.historySize();
        var solver = new CenterReductionSolver(op);
        assertFalse(solver.solve());
        assertEquals(played, op.historySize());
        assertTrue(CenterReductionSolver.isCubeSolved(new Cube(2)));
    }

    @Test
    public void testFiveByFive() {
        var cube = new Cube(5);
        var op = new Operator(cube);
        op.play(Algs.scramble(5, 42));
        assertFalse(CenterReductionSolver.isCubeSolved(cube));

        var solver = new CenterReductionSolver(op);
        assertTrue(solver.solve());
        assertTrue(solver.solved());
        assertTrue(CubeSanity.areCentersMonochrome(cube));
        CubeSanity.checkColorCounts(cube);
    }

    @Test
    public void testFourByFourKeepsTrackerAssignment() {
        var cube = new Cube(4);
        var op = new Operator(cube);
        op.play(Algs.scramble(4, 7));
        try (var holder = new TrackerHolder(cube)) {
            assertTrue(CubeColorScheme.BOY.isSameScheme(holder.getFaceColors()));
            var solver = new CenterReductionSolver(op);
            assertTrue(solver.solve(holder));
            assertTrue(CubeSanity.areCentersMonochrome(cube));
            assertTrue(holder.allFacesSolved());
            for (var face : cube.faces()) {
                assertEquals(holder.faceColor(face.name()), face.centerColor(new Point(0, 0)));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 4, 5, 6, 7, 8 })
    public void testReducesWithFullSanityChecks(int size) {
        var cube = new Cube(size);
        var op = new Operator(cube);
        op.play(Algs.scramble(size, 1000 + size));
        var solver = new CenterReductionSolver(op, CenterSolverConfig.defaultConfig()
                                                                     .withSanityCheck(SanityCheck.FULL));
        solver.solve();
        assertTrue(solver.solved());
        CubeSanity.checkColorCounts(cube);
    }

    @ParameterizedTest
    @ValueSource(ints = { 5, 6 })
    public void testSingleCellCommutatorsOnly(int size) {
        var cube = new Cube(size);
        var op = new Operator(cube);
        op.play(Algs.scramble(size, 3));
        var config = CenterSolverConfig.defaultConfig()
                                       .withOptimizeCompleteSlices(false)
                                       .withOptimizeBigBlocks(false)
                                       .withSanityCheck(SanityCheck.NONE);
        var solver = new CenterReductionSolver(op, config);
        assertTrue(solver.solve());
        assertTrue(solver.solved());
        var statistics = solver.getBlockStatistics();
        assertTrue(statistics.totalBlocks() > 0);
        assertEquals(statistics.totalBlocks(), statistics.count(1));
    }

    @Test
    public void testBigBlocksAndLooseSliceSwaps() {
        var cube = new Cube(7);
        var op = new Operator(cube);
        op.play(Algs.scramble(7, 12));
        var solver = new CenterReductionSolver(op, CenterSolverConfig.defaultConfig()
                                                                     .withCompleteSlicesOnlyTargetZero(false));
        assertTrue(solver.solve());
        assertTrue(solver.solved());
    }

    @ParameterizedTest
    @ValueSource(ints = { 5, 7 })
    public void testCageKeepsEdgesAndCorners(int size) {
        var cube = new Cube(size);
        var op = new Operator(cube);
        scrambleCentersOnly(op, size);
        assertFalse(CenterReductionSolver.isCubeSolved(cube));

        var solver = new CenterReductionSolver(op, CenterSolverConfig.cageConfig());
        assertTrue(solver.solve());
        // with the cage untouched and the centers reduced, every face is a single color
        for (var face : FaceName.values()) {
            var color = cube.sticker(face, 0, 0).color();
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    assertEquals(color, cube.sticker(face, r, c).color(), face + " (" + r + ", " + c + ")");
                }
            }
        }
    }

    @Test
    public void testEvenCubeCage() {
        var cube = new Cube(6);
        var op = new Operator(cube);
        scrambleCentersOnly(op, 6);
        var solver = new CenterReductionSolver(op, CenterSolverConfig.cageConfig());
        solver.solve();
        assertTrue(solver.solved());
    }

    @Test
    public void testSolveIsIdempotent() {
        var cube = new Cube(6);
        var op = new Operator(cube);
        op.play(Algs.scramble(6, 5));
        var solver = new CenterReductionSolver(op);
        assertTrue(solver.solve());
        int played = op.historySize();
        assertTrue(solver.solved());
        assertFalse(solver.solve());
        assertTrue(solver.solved());
        assertEquals(played, op.historySize());
    }

    @Test
    public void testSolveSingleFace() {
        var cube = new Cube(6);
        var op = new Operator(cube);
        op.play(Algs.scramble(6, 21));
        try (var holder = new TrackerHolder(cube)) {
            var tracker = holder.trackers().get(2);
            var solver = new CenterReductionSolver(op);
            solver.solveSingleFace(holder, tracker);
            assertTrue(tracker.face().isCenterSolved(tracker.color()));
            assertFalse(solver.solveSingleFace(holder, tracker));
        }
    }

    @Test
    public void testAbortLeavesTrackersConsistent() {
        var cube = new Cube(6);
        var op = new Operator(cube);
        op.play(Algs.scramble(6, 9));
        try (var holder = new TrackerHolder(cube)) {
            var before = op.moveCount();
            op.addListener((move, undo) -> {
                if (op.moveCount() - before > 40) {
                    op.abort();
                }
            });
            var solver = new CenterReductionSolver(op);
            assertThrows(OperationAbortedException.class, () -> solver.solve(holder));
            assertFalse(holder.isPreservingPhysicalFaces());
            assertTrue(CubeColorScheme.BOY.isSameScheme(holder.getFaceColors()));
        }
    }

    @Test
    public void testIterationGuard() {
        var cube = new Cube(6);
        var op = new Operator(cube);
        op.play(Algs.scramble(6, 4));
        var solver = new CenterReductionSolver(op, CenterSolverConfig.defaultConfig().withMaxIterations(1));
        assertThrows(IllegalStateException.class, solver::solve);
    }

    private static void scrambleCentersOnly(Operator op, int size) {
        var cube = op.cube();
        var engine = new BlockCommutatorEngine(op);
        var random = new Random(size);
        var faces = FaceName.values();
        int n = cube.centerSize();
        for (int i = 0; i < 60; i++) {
            var target = cube.face(faces[random.nextInt(6)]);
            var source = cube.face(faces[random.nextInt(6)]);
            var block = Block.of(Point.of(random.nextInt(n), random.nextInt(n)));
            if (target == source || !engine.isValidBlock(target, source, block)) {
                continue;
            }
            engine.executeCommutator(source, target, block, true, false);
        }
    }
}
