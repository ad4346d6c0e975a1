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
import com.hellblazer.nxn.cube.alg.WholeCubeAlg;
import com.hellblazer.nxn.cube.layout.CoordinateGeometry;
import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.CubeColorScheme;
import com.hellblazer.nxn.cube.model.CubeSanity;
import com.hellblazer.nxn.cube.model.CubeTextDump;
import com.hellblazer.nxn.cube.model.Face;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.operator.MoveListener;
import com.hellblazer.nxn.cube.operator.Operator;
import com.hellblazer.nxn.geometry.Block;
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.solver.commutator.BlockCommutatorEngine;
import com.hellblazer.nxn.solver.commutator.CenterBlockStatistics;
import com.hellblazer.nxn.solver.commutator.CenterLine;
import com.hellblazer.nxn.solver.commutator.SearchBlockMode;
import com.hellblazer.nxn.solver.tracker.FaceTracker;
import com.hellblazer.nxn.solver.tracker.TrackerHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;

/**
 * Reduces the centers of an NxN cube: every face's center grid ends up in one color, and the six colors form the
 * scheme of the solved cube.
 * <p>
 * Faces are solved one tracker at a time. The tracker's face is brought to the front with a whole cube rotation,
 * then centers of its color are drawn from the four adjacent faces and the back face, by complete line swaps where
 * they pay off and otherwise by block commutators. The passes repeat until a pass does no work.
 *
 * @author hal.hildebrand
 */
public final class CenterReductionSolver {
    private static final Logger log = LoggerFactory.getLogger(CenterReductionSolver.class);

    private final Operator              operator;
    private final Cube                  cube;
    private final CenterSolverConfig    config;
    private final BlockCommutatorEngine engine;
    private final CenterBlockStatistics statistics = new CenterBlockStatistics();

    public CenterReductionSolver(Operator operator) {
        this(operator, CenterSolverConfig.defaultConfig());
    }

    public CenterReductionSolver(Operator operator, CenterSolverConfig config) {
        this.operator = operator;
        this.cube = operator.cube();
        this.config = config;
        this.engine = new BlockCommutatorEngine(operator);
    }

    /**
     * @return true when every face's center grid is monochrome and the face colors form the BOY scheme; trivially
     * true for a cube without centers
     */
    public static boolean isCubeSolved(Cube cube) {
        return isCubeSolved(cube, CubeColorScheme.BOY);
    }

    public static boolean isCubeSolved(Cube cube, CubeColorScheme scheme) {
        if (cube.size() < 3) {
            return true;
        }
        if (!CubeSanity.areCentersMonochrome(cube)) {
            return false;
        }
        var colors = new EnumMap<FaceName, Color>(FaceName.class);
        for (var face : cube.faces()) {
            colors.put(face.name(), face.centerColor(new Point(0, 0)));
        }
        return scheme.isSameScheme(colors);
    }

    public CenterSolverConfig config() {
        return config;
    }

    public BlockCommutatorEngine engine() {
        return engine;
    }

    public boolean solved() {
        return isCubeSolved(cube);
    }

    public CenterBlockStatistics getBlockStatistics() {
        return statistics;
    }

    /**
     * Reduce the centers with trackers created, and released, for this call.
     *
     * @return true when any move was played
     */
    public boolean solve() {
        if (solved()) {
            return false;
        }
        try (var holder = new TrackerHolder(cube)) {
            return solve(holder);
        }
    }

    /**
     * Reduce the centers to the colors designated by the holder's trackers.
     *
     * @return true when any move was played
     * @throws IllegalStateException if the centers are not reduced when no further progress is possible, or the
     *                               iteration limit is reached
     */
    public boolean solve(TrackerHolder holder) {
        if (solved()) {
            log.debug("Centers of {} already reduced", cube);
            return false;
        }
        log.info("Reducing centers of {} using {}", cube, config);
        if (log.isTraceEnabled()) {
            log.trace("Starting from:\n{}", CubeTextDump.dump(cube));
        }
        long before = operator.moveCount();
        var checker = installSanityCheck(holder);
        try {
            boolean work = false;
            int iterations = 0;
            while (doFaces(holder, holder.trackers())) {
                work = true;
                if (++iterations >= config.getMaxIterations()) {
                    throw new IllegalStateException("Centers of " + cube + " not reduced after " + iterations
                                                    + " passes");
                }
            }
            if (!solved()) {
                log.warn("Centers not reduced:\n{}", CubeTextDump.dump(cube));
                throw new IllegalStateException("No progress possible but centers of " + cube + " not reduced");
            }
            log.info("Reduced centers of {} in {} moves, blocks {}", cube, operator.moveCount() - before,
                     statistics);
            return work;
        } finally {
            if (checker != null) {
                operator.removeListener(checker);
            }
        }
    }

    /**
     * Bring the center grid of one face to its tracker's color.
     *
     * @return true when any move was played
     */
    public boolean solveSingleFace(TrackerHolder holder, FaceTracker tracker) {
        var checker = installSanityCheck(holder);
        try {
            boolean work = false;
            int iterations = 0;
            while (doFaces(holder, List.of(tracker))) {
                work = true;
                if (++iterations >= config.getMaxIterations()) {
                    throw new IllegalStateException("Face " + tracker + " not solved after " + iterations
                                                    + " passes");
                }
            }
            if (!tracker.face().isCenterSolved(tracker.color())) {
                throw new IllegalStateException("No progress possible but face of " + tracker + " not solved");
            }
            return work;
        } finally {
            if (checker != null) {
                operator.removeListener(checker);
            }
        }
    }

    private boolean doFaces(TrackerHolder holder, List<FaceTracker> trackers) {
        boolean work = false;
        for (var tracker : trackers) {
            if (doCenter(holder, tracker)) {
                work = true;
            }
        }
        return work;
    }

    private boolean doCenter(TrackerHolder holder, FaceTracker tracker) {
        var color = tracker.color();
        if (tracker.face().isCenterSolved(color)) {
            return false;
        }
        if (cube.faces().stream().noneMatch(f -> !tracker.isOn(f) && f.countCenterColor(color) > 0)) {
            log.warn("No source for {} while {} is unsolved", color, tracker.face());
            return false;
        }
        bringFaceFront(tracker);
        var target = cube.face(FaceName.F);
        log.debug("Solving {} on {}", color, target);

        boolean work = false;
        try (var frozen = holder.frozenFaceColors()) {
            for (var source : sources(target)) {
                if (source.countCenterColor(color) == 0) {
                    continue;
                }
                if (config.isOptimizeCompleteSlices() && !config.isPreserveCage()) {
                    work |= doCompleteSlices(holder, color, target, source);
                }
                if (config.isOptimizeBigBlocks()) {
                    work |= doBlocks(holder, color, target, source);
                } else {
                    work |= doCells(holder, color, target, source);
                }
                if (target.isCenterSolved(color)) {
                    break;
                }
            }
        }
        return work;
    }

    private void bringFaceFront(FaceTracker tracker) {
        var face = tracker.face().name();
        if (face == FaceName.F) {
            return;
        }
        var axis = CoordinateGeometry.axesBetween(face, FaceName.F).get(0);
        int turns = CoordinateGeometry.wholeCubeTurns(axis, face, FaceName.F).getAsInt();
        operator.play(new WholeCubeAlg(axis, Algs.normalizeTurns(turns)));
        if (tracker.face().name() != FaceName.F) {
            throw new IllegalStateException("Rotation did not bring " + tracker + " to the front");
        }
    }

    private static List<Face> sources(Face target) {
        var sources = new ArrayList<>(target.adjacentFaces());
        sources.add(target.opposite());
        return sources;
    }

    private boolean doCompleteSlices(TrackerHolder holder, Color color, Face target, Face source) {
        boolean work = false;
        while (doOneCompleteSlice(holder, color, target, source)) {
            work = true;
        }
        return work;
    }

    private boolean doOneCompleteSlice(TrackerHolder holder, Color color, Face target, Face source) {
        int n = cube.centerSize();
        var sourceLines = new ArrayList<ScoredLine>();
        for (var line : CenterLine.all(n)) {
            if (!line.isMiddle()) {
                int matches = line.countColor(source, color);
                if (matches > 0) {
                    sourceLines.add(new ScoredLine(line, matches));
                }
            }
        }
        sourceLines.sort(Comparator.comparingInt(ScoredLine::matches).reversed());

        for (var sourceLine : sourceLines) {
            int index = sourceLine.line().index();
            var targetLines = new ArrayList<ScoredLine>(4);
            for (int i : new int[] { index, n - 1 - index }) {
                for (var line : List.of(CenterLine.row(i, n), CenterLine.col(i, n))) {
                    targetLines.add(new ScoredLine(line, line.countColor(target, color)));
                }
            }
            targetLines.sort(Comparator.comparingInt(ScoredLine::matches));
            var minTarget = targetLines.get(0);
            // a source line holding at most half the color could be swapped straight back
            if ((minTarget.matches() == 0 || !config.isCompleteSlicesOnlyTargetZero())
            && sourceLine.matches() * 2 > n && sourceLine.matches() > minTarget.matches()) {
                try (var preserve = holder.preservePhysicalFaces()) {
                    engine.swapCompleteSlice(target, source, minTarget.line(), sourceLine.line(), false, false);
                }
                afterCommutator();
                return true;
            }
        }
        return false;
    }

    private boolean doBlocks(TrackerHolder holder, Color color, Face target, Face source) {
        boolean work = false;
        for (var block : engine.searchBigBlock(target, p -> target.centerColor(p) != color)) {
            if (source.countCenterColor(color) == 0) {
                break;
            }
            if (!engine.isValidBlock(target, source, block)
            || engine.searchBlock(target, source, color, SearchBlockMode.EXACT_MATCH, block).isEmpty()) {
                continue;
            }
            try (var preserve = holder.preservePhysicalFaces()) {
                var result = engine.tryBlock(target, source, color, block, SearchBlockMode.EXACT_MATCH,
                                             config.isPreserveCage());
                if (result.isEmpty()) {
                    continue;
                }
            }
            statistics.record(block);
            afterCommutator();
            work = true;
        }
        return work;
    }

    private boolean doCells(TrackerHolder holder, Color color, Face target, Face source) {
        boolean work = false;
        for (var slice : target.centerSlices()) {
            if (slice.color() == color) {
                continue;
            }
            var block = Block.of(slice.point());
            try (var preserve = holder.preservePhysicalFaces()) {
                var result = engine.tryBlock(target, source, color, block, SearchBlockMode.COMPLETE_BLOCK,
                                             config.isPreserveCage());
                if (result.isEmpty()) {
                    continue;
                }
            }
            if (slice.color() != color) {
                throw new IllegalStateException("Commutator did not fix " + slice + " from " + source);
            }
            statistics.record(block);
            afterCommutator();
            work = true;
        }
        return work;
    }

    private void afterCommutator() {
        if (config.getSanityCheck() == SanityCheck.FULL) {
            CubeSanity.checkColorCounts(cube);
        }
    }

    private MoveListener installSanityCheck(TrackerHolder holder) {
        if (config.getSanityCheck() == SanityCheck.NONE) {
            return null;
        }
        MoveListener checker = (move, undo) -> {
            if (!holder.isPreservingPhysicalFaces()) {
                holder.getFaceColors();
            }
        };
        operator.addListener(checker);
        return checker;
    }

    private record ScoredLine(CenterLine line, int matches) {
    }
}
