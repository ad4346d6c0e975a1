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
package com.hellblazer.nxn.solver.commutator;

import com.hellblazer.nxn.cube.alg.Alg;
import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.alg.FaceAlg;
import com.hellblazer.nxn.cube.alg.SliceAlg;
import com.hellblazer.nxn.cube.layout.CoordinateGeometry;
import com.hellblazer.nxn.cube.layout.CubeTopology;
import com.hellblazer.nxn.cube.layout.SliceCut;
import com.hellblazer.nxn.cube.model.Color;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.Face;
import com.hellblazer.nxn.cube.operator.Operator;
import com.hellblazer.nxn.cube.translate.FaceTranslator;
import com.hellblazer.nxn.cube.translate.SliceAlgorithmResult;
import com.hellblazer.nxn.geometry.Block;
import com.hellblazer.nxn.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * Moves rectangular blocks of center stickers between faces with the commutator
 * {@code [S1, F S2 F'] = S1 F S2 F' S1' F S2' F'}, where {@code F} turns the target face and {@code S1}, {@code S2}
 * are the inner slice layers through the target block and through its image under {@code F}. The result is a pure
 * 3-cycle of center blocks: source to target, target to a second block on the source face, second block to source.
 * Edges and corners are left where they were, apart from an optional setup rotation of the source face.
 *
 * @author hal.hildebrand
 */
public final class BlockCommutatorEngine {
    private static final Logger log = LoggerFactory.getLogger(BlockCommutatorEngine.class);

    private final Operator           operator;
    private final Cube               cube;
    private final CoordinateGeometry geometry;
    private final FaceTranslator     translator;

    public BlockCommutatorEngine(Operator operator) {
        this.operator = operator;
        this.cube = operator.cube();
        this.geometry = new CoordinateGeometry(cube);
        this.translator = new FaceTranslator(geometry);
    }

    public Operator operator() {
        return operator;
    }

    public FaceTranslator translator() {
        return translator;
    }

    /**
     * Look for a rotation of the source face that lines up source cells of the color with the target block.
     *
     * @return the clockwise setup rotation of the source face, or empty when no rotation qualifies or the target
     * block already holds the color everywhere
     */
    public OptionalInt searchBlock(Face target, Face source, Color color, SearchBlockMode mode, Block block) {
        int n = cube.centerSize();
        checkBlock(block, n);
        int targetOk = countColor(target, block, color);
        if (targetOk == block.size()) {
            return OptionalInt.empty();
        }
        var natural = naturalSourceBlock(target, source, block);
        for (int k = 0; k < 4; k++) {
            var candidate = natural.rotateClockwise(k, n);
            int count = countColor(source, candidate, color);
            boolean qualifies = switch (mode) {
                case COMPLETE_BLOCK -> count == block.size();
                case BIG_THAN_SOURCE -> count > targetOk;
                case EXACT_MATCH -> targetOk == 0 && count == block.size();
            };
            if (qualifies) {
                return OptionalInt.of(Math.floorMod(-k, 4));
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return the maximal blocks of the color on the face, one per starting cell, largest first
     */
    public List<Block> searchBigBlock(Face face, Color color) {
        return searchBigBlock(face, p -> face.centerColor(p) == color);
    }

    /**
     * Grow a block from every cell satisfying the predicate, first upward along its column and then rightward while
     * every row of the block still satisfies it. Blocks of equal size keep their discovery order.
     */
    public List<Block> searchBigBlock(Face face, Predicate<Point> cellPredicate) {
        int n = face.centerSize();
        var blocks = new ArrayList<Block>();
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (!cellPredicate.test(new Point(r, c))) {
                    continue;
                }
                int endRow = r;
                while (endRow + 1 < n && cellPredicate.test(new Point(endRow + 1, c))) {
                    endRow++;
                }
                int endCol = c;
                while (endCol + 1 < n && columnMatches(cellPredicate, r, endRow, endCol + 1)) {
                    endCol++;
                }
                blocks.add(Block.of(r, c, endRow, endCol));
            }
        }
        blocks.sort(Comparator.comparingInt(Block::size).reversed());
        return blocks;
    }

    /**
     * @return true when turning the target face one way or the other carries the block off the slice layers it
     * occupies
     */
    public boolean isValidBlock(Face target, Face source, Block block) {
        return faceTurn(cut(target, source), block).isPresent();
    }

    /**
     * @return where the source content must sit, with no setup rotation, for the slice move to deliver it onto the
     * target block
     */
    public Block naturalSourceBlock(Face target, Face source, Block targetBlock) {
        var start = translator.translate(target.name(), source.name(), targetBlock.start()).sourceCoord();
        var end = translator.translate(target.name(), source.name(), targetBlock.end()).sourceCoord();
        return new Block(start, end);
    }

    /**
     * Commutate the source block, already in its natural position, onto the target block.
     */
    public CommutatorResult executeCommutator(Face source, Face target, Block targetBlock, boolean preserveState,
                                              boolean dryRun) {
        return executeCommutator(source, target, targetBlock, null, preserveState, dryRun);
    }

    /**
     * Build, and unless {@code dryRun} play, the commutator bringing {@code sourceBlock} onto {@code targetBlock}.
     *
     * @param sourceBlock   the block on the source face, or null for the natural source position
     * @param preserveState undo the source setup rotation afterwards
     * @throws IllegalArgumentException if the faces are the same, a block is off the grid, or no rotation of the
     *                                  source face lines the source block up
     * @throws IllegalStateException    if both face turn directions keep the block on its own slice layers
     */
    public CommutatorResult executeCommutator(Face source, Face target, Block targetBlock, Block sourceBlock,
                                              boolean preserveState, boolean dryRun) {
        if (source.name() == target.name()) {
            throw new IllegalArgumentException("Source and target are both " + target);
        }
        int n = cube.centerSize();
        checkBlock(targetBlock, n);
        var path = path(target, source);
        int rotation = faceTurn(cut(target, source), targetBlock).orElseThrow(
        () -> new IllegalStateException("Both turns of " + target + " overlap block " + targetBlock));
        var rotated = targetBlock.rotateClockwise(rotation, n);
        var natural = naturalSourceBlock(target, source, targetBlock);
        int setup = 0;
        if (sourceBlock != null) {
            checkBlock(sourceBlock, n);
            setup = setupRotation(sourceBlock, natural, n);
        }

        var s1 = layers(target, path, targetBlock);
        var s2 = layers(target, path, rotated);
        var turn = new FaceAlg(target.name(), rotation);
        var commutator = Algs.seq(s1, turn, s2, turn.inverse(), s1.inverse(), turn, s2.inverse(), turn.inverse());
        var parts = new ArrayList<Alg>(3);
        parts.add(new FaceAlg(source.name(), setup));
        parts.add(commutator);
        if (preserveState) {
            parts.add(new FaceAlg(source.name(), -setup));
        }
        var second = naturalSourceBlock(target, source, rotated);
        if (preserveState) {
            second = second.rotateClockwise(-setup, n);
        }
        var result = new CommutatorResult(Algs.seq(parts), targetBlock, sourceBlock == null ? natural : sourceBlock,
                                          second);
        if (log.isDebugEnabled()) {
            log.debug("Commutator {} <- {} block {} from {}, second {}: {}", target, source, targetBlock,
                      result.sourceBlock(), second, commutator);
        }
        if (!dryRun) {
            operator.play(result.alg());
        }
        return result;
    }

    /**
     * Search for a qualifying source block and, when found, play the commutator.
     */
    public Optional<CommutatorResult> tryBlock(Face target, Face source, Color color, Block targetBlock,
                                               SearchBlockMode mode, boolean preserveState) {
        if (!isValidBlock(target, source, targetBlock)) {
            return Optional.empty();
        }
        var setup = searchBlock(target, source, color, mode, targetBlock);
        if (setup.isEmpty()) {
            return Optional.empty();
        }
        int n = cube.centerSize();
        var sourceBlock = naturalSourceBlock(target, source, targetBlock).rotateClockwise(-setup.getAsInt(), n);
        return Optional.of(executeCommutator(source, target, targetBlock, sourceBlock, preserveState, false));
    }

    /**
     * Exchange a complete line of the target with a complete line of the source, using
     * {@code S' source2 S} on the single slice layer through the target line. A target line running across the slice
     * is first turned onto it with a counterclockwise turn of the target face.
     *
     * @param preserveState undo the source setup rotation and the target face turn afterwards, so the target line
     *                      and the source line trade places; the rest of the source face's centers end up turned
     *                      half way round
     * @throws IllegalArgumentException if the lines are the middle line of an odd grid, or the source line cannot
     *                                  be rotated onto the layer the target line maps to
     */
    public SliceSwapResult swapCompleteSlice(Face target, Face source, CenterLine targetLine, CenterLine sourceLine,
                                             boolean preserveState, boolean dryRun) {
        if (source.name() == target.name()) {
            throw new IllegalArgumentException("Source and target are both " + target);
        }
        int n = cube.centerSize();
        var path = path(target, source);
        var cut = cut(target, source);
        int conversion = 0;
        var line = targetLine.block();
        if (targetLine.orientation() != cut) {
            conversion = -1;
            line = line.rotateClockwise(conversion, n);
        }
        var natural = naturalSourceBlock(target, source, line);
        var mirror = natural.rotateClockwise(2, n);
        if (mirror.equals(natural)) {
            throw new IllegalArgumentException("Middle line " + targetLine + " of " + target + " cannot be swapped");
        }
        int setup = setupRotation(sourceLine.block(), mirror, n);
        int index = geometry.sliceIndexOf(path.slice(), target.name(), line.start());
        var slice = SliceAlg.single(path.slice(), index, path.n());

        var parts = new ArrayList<Alg>(7);
        parts.add(new FaceAlg(target.name(), conversion));
        parts.add(new FaceAlg(source.name(), setup));
        parts.add(slice.inverse());
        parts.add(new FaceAlg(source.name(), 2));
        parts.add(slice);
        if (preserveState) {
            parts.add(new FaceAlg(source.name(), -setup));
            parts.add(new FaceAlg(target.name(), -conversion));
        }
        var result = new SliceSwapResult(Algs.seq(parts), targetLine, sourceLine);
        log.debug("Swap {} {} <- {} {}: {}", target, targetLine, source, sourceLine, result.alg());
        if (!dryRun) {
            operator.play(result.alg());
        }
        return result;
    }

    private SliceAlgorithmResult path(Face target, Face source) {
        return translator.translate(target.name(), source.name(), new Point(0, 0)).firstSliceAlgorithm();
    }

    private SliceCut cut(Face target, Face source) {
        return CubeTopology.doesSliceCutRowsOrColumns(path(target, source).slice(), target.name());
    }

    private OptionalInt faceTurn(SliceCut cut, Block block) {
        int n = cube.centerSize();
        for (int rotation : new int[] { 1, -1 }) {
            var rotated = block.rotateClockwise(rotation, n);
            boolean overlaps = cut == SliceCut.COL ? block.colsOverlap(rotated) : block.rowsOverlap(rotated);
            if (!overlaps) {
                return OptionalInt.of(rotation);
            }
        }
        return OptionalInt.empty();
    }

    private SliceAlg layers(Face target, SliceAlgorithmResult path, Block block) {
        int first = geometry.sliceIndexOf(path.slice(), target.name(), block.start());
        int last = geometry.sliceIndexOf(path.slice(), target.name(), block.end());
        return new SliceAlg(path.slice(), Math.min(first, last), Math.max(first, last), path.n());
    }

    private static int setupRotation(Block from, Block to, int n) {
        for (int k = 0; k < 4; k++) {
            if (from.rotateClockwise(k, n).equals(to)) {
                return k;
            }
        }
        throw new IllegalArgumentException("No rotation of the source face carries " + from + " onto " + to);
    }

    private static boolean columnMatches(Predicate<Point> predicate, int fromRow, int toRow, int col) {
        for (int r = fromRow; r <= toRow; r++) {
            if (!predicate.test(new Point(r, col))) {
                return false;
            }
        }
        return true;
    }

    private static int countColor(Face face, Block block, Color color) {
        int count = 0;
        for (var cell : block.cells()) {
            if (face.centerColor(cell) == color) {
                count++;
            }
        }
        return count;
    }

    private static void checkBlock(Block block, int n) {
        if (!block.isInside(n)) {
            throw new IllegalArgumentException("Block " + block + " outside center grid of size " + n);
        }
    }
}
