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

import com.hellblazer.nxn.geometry.Point3i;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * An NxN cube. All stickers live in a flat arena indexed by (face, row, col); faces, edges, corners and slices are
 * views onto that arena. A move permutes the sticker objects of one or more layers and increments the modify
 * counter.
 * <p>
 * Geometry is computed in doubled integer coordinates: the center of the cubie at layer {@code i} along an axis has
 * coordinate {@code 2i - (N - 1)}, so the outer layers sit at {@code +/-(N - 1)}.
 *
 * @author hal.hildebrand
 */
public final class Cube {
    private static final Logger log = LoggerFactory.getLogger(Cube.class);

    private final int                         size;
    private final Sticker[]                   stickers;
    private final Map<FaceName, Face>         faces  = new EnumMap<>(FaceName.class);
    private final Map<SliceName, Slice>       slices = new EnumMap<>(SliceName.class);
    private final List<Edge>                  edges;
    private final List<Corner>                corners;
    // [axis][layer] -> 4-cycles of slot indices, content moving a -> b -> c -> d -> a on a clockwise quarter turn
    private final int[][][][]                 layerCycles;
    private       long                        modifyCounter;

    public Cube(int size) {
        this(size, CubeColorScheme.BOY);
    }

    public Cube(int size, CubeColorScheme scheme) {
        if (size < 2) {
            throw new IllegalArgumentException("Cube size must be at least 2: " + size);
        }
        this.size = size;
        this.stickers = new Sticker[6 * size * size];
        for (var name : FaceName.values()) {
            var color = scheme.color(name);
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    stickers[slot(name, row, col)] = new Sticker(color);
                }
            }
            faces.put(name, new Face(this, name));
        }
        for (var name : SliceName.values()) {
            slices.put(name, new Slice(this, name));
        }
        edges = Collections.unmodifiableList(createEdges());
        corners = Collections.unmodifiableList(createCorners());
        layerCycles = new int[Axis.values().length][size][][];
        log.debug("Created {}x{}x{} cube", size, size, size);
    }

    public int size() {
        return size;
    }

    /**
     * @return the side of a face's center grid, {@code N - 2}
     */
    public int centerSize() {
        return size - 2;
    }

    public boolean isOdd() {
        return size % 2 == 1;
    }

    public long modifyCounter() {
        return modifyCounter;
    }

    public Face face(FaceName name) {
        return faces.get(name);
    }

    public List<Face> faces() {
        return List.copyOf(faces.values());
    }

    public Slice slice(SliceName name) {
        return slices.get(name);
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Corner> corners() {
        return corners;
    }

    public Optional<Face> findFace(Predicate<Face> predicate) {
        return faces.values().stream().filter(predicate).findFirst();
    }

    /**
     * @return the sticker at a full-face coordinate, including the border
     */
    public Sticker sticker(FaceName face, int row, int col) {
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IllegalArgumentException("(" + row + ", " + col + ") outside face of size " + size);
        }
        return stickers[slot(face, row, col)];
    }

    /**
     * @return the color of every sticker, in arena order
     */
    public Color[] snapshotColors() {
        var colors = new Color[stickers.length];
        for (int i = 0; i < stickers.length; i++) {
            colors[i] = stickers[i].color();
        }
        return colors;
    }

    /**
     * Arena index of a full-face coordinate, matching {@link #snapshotColors()}.
     */
    public int slot(FaceName face, int row, int col) {
        return (face.ordinal() * size + row) * size + col;
    }

    /**
     * @return the doubled-coordinate center of the cubie that carries the sticker at the full-face coordinate
     */
    public Point3i cubie(FaceName face, int row, int col) {
        int last = size - 1;
        return face.normal()
                   .multiply(last)
                   .add(face.right().multiply(2 * col - last))
                   .add(face.up().multiply(2 * row - last));
    }

    /**
     * @return the layer (0 at the negative end of the axis) that contains the cubie
     */
    public int layer(Axis axis, Point3i cubie) {
        return (cubie.dot(axis.vector()) + size - 1) / 2;
    }

    /**
     * @return the arena index of the sticker of the cubie that faces along the normal
     */
    public int slotOf(Point3i cubie, Point3i normal) {
        var face = FaceName.ofNormal(normal);
        int col = (cubie.dot(face.right()) + size - 1) / 2;
        int row = (cubie.dot(face.up()) + size - 1) / 2;
        return slot(face, row, col);
    }

    public FaceName faceOfSlot(int slot) {
        return FaceName.values()[slot / (size * size)];
    }

    public int rowOfSlot(int slot) {
        return (slot / size) % size;
    }

    public int colOfSlot(int slot) {
        return slot % size;
    }

    /**
     * Rotate a face clockwise, as seen from outside the face.
     *
     * @param quarterTurns clockwise quarter turns, negative for counterclockwise
     */
    public void rotateFace(FaceName face, int quarterTurns) {
        int sign = face.normal().dot(Axis.parallelTo(face.normal()).vector());
        int layer = sign > 0 ? size - 1 : 0;
        rotateLayers(Axis.parallelTo(face.normal()), layer, layer, sign * quarterTurns);
    }

    /**
     * Rotate a contiguous range of inner slice layers, in the direction of the slice's reference face.
     *
     * @param from         first 1-based slice index
     * @param to           last 1-based slice index, inclusive
     * @param quarterTurns quarter turns in the reference face direction
     */
    public void rotateSlice(SliceName slice, int from, int to, int quarterTurns) {
        if (from < 1 || to > size - 2 || from > to) {
            throw new IllegalArgumentException(
            "Slice range " + slice + "[" + from + ":" + to + "] invalid for cube size " + size);
        }
        int sign = slice.axisSign();
        int first = sliceLayer(slice, from);
        int last = sliceLayer(slice, to);
        rotateLayers(slice.axis(), Math.min(first, last), Math.max(first, last), sign * quarterTurns);
    }

    /**
     * @return the axis layer of a 1-based slice index
     */
    public int sliceLayer(SliceName slice, int index) {
        return slice.axisSign() > 0 ? size - 1 - index : index;
    }

    /**
     * @return the 1-based slice index of an axis layer
     */
    public int sliceIndex(SliceName slice, int layer) {
        return slice.axisSign() > 0 ? size - 1 - layer : layer;
    }

    public void rotateWholeCube(Axis axis, int quarterTurns) {
        rotateLayers(axis, 0, size - 1, quarterTurns);
    }

    /**
     * Rotate layers {@code from..to} about the axis, clockwise as seen from the positive end of the axis. This is
     * the single mutation primitive; every move counts once against the modify counter.
     */
    public void rotateLayers(Axis axis, int from, int to, int quarterTurns) {
        if (from < 0 || to >= size || from > to) {
            throw new IllegalArgumentException("Layer range [" + from + ", " + to + "] invalid for size " + size);
        }
        int turns = Math.floorMod(quarterTurns, 4);
        modifyCounter++;
        if (turns == 0) {
            return;
        }
        for (int layer = from; layer <= to; layer++) {
            var cycles = cyclesOf(axis, layer);
            for (int t = 0; t < turns; t++) {
                for (var cycle : cycles) {
                    var tmp = stickers[cycle[3]];
                    stickers[cycle[3]] = stickers[cycle[2]];
                    stickers[cycle[2]] = stickers[cycle[1]];
                    stickers[cycle[1]] = stickers[cycle[0]];
                    stickers[cycle[0]] = tmp;
                }
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("Rotated {} layers {}..{} by {}, counter {}", axis, from, to, turns, modifyCounter);
        }
    }

    private int[][] cyclesOf(Axis axis, int layer) {
        var cached = layerCycles[axis.ordinal()][layer];
        if (cached != null) {
            return cached;
        }
        var visited = new boolean[stickers.length];
        var cycles = new ArrayList<int[]>();
        for (var face : FaceName.values()) {
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    int start = slot(face, row, col);
                    var cubie = cubie(face, row, col);
                    if (visited[start] || layer(axis, cubie) != layer) {
                        continue;
                    }
                    var cycle = new int[4];
                    var normal = face.normal();
                    for (int i = 0; i < 4; i++) {
                        cycle[i] = slotOf(cubie, normal);
                        visited[cycle[i]] = true;
                        cubie = cubie.rotateClockwise(axis.vector());
                        normal = normal.rotateClockwise(axis.vector());
                    }
                    if (cycle[1] != cycle[0]) {
                        cycles.add(cycle);
                    }
                }
            }
        }
        cached = cycles.toArray(new int[0][]);
        layerCycles[axis.ordinal()][layer] = cached;
        return cached;
    }

    private List<Edge> createEdges() {
        var result = new ArrayList<Edge>(12);
        var names = FaceName.values();
        for (int i = 0; i < names.length; i++) {
            for (int j = i + 1; j < names.length; j++) {
                if (names[i].isAdjacent(names[j])) {
                    result.add(new Edge(this, names[i], names[j]));
                }
            }
        }
        return result;
    }

    private List<Corner> createCorners() {
        var result = new ArrayList<Corner>(8);
        for (var x : new FaceName[] { FaceName.L, FaceName.R }) {
            for (var y : new FaceName[] { FaceName.D, FaceName.U }) {
                for (var z : new FaceName[] { FaceName.B, FaceName.F }) {
                    result.add(new Corner(this, y, z, x));
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Cube{" + size + "x" + size + ", counter=" + modifyCounter + "}";
    }
}
