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

import java.util.ArrayList;
import java.util.List;

/**
 * The edge shared by two adjacent faces. Its N-2 wings are indexed by the LTR index of the first face; the LTR index
 * on a face grows left to right along a horizontal edge and bottom to top along a vertical one.
 *
 * @author hal.hildebrand
 */
public final class Edge implements Part {

    private final Cube     cube;
    private final FaceName face1;
    private final FaceName face2;
    private final boolean  sameDirection;

    Edge(Cube cube, FaceName face1, FaceName face2) {
        if (!face1.isAdjacent(face2)) {
            throw new IllegalArgumentException(face1 + " and " + face2 + " do not share an edge");
        }
        this.cube = cube;
        this.face1 = face1;
        this.face2 = face2;
        this.sameDirection = cube.size() < 3 || translateLtr(face1, 0) == 0;
    }

    public FaceName face1() {
        return face1;
    }

    public FaceName face2() {
        return face2;
    }

    public boolean contains(FaceName face) {
        return face1 == face || face2 == face;
    }

    public FaceName otherFace(FaceName face) {
        if (face == face1) {
            return face2;
        }
        if (face == face2) {
            return face1;
        }
        throw new IllegalArgumentException(face + " is not on edge " + this);
    }

    /**
     * @return true when both faces number the wings of this edge in the same order
     */
    public boolean isSameDirection() {
        return sameDirection;
    }

    public int wingCount() {
        return cube.size() - 2;
    }

    /**
     * @param ltr LTR index on {@code face1}
     */
    public EdgeWing wing(int ltr) {
        if (ltr < 0 || ltr >= wingCount()) {
            throw new IllegalArgumentException("Wing index " + ltr + " outside edge " + this);
        }
        return new EdgeWing(this, ltr);
    }

    public List<EdgeWing> wings() {
        var wings = new ArrayList<EdgeWing>(wingCount());
        for (int i = 0; i < wingCount(); i++) {
            wings.add(new EdgeWing(this, i));
        }
        return wings;
    }

    /**
     * Convert an LTR index on one face of the edge into the LTR index of the same wing on the other face.
     */
    public int translateLtr(FaceName from, int ltr) {
        var to = otherFace(from);
        var cell = borderCell(from, to, ltr);
        int slot = cube.slotOf(cube.cubie(from, cell[0], cell[1]), to.normal());
        return ltrOf(to, from, cube.rowOfSlot(slot), cube.colOfSlot(slot));
    }

    /**
     * @return the sticker of the wing with the given LTR index on the given face
     */
    public Sticker sticker(FaceName face, int ltr) {
        var cell = borderCell(face, otherFace(face), ltr);
        return cube.sticker(face, cell[0], cell[1]);
    }

    @Override
    public List<FacedSticker> stickers() {
        var result = new ArrayList<FacedSticker>(2 * wingCount());
        for (var wing : wings()) {
            result.addAll(wing.stickers());
        }
        return result;
    }

    /**
     * Full-face {row, col} of the non-corner border cell with the given LTR index, on the side facing {@code toward}.
     */
    int[] borderCell(FaceName face, FaceName toward, int ltr) {
        int last = cube.size() - 1;
        int pos = ltr + 1;
        var n = toward.normal();
        if (n.equals(face.up())) {
            return new int[] { last, pos };
        } else if (n.equals(face.up().negate())) {
            return new int[] { 0, pos };
        } else if (n.equals(face.right())) {
            return new int[] { pos, last };
        } else if (n.equals(face.right().negate())) {
            return new int[] { pos, 0 };
        }
        throw new IllegalArgumentException(face + " is not adjacent to " + toward);
    }

    private int ltrOf(FaceName face, FaceName toward, int row, int col) {
        var n = toward.normal();
        boolean horizontal = Math.abs(n.dot(face.up())) == 1;
        return (horizontal ? col : row) - 1;
    }

    @Override
    public String toString() {
        return face1.name() + face2.name();
    }
}
