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

import java.util.List;

/**
 * One wing position of an edge: a pair of stickers, one on each face of the edge.
 *
 * @param edge  the owning edge
 * @param index LTR index on the edge's first face
 * @author hal.hildebrand
 */
public record EdgeWing(Edge edge, int index) implements Part {

    public int ltrOn(FaceName face) {
        return face == edge.face1() ? index : edge.translateLtr(edge.face1(), index);
    }

    public Sticker sticker(FaceName face) {
        return edge.sticker(face, ltrOn(face));
    }

    @Override
    public List<FacedSticker> stickers() {
        return List.of(new FacedSticker(edge.face1(), sticker(edge.face1())),
                       new FacedSticker(edge.face2(), sticker(edge.face2())));
    }
}
