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

import com.hellblazer.nxn.geometry.Point;

/**
 * A center sticker position on a face. The view resolves the sticker on every access, so after a move it shows
 * whatever sticker now occupies the position.
 *
 * @author hal.hildebrand
 */
public record CenterSlice(Face face, Point point) {

    public Sticker sticker() {
        return face.centerSticker(point);
    }

    public Color color() {
        return sticker().color();
    }

    public int row() {
        return point.row();
    }

    public int col() {
        return point.col();
    }

    @Override
    public String toString() {
        return face + point.toString() + "=" + color();
    }
}
