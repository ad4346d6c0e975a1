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

package com.hellblazer.nxn.cube.alg;

import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.SliceName;

import java.util.List;

/**
 * Turn a contiguous range of inner slice layers {@code n} quarter turns in the direction of the slice's reference
 * face. Indices are 1-based; {@link #ALL} as the upper bound means the last inner layer of whatever cube the
 * algorithm is played on.
 *
 * @author hal.hildebrand
 */
public record SliceAlg(SliceName slice, int from, int to, int n) implements Alg {

    public static final int ALL = -1;

    public SliceAlg {
        if (from < 1 || (to != ALL && to < from)) {
            throw new IllegalArgumentException("Invalid slice range " + slice + "[" + from + ":" + to + "]");
        }
    }

    public static SliceAlg whole(SliceName slice, int n) {
        return new SliceAlg(slice, 1, ALL, n);
    }

    public static SliceAlg single(SliceName slice, int index, int n) {
        return new SliceAlg(slice, index, index, n);
    }

    public boolean isWhole() {
        return from == 1 && to == ALL;
    }

    @Override
    public void play(Cube cube) {
        cube.rotateSlice(slice, from, to == ALL ? cube.size() - 2 : to, n);
    }

    @Override
    public SliceAlg inverse() {
        return new SliceAlg(slice, from, to, -n);
    }

    @Override
    public SliceAlg times(int count) {
        return new SliceAlg(slice, from, to, n * count);
    }

    @Override
    public List<Alg> flatten() {
        return Algs.normalizeTurns(n) == 0 ? List.of() : List.of(this);
    }

    @Override
    public String toString() {
        String range;
        if (isWhole()) {
            range = "";
        } else if (to == from) {
            range = "[" + from + "]";
        } else {
            range = "[" + from + ":" + (to == ALL ? "" : to) + "]";
        }
        return slice.name() + range + Algs.suffix(n);
    }
}
