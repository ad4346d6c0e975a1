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
import java.util.Arrays;
import java.util.List;

/**
 * An inner slice group, spanning the four faces perpendicular to the reference face's normal.
 *
 * @author hal.hildebrand
 */
public final class Slice {

    private final Cube      cube;
    private final SliceName name;

    Slice(Cube cube, SliceName name) {
        this.cube = cube;
        this.name = name;
    }

    public SliceName name() {
        return name;
    }

    public FaceName reference() {
        return name.reference();
    }

    /**
     * @return number of inner layers, 1-based indices run from 1 to this value
     */
    public int count() {
        return cube.size() - 2;
    }

    /**
     * @return the four faces the slice crosses, in enum order
     */
    public List<FaceName> faces() {
        var axis = name.axis().vector();
        return Arrays.stream(FaceName.values()).filter(f -> f.normal().dot(axis) == 0).toList();
    }

    /**
     * @return the center slices of one inner layer on all four crossed faces
     */
    public List<CenterSlice> centerSlices(int index) {
        if (index < 1 || index > count()) {
            throw new IllegalArgumentException("Slice index " + index + " outside " + name + "[1:" + count() + "]");
        }
        int layer = cube.sliceLayer(name, index);
        var result = new ArrayList<CenterSlice>();
        for (var faceName : faces()) {
            for (var cs : cube.face(faceName).centerSlices()) {
                if (cube.layer(name.axis(), cube.cubie(faceName, cs.row() + 1, cs.col() + 1)) == layer) {
                    result.add(cs);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return name.name();
    }
}
