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

package com.hellblazer.nxn.cube.layout;

import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.geometry.TransformType;

import java.util.List;

/**
 * The walk of a slice across its four faces, in content flow order. A positive quarter turn of the slice carries the
 * content at (face j, index, slot) to (face j+1, index, slot), which is what makes the per face point functions
 * compose into face to face transforms.
 *
 * @author hal.hildebrand
 */
public final class WalkingInfo {

    private final SliceName      slice;
    private final int            size;
    private final List<FaceWalk> walks;

    WalkingInfo(SliceName slice, int size, List<FaceWalk> walks) {
        this.slice = slice;
        this.size = size;
        this.walks = List.copyOf(walks);
    }

    public SliceName slice() {
        return slice;
    }

    /**
     * @return the four face walks, starting with the walk's start face
     */
    public List<FaceWalk> walks() {
        return walks;
    }

    public FaceWalk walk(FaceName face) {
        return walks.stream()
                    .filter(w -> w.face() == face)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(slice + " does not cross " + face));
    }

    public Point computePoint(FaceName face, int index, int slot) {
        if (index < 0 || index >= size || slot < 0 || slot >= size) {
            throw new IllegalArgumentException("index " + index + ", slot " + slot + " outside size " + size);
        }
        return walk(face).computePoint(size, index, slot);
    }

    /**
     * @return number of positive slice quarter turns that carry content from {@code a} to {@code b}
     */
    public int steps(FaceName a, FaceName b) {
        return Math.floorMod(walks.indexOf(walk(b)) - walks.indexOf(walk(a)), 4);
    }

    /**
     * @return the transform taking a center point on {@code a} to the point its content reaches on {@code b}
     */
    public FaceTransform getTransform(FaceName a, FaceName b) {
        var from = walk(a);
        var to = walk(b);
        if (size == 0) {
            return new FaceTransform(a, b, TransformType.IDENTITY, 0);
        }
        var type = TransformType.classify(size, p -> {
            var indexSlot = from.indexAndSlot(size, p);
            return to.computePoint(size, indexSlot[0], indexSlot[1]);
        }).orElseThrow(() -> new IllegalStateException("Walk of " + slice + " maps " + a + " onto " + b
                                                       + " by a reflection"));
        return new FaceTransform(a, b, type, size);
    }

    @Override
    public String toString() {
        return "WalkingInfo{" + slice + ", " + walks + "}";
    }
}
