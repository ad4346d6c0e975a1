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

/**
 * Inner slice groups. Each turns like its reference face: M like L, E like D and S like F. Slice index 1 is the
 * inner layer adjacent to the reference face.
 *
 * @author hal.hildebrand
 */
public enum SliceName {
    E(FaceName.D), M(FaceName.L), S(FaceName.F);

    private final FaceName reference;

    SliceName(FaceName reference) {
        this.reference = reference;
    }

    public static SliceName of(Axis axis) {
        for (var slice : values()) {
            if (slice.axis() == axis) {
                return slice;
            }
        }
        throw new IllegalArgumentException("No slice for " + axis);
    }

    public FaceName reference() {
        return reference;
    }

    public Axis axis() {
        return Axis.parallelTo(reference.normal());
    }

    /**
     * @return +1 when a positive slice turn is a positive turn about its axis, -1 otherwise
     */
    public int axisSign() {
        return reference.normal().dot(axis().vector());
    }
}
