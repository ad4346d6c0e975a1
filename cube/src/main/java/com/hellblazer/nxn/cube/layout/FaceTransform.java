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
import com.hellblazer.nxn.geometry.Point;
import com.hellblazer.nxn.geometry.TransformType;

/**
 * A center coordinate transform from one face to another.
 *
 * @author hal.hildebrand
 */
public record FaceTransform(FaceName from, FaceName to, TransformType type, int size) {

    public Point apply(Point p) {
        return type.apply(p.checkInside(size), size);
    }

    public FaceTransform inverse() {
        return new FaceTransform(to, from, type.inverse(), size);
    }

    /**
     * @return this transform followed by {@code next}
     */
    public FaceTransform andThen(FaceTransform next) {
        if (next.from != to) {
            throw new IllegalArgumentException("Cannot chain " + this + " with " + next);
        }
        return new FaceTransform(from, next.to, type.andThen(next.type), size);
    }
}
