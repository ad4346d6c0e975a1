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

package com.hellblazer.nxn.geometry;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The four orientation preserving transforms of a square grid. Clockwise is as seen by a viewer looking at the
 * grid, with row 0 at the bottom.
 *
 * @author hal.hildebrand
 */
public enum TransformType {
    IDENTITY(0), ROT_90_CW(1), ROT_180(2), ROT_90_CCW(3);

    private final int clockwiseTurns;

    TransformType(int clockwiseTurns) {
        this.clockwiseTurns = clockwiseTurns;
    }

    /**
     * @param quarterTurns clockwise quarter turns, negative for counterclockwise
     */
    public static TransformType ofClockwiseTurns(int quarterTurns) {
        return switch (Math.floorMod(quarterTurns, 4)) {
            case 0 -> IDENTITY;
            case 1 -> ROT_90_CW;
            case 2 -> ROT_180;
            default -> ROT_90_CCW;
        };
    }

    /**
     * Find the transform that maps every cell of a grid the same way as the supplied mapping.
     *
     * @return the matching transform, or empty when the mapping is not a grid rotation
     */
    public static Optional<TransformType> classify(int size, UnaryOperator<Point> mapping) {
        for (var type : values()) {
            boolean matches = true;
            for (int r = 0; r < size && matches; r++) {
                for (int c = 0; c < size && matches; c++) {
                    var p = new Point(r, c);
                    matches = type.apply(p, size).equals(mapping.apply(p));
                }
            }
            if (matches) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public int clockwiseTurns() {
        return clockwiseTurns;
    }

    public TransformType inverse() {
        return ofClockwiseTurns(-clockwiseTurns);
    }

    /**
     * @return the transform equivalent to applying this one and then {@code next}
     */
    public TransformType andThen(TransformType next) {
        return ofClockwiseTurns(clockwiseTurns + next.clockwiseTurns);
    }

    public Point apply(Point p, int size) {
        int last = size - 1;
        return switch (this) {
            case IDENTITY -> p;
            case ROT_90_CW -> new Point(last - p.col(), p.row());
            case ROT_180 -> new Point(last - p.row(), last - p.col());
            case ROT_90_CCW -> new Point(p.col(), last - p.row());
        };
    }
}
