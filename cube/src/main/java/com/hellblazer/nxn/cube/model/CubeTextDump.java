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
 * Renders a cube as an unfolded text net, for debug logging.
 *
 * <pre>
 *     U
 *   L F R B
 *     D
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class CubeTextDump {

    private CubeTextDump() {
    }

    public static String dump(Cube cube) {
        int n = cube.size();
        var sb = new StringBuilder();
        var pad = " ".repeat(n + 1);
        for (int row = n - 1; row >= 0; row--) {
            sb.append(pad).append(line(cube, FaceName.U, row)).append('\n');
        }
        for (int row = n - 1; row >= 0; row--) {
            for (var face : new FaceName[] { FaceName.L, FaceName.F, FaceName.R, FaceName.B }) {
                sb.append(line(cube, face, row)).append(' ');
            }
            sb.setLength(sb.length() - 1);
            sb.append('\n');
        }
        for (int row = n - 1; row >= 0; row--) {
            sb.append(pad).append(line(cube, FaceName.D, row)).append('\n');
        }
        return sb.toString();
    }

    private static String line(Cube cube, FaceName face, int row) {
        var sb = new StringBuilder(cube.size());
        for (int col = 0; col < cube.size(); col++) {
            sb.append(cube.sticker(face, row, col).color().code());
        }
        return sb.toString();
    }
}
