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
import com.hellblazer.nxn.cube.model.FaceName;

import java.util.List;

/**
 * Turn one face clockwise (as seen from outside the face) {@code n} quarter turns.
 *
 * @author hal.hildebrand
 */
public record FaceAlg(FaceName face, int n) implements Alg {

    @Override
    public void play(Cube cube) {
        cube.rotateFace(face, n);
    }

    @Override
    public FaceAlg inverse() {
        return new FaceAlg(face, -n);
    }

    @Override
    public FaceAlg times(int count) {
        return new FaceAlg(face, n * count);
    }

    @Override
    public List<Alg> flatten() {
        return Algs.normalizeTurns(n) == 0 ? List.of() : List.of(this);
    }

    @Override
    public String toString() {
        return face.name() + Algs.suffix(n);
    }
}
