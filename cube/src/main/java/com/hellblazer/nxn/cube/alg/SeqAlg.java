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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of algorithms played in order.
 *
 * @author hal.hildebrand
 */
public record SeqAlg(List<Alg> algs) implements Alg {

    public SeqAlg {
        algs = List.copyOf(algs);
    }

    @Override
    public void play(Cube cube) {
        for (var alg : flatten()) {
            alg.play(cube);
        }
    }

    @Override
    public SeqAlg inverse() {
        var reversed = new ArrayList<Alg>(algs.size());
        for (var alg : algs) {
            reversed.add(alg.inverse());
        }
        Collections.reverse(reversed);
        return new SeqAlg(reversed);
    }

    @Override
    public Alg times(int n) {
        var base = n < 0 ? inverse() : this;
        return new SeqAlg(Collections.nCopies(Math.abs(n), base));
    }

    @Override
    public List<Alg> flatten() {
        var result = new ArrayList<Alg>();
        for (var alg : algs) {
            result.addAll(alg.flatten());
        }
        return result;
    }

    @Override
    public String toString() {
        return flatten().stream().map(Alg::toString).collect(Collectors.joining(" "));
    }
}
