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

import com.hellblazer.nxn.cube.model.Axis;
import com.hellblazer.nxn.cube.model.Cube;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class AlgsTest {

    @Test
    public void testNotation() {
        var alg = Algs.parse("R U' M[2] E[1:2]2 X Y' z2 F2'");
        assertEquals(8, alg.count());
        assertEquals("R U' M[2] E[1:2]2 X Y' Z2 F2", alg.toString());
        assertEquals(new SliceAlg(SliceName.E, 1, 2, 2), alg.algs().get(3));
        assertEquals(new WholeCubeAlg(Axis.Z, 2), alg.algs().get(6));
        assertEquals("M[2:]", Algs.parse("M[2:]").toString());
        assertEquals("RUR'", Algs.parse("RUR'").toString().replace(" ", ""));
    }

    @Test
    public void testParseErrors() {
        assertThrows(IllegalArgumentException.class, () -> Algs.parse("R Q"));
        assertThrows(IllegalArgumentException.class, () -> Algs.parse("R[2]"));
        assertThrows(IllegalArgumentException.class, () -> Algs.parse("X[1]"));
        assertThrows(IllegalArgumentException.class, () -> Algs.parse("M[0]"));
    }

    @Test
    public void testInverseAndTimes() {
        var alg = Algs.seq(Algs.R, Algs.U.inverse(), Algs.slice(SliceName.M, 1));
        assertEquals("M[1]' U R'", alg.inverse().toString());
        assertEquals("R U' M[1] R U' M[1]", alg.times(2).toString());
        assertEquals("M[1]' U R'", alg.times(-1).toString());
        assertEquals(new FaceAlg(FaceName.F, 3), Algs.F.times(3));
        assertEquals("F'", Algs.F.times(3).toString());
        assertEquals(0, Algs.F.times(4).count());
    }

    @Test
    public void testSimplify() {
        assertEquals("R2", Algs.simplify(Algs.parse("R R")).toString());
        assertEquals("", Algs.simplify(Algs.parse("R R'")).toString());
        assertEquals("U2", Algs.simplify(Algs.parse("U R R' U2 U'")).toString());
        assertEquals("M[1] M[2]", Algs.simplify(Algs.parse("M[1] M[2]")).toString());
    }

    @Test
    public void testScrambleIsReproducible() {
        assertEquals(Algs.scramble(5, 42).toString(), Algs.scramble(5, 42).toString());
        assertNotEquals(Algs.scramble(5, 42).toString(), Algs.scramble(5, 43).toString());
        assertEquals(60, Algs.scramble(5, 42).count());
        assertTrue(Algs.scramble(3, 1).flatten().stream().allMatch(a -> a instanceof FaceAlg));
    }

    @Property
    @Label("An algorithm followed by its inverse leaves the cube unchanged")
    void inverseIsNoOp(@ForAll @IntRange(min = 2, max = 7) int size, @ForAll long seed) {
        var cube = new Cube(size);
        Algs.scramble(size, seed + 1).play(cube);
        var before = cube.snapshotColors();
        var alg = Algs.seq(Algs.scramble(size, seed, 30), Algs.X, Algs.Y.times(2), Algs.Z.inverse());
        alg.play(cube);
        alg.inverse().play(cube);
        assertArrayEquals(before, cube.snapshotColors());
    }
}
