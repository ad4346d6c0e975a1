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

package com.hellblazer.nxn.cube.operator;

import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.model.Cube;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OperatorTest {

    private Cube     cube;
    private Operator op;

    @BeforeEach
    public void setUp() {
        cube = new Cube(4);
        op = new Operator(cube);
    }

    @Test
    public void testHistoryAndUndo() {
        var solved = cube.snapshotColors();
        op.play(Algs.parse("R U M[1] F'"));
        assertEquals(4, op.historySize());
        assertEquals("F'", op.history().get(3).toString());
        assertEquals(Algs.parse("F'").algs().get(0), op.undo());
        assertEquals(3, op.historySize());
        op.undoAll();
        assertEquals(0, op.historySize());
        assertNull(op.undo());
        assertArrayEquals(solved, cube.snapshotColors());
        assertEquals(8, op.moveCount());
    }

    @Test
    public void testQueryRestoreState() {
        op.play(Algs.R);
        var before = cube.snapshotColors();
        try (var ignored = op.withQueryRestoreState()) {
            op.play(Algs.scramble(4, 3));
        }
        assertArrayEquals(before, cube.snapshotColors());
        assertEquals(1, op.historySize());
    }

    @Test
    public void testAbortStopsBetweenMoves() {
        var seen = new ArrayList<String>();
        op.addListener((move, undo) -> {
            seen.add(move.toString());
            if (seen.size() == 2) {
                op.abort();
            }
        });
        assertThrows(OperationAbortedException.class, () -> op.play(Algs.parse("R U F D")));
        assertEquals(2, op.historySize());
        assertEquals(2, cube.modifyCounter());
        assertTrue(op.isAbortRequested());

        op.undoAll();
        assertEquals(0, op.historySize());
        op.clearAbort();
        op.play(Algs.L);
        assertEquals(1, op.historySize());
    }

    @Test
    public void testListenerSeesUndo() {
        var undone = new ArrayList<String>();
        op.addListener((move, undo) -> {
            if (undo) {
                undone.add(move.toString());
            }
        });
        op.play(Algs.parse("R U2"));
        op.undoAll();
        assertEquals(List.of("U2", "R'"), undone);
    }
}
