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

import com.hellblazer.nxn.cube.alg.Alg;
import com.hellblazer.nxn.cube.alg.Algs;
import com.hellblazer.nxn.cube.model.Cube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Plays algorithms on a cube one atomic move at a time, recording a history that supports undo. An abort request
 * is honored between atomic moves.
 *
 * @author hal.hildebrand
 */
public final class Operator {
    private static final Logger log = LoggerFactory.getLogger(Operator.class);

    private final Cube               cube;
    private final List<Alg>          history   = new ArrayList<>();
    private final List<MoveListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean      abort     = new AtomicBoolean();
    private       long               moveCount;

    public Operator(Cube cube) {
        this.cube = cube;
    }

    public Cube cube() {
        return cube;
    }

    /**
     * Play the algorithm and record its moves in the history.
     *
     * @throws OperationAbortedException if an abort was requested; the moves played so far stay played and recorded
     */
    public void play(Alg alg) {
        var moves = alg.flatten();
        if (log.isDebugEnabled() && !moves.isEmpty()) {
            log.debug("Play {} ({} moves)", Algs.simplify(alg), moves.size());
        }
        for (var move : moves) {
            checkAbort();
            move.play(cube);
            history.add(move);
            moveCount++;
            for (var listener : listeners) {
                listener.moved(move, false);
            }
        }
    }

    /**
     * Undo the last recorded move. Undo ignores abort requests, so restoring scopes always complete.
     *
     * @return the undone move, or null when the history is empty
     */
    public Alg undo() {
        if (history.isEmpty()) {
            return null;
        }
        var move = history.remove(history.size() - 1);
        var inverse = move.inverse();
        inverse.play(cube);
        moveCount++;
        for (var listener : listeners) {
            listener.moved(inverse, true);
        }
        return move;
    }

    /**
     * Undo moves until the history is back to the given size.
     */
    public void undoTo(int historySize) {
        if (historySize < 0 || historySize > history.size()) {
            throw new IllegalArgumentException("History has " + history.size() + " moves, cannot undo to "
                                               + historySize);
        }
        while (history.size() > historySize) {
            undo();
        }
    }

    public void undoAll() {
        undoTo(0);
    }

    public List<Alg> history() {
        return List.copyOf(history);
    }

    public int historySize() {
        return history.size();
    }

    /**
     * @return total atomic moves played, undo moves included
     */
    public long moveCount() {
        return moveCount;
    }

    /**
     * Open a scope whose moves are all undone when it closes, for queries that need to play moves to look at the
     * result.
     */
    public QueryRestoreState withQueryRestoreState() {
        return new QueryRestoreState(this, history.size());
    }

    public void addListener(MoveListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MoveListener listener) {
        listeners.remove(listener);
    }

    /**
     * Request that the move in progress stops at the next atomic move boundary.
     */
    public void abort() {
        abort.set(true);
    }

    public void clearAbort() {
        abort.set(false);
    }

    public boolean isAbortRequested() {
        return abort.get();
    }

    private void checkAbort() {
        if (abort.get()) {
            log.debug("Abort requested after {} moves", moveCount);
            throw new OperationAbortedException("Aborted after " + moveCount + " moves");
        }
    }

    /**
     * Undoes, on close, every move played since it was opened.
     */
    public static final class QueryRestoreState implements AutoCloseable {
        private final Operator operator;
        private final int      mark;

        private QueryRestoreState(Operator operator, int mark) {
            this.operator = operator;
            this.mark = mark;
        }

        @Override
        public void close() {
            operator.undoTo(mark);
        }
    }
}
