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
package com.hellblazer.nxn.solver.commutator;

import com.hellblazer.nxn.geometry.Block;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Histogram of the block sizes moved by commutators.
 *
 * @author hal.hildebrand
 */
public final class CenterBlockStatistics {

    private final SortedMap<Integer, Integer> histogram = new TreeMap<>();

    public void record(Block block) {
        record(block.size());
    }

    public void record(int blockSize) {
        if (blockSize < 1) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }
        histogram.merge(blockSize, 1, Integer::sum);
    }

    public int count(int blockSize) {
        return histogram.getOrDefault(blockSize, 0);
    }

    public int totalBlocks() {
        return histogram.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return the number of center cells moved by all recorded blocks
     */
    public int totalCells() {
        return histogram.entrySet().stream().mapToInt(e -> e.getKey() * e.getValue()).sum();
    }

    public SortedMap<Integer, Integer> asMap() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(histogram));
    }

    public void reset() {
        histogram.clear();
    }

    @Override
    public String toString() {
        return "CenterBlockStatistics" + histogram;
    }
}
