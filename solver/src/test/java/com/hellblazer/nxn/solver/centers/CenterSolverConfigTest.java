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
package com.hellblazer.nxn.solver.centers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CenterSolverConfigTest {

    @Test
    public void testDefaultConfiguration() {
        var config = CenterSolverConfig.defaultConfig();
        assertTrue(config.isOptimizeCompleteSlices());
        assertTrue(config.isCompleteSlicesOnlyTargetZero());
        assertTrue(config.isOptimizeBigBlocks());
        assertFalse(config.isOptimizeOddCubeFaceSwap());
        assertFalse(config.isPreserveCage());
        assertEquals(SanityCheck.TRACKERS, config.getSanityCheck());
        assertEquals(1000, config.getMaxIterations());
    }

    @Test
    public void testCageConfiguration() {
        var config = CenterSolverConfig.cageConfig();
        assertTrue(config.isPreserveCage());
        assertFalse(config.isOptimizeCompleteSlices());
        assertTrue(config.isOptimizeBigBlocks());
    }

    @Test
    public void testFluentAPISetters() {
        var config = new CenterSolverConfig();
        assertSame(config, config.withOptimizeBigBlocks(false));
        assertFalse(config.isOptimizeBigBlocks());
        config.withCompleteSlicesOnlyTargetZero(false).withSanityCheck(SanityCheck.FULL).withMaxIterations(7);
        assertFalse(config.isCompleteSlicesOnlyTargetZero());
        assertEquals(SanityCheck.FULL, config.getSanityCheck());
        assertEquals(7, config.getMaxIterations());

        assertThrows(IllegalArgumentException.class, () -> config.withMaxIterations(0));
        assertThrows(IllegalArgumentException.class, () -> config.withSanityCheck(null));
        assertThrows(UnsupportedOperationException.class, () -> config.withOptimizeOddCubeFaceSwap(true));
        assertSame(config, config.withOptimizeOddCubeFaceSwap(false));
    }
}
