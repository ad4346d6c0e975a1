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

/**
 * Configuration of the center reduction solver.
 * <p>
 * The configuration uses a fluent API; the solver reads it but never changes it.
 *
 * @author hal.hildebrand
 */
public class CenterSolverConfig {

    // Shortcuts
    private boolean optimizeCompleteSlices       = true;
    private boolean completeSlicesOnlyTargetZero = true;
    private boolean optimizeBigBlocks            = true;
    private boolean optimizeOddCubeFaceSwap      = false;

    // Cage method: undo source setup rotations so edges and corners stay put
    private boolean preserveCage = false;

    // Guards
    private SanityCheck sanityCheck   = SanityCheck.TRACKERS;
    private int         maxIterations = 1000;

    /**
     * Create the default configuration: all shortcuts that work with a reduction, no cage preservation.
     */
    public static CenterSolverConfig defaultConfig() {
        return new CenterSolverConfig();
    }

    /**
     * Create a configuration that keeps every edge and corner in place, for solving centers after the edges.
     */
    public static CenterSolverConfig cageConfig() {
        return new CenterSolverConfig().withPreserveCage(true).withOptimizeCompleteSlices(false);
    }

    // Fluent API methods

    public CenterSolverConfig withOptimizeCompleteSlices(boolean enable) {
        this.optimizeCompleteSlices = enable;
        return this;
    }

    public CenterSolverConfig withCompleteSlicesOnlyTargetZero(boolean enable) {
        this.completeSlicesOnlyTargetZero = enable;
        return this;
    }

    public CenterSolverConfig withOptimizeBigBlocks(boolean enable) {
        this.optimizeBigBlocks = enable;
        return this;
    }

    /**
     * @throws UnsupportedOperationException when enabling: the odd cube whole face swap is not implemented
     */
    public CenterSolverConfig withOptimizeOddCubeFaceSwap(boolean enable) {
        if (enable) {
            throw new UnsupportedOperationException("Odd cube whole face swap is not implemented");
        }
        this.optimizeOddCubeFaceSwap = false;
        return this;
    }

    public CenterSolverConfig withPreserveCage(boolean enable) {
        this.preserveCage = enable;
        return this;
    }

    public CenterSolverConfig withSanityCheck(SanityCheck check) {
        if (check == null) {
            throw new IllegalArgumentException("Sanity check cannot be null");
        }
        this.sanityCheck = check;
        return this;
    }

    public CenterSolverConfig withMaxIterations(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive");
        }
        this.maxIterations = max;
        return this;
    }

    // Getters

    public boolean isOptimizeCompleteSlices() {
        return optimizeCompleteSlices;
    }

    public boolean isCompleteSlicesOnlyTargetZero() {
        return completeSlicesOnlyTargetZero;
    }

    public boolean isOptimizeBigBlocks() {
        return optimizeBigBlocks;
    }

    public boolean isOptimizeOddCubeFaceSwap() {
        return optimizeOddCubeFaceSwap;
    }

    public boolean isPreserveCage() {
        return preserveCage;
    }

    public SanityCheck getSanityCheck() {
        return sanityCheck;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    public String toString() {
        return "CenterSolverConfig{" + "completeSlices=" + optimizeCompleteSlices + ", onlyTargetZero="
        + completeSlicesOnlyTargetZero + ", bigBlocks=" + optimizeBigBlocks + ", preserveCage=" + preserveCage
        + ", sanityCheck=" + sanityCheck + ", maxIterations=" + maxIterations + "}";
    }
}
