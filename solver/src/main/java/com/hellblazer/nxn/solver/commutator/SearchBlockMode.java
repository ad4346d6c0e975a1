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

/**
 * What a source block must hold, relative to the target block, for a commutator to be worth playing.
 *
 * @author hal.hildebrand
 */
public enum SearchBlockMode {
    /** every source cell has the color */
    COMPLETE_BLOCK,
    /** the source holds more cells of the color than the target already does */
    BIG_THAN_SOURCE,
    /** no target cell has the color and every source cell does */
    EXACT_MATCH
}
