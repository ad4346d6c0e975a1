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

import com.hellblazer.nxn.cube.alg.Alg;
import com.hellblazer.nxn.geometry.Block;

/**
 * A block commutator and the three blocks it cycles: the source block's content lands on the target block, the
 * target block's content lands on the second block, and the second block's content lands on the source block.
 *
 * @param alg         the full algorithm, setup moves included
 * @param targetBlock the block on the target face
 * @param sourceBlock the block on the source face, before any setup rotation
 * @param secondBlock where the target's previous content ends up on the source face
 * @author hal.hildebrand
 */
public record CommutatorResult(Alg alg, Block targetBlock, Block sourceBlock, Block secondBlock) {
}
