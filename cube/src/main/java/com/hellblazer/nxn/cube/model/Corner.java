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

package com.hellblazer.nxn.cube.model;

import com.hellblazer.nxn.geometry.Point3i;

import java.util.List;

/**
 * The corner shared by three mutually adjacent faces.
 *
 * @author hal.hildebrand
 */
public final class Corner implements Part {

    private final Cube           cube;
    private final List<FaceName> faces;
    private final Point3i        cubie;

    Corner(Cube cube, FaceName f1, FaceName f2, FaceName f3) {
        this.cube = cube;
        this.faces = List.of(f1, f2, f3);
        this.cubie = f1.normal().add(f2.normal()).add(f3.normal()).multiply(cube.size() - 1);
    }

    public List<FaceName> faces() {
        return faces;
    }

    public boolean contains(FaceName face) {
        return faces.contains(face);
    }

    public Sticker sticker(FaceName face) {
        if (!contains(face)) {
            throw new IllegalArgumentException(face + " is not on corner " + this);
        }
        int slot = cube.slotOf(cubie, face.normal());
        return cube.sticker(face, cube.rowOfSlot(slot), cube.colOfSlot(slot));
    }

    @Override
    public List<FacedSticker> stickers() {
        return faces.stream().map(f -> new FacedSticker(f, sticker(f))).toList();
    }

    @Override
    public String toString() {
        return faces.get(0).name() + faces.get(1).name() + faces.get(2).name();
    }
}
