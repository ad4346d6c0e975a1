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

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A physical sticker. Moves permute sticker objects, so a sticker's color and its tags travel with it through
 * every rotation. Tags are keyed by kind and by an owner id, so that independent owners never collide.
 *
 * @author hal.hildebrand
 */
public final class Sticker {

    private final Color                           color;
    private       EnumMap<TagKind, Map<Long, Object>> tags;

    public Sticker(Color color) {
        this.color = color;
    }

    public Color color() {
        return color;
    }

    public void tag(TagKind kind, long owner, Object payload) {
        if (tags == null) {
            tags = new EnumMap<>(TagKind.class);
        }
        tags.computeIfAbsent(kind, k -> new HashMap<>()).put(owner, payload);
    }

    public boolean hasTag(TagKind kind, long owner) {
        return tags != null && tags.containsKey(kind) && tags.get(kind).containsKey(owner);
    }

    public Optional<Object> tag(TagKind kind, long owner) {
        if (tags == null || !tags.containsKey(kind)) {
            return Optional.empty();
        }
        return Optional.ofNullable(tags.get(kind).get(owner));
    }

    public boolean removeTag(TagKind kind, long owner) {
        if (tags == null || !tags.containsKey(kind)) {
            return false;
        }
        var owners = tags.get(kind);
        boolean removed = owners.remove(owner) != null;
        if (owners.isEmpty()) {
            tags.remove(kind);
        }
        return removed;
    }

    public boolean hasTags() {
        return tags != null && !tags.isEmpty();
    }

    @Override
    public String toString() {
        return "Sticker{" + color + (hasTags() ? ", tags=" + tags : "") + "}";
    }
}
