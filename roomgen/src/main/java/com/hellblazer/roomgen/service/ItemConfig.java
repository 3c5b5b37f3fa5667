/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Roomgen.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.roomgen.service;

import com.hellblazer.roomgen.geometry.Position;

import java.util.Objects;

/**
 * Items to add to a room, looked up by content key.
 *
 * @author hal.hildebrand
 */
public record ItemConfig(String key, int count, boolean randomPlace, Position position) {

    public ItemConfig {
        Objects.requireNonNull(key, "Item key cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
    }

    public static ItemConfig random(String key, int count) {
        return new ItemConfig(key, count, true, null);
    }
}
