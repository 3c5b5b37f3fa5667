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

import java.util.List;
import java.util.Objects;

/**
 * A non-player character to add to a room, optionally carrying items looked up by content key.
 *
 * @author hal.hildebrand
 */
public record NpcConfig(String name, String key, List<String> inventoryKeys, boolean randomPlace,
                        Position position) {

    public NpcConfig {
        Objects.requireNonNull(name, "Name cannot be null");
        inventoryKeys = inventoryKeys == null ? List.of() : List.copyOf(inventoryKeys);
    }
}
