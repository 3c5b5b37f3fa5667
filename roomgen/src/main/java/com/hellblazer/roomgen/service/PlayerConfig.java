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
 * A player character to add to a room.
 *
 * @author hal.hildebrand
 */
public record PlayerConfig(String name, int level, boolean randomPlace, Position position) {

    public PlayerConfig {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    public static PlayerConfig at(String name, int level, Position position) {
        return new PlayerConfig(name, level, false, position);
    }

    public static PlayerConfig random(String name, int level) {
        return new PlayerConfig(name, level, true, null);
    }
}
