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
package com.hellblazer.roomgen.balance;

import com.hellblazer.roomgen.geometry.Position;

import java.util.Objects;

/**
 * A kind of monster to add to a room, and how many.
 *
 * @param name        display name
 * @param key         content reference used to look up XP
 * @param cr          challenge rating of one monster
 * @param count       number of monsters of this kind
 * @param randomPlace whether to place each monster at a random empty position
 * @param position    requested position when {@code randomPlace} is false
 * @author hal.hildebrand
 */
public record MonsterConfig(String name, String key, double cr, int count, boolean randomPlace, Position position) {

    public MonsterConfig {
        Objects.requireNonNull(name, "Name cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
        if (cr < 0) {
            throw new IllegalArgumentException("Challenge rating cannot be negative: " + cr);
        }
    }

    public static MonsterConfig random(String name, String key, double cr, int count) {
        return new MonsterConfig(name, key, cr, count, true, null);
    }

    public double totalCR() {
        return cr * count;
    }

    public MonsterConfig withCount(int newCount) {
        return new MonsterConfig(name, key, cr, newCount, randomPlace, position);
    }
}
