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
package com.hellblazer.roomgen.entity;

import com.hellblazer.roomgen.geometry.Position;

import java.util.Objects;

/**
 * A monster instance. {@code key} references the external content entry; {@code xp} is the reward awarded when the
 * monster is cleaned out of a room.
 *
 * @author hal.hildebrand
 */
public final class Monster implements Placeable {
    private final String   id;
    private final String   key;
    private final String   name;
    private final double   challengeRating;
    private final int      xp;
    private       Position position;

    public Monster(String id, String key, String name, double challengeRating, int xp, Position position) {
        this.id = Objects.requireNonNull(id, "Monster ID cannot be null");
        this.key = key;
        this.name = name;
        this.challengeRating = challengeRating;
        this.xp = xp;
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Monster copy() {
        return new Monster(id, key, name, challengeRating, xp, position);
    }

    public double getChallengeRating() {
        return challengeRating;
    }

    @Override
    public CellType getCellType() {
        return CellType.MONSTER;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public int getXp() {
        return xp;
    }

    @Override
    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public String toString() {
        return "Monster[" + id + ", " + name + ", CR " + challengeRating + " @ " + position + "]";
    }
}
