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
 * A player character.
 *
 * @author hal.hildebrand
 */
public final class Player implements Placeable {
    private final String   id;
    private final String   name;
    private final int      level;
    private       Position position;

    public Player(String id, String name, int level, Position position) {
        this.id = Objects.requireNonNull(id, "Player ID cannot be null");
        this.name = name;
        this.level = level;
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Player copy() {
        return new Player(id, name, level, position);
    }

    @Override
    public CellType getCellType() {
        return CellType.PLAYER;
    }

    @Override
    public String getId() {
        return id;
    }

    public int getLevel() {
        return level;
    }

    public String getName() {
        return name;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    @Override
    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public String toString() {
        return "Player[" + id + ", " + name + ", level " + level + " @ " + position + "]";
    }
}
