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
 * A physical obstacle such as a wall segment, pillar or piece of furniture.
 *
 * @author hal.hildebrand
 */
public final class Obstacle implements Placeable {
    private final String   id;
    private final String   key;
    private final String   name;
    private final boolean  blocking;
    private       Position position;

    public Obstacle(String id, String key, String name, boolean blocking, Position position) {
        this.id = Objects.requireNonNull(id, "Obstacle ID cannot be null");
        this.key = key;
        this.name = name;
        this.blocking = blocking;
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Obstacle copy() {
        return new Obstacle(id, key, name, blocking, position);
    }

    @Override
    public CellType getCellType() {
        return CellType.OBSTACLE;
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

    /**
     * Whether the obstacle blocks movement through its square
     */
    public boolean isBlocking() {
        return blocking;
    }

    @Override
    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public String toString() {
        return "Obstacle[" + id + ", " + name + " @ " + position + "]";
    }
}
