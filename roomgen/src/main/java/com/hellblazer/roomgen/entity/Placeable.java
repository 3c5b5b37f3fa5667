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

/**
 * Capability shared by every entity that can occupy a room cell. The hierarchy is closed: the placement algorithms
 * operate generically over any placeable and rely on {@link #getCellType()} to route an entity to its collection.
 *
 * @author hal.hildebrand
 */
public sealed interface Placeable permits Monster, Player, Item, Npc, Obstacle {

    /**
     * Identity of this entity, unique within a room's lifetime
     */
    String getId();

    Position getPosition();

    void setPosition(Position position);

    CellType getCellType();

    /**
     * An independent value copy of this entity. Rooms only ever store and hand out copies.
     */
    Placeable copy();
}
