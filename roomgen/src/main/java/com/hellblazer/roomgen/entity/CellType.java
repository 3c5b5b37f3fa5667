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

/**
 * What occupies a cell of a room grid. Every kind other than {@link #EMPTY} corresponds to exactly one entity
 * collection of the room.
 *
 * @author hal.hildebrand
 */
public enum CellType {
    EMPTY, MONSTER, ITEM, PLAYER, NPC, OBSTACLE;

    /**
     * @return true if entities of this kind can be placed in a room
     */
    public boolean isPlaceable() {
        return this != EMPTY;
    }
}
