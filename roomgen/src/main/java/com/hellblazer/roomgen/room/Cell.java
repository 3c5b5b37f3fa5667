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
package com.hellblazer.roomgen.room;

import com.hellblazer.roomgen.entity.CellType;

/**
 * One grid unit. Records at most one entity's kind and identity; an empty cell carries no entity ID.
 *
 * @author hal.hildebrand
 */
public record Cell(CellType type, String entityId) {

    public static final Cell EMPTY = new Cell(CellType.EMPTY, null);

    public Cell {
        if (type == null) {
            throw new IllegalArgumentException("Cell type cannot be null");
        }
        if (type == CellType.EMPTY && entityId != null) {
            throw new IllegalArgumentException("Empty cell cannot carry an entity ID");
        }
        if (type != CellType.EMPTY && (entityId == null || entityId.isEmpty())) {
            throw new IllegalArgumentException("Occupied cell requires an entity ID");
        }
    }

    public static Cell of(CellType type, String entityId) {
        return new Cell(type, entityId);
    }

    public boolean isEmpty() {
        return type == CellType.EMPTY;
    }

    /**
     * @return true if this cell records the given entity
     */
    public boolean holds(CellType type, String entityId) {
        return this.type == type && entityId.equals(this.entityId);
    }
}
