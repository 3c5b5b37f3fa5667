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

import com.hellblazer.roomgen.entity.Placeable;
import com.hellblazer.roomgen.geometry.Position;

/**
 * Request object for batch placement. Encapsulates the entity to place and where it should go.
 *
 * @param entity      the entity to place; its own position is ignored in favour of the request
 * @param randomPlace whether to choose a position via {@link PlacementEngine#findEmptyPosition(Room)}
 * @param position    the requested position, required when {@code randomPlace} is false
 * @author hal.hildebrand
 */
public record PlacementRequest(Placeable entity, boolean randomPlace, Position position) {

    /**
     * Request placement at an exact position
     */
    public static PlacementRequest at(Placeable entity, Position position) {
        return new PlacementRequest(entity, false, position);
    }

    /**
     * Request placement at a random empty position
     */
    public static PlacementRequest random(Placeable entity) {
        return new PlacementRequest(entity, true, null);
    }

    /**
     * Validate the request parameters
     *
     * @throws RoomException with {@link RoomError#INVALID_CONFIG} for a malformed request
     */
    public void validate() {
        if (entity == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "placement request has no entity");
        }
        if (entity.getId() == null || entity.getId().isBlank()) {
            throw new RoomException(RoomError.INVALID_CONFIG, entity.getCellType() + " in request has no ID");
        }
        if (!randomPlace && position == null) {
            throw new RoomException(RoomError.INVALID_CONFIG,
                                    entity.getId() + " must have a position when random placement is off");
        }
    }
}
