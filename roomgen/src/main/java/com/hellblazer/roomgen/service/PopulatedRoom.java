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

import com.hellblazer.roomgen.room.BatchPlacementResult;
import com.hellblazer.roomgen.room.Room;

import java.util.Objects;

/**
 * A freshly generated room together with the outcome of populating it. Entities the room could not hold are reported
 * in {@link BatchPlacementResult#getFailures()}.
 *
 * @param room      the generated room
 * @param placement where each requested entity ended up
 * @author hal.hildebrand
 */
public record PopulatedRoom(Room room, BatchPlacementResult placement) {

    public PopulatedRoom {
        Objects.requireNonNull(room, "Room cannot be null");
        Objects.requireNonNull(placement, "Placement result cannot be null");
    }

    /**
     * Check if every requested entity was placed.
     */
    public boolean isCompleteSuccess() {
        return placement.isCompleteSuccess();
    }
}
