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

/**
 * Failure codes raised through {@link RoomException}.
 *
 * @author hal.hildebrand
 */
public enum RoomError {
    /** Operation invoked without a room */
    NIL_ROOM,
    /** Position outside [0, width) x [0, height) of a gridded room */
    INVALID_POSITION,
    /** Target cell already holds a different entity */
    CELL_OCCUPIED,
    /** Every cell of a gridded room is occupied */
    NO_EMPTY_POSITIONS,
    /** Referenced entity is not in the room */
    ENTITY_NOT_FOUND,
    /** Non-positive room width or height */
    INVALID_DIMENSIONS,
    /** Malformed request or configuration */
    INVALID_CONFIG,
    /** Operation does not apply to the given cell type */
    UNSUPPORTED_CELL_TYPE,
    INVALID_DIFFICULTY,
    EMPTY_PARTY,
    /** Content key unknown to a repository */
    CONTENT_NOT_FOUND,
    /** Content source could not be read */
    CONTENT_UNAVAILABLE
}
