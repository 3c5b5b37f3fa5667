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

import java.util.Objects;

/**
 * Exception thrown when a room operation cannot be completed. The {@link RoomError} code identifies the failure so
 * callers can react to specific conditions without parsing messages.
 *
 * @author hal.hildebrand
 */
public class RoomException extends RuntimeException {
    private final RoomError error;

    public RoomException(RoomError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "Error code cannot be null");
    }

    public RoomException(RoomError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "Error code cannot be null");
    }

    /**
     * Fail with {@link RoomError#NIL_ROOM} if the room is absent
     *
     * @return the room
     */
    public static Room requireRoom(Room room) {
        if (room == null) {
            throw new RoomException(RoomError.NIL_ROOM, "room is null");
        }
        return room;
    }

    public RoomError getError() {
        return error;
    }

    public boolean is(RoomError code) {
        return error == code;
    }
}
