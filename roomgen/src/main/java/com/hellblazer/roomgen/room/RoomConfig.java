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
 * Parameters for creating a room. Missing light level and room type default to {@link LightLevel#BRIGHT} and
 * {@link RoomType#COMBAT}.
 *
 * @param width       width in grid units
 * @param height      height in grid units
 * @param lightLevel  ambient light
 * @param description free text description
 * @param roomType    purpose of the room
 * @param useGrid     whether the room tracks occupancy, enabling collision detection
 * @author hal.hildebrand
 */
public record RoomConfig(int width, int height, LightLevel lightLevel, String description, RoomType roomType,
                         boolean useGrid) {

    public RoomConfig {
        if (lightLevel == null) {
            lightLevel = LightLevel.BRIGHT;
        }
        if (roomType == null) {
            roomType = RoomType.COMBAT;
        }
        if (description == null) {
            description = "";
        }
    }

    public static RoomConfig gridded(int width, int height) {
        return new RoomConfig(width, height, LightLevel.BRIGHT, "", RoomType.COMBAT, true);
    }

    public static RoomConfig gridless(int width, int height) {
        return new RoomConfig(width, height, LightLevel.BRIGHT, "", RoomType.COMBAT, false);
    }

    /**
     * @throws RoomException with {@link RoomError#INVALID_DIMENSIONS} for a non-positive width or height
     */
    public void validate() {
        if (width <= 0 || height <= 0) {
            throw new RoomException(RoomError.INVALID_DIMENSIONS,
                                    "room dimensions must be positive: " + width + "x" + height);
        }
    }

    public RoomConfig withDescription(String description) {
        return new RoomConfig(width, height, lightLevel, description, roomType, useGrid);
    }

    public RoomConfig withLightLevel(LightLevel lightLevel) {
        return new RoomConfig(width, height, lightLevel, description, roomType, useGrid);
    }

    public RoomConfig withRoomType(RoomType roomType) {
        return new RoomConfig(width, height, lightLevel, description, roomType, useGrid);
    }
}
