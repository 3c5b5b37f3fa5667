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
package com.hellblazer.roomgen.content;

/**
 * Source of monster reward data.
 *
 * @author hal.hildebrand
 */
public interface MonsterRepository {

    /**
     * @return the XP awarded for defeating the monster with the given content key
     * @throws com.hellblazer.roomgen.room.RoomException with
     *                                                   {@link com.hellblazer.roomgen.room.RoomError#CONTENT_NOT_FOUND}
     *                                                   for an unknown key
     */
    int getMonsterXP(String key);
}
