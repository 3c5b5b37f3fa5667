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

import java.util.List;

/**
 * Outcome of a room cleanup.
 *
 * @param totalXp    XP summed over removed monsters; zero for every other kind
 * @param removedIds IDs of removed entities, in removal order
 * @param notRemoved requested IDs that were not found in the matching collection
 * @author hal.hildebrand
 */
public record CleanupResult(int totalXp, List<String> removedIds, List<String> notRemoved) {

    public CleanupResult {
        removedIds = List.copyOf(removedIds);
        notRemoved = List.copyOf(notRemoved);
    }

    public int removedCount() {
        return removedIds.size();
    }
}
