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
import com.hellblazer.roomgen.entity.Monster;
import com.hellblazer.roomgen.entity.Placeable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;

import static com.hellblazer.roomgen.room.RoomException.requireRoom;

/**
 * Bulk removal of one kind of entity, aggregating the XP reward of removed monsters. Every removal goes through
 * {@link PlacementEngine#removeEntity(Room, String, CellType)}, so grid cells are cleared exactly as for a single
 * removal.
 *
 * @author hal.hildebrand
 */
public class RoomCleaner {
    private static final Logger log = LoggerFactory.getLogger(RoomCleaner.class);

    private final PlacementEngine engine;

    public RoomCleaner(PlacementEngine engine) {
        this.engine = Objects.requireNonNull(engine, "Placement engine cannot be null");
    }

    /**
     * Remove entities of the given kind.
     *
     * @param ids the IDs to remove; null or empty removes every entity of the kind. Repeated IDs count once. IDs not
     *            found are reported in {@link CleanupResult#notRemoved()}, never raised.
     * @throws RoomException with {@link RoomError#NIL_ROOM}, {@link RoomError#UNSUPPORTED_CELL_TYPE} for
     *                       {@link CellType#EMPTY}, or {@link RoomError#INVALID_CONFIG} for a null ID; the room is
     *                       untouched when these are raised
     */
    public CleanupResult cleanupRoom(Room room, CellType cellType, Collection<String> ids) {
        requireRoom(room);
        if (cellType == null || !cellType.isPlaceable()) {
            throw new RoomException(RoomError.UNSUPPORTED_CELL_TYPE, "unsupported entity type: " + cellType);
        }

        var targets = new LinkedHashSet<String>();
        if (ids == null || ids.isEmpty()) {
            // Snapshot, removal mutates the collection
            for (var entity : room.collection(cellType)) {
                targets.add(entity.getId());
            }
        } else {
            for (var id : ids) {
                if (id == null) {
                    throw new RoomException(RoomError.INVALID_CONFIG, "cleanup IDs cannot contain null");
                }
                targets.add(id);
            }
        }

        int totalXp = 0;
        var removed = new ArrayList<String>();
        var notRemoved = new ArrayList<String>();
        for (var id : targets) {
            var stored = room.findStored(cellType, id);
            if (stored != null && engine.removeEntity(room, id, cellType)) {
                totalXp += rewardOf(stored);
                removed.add(id);
            } else {
                notRemoved.add(id);
            }
        }

        log.info("Cleaned {} {} entities from room, {} not found, {} XP", removed.size(), cellType,
                 notRemoved.size(), totalXp);
        return new CleanupResult(totalXp, removed, notRemoved);
    }

    private int rewardOf(Placeable entity) {
        return entity instanceof Monster monster ? monster.getXp() : 0;
    }
}
