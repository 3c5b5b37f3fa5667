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
import com.hellblazer.roomgen.entity.Placeable;
import com.hellblazer.roomgen.geometry.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.hellblazer.roomgen.room.RoomException.requireRoom;

/**
 * Places a mixed list of entities in one pass, resolving same-cell conflicts by entity priority.
 * <p>
 * Requests are bucketed by kind and the buckets processed in {@link #PRIORITY_ORDER}: players first, then monsters,
 * NPCs, obstacles and items. Within a bucket requests keep their input order. A bucket is finished before the next
 * begins and an entity, once placed, is never displaced again, so the earliest-processed request always keeps its
 * exact cell.
 * <p>
 * A fixed-position request whose cell is taken or out of bounds is handled by the configured
 * {@link ConflictResolution}. Only structural problems (no room, malformed request, duplicate IDs) fail the batch, and
 * they are detected before anything is placed.
 *
 * @author hal.hildebrand
 */
public class BatchPlacer {
    /**
     * Fixed placement priority, highest first
     */
    public static final List<CellType> PRIORITY_ORDER = List.of(CellType.PLAYER, CellType.MONSTER, CellType.NPC,
                                                                CellType.OBSTACLE, CellType.ITEM);

    private static final Logger log = LoggerFactory.getLogger(BatchPlacer.class);

    private final PlacementEngine    engine;
    private final ConflictResolution conflictResolution;

    public BatchPlacer(PlacementEngine engine) {
        this(engine, ConflictResolution.DISPLACE);
    }

    public BatchPlacer(PlacementEngine engine, ConflictResolution conflictResolution) {
        this.engine = Objects.requireNonNull(engine, "Placement engine cannot be null");
        this.conflictResolution = Objects.requireNonNull(conflictResolution, "Conflict resolution cannot be null");
    }

    /**
     * Place every requested entity.
     *
     * @return where each entity ended up, which were displaced, and which could not be placed
     * @throws RoomException with {@link RoomError#NIL_ROOM} or {@link RoomError#INVALID_CONFIG}; the room is untouched
     *                       when these are raised
     */
    public BatchPlacementResult addPlaceablesToRoom(Room room, List<PlacementRequest> requests) {
        requireRoom(room);
        if (requests == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "placement requests cannot be null");
        }
        var buckets = partition(room, requests);

        var result = BatchPlacementResult.builder();
        for (var type : PRIORITY_ORDER) {
            for (var request : buckets.get(type)) {
                place(room, request, result);
            }
        }
        var outcome = result.build();
        log.info("Batch placement in {}x{} room: {}", room.getWidth(), room.getHeight(), outcome.getSummary());
        return outcome;
    }

    public ConflictResolution getConflictResolution() {
        return conflictResolution;
    }

    private Map<CellType, List<PlacementRequest>> partition(Room room, List<PlacementRequest> requests) {
        var buckets = new EnumMap<CellType, List<PlacementRequest>>(CellType.class);
        for (var type : PRIORITY_ORDER) {
            buckets.put(type, new ArrayList<>());
        }
        var ids = new HashSet<String>();
        for (var request : requests) {
            if (request == null) {
                throw new RoomException(RoomError.INVALID_CONFIG, "placement request cannot be null");
            }
            request.validate();
            var id = request.entity().getId();
            if (!ids.add(id) || room.findStored(id).isPresent()) {
                throw new RoomException(RoomError.INVALID_CONFIG, "duplicate entity ID " + id);
            }
            buckets.get(request.entity().getCellType()).add(request);
        }
        return buckets;
    }

    private void place(Room room, PlacementRequest request, BatchPlacementResult.Builder result) {
        Placeable entity = request.entity().copy();
        var id = entity.getId();

        if (request.randomPlace()) {
            try {
                entity.setPosition(engine.findEmptyPosition(room));
                engine.placeEntity(room, entity);
                result.withPlacement(id, entity.getPosition());
            } catch (RoomException e) {
                log.warn("Unable to place {} {}: {}", entity.getCellType(), id, e.getMessage());
                result.withFailure(id, e.getError());
            }
            return;
        }

        var requested = request.position();
        entity.setPosition(requested);
        try {
            engine.placeEntity(room, entity);
            result.withPlacement(id, requested);
            return;
        } catch (RoomException e) {
            if (!e.is(RoomError.CELL_OCCUPIED) && !e.is(RoomError.INVALID_POSITION)) {
                throw e;
            }
            if (conflictResolution == ConflictResolution.SKIP) {
                log.warn("Skipping {} {}: {}", entity.getCellType(), id, e.getMessage());
                result.withFailure(id, e.getError());
                return;
            }
        }

        Position fallback;
        try {
            fallback = engine.findEmptyPosition(room);
        } catch (RoomException e) {
            log.warn("No fallback cell for {} {} displaced from {}", entity.getCellType(), id, requested);
            result.withFailure(id, e.getError());
            return;
        }
        entity.setPosition(fallback);
        engine.placeEntity(room, entity);
        log.warn("Displaced {} {} from {} to {}", entity.getCellType(), id, requested, fallback);
        result.withDisplaced(id, fallback);
    }
}
