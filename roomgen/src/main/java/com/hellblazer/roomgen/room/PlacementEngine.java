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

import java.util.Objects;
import java.util.Random;

import static com.hellblazer.roomgen.room.RoomException.requireRoom;

/**
 * Single-entity placement, removal and movement. Every operation validates before it writes, so a failed call leaves
 * the room untouched.
 * <p>
 * Gridded rooms enforce bounds and occupancy. Gridless rooms skip both checks: entities are stored unconditionally and
 * positions are advisory.
 * <p>
 * The random source drives {@link #findEmptyPosition(Room)}; inject a seeded {@link Random} for reproducible
 * placement.
 *
 * @author hal.hildebrand
 */
public class PlacementEngine {
    private static final Logger log = LoggerFactory.getLogger(PlacementEngine.class);

    private final Random random;

    public PlacementEngine() {
        this(new Random());
    }

    public PlacementEngine(Random random) {
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
    }

    /**
     * Find a position for a new entity.
     * <p>
     * For a gridded room, one of the empty cells chosen uniformly at random. For a gridless room, a uniformly random
     * position within the room dimensions with no emptiness guarantee, since a gridless room cannot determine
     * occupancy.
     *
     * @throws RoomException with {@link RoomError#NO_EMPTY_POSITIONS} if every cell of a gridded room is occupied
     */
    public Position findEmptyPosition(Room room) {
        requireRoom(room);
        var grid = room.grid();
        if (grid == null) {
            return new Position(random.nextInt(room.getWidth()), random.nextInt(room.getHeight()));
        }
        var empty = grid.emptyPositions();
        if (empty.isEmpty()) {
            throw new RoomException(RoomError.NO_EMPTY_POSITIONS, "no empty positions available in room");
        }
        return empty.get(random.nextInt(empty.size()));
    }

    /**
     * Move the entity with the given ID, whatever its kind, to a new position. Moving onto the entity's own cell is a
     * permitted no-op reposition.
     *
     * @throws RoomException with {@link RoomError#ENTITY_NOT_FOUND}, {@link RoomError#INVALID_POSITION} or
     *                       {@link RoomError#CELL_OCCUPIED}
     */
    public void moveEntity(Room room, String entityId, Position newPosition) {
        requireRoom(room);
        Objects.requireNonNull(newPosition, "Position cannot be null");
        var stored = room.findStored(entityId)
                         .orElseThrow(() -> new RoomException(RoomError.ENTITY_NOT_FOUND,
                                                              "entity " + entityId + " not found in room"));
        relocate(room, stored, newPosition);
    }

    /**
     * Move a placeable to a new position, updating both the room's record and the caller's instance.
     *
     * @throws RoomException with {@link RoomError#ENTITY_NOT_FOUND}, {@link RoomError#INVALID_POSITION} or
     *                       {@link RoomError#CELL_OCCUPIED}
     */
    public void movePlaceable(Room room, Placeable entity, Position newPosition) {
        requireRoom(room);
        if (entity == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "entity cannot be null");
        }
        Objects.requireNonNull(newPosition, "Position cannot be null");
        var stored = room.findStored(entity.getCellType(), entity.getId());
        if (stored == null) {
            throw new RoomException(RoomError.ENTITY_NOT_FOUND, "entity " + entity.getId() + " not found in room");
        }
        relocate(room, stored, newPosition);
        entity.setPosition(newPosition);
    }

    /**
     * Add a copy of the entity to the room at the entity's current position.
     *
     * @throws RoomException with {@link RoomError#INVALID_POSITION} or {@link RoomError#CELL_OCCUPIED} for a gridded
     *                       room whose target cell is out of bounds or taken
     */
    public void placeEntity(Room room, Placeable entity) {
        requireRoom(room);
        if (entity == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "entity cannot be null");
        }
        var id = entity.getId();
        if (id == null || id.isBlank()) {
            throw new RoomException(RoomError.INVALID_CONFIG, entity.getCellType() + " has no ID");
        }
        if (room.findStored(id).isPresent()) {
            throw new RoomException(RoomError.INVALID_CONFIG, "entity " + id + " is already in the room");
        }
        var position = entity.getPosition();
        var grid = room.grid();
        if (grid != null) {
            if (!grid.contains(position)) {
                throw new RoomException(RoomError.INVALID_POSITION,
                                        "position " + position + " is outside room boundaries " + room.getWidth()
                                        + "x" + room.getHeight());
            }
            var cell = grid.get(position);
            if (!cell.isEmpty()) {
                throw new RoomException(RoomError.CELL_OCCUPIED,
                                        "cell " + position + " is already occupied by " + cell.entityId());
            }
        }

        room.collection(entity.getCellType()).add(entity.copy());
        if (grid != null) {
            grid.set(position, Cell.of(entity.getCellType(), id));
        }
        log.debug("Placed {} {} at {}", entity.getCellType(), id, position);
    }

    /**
     * Remove an entity by ID and kind. Absence is not a failure: callers frequently probe for presence.
     *
     * @return true if the entity was found and removed
     */
    public boolean removeEntity(Room room, String entityId, CellType type) {
        requireRoom(room);
        var collection = room.collection(type);
        if (collection == null) {
            return false;
        }
        var iterator = collection.iterator();
        while (iterator.hasNext()) {
            var entity = iterator.next();
            if (entity.getId().equals(entityId)) {
                clearCell(room.grid(), entity);
                iterator.remove();
                log.debug("Removed {} {} from {}", type, entityId, entity.getPosition());
                return true;
            }
        }
        return false;
    }

    /**
     * Remove a placeable by its own ID and kind.
     *
     * @return true if the entity was found and removed
     */
    public boolean removePlaceable(Room room, Placeable entity) {
        requireRoom(room);
        if (entity == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "entity cannot be null");
        }
        return removeEntity(room, entity.getId(), entity.getCellType());
    }

    private void clearCell(Grid grid, Placeable entity) {
        if (grid == null) {
            return;
        }
        var position = entity.getPosition();
        // Only clear a cell that still records this entity
        if (grid.contains(position) && grid.get(position).holds(entity.getCellType(), entity.getId())) {
            grid.clear(position);
        }
    }

    private void relocate(Room room, Placeable stored, Position newPosition) {
        var grid = room.grid();
        var oldPosition = stored.getPosition();
        if (grid == null) {
            stored.setPosition(newPosition);
            log.debug("Moved {} {} from {} to {} (gridless)", stored.getCellType(), stored.getId(), oldPosition,
                      newPosition);
            return;
        }
        if (!grid.contains(newPosition)) {
            throw new RoomException(RoomError.INVALID_POSITION,
                                    "new position " + newPosition + " is outside room bounds " + room.getWidth() + "x"
                                    + room.getHeight());
        }
        var target = grid.get(newPosition);
        if (!target.isEmpty() && !target.holds(stored.getCellType(), stored.getId())) {
            throw new RoomException(RoomError.CELL_OCCUPIED,
                                    "cell " + newPosition + " is already occupied by " + target.entityId());
        }
        clearCell(grid, stored);
        stored.setPosition(newPosition);
        grid.set(newPosition, Cell.of(stored.getCellType(), stored.getId()));
        log.debug("Moved {} {} from {} to {}", stored.getCellType(), stored.getId(), oldPosition, newPosition);
    }
}
