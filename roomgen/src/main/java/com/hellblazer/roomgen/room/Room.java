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

import com.hellblazer.roomgen.entity.*;
import com.hellblazer.roomgen.geometry.Position;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A bounded rectangular room holding monsters, players, items, NPCs and obstacles. The per-type collections are the
 * authoritative store of entity data; the optional {@link Grid} is an occupancy index derived from them.
 * <p>
 * For a gridded room, a cell records entity E exactly when E is in its collection with E's position equal to that
 * cell. A gridless room carries no such invariant: positions are advisory and collision detection is unavailable.
 * <p>
 * All mutation of the collections and the grid is routed through {@link PlacementEngine}, {@link BatchPlacer},
 * {@link RoomCleaner} and {@link NpcInventory}. Every accessor hands out copies. Rooms are not thread-safe; callers
 * needing concurrent access must serialize mutating calls externally.
 *
 * @author hal.hildebrand
 */
public class Room {

    private final int                              width;
    private final int                              height;
    private final Map<CellType, List<Placeable>>   collections;
    private       LightLevel                       lightLevel;
    private       String                           description;
    private       RoomType                         roomType;
    private       Grid                             grid;

    private Room(RoomConfig config) {
        this.width = config.width();
        this.height = config.height();
        this.lightLevel = config.lightLevel();
        this.description = config.description();
        this.roomType = config.roomType();
        this.collections = new EnumMap<>(CellType.class);
        for (var type : CellType.values()) {
            if (type.isPlaceable()) {
                collections.put(type, new ArrayList<>());
            }
        }
        if (config.useGrid()) {
            this.grid = new Grid(width, height);
        }
    }

    /**
     * Create an empty room
     *
     * @throws RoomException with {@link RoomError#INVALID_DIMENSIONS} for a non-positive width or height
     */
    public static Room create(RoomConfig config) {
        Objects.requireNonNull(config, "Room config cannot be null");
        config.validate();
        return new Room(config);
    }

    /**
     * The grid cell at the given position, or empty for a gridless room
     *
     * @throws RoomException with {@link RoomError#INVALID_POSITION} if the position lies outside a gridded room
     */
    public Optional<Cell> cellAt(Position position) {
        if (grid == null) {
            return Optional.empty();
        }
        if (!grid.contains(position)) {
            throw new RoomException(RoomError.INVALID_POSITION, "position " + position + " is outside room bounds");
        }
        return Optional.of(grid.get(position));
    }

    /**
     * Find any entity by ID
     *
     * @return a copy of the entity, or empty if the room does not hold it
     */
    public Optional<Placeable> findEntity(String id) {
        return findStored(id).map(Placeable::copy);
    }

    public String getDescription() {
        return description;
    }

    /**
     * Copies of all entities of the given kind, in placement order
     */
    public List<Placeable> getEntities(CellType type) {
        var collection = collections.get(type);
        if (collection == null) {
            return List.of();
        }
        return collection.stream().map(Placeable::copy).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Total number of entities across all collections
     */
    public int getEntityCount() {
        return collections.values().stream().mapToInt(List::size).sum();
    }

    public int getEntityCount(CellType type) {
        var collection = collections.get(type);
        return collection == null ? 0 : collection.size();
    }

    public int getHeight() {
        return height;
    }

    public List<Item> getItems() {
        return typed(CellType.ITEM, Item.class);
    }

    public LightLevel getLightLevel() {
        return lightLevel;
    }

    public List<Monster> getMonsters() {
        return typed(CellType.MONSTER, Monster.class);
    }

    public List<Npc> getNpcs() {
        return typed(CellType.NPC, Npc.class);
    }

    public List<Obstacle> getObstacles() {
        return typed(CellType.OBSTACLE, Obstacle.class);
    }

    public List<Player> getPlayers() {
        return typed(CellType.PLAYER, Player.class);
    }

    public RoomType getRoomType() {
        return roomType;
    }

    public int getWidth() {
        return width;
    }

    public boolean hasGrid() {
        return grid != null;
    }

    /**
     * Convert a gridless room into a gridded one, indexing every entity it already holds. If any entity lies out of
     * bounds or shares a cell with another, the room is left gridless.
     *
     * @throws RoomException with {@link RoomError#INVALID_POSITION} or {@link RoomError#CELL_OCCUPIED}
     */
    public void initializeGrid() {
        if (grid != null) {
            return;
        }
        var index = new Grid(width, height);
        for (var collection : collections.values()) {
            for (var entity : collection) {
                var position = entity.getPosition();
                if (!index.contains(position)) {
                    throw new RoomException(RoomError.INVALID_POSITION,
                                            entity.getId() + " at " + position + " is outside room bounds");
                }
                if (!index.isEmpty(position)) {
                    throw new RoomException(RoomError.CELL_OCCUPIED,
                                            entity.getId() + " collides with " + index.get(position).entityId()
                                            + " at " + position);
                }
                index.set(position, Cell.of(entity.getCellType(), entity.getId()));
            }
        }
        grid = index;
    }

    public boolean isEmpty() {
        return getEntityCount() == 0;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public void setLightLevel(LightLevel lightLevel) {
        this.lightLevel = Objects.requireNonNull(lightLevel, "Light level cannot be null");
    }

    public void setRoomType(RoomType roomType) {
        this.roomType = Objects.requireNonNull(roomType, "Room type cannot be null");
    }

    @Override
    public String toString() {
        return String.format("Room[%dx%d, %s, %s, grid=%s, monsters=%d, players=%d, items=%d, npcs=%d, obstacles=%d]",
                             width, height, roomType, lightLevel, grid != null, getEntityCount(CellType.MONSTER),
                             getEntityCount(CellType.PLAYER), getEntityCount(CellType.ITEM),
                             getEntityCount(CellType.NPC), getEntityCount(CellType.OBSTACLE));
    }

    // ===== Internal access for the placement operations =====

    /**
     * The live collection for the given kind, or null for {@link CellType#EMPTY}
     */
    List<Placeable> collection(CellType type) {
        return collections.get(type);
    }

    /**
     * The live stored entity, or null
     */
    Placeable findStored(CellType type, String id) {
        var collection = collections.get(type);
        if (collection == null) {
            return null;
        }
        for (var entity : collection) {
            if (entity.getId().equals(id)) {
                return entity;
            }
        }
        return null;
    }

    Optional<Placeable> findStored(String id) {
        for (var type : collections.keySet()) {
            var entity = findStored(type, id);
            if (entity != null) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    Grid grid() {
        return grid;
    }

    private <T extends Placeable> List<T> typed(CellType type, Class<T> clazz) {
        Function<Placeable, T> cast = entity -> clazz.cast(entity.copy());
        return collections.get(type).stream().map(cast).collect(Collectors.toUnmodifiableList());
    }
}
