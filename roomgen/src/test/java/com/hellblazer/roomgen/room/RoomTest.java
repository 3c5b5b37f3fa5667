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
import com.hellblazer.roomgen.geometry.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static com.hellblazer.roomgen.room.RoomTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RoomTest {

    private PlacementEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PlacementEngine(new Random(42));
    }

    @Test
    void testAccessorsReturnCopies() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        engine.placeEntity(room, monster("m1", 1, 1));

        var copy = room.getMonsters().get(0);
        copy.setPosition(new Position(3, 3));
        room.findEntity("m1").orElseThrow().setPosition(new Position(4, 4));

        assertEquals(new Position(1, 1), room.getMonsters().get(0).getPosition());
        assertThrows(UnsupportedOperationException.class, () -> room.getMonsters().clear());
        assertGridConsistent(room);
    }

    @Test
    void testCellAt() {
        var room = Room.create(RoomConfig.gridded(3, 3));
        assertEquals(Cell.EMPTY, room.cellAt(new Position(2, 2)).orElseThrow());
        var e = assertThrows(RoomException.class, () -> room.cellAt(new Position(3, 0)));
        assertEquals(RoomError.INVALID_POSITION, e.getError());

        var gridless = Room.create(RoomConfig.gridless(3, 3));
        assertTrue(gridless.cellAt(new Position(7, 7)).isEmpty());
    }

    @Test
    void testCreateWithDefaults() {
        var room = Room.create(RoomConfig.gridded(8, 6));
        assertEquals(8, room.getWidth());
        assertEquals(6, room.getHeight());
        assertEquals(LightLevel.BRIGHT, room.getLightLevel());
        assertEquals(RoomType.COMBAT, room.getRoomType());
        assertEquals("", room.getDescription());
        assertTrue(room.hasGrid());
        assertTrue(room.isEmpty());

        var dark = Room.create(RoomConfig.gridless(4, 4)
                                         .withLightLevel(LightLevel.DARK)
                                         .withDescription("A damp cellar")
                                         .withRoomType(RoomType.TREASURE));
        assertFalse(dark.hasGrid());
        assertEquals(LightLevel.DARK, dark.getLightLevel());
        assertEquals("A damp cellar", dark.getDescription());
        assertEquals(RoomType.TREASURE, dark.getRoomType());
        assertFalse(RoomType.TREASURE.getDescription().isEmpty());
    }

    @Test
    void testEntityCounts() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        engine.placeEntity(room, monster("m1", 0, 0));
        engine.placeEntity(room, monster("m2", 1, 0));
        engine.placeEntity(room, obstacle("o1", 2, 0));

        assertEquals(3, room.getEntityCount());
        assertEquals(2, room.getEntityCount(CellType.MONSTER));
        assertEquals(1, room.getObstacles().size());
        assertEquals(0, room.getEntityCount(CellType.EMPTY));
        assertTrue(room.getEntities(CellType.EMPTY).isEmpty());
    }

    @Test
    void testInitializeGridConflictLeavesRoomGridless() {
        var room = Room.create(RoomConfig.gridless(5, 5));
        engine.placeEntity(room, monster("m1", 1, 1));
        engine.placeEntity(room, item("i1", 1, 1));

        var e = assertThrows(RoomException.class, room::initializeGrid);
        assertEquals(RoomError.CELL_OCCUPIED, e.getError());
        assertFalse(room.hasGrid());

        var outside = Room.create(RoomConfig.gridless(5, 5));
        engine.placeEntity(outside, monster("m1", 9, 9));
        var e2 = assertThrows(RoomException.class, outside::initializeGrid);
        assertEquals(RoomError.INVALID_POSITION, e2.getError());
        assertFalse(outside.hasGrid());
    }

    @Test
    void testInitializeGridIndexesExistingEntities() {
        var room = Room.create(RoomConfig.gridless(5, 5));
        engine.placeEntity(room, monster("m1", 1, 1));
        engine.placeEntity(room, player("p1", 4, 0));

        room.initializeGrid();

        assertTrue(room.hasGrid());
        assertEquals(Cell.of(CellType.MONSTER, "m1"), room.cellAt(new Position(1, 1)).orElseThrow());
        assertEquals(Cell.of(CellType.PLAYER, "p1"), room.cellAt(new Position(4, 0)).orElseThrow());
        assertGridConsistent(room);

        var e = assertThrows(RoomException.class, () -> engine.placeEntity(room, item("i1", 1, 1)));
        assertEquals(RoomError.CELL_OCCUPIED, e.getError());
    }

    @ParameterizedTest
    @CsvSource({ "0, 5", "5, 0", "-1, 3", "3, -2" })
    void testInvalidDimensions(int width, int height) {
        var e = assertThrows(RoomException.class, () -> Room.create(RoomConfig.gridded(width, height)));
        assertEquals(RoomError.INVALID_DIMENSIONS, e.getError());
    }

    @Test
    void testCellInvariants() {
        assertTrue(Cell.EMPTY.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Cell(CellType.MONSTER, null));
        assertThrows(IllegalArgumentException.class, () -> new Cell(CellType.EMPTY, "m1"));
        assertTrue(Cell.of(CellType.NPC, "n1").holds(CellType.NPC, "n1"));
        assertFalse(Cell.of(CellType.NPC, "n1").holds(CellType.MONSTER, "n1"));
    }
}
