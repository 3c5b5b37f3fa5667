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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static com.hellblazer.roomgen.room.RoomTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BatchPlacerTest {

    private PlacementEngine engine;
    private BatchPlacer     placer;

    @BeforeEach
    void setUp() {
        engine = new PlacementEngine(new Random(42));
        placer = new BatchPlacer(engine);
    }

    @Test
    void testDuplicateIdsRejectedBeforePlacement() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        var requests = List.of(PlacementRequest.at(player("p1", 0, 0), new Position(0, 0)),
                               PlacementRequest.random(monster("p1", 0, 0)));
        var e = assertThrows(RoomException.class, () -> placer.addPlaceablesToRoom(room, requests));
        assertEquals(RoomError.INVALID_CONFIG, e.getError());
        assertTrue(room.isEmpty());
    }

    @Test
    void testEarlierPlacedEntityIsNeverDisplaced() {
        var room = Room.create(RoomConfig.gridded(6, 6));
        engine.placeEntity(room, item("i0", 1, 1));

        var result = placer.addPlaceablesToRoom(room, List.of(PlacementRequest.at(player("p1", 0, 0),
                                                                                  new Position(1, 1))));
        assertTrue(result.getDisplaced().containsKey("p1"));
        assertEquals(Cell.of(CellType.ITEM, "i0"), room.cellAt(new Position(1, 1)).orElseThrow());
        assertNotEquals(new Position(1, 1), room.findEntity("p1").orElseThrow().getPosition());
        assertGridConsistent(room);
    }

    @Test
    void testExhaustionDuringFallbackIsPerEntityFailure() {
        var room = Room.create(RoomConfig.gridded(2, 1));
        var target = new Position(0, 0);
        var requests = List.of(PlacementRequest.at(item("i1", 0, 0), target),
                               PlacementRequest.at(monster("m1", 0, 0), target),
                               PlacementRequest.at(player("p1", 0, 0), target));

        var result = placer.addPlaceablesToRoom(room, requests);

        assertEquals(target, result.getPlacements().get("p1"));
        assertEquals(new Position(1, 0), result.getDisplaced().get("m1"));
        assertEquals(RoomError.NO_EMPTY_POSITIONS, result.getFailures().get("i1"));
        assertFalse(result.isCompleteSuccess());
        assertEquals(2, result.getSuccessCount());
        assertEquals(1, result.getFailureCount());
        assertTrue(room.getItems().isEmpty());
        assertGridConsistent(room);
    }

    @Test
    void testGridlessBatchHasNoConflicts() {
        var room = Room.create(RoomConfig.gridless(10, 10));
        var target = new Position(1, 1);
        var result = placer.addPlaceablesToRoom(room, List.of(PlacementRequest.at(monster("m1", 0, 0), target),
                                                              PlacementRequest.at(player("p1", 0, 0), target),
                                                              PlacementRequest.at(item("i1", 0, 0), target)));

        assertTrue(result.isCompleteSuccess());
        assertTrue(result.getDisplaced().isEmpty());
        for (var entity : allEntities(room)) {
            assertEquals(target, entity.getPosition());
        }
    }

    @Test
    void testInputOrderWithinPriorityBand() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        var target = new Position(3, 3);
        var result = placer.addPlaceablesToRoom(room, List.of(PlacementRequest.at(monster("m1", 0, 0), target),
                                                              PlacementRequest.at(monster("m2", 0, 0), target)));

        assertEquals(target, room.findEntity("m1").orElseThrow().getPosition());
        assertTrue(result.getDisplaced().containsKey("m2"));
        assertEquals(List.of("m1", "m2"), result.getPlacedIds());
        assertGridConsistent(room);
    }

    @Test
    void testMalformedRequestAbortsBeforePlacement() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        var requests = new ArrayList<PlacementRequest>();
        requests.add(PlacementRequest.at(player("p1", 0, 0), new Position(0, 0)));
        requests.add(new PlacementRequest(monster("m1", 0, 0), false, null));

        var e = assertThrows(RoomException.class, () -> placer.addPlaceablesToRoom(room, requests));
        assertEquals(RoomError.INVALID_CONFIG, e.getError());
        assertTrue(room.isEmpty());

        requests.set(1, null);
        assertThrows(RoomException.class, () -> placer.addPlaceablesToRoom(room, requests));
        assertTrue(room.isEmpty());
    }

    @Test
    void testNilRoom() {
        var e = assertThrows(RoomException.class, () -> placer.addPlaceablesToRoom(null, List.of()));
        assertEquals(RoomError.NIL_ROOM, e.getError());
    }

    @Test
    void testOutOfBoundsRequestIsDisplaced() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        var result = placer.addPlaceablesToRoom(room, List.of(PlacementRequest.at(npc("n1", 0, 0),
                                                                                  new Position(20, 20))));
        var fallback = result.getDisplaced().get("n1");
        assertNotNull(fallback);
        assertTrue(fallback.isWithin(5, 5));
        assertGridConsistent(room);
    }

    @Test
    @DisplayName("Player keeps its cell when every kind requests the same cell")
    void testPriorityResolution() {
        var room = Room.create(RoomConfig.gridded(10, 10));
        var target = new Position(2, 2);
        // Lowest priority first, to show input order does not matter across kinds
        var requests = List.of(PlacementRequest.at(item("i1", 0, 0), target),
                               PlacementRequest.at(obstacle("o1", 0, 0), target),
                               PlacementRequest.at(npc("n1", 0, 0), target),
                               PlacementRequest.at(monster("m1", 0, 0), target),
                               PlacementRequest.at(player("p1", 0, 0), target));

        var result = placer.addPlaceablesToRoom(room, requests);

        assertTrue(result.isCompleteSuccess());
        assertEquals(5, result.getSuccessCount());
        assertEquals(Cell.of(CellType.PLAYER, "p1"), room.cellAt(target).orElseThrow());
        assertEquals(List.of("p1", "m1", "n1", "o1", "i1"), result.getPlacedIds());
        assertEquals(4, result.getDisplaced().size());

        var positions = new HashSet<Position>();
        for (var entity : allEntities(room)) {
            assertTrue(entity.getPosition().isWithin(10, 10));
            assertTrue(positions.add(entity.getPosition()), "Shared position " + entity.getPosition());
            if (!entity.getId().equals("p1")) {
                assertNotEquals(target, entity.getPosition());
                assertEquals(entity.getPosition(), result.getDisplaced().get(entity.getId()));
            }
        }
        assertGridConsistent(room);
    }

    @Test
    void testRandomPlacementFillsRoom() {
        var room = Room.create(RoomConfig.gridded(5, 4));
        var requests = new ArrayList<PlacementRequest>();
        for (int i = 0; i < 20; i++) {
            requests.add(PlacementRequest.random(item("i" + i, 0, 0)));
        }
        var result = placer.addPlaceablesToRoom(room, requests);

        assertTrue(result.isCompleteSuccess());
        assertEquals(20, room.getItems().size());
        assertTrue(result.getDisplaced().isEmpty());
        assertGridConsistent(room);

        var overflow = placer.addPlaceablesToRoom(room, List.of(PlacementRequest.random(monster("m1", 0, 0))));
        assertEquals(RoomError.NO_EMPTY_POSITIONS, overflow.getFailures().get("m1"));
    }

    @Test
    void testRequestEntityIsNotMutated() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        Placeable monster = monster("m1", 0, 0);
        placer.addPlaceablesToRoom(room, List.of(PlacementRequest.at(monster, new Position(4, 1))));

        assertEquals(new Position(0, 0), monster.getPosition());
        assertEquals(new Position(4, 1), room.findEntity("m1").orElseThrow().getPosition());
    }

    @Test
    void testSkipPolicyRecordsFailure() {
        var room = Room.create(RoomConfig.gridded(5, 5));
        var skipping = new BatchPlacer(engine, ConflictResolution.SKIP);
        var target = new Position(2, 2);
        var result = skipping.addPlaceablesToRoom(room, List.of(PlacementRequest.at(monster("m1", 0, 0), target),
                                                                PlacementRequest.at(player("p1", 0, 0), target),
                                                                PlacementRequest.at(item("i1", 0, 0),
                                                                                    new Position(9, 9))));

        assertEquals(target, result.getPlacements().get("p1"));
        assertEquals(RoomError.CELL_OCCUPIED, result.getFailures().get("m1"));
        assertEquals(RoomError.INVALID_POSITION, result.getFailures().get("i1"));
        assertTrue(result.getDisplaced().isEmpty());
        assertEquals(1, room.getEntityCount());
    }
}
