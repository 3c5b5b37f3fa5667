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
package com.hellblazer.roomgen.service;

import com.hellblazer.roomgen.balance.MonsterConfig;
import com.hellblazer.roomgen.content.JsonItemRepository;
import com.hellblazer.roomgen.content.JsonMonsterRepository;
import com.hellblazer.roomgen.entity.CellType;
import com.hellblazer.roomgen.geometry.Position;
import com.hellblazer.roomgen.room.ConflictResolution;
import com.hellblazer.roomgen.room.RoomConfig;
import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RoomGenConfigTest {

    @Test
    void testDefaults() {
        var config = RoomGenConfig.defaultConfig();
        assertTrue(config.getSeed().isEmpty());
        assertEquals(ConflictResolution.DISPLACE, config.getConflictResolution());
        assertEquals(JsonMonsterRepository.DEFAULT_RESOURCE, config.getMonsterResource());
        assertEquals(JsonItemRepository.DEFAULT_RESOURCE, config.getItemResource());
    }

    @Test
    void testLoad() {
        var config = RoomGenConfig.load("/roomgen-test.json");
        assertEquals(42L, config.getSeed().orElseThrow());
        assertEquals(ConflictResolution.SKIP, config.getConflictResolution());
        assertEquals(JsonItemRepository.DEFAULT_RESOURCE, config.getItemResource());
    }

    @Test
    void testLoadFailures() {
        var missing = assertThrows(RoomException.class, () -> RoomGenConfig.load("/no-such-config.json"));
        assertEquals(RoomError.CONTENT_UNAVAILABLE, missing.getError());

        var invalid = assertThrows(RoomException.class, () -> RoomGenConfig.load("/roomgen-invalid.json"));
        assertEquals(RoomError.INVALID_CONFIG, invalid.getError());
    }

    @Test
    void testSeedIsReproducible() {
        var config = RoomGenConfig.defaultConfig().withSeed(7);
        var a = config.newRandom();
        var b = config.newRandom();
        for (int i = 0; i < 10; i++) {
            assertEquals(a.nextInt(100), b.nextInt(100));
        }
    }

    @Test
    void testServiceFromConfig() {
        var service = RoomService.fromConfig(RoomGenConfig.load("/roomgen-test.json"));
        var room = service.generateRoom(RoomConfig.gridded(6, 6));

        var target = new Position(1, 1);
        var goblins = new MonsterConfig("Goblin", "goblin", 0.25, 2, false, target);
        var result = service.addMonstersToRoom(room, List.of(goblins));
        service.addItemsToRoom(room, List.of(ItemConfig.random("dagger", 2)));

        assertEquals(2, room.getItems().size());
        // Second goblin is skipped rather than displaced
        assertEquals(1, result.getSuccessCount());
        assertEquals(1, result.getFailureCount());
        assertEquals(50, service.cleanupRoom(room, CellType.MONSTER, null).totalXp());
    }
}
