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

import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class JsonMonsterRepositoryTest {

    @Test
    void testBundledMonsters() {
        var repository = new JsonMonsterRepository();
        assertEquals(50, repository.getMonsterXP("goblin"));
        assertEquals(450, repository.getMonsterXP("ogre"));
        assertEquals(15000, repository.getMonsterXP("iron-golem"));
        assertEquals(2.0, repository.getChallengeRating("ogre"));
        assertEquals("Young Green Dragon", repository.getName("young-green-dragon"));
        assertTrue(repository.getKeys().contains("troll"));
    }

    @Test
    void testMissingResource() {
        var e = assertThrows(RoomException.class, () -> new JsonMonsterRepository("/content/no-such-file.json"));
        assertEquals(RoomError.CONTENT_UNAVAILABLE, e.getError());
    }

    @Test
    void testUnknownMonster() {
        var repository = new JsonMonsterRepository();
        var e = assertThrows(RoomException.class, () -> repository.getMonsterXP("beholder"));
        assertEquals(RoomError.CONTENT_NOT_FOUND, e.getError());
        assertThrows(RoomException.class, () -> repository.getMonsterXP(null));
    }
}
