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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Utility methods for room tests
 *
 * @author hal.hildebrand
 */
public class RoomTestUtils {

    /**
     * Assert the grid of a gridded room records exactly the live entities: a cell is occupied iff one entity sits
     * there, with matching kind and ID, and no two entities share a cell.
     */
    public static void assertGridConsistent(Room room) {
        assertTrue(room.hasGrid(), "Room must be gridded");
        var byPosition = new HashMap<Position, Placeable>();
        for (var entity : allEntities(room)) {
            var previous = byPosition.put(entity.getPosition(), entity);
            assertNull(previous, "Double placement at " + entity.getPosition() + ": " + previous + " and " + entity);
        }
        for (int y = 0; y < room.getHeight(); y++) {
            for (int x = 0; x < room.getWidth(); x++) {
                var position = new Position(x, y);
                var cell = room.cellAt(position).orElseThrow();
                var entity = byPosition.get(position);
                if (entity == null) {
                    assertTrue(cell.isEmpty(), "Cell " + position + " records " + cell + " but holds no entity");
                } else {
                    assertEquals(Cell.of(entity.getCellType(), entity.getId()), cell, "Cell " + position);
                }
            }
        }
    }

    public static List<Placeable> allEntities(Room room) {
        var result = new ArrayList<Placeable>();
        for (var type : CellType.values()) {
            result.addAll(room.getEntities(type));
        }
        return result;
    }

    public static Item item(String id, int x, int y) {
        return Item.builder().withId(id).withKey("torch").withName("Torch").withPosition(new Position(x, y)).build();
    }

    public static Monster monster(String id, int x, int y) {
        return monster(id, 0, x, y);
    }

    public static Monster monster(String id, int xp, int x, int y) {
        return new Monster(id, "goblin", "Goblin", 0.25, xp, new Position(x, y));
    }

    public static Npc npc(String id, int x, int y) {
        return new Npc(id, "commoner", "Commoner", new Position(x, y));
    }

    public static Obstacle obstacle(String id, int x, int y) {
        return new Obstacle(id, "pillar", "Pillar", true, new Position(x, y));
    }

    public static Player player(String id, int x, int y) {
        return new Player(id, "Aria", 3, new Position(x, y));
    }
}
