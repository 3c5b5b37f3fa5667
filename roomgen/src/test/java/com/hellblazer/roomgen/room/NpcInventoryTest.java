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

import com.hellblazer.roomgen.common.SequentialIdGenerator;
import com.hellblazer.roomgen.entity.Item;
import com.hellblazer.roomgen.geometry.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.hellblazer.roomgen.room.RoomTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class NpcInventoryTest {

    private NpcInventory inventory;
    private Room         room;

    @BeforeEach
    void setUp() {
        inventory = new NpcInventory(new SequentialIdGenerator("item", 1));
        room = Room.create(RoomConfig.gridded(5, 5));
        new PlacementEngine(new Random(42)).placeEntity(room, npc("n1", 2, 2));
    }

    @Test
    void testAddAssignsFreshId() {
        var potion = Item.builder().withKey("potion-of-healing").withName("Potion of Healing").build();
        assertFalse(potion.hasId());

        var stored = inventory.addItemToNpcInventory(room, "n1", potion);

        assertEquals("item-1", stored.getId());
        assertEquals("potion-of-healing", stored.getKey());
        assertEquals(1, inventory.getNpcInventory(room, "n1").size());
        // Inventory never touches the room grid or item collection
        assertTrue(room.getItems().isEmpty());
        assertEquals(1, room.getEntityCount());
        assertGridConsistent(room);
    }

    @Test
    void testAddKeepsExistingId() {
        var stored = inventory.addItemToNpcInventory(room, "n1", item("torch-7", 0, 0));
        assertEquals("torch-7", stored.getId());
        assertEquals("torch-7", inventory.getNpcInventory(room, "n1").get(0).getId());
    }

    @Test
    void testInventoryCopiesAreIndependent() {
        inventory.addItemToNpcInventory(room, "n1", item("torch-1", 0, 0));
        var copy = inventory.getNpcInventory(room, "n1").get(0);
        copy.setPosition(new Position(4, 4));

        assertEquals(new Position(0, 0), inventory.getNpcInventory(room, "n1").get(0).getPosition());
        assertThrows(UnsupportedOperationException.class,
                     () -> inventory.getNpcInventory(room, "n1").add(item("x", 0, 0)));
    }

    @Test
    void testNullItem() {
        var e = assertThrows(RoomException.class, () -> inventory.addItemToNpcInventory(room, "n1", null));
        assertEquals(RoomError.INVALID_CONFIG, e.getError());
    }

    @Test
    void testRemoveItem() {
        inventory.addItemToNpcInventory(room, "n1", item("torch-1", 0, 0));
        inventory.addItemToNpcInventory(room, "n1", item("torch-2", 0, 0));

        var removed = inventory.removeItemFromNpcInventory(room, "n1", "torch-1");
        assertEquals("torch-1", removed.getId());
        var remaining = inventory.getNpcInventory(room, "n1");
        assertEquals(1, remaining.size());
        assertEquals("torch-2", remaining.get(0).getId());

        var e = assertThrows(RoomException.class,
                             () -> inventory.removeItemFromNpcInventory(room, "n1", "torch-1"));
        assertEquals(RoomError.ENTITY_NOT_FOUND, e.getError());
    }

    @Test
    void testUnknownNpc() {
        var e = assertThrows(RoomException.class, () -> inventory.getNpcInventory(room, "n2"));
        assertEquals(RoomError.ENTITY_NOT_FOUND, e.getError());

        var e2 = assertThrows(RoomException.class,
                              () -> inventory.addItemToNpcInventory(null, "n1", item("i", 0, 0)));
        assertEquals(RoomError.NIL_ROOM, e2.getError());
    }
}
