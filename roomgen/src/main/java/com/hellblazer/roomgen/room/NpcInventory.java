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

import com.hellblazer.roomgen.common.IdGenerator;
import com.hellblazer.roomgen.common.UUIDIdGenerator;
import com.hellblazer.roomgen.entity.CellType;
import com.hellblazer.roomgen.entity.Item;
import com.hellblazer.roomgen.entity.Npc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.hellblazer.roomgen.room.RoomException.requireRoom;

/**
 * Management of the items carried by NPCs in a room. Inventory items never touch the room grid.
 *
 * @author hal.hildebrand
 */
public class NpcInventory {
    private static final Logger log = LoggerFactory.getLogger(NpcInventory.class);

    private final IdGenerator idGenerator;

    public NpcInventory() {
        this(new UUIDIdGenerator());
    }

    public NpcInventory(IdGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator cannot be null");
    }

    /**
     * Append an item to an NPC's inventory, giving it a fresh identity if it has none.
     *
     * @return a copy of the item as stored
     * @throws RoomException with {@link RoomError#ENTITY_NOT_FOUND} if the NPC is not in the room
     */
    public Item addItemToNpcInventory(Room room, String npcId, Item item) {
        var npc = requireNpc(room, npcId);
        if (item == null) {
            throw new RoomException(RoomError.INVALID_CONFIG, "item cannot be null");
        }
        var stored = item.hasId() ? item.copy() : item.withId(idGenerator.generateId());
        npc.addToInventory(stored);
        log.debug("Added item {} to inventory of NPC {}", stored.getId(), npcId);
        return stored.copy();
    }

    /**
     * @return copies of the NPC's items, in insertion order
     * @throws RoomException with {@link RoomError#ENTITY_NOT_FOUND} if the NPC is not in the room
     */
    public List<Item> getNpcInventory(Room room, String npcId) {
        return requireNpc(room, npcId).getInventory()
                                      .stream()
                                      .map(Item::copy)
                                      .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Remove and return an item from an NPC's inventory.
     *
     * @throws RoomException with {@link RoomError#ENTITY_NOT_FOUND} if the NPC is not in the room or does not carry
     *                       the item
     */
    public Item removeItemFromNpcInventory(Room room, String npcId, String itemId) {
        var npc = requireNpc(room, npcId);
        var removed = npc.removeFromInventory(itemId)
                         .orElseThrow(() -> new RoomException(RoomError.ENTITY_NOT_FOUND,
                                                              "item " + itemId + " not in inventory of NPC " + npcId));
        log.debug("Removed item {} from inventory of NPC {}", itemId, npcId);
        return removed;
    }

    private Npc requireNpc(Room room, String npcId) {
        requireRoom(room);
        var stored = room.findStored(CellType.NPC, npcId);
        if (stored == null) {
            throw new RoomException(RoomError.ENTITY_NOT_FOUND, "NPC " + npcId + " not found in room");
        }
        return (Npc) stored;
    }
}
