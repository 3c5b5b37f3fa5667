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
package com.hellblazer.roomgen.entity;

import com.hellblazer.roomgen.geometry.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A non-player character. Carries an ordered inventory of items which is independent of room placement: inventory
 * items never occupy grid cells.
 *
 * @author hal.hildebrand
 */
public final class Npc implements Placeable {
    private final String     id;
    private final String     key;
    private final String     name;
    private final List<Item> inventory;
    private       Position   position;

    public Npc(String id, String key, String name, Position position) {
        this(id, key, name, List.of(), position);
    }

    public Npc(String id, String key, String name, List<Item> inventory, Position position) {
        this.id = Objects.requireNonNull(id, "NPC ID cannot be null");
        this.key = key;
        this.name = name;
        this.position = Objects.requireNonNull(position, "Position cannot be null");
        this.inventory = new ArrayList<>(inventory.size());
        for (var item : inventory) {
            this.inventory.add(item.copy());
        }
    }

    /**
     * Append a copy of the item to the end of the inventory
     */
    public void addToInventory(Item item) {
        inventory.add(item.copy());
    }

    @Override
    public Npc copy() {
        return new Npc(id, key, name, inventory, position);
    }

    @Override
    public CellType getCellType() {
        return CellType.NPC;
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * @return unmodifiable view of the inventory, in insertion order
     */
    public List<Item> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    /**
     * Remove the first inventory item with the given ID, preserving the order of the rest
     *
     * @return the removed item, or empty if the NPC does not carry it
     */
    public Optional<Item> removeFromInventory(String itemId) {
        var iterator = inventory.iterator();
        while (iterator.hasNext()) {
            var item = iterator.next();
            if (Objects.equals(item.getId(), itemId)) {
                iterator.remove();
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    @Override
    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public String toString() {
        return "NPC[" + id + ", " + name + ", " + inventory.size() + " items @ " + position + "]";
    }
}
