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

import com.hellblazer.roomgen.entity.Item;

import java.util.List;

/**
 * Source of item data. Every returned item is a fresh instance with its own identity, ready to hand to the placement
 * engine.
 *
 * @author hal.hildebrand
 */
public interface ItemRepository {

    Item getItemByKey(String key);

    /**
     * Up to {@code count} distinct items chosen at random
     */
    List<Item> getRandomItems(int count);

    /**
     * Up to {@code count} distinct items of the given equipment category chosen at random
     */
    List<Item> getRandomItemsByCategory(String category, int count);
}
