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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.roomgen.common.IdGenerator;
import com.hellblazer.roomgen.common.UUIDIdGenerator;
import com.hellblazer.roomgen.entity.Item;
import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Item data loaded from a JSON array on the classpath. Each entry describes equipment, a weapon or armor:
 *
 * <pre>
 * [ { "key": "longsword", "name": "Longsword", "type": "weapon", "category": "martial-weapons",
 *     "value": 15, "valueUnit": "gp", "weight": 3, "properties": ["versatile"],
 *     "damageDice": "1d8", "damageType": "slashing" }, ... ]
 * </pre>
 *
 * Random selection draws without replacement from the injected random source.
 *
 * @author hal.hildebrand
 */
public class JsonItemRepository implements ItemRepository {
    public static final String DEFAULT_RESOURCE = "/content/items.json";

    private static final Logger log = LoggerFactory.getLogger(JsonItemRepository.class);

    private final Map<String, ItemData> items;
    private final IdGenerator           idGenerator;
    private final Random                random;

    public JsonItemRepository() {
        this(DEFAULT_RESOURCE, new UUIDIdGenerator(), new Random());
    }

    public JsonItemRepository(String resource, IdGenerator idGenerator, Random random) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator cannot be null");
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
        this.items = load(resource);
        log.info("Loaded {} items from {}", items.size(), resource);
    }

    static Map<String, ItemData> load(String resource) {
        try (InputStream is = JsonItemRepository.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "item resource not found: " + resource);
            }
            var entries = new ObjectMapper().readValue(is, new TypeReference<List<ItemData>>() {
            });
            // Preserve file order so seeded selection is reproducible
            var result = new LinkedHashMap<String, ItemData>();
            for (var entry : entries) {
                result.put(entry.key(), entry);
            }
            return result;
        } catch (IOException e) {
            throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "unable to read items from " + resource, e);
        }
    }

    public Set<String> getCategories() {
        return items.values().stream().map(ItemData::category).filter(Objects::nonNull).collect(Collectors.toSet());
    }

    @Override
    public Item getItemByKey(String key) {
        var data = key == null ? null : items.get(key);
        if (data == null) {
            throw new RoomException(RoomError.CONTENT_NOT_FOUND, "unknown item: " + key);
        }
        return toItem(data);
    }

    @Override
    public List<Item> getRandomItems(int count) {
        return draw(new ArrayList<>(items.values()), count);
    }

    @Override
    public List<Item> getRandomItemsByCategory(String category, int count) {
        var candidates = items.values()
                              .stream()
                              .filter(data -> Objects.equals(category, data.category()))
                              .collect(Collectors.toCollection(ArrayList::new));
        if (candidates.isEmpty()) {
            throw new RoomException(RoomError.CONTENT_NOT_FOUND, "no items in category: " + category);
        }
        return draw(candidates, count);
    }

    private List<Item> draw(List<ItemData> candidates, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
        Collections.shuffle(candidates, random);
        return candidates.stream().limit(count).map(this::toItem).collect(Collectors.toList());
    }

    private Item toItem(ItemData data) {
        return Item.builder()
                   .withId(idGenerator.generateId())
                   .withKey(data.key())
                   .withName(data.name())
                   .withType(data.type())
                   .withCategory(data.category())
                   .withValue(data.value(), data.valueUnit())
                   .withWeight(data.weight())
                   .withProperties(data.properties())
                   .withDamage(data.damageDice(), data.damageType())
                   .withArmorClass(data.armorClass())
                   .withStealthDisadvantage(data.stealthDisadvantage())
                   .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemData(String key, String name, String type, String category, int value, String valueUnit, int weight,
                    List<String> properties, String damageDice, String damageType, int armorClass,
                    boolean stealthDisadvantage) {
    }
}
