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
import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Monster data loaded from a JSON array on the classpath:
 *
 * <pre>
 * [ { "key": "goblin", "name": "Goblin", "challengeRating": 0.25, "xp": 50 }, ... ]
 * </pre>
 *
 * @author hal.hildebrand
 */
public class JsonMonsterRepository implements MonsterRepository {
    public static final String DEFAULT_RESOURCE = "/content/monsters.json";

    private static final Logger log = LoggerFactory.getLogger(JsonMonsterRepository.class);

    private final Map<String, MonsterData> monsters;

    public JsonMonsterRepository() {
        this(DEFAULT_RESOURCE);
    }

    public JsonMonsterRepository(String resource) {
        this.monsters = load(resource);
        log.info("Loaded {} monsters from {}", monsters.size(), resource);
    }

    static Map<String, MonsterData> load(String resource) {
        try (InputStream is = JsonMonsterRepository.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "monster resource not found: " + resource);
            }
            var entries = new ObjectMapper().readValue(is, new TypeReference<List<MonsterData>>() {
            });
            var result = new HashMap<String, MonsterData>();
            for (var entry : entries) {
                result.put(entry.key(), entry);
            }
            return result;
        } catch (IOException e) {
            throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "unable to read monsters from " + resource, e);
        }
    }

    /**
     * Challenge rating of the monster with the given key
     */
    public double getChallengeRating(String key) {
        return require(key).challengeRating();
    }

    public Set<String> getKeys() {
        return Set.copyOf(monsters.keySet());
    }

    @Override
    public int getMonsterXP(String key) {
        return require(key).xp();
    }

    public String getName(String key) {
        return require(key).name();
    }

    private MonsterData require(String key) {
        var data = key == null ? null : monsters.get(key);
        if (data == null) {
            throw new RoomException(RoomError.CONTENT_NOT_FOUND, "unknown monster: " + key);
        }
        return data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MonsterData(String key, String name, double challengeRating, int xp) {
    }
}
