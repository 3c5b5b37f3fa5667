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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.roomgen.content.JsonItemRepository;
import com.hellblazer.roomgen.content.JsonMonsterRepository;
import com.hellblazer.roomgen.room.ConflictResolution;
import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Configuration for room generation. A fixed seed makes every random choice reproducible.
 *
 * @author hal.hildebrand
 */
public class RoomGenConfig {

    private Long               seed;
    private ConflictResolution conflictResolution = ConflictResolution.DISPLACE;
    private String             monsterResource    = JsonMonsterRepository.DEFAULT_RESOURCE;
    private String             itemResource       = JsonItemRepository.DEFAULT_RESOURCE;

    /**
     * Unseeded configuration using the bundled content.
     */
    public static RoomGenConfig defaultConfig() {
        return new RoomGenConfig();
    }

    /**
     * Read a configuration from a JSON classpath resource. Absent fields keep their defaults:
     *
     * <pre>
     * { "seed": 42, "conflictResolution": "DISPLACE",
     *   "monsterResource": "/content/monsters.json", "itemResource": "/content/items.json" }
     * </pre>
     */
    public static RoomGenConfig load(String resource) {
        try (InputStream is = RoomGenConfig.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "configuration not found: " + resource);
            }
            var root = new ObjectMapper().readTree(is);
            var config = new RoomGenConfig();
            if (root.hasNonNull("seed")) {
                config.withSeed(root.get("seed").asLong());
            }
            if (root.hasNonNull("conflictResolution")) {
                try {
                    config.withConflictResolution(ConflictResolution.valueOf(root.get("conflictResolution").asText()));
                } catch (IllegalArgumentException e) {
                    throw new RoomException(RoomError.INVALID_CONFIG,
                                            "unknown conflict resolution: " + root.get("conflictResolution"), e);
                }
            }
            if (root.hasNonNull("monsterResource")) {
                config.withMonsterResource(root.get("monsterResource").asText());
            }
            if (root.hasNonNull("itemResource")) {
                config.withItemResource(root.get("itemResource").asText());
            }
            return config;
        } catch (IOException e) {
            throw new RoomException(RoomError.CONTENT_UNAVAILABLE, "unable to read configuration " + resource, e);
        }
    }

    public ConflictResolution getConflictResolution() {
        return conflictResolution;
    }

    public String getItemResource() {
        return itemResource;
    }

    public String getMonsterResource() {
        return monsterResource;
    }

    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    /**
     * A random source honouring the configured seed
     */
    public Random newRandom() {
        return seed == null ? new Random() : new Random(seed);
    }

    // Fluent API for configuration

    public RoomGenConfig withConflictResolution(ConflictResolution resolution) {
        this.conflictResolution = Objects.requireNonNull(resolution, "Conflict resolution cannot be null");
        return this;
    }

    public RoomGenConfig withItemResource(String resource) {
        this.itemResource = Objects.requireNonNull(resource, "Item resource cannot be null");
        return this;
    }

    public RoomGenConfig withMonsterResource(String resource) {
        this.monsterResource = Objects.requireNonNull(resource, "Monster resource cannot be null");
        return this;
    }

    public RoomGenConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    @Override
    public String toString() {
        return String.format("RoomGenConfig[seed=%s, conflictResolution=%s, monsters=%s, items=%s]", seed,
                             conflictResolution, monsterResource, itemResource);
    }
}
