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

import com.hellblazer.roomgen.geometry.Position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a batch placement, providing detailed information about where each entity ended up.
 *
 * @author hal.hildebrand
 */
public class BatchPlacementResult {

    private final Map<String, Position>  placements;
    private final Map<String, Position>  displaced;
    private final Map<String, RoomError> failures;

    private BatchPlacementResult(Builder builder) {
        this.placements = Collections.unmodifiableMap(new LinkedHashMap<>(builder.placements));
        this.displaced = Collections.unmodifiableMap(new LinkedHashMap<>(builder.displaced));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.failures));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entities moved off their requested cell, mapped to the fallback position they were placed at.
     */
    public Map<String, Position> getDisplaced() {
        return displaced;
    }

    public int getFailureCount() {
        return failures.size();
    }

    /**
     * Entities that could not be placed, mapped to the reason.
     */
    public Map<String, RoomError> getFailures() {
        return failures;
    }

    /**
     * IDs of placed entities, in processing order (priority band first, then input order).
     */
    public List<String> getPlacedIds() {
        return List.copyOf(placements.keySet());
    }

    /**
     * Final position of every placed entity.
     */
    public Map<String, Position> getPlacements() {
        return placements;
    }

    public int getSuccessCount() {
        return placements.size();
    }

    /**
     * Get a summary string of the operation results.
     */
    public String getSummary() {
        return String.format("BatchPlacementResult[placed=%d, displaced=%d, failed=%d]", placements.size(),
                             displaced.size(), failures.size());
    }

    /**
     * Check if every entity was placed.
     */
    public boolean isCompleteSuccess() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return getSummary();
    }

    /**
     * Builder for BatchPlacementResult.
     */
    public static class Builder {
        private final Map<String, Position>  placements = new LinkedHashMap<>();
        private final Map<String, Position>  displaced  = new LinkedHashMap<>();
        private final Map<String, RoomError> failures   = new LinkedHashMap<>();

        public BatchPlacementResult build() {
            return new BatchPlacementResult(this);
        }

        public Builder withDisplaced(String id, Position fallback) {
            displaced.put(id, fallback);
            placements.put(id, fallback);
            return this;
        }

        public Builder withFailure(String id, RoomError error) {
            failures.put(id, error);
            return this;
        }

        public Builder withPlacement(String id, Position position) {
            placements.put(id, position);
            return this;
        }
    }
}
