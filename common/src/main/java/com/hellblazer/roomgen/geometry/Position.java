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
package com.hellblazer.roomgen.geometry;

/**
 * Immutable 2D grid coordinate. A position carries no bounds of its own; validity is always relative to the room it is
 * used in.
 *
 * @author hal.hildebrand
 */
public record Position(int x, int y) {

    /**
     * Create a position at the origin (0, 0).
     *
     * @return position at origin
     */
    public static Position origin() {
        return new Position(0, 0);
    }

    /**
     * Distance in grid squares using tabletop movement rules, where a diagonal step costs the same as an orthogonal one
     * (Chebyshev distance).
     *
     * @param other the other position
     * @return max(|dx|, |dy|)
     */
    public int distanceTo(Position other) {
        return Math.max(Math.abs(other.x - x), Math.abs(other.y - y));
    }

    /**
     * Check whether this position lies in [0, width) x [0, height).
     */
    public boolean isWithin(int width, int height) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Translate by the given offsets.
     *
     * @return new translated position
     */
    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
