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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Occupancy index of a room, Height x Width cells addressed as [y][x]. The grid is derived from the room's entity
 * collections and is only ever written by the room's own placement operations.
 *
 * @author hal.hildebrand
 */
final class Grid {
    private final int      width;
    private final int      height;
    private final Cell[][] cells;

    Grid(int width, int height) {
        this.width = width;
        this.height = height;
        this.cells = new Cell[height][width];
        for (var row : cells) {
            Arrays.fill(row, Cell.EMPTY);
        }
    }

    public boolean contains(Position position) {
        return position.isWithin(width, height);
    }

    /**
     * Positions of all empty cells in row-major order
     */
    public List<Position> emptyPositions() {
        var result = new ArrayList<Position>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x].isEmpty()) {
                    result.add(new Position(x, y));
                }
            }
        }
        return result;
    }

    public Cell get(Position position) {
        return cells[position.y()][position.x()];
    }

    public boolean isEmpty(Position position) {
        return get(position).isEmpty();
    }

    void clear(Position position) {
        cells[position.y()][position.x()] = Cell.EMPTY;
    }

    void set(Position position, Cell cell) {
        cells[position.y()][position.x()] = cell;
    }
}
