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
package com.hellblazer.roomgen.balance;

import com.hellblazer.roomgen.entity.Player;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered group of player characters.
 *
 * @author hal.hildebrand
 */
public record Party(List<PartyMember> members) {

    public Party {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static Party of(PartyMember... members) {
        return new Party(List.of(members));
    }

    /**
     * Build a party from the players of a room
     */
    public static Party fromPlayers(List<Player> players) {
        return new Party(players.stream()
                                .map(p -> new PartyMember(p.getName(), p.getLevel()))
                                .collect(Collectors.toList()));
    }

    /**
     * @return the mean member level, or 0 for an empty party
     */
    public double averageLevel() {
        return members.stream().mapToInt(PartyMember::level).average().orElse(0.0);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }
}
