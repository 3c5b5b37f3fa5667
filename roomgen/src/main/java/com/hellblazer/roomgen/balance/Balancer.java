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

import com.hellblazer.roomgen.entity.Monster;

import java.util.List;

/**
 * Sizes monster encounters against a party using challenge rating arithmetic.
 *
 * @author hal.hildebrand
 */
public interface Balancer {

    /**
     * Scale monster counts so the encounter approaches the target difficulty for the party
     */
    List<MonsterConfig> adjustMonsterSelection(List<MonsterConfig> monsterConfigs, Party party,
                                               EncounterDifficulty difficulty);

    /**
     * Target total challenge rating for the party at the given difficulty
     */
    double calculateTargetCR(Party party, EncounterDifficulty difficulty);

    /**
     * Classify an existing set of monsters against the party
     */
    EncounterDifficulty determineEncounterDifficulty(List<Monster> monsters, Party party);
}
