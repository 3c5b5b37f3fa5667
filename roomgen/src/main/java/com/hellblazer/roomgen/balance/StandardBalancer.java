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
import com.hellblazer.roomgen.room.RoomError;
import com.hellblazer.roomgen.room.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Challenge rating balancer.
 * <p>
 * Target CR = average party level x difficulty multiplier x party size adjustment, rounded to the nearest quarter. The
 * size adjustment is 0.5 for a solo player, 0.75 for two, 1.0 for three or four, 1.25 for five and 1.5 for six or
 * more.
 *
 * @author hal.hildebrand
 */
public class StandardBalancer implements Balancer {
    private static final Logger log = LoggerFactory.getLogger(StandardBalancer.class);

    /** Relative distance from target CR within which a selection is left alone */
    private static final double TOLERANCE = 0.1;

    static double sizeAdjustment(int partySize) {
        return switch (partySize) {
            case 1 -> 0.5;
            case 2 -> 0.75;
            case 3, 4 -> 1.0;
            case 5 -> 1.25;
            default -> 1.5;
        };
    }

    private static void validate(Party party) {
        if (party == null || party.isEmpty()) {
            throw new RoomException(RoomError.EMPTY_PARTY, "party cannot be empty");
        }
    }

    @Override
    public List<MonsterConfig> adjustMonsterSelection(List<MonsterConfig> monsterConfigs, Party party,
                                                      EncounterDifficulty difficulty) {
        validate(party);
        var targetCR = calculateTargetCR(party, difficulty);
        var currentCR = monsterConfigs.stream().mapToDouble(MonsterConfig::totalCR).sum();

        if (currentCR == 0.0 || Math.abs(currentCR - targetCR) / targetCR < TOLERANCE) {
            return List.copyOf(monsterConfigs);
        }

        var scale = targetCR / currentCR;
        var adjusted = new ArrayList<MonsterConfig>(monsterConfigs.size());
        for (var config : monsterConfigs) {
            int count = (int) Math.round(config.count() * scale);
            if (config.count() > 0 && count < 1) {
                count = 1;
            }
            adjusted.add(config.withCount(count));
        }
        log.debug("Scaled monster selection by {} toward target CR {} (was {})", scale, targetCR, currentCR);
        return adjusted;
    }

    @Override
    public double calculateTargetCR(Party party, EncounterDifficulty difficulty) {
        validate(party);
        if (difficulty == null) {
            throw new RoomException(RoomError.INVALID_DIFFICULTY, "difficulty is required");
        }
        var target = party.averageLevel() * difficulty.getCrMultiplier() * sizeAdjustment(party.size());
        return Math.round(target * 4) / 4.0;
    }

    @Override
    public EncounterDifficulty determineEncounterDifficulty(List<Monster> monsters, Party party) {
        validate(party);
        var totalCR = monsters.stream().mapToDouble(Monster::getChallengeRating).sum();
        var ratio = totalCR / (party.averageLevel() * sizeAdjustment(party.size()));

        var levels = EncounterDifficulty.values();
        for (int i = levels.length - 1; i > 0; i--) {
            if (ratio >= levels[i].getCrMultiplier()) {
                return levels[i];
            }
        }
        // Anything below medium, trivial included, reads as easy
        return EncounterDifficulty.EASY;
    }
}
