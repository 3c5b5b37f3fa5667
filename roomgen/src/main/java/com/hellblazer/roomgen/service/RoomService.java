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

import com.hellblazer.roomgen.balance.*;
import com.hellblazer.roomgen.common.IdGenerator;
import com.hellblazer.roomgen.common.UUIDIdGenerator;
import com.hellblazer.roomgen.content.ItemRepository;
import com.hellblazer.roomgen.content.JsonItemRepository;
import com.hellblazer.roomgen.content.JsonMonsterRepository;
import com.hellblazer.roomgen.content.MonsterRepository;
import com.hellblazer.roomgen.entity.*;
import com.hellblazer.roomgen.geometry.Position;
import com.hellblazer.roomgen.room.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static com.hellblazer.roomgen.room.RoomException.requireRoom;

/**
 * Room generation service. Turns configurations into entities with fresh identities and content looked up from the
 * repositories, then hands them to the placement core. All placement flows through one {@link BatchPlacer} so the
 * priority rules apply whenever several kinds are populated together.
 *
 * @author hal.hildebrand
 */
public class RoomService {
    static final String TREASURE_NOTE = "Remember to clear the room after collecting all treasure.";

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    private final MonsterRepository monsterRepository;
    private final ItemRepository    itemRepository;
    private final Balancer          balancer;
    private final IdGenerator       idGenerator;
    private final PlacementEngine   placement;
    private final BatchPlacer       batchPlacer;
    private final RoomCleaner       cleaner;
    private final NpcInventory      inventory;

    public RoomService(MonsterRepository monsterRepository, ItemRepository itemRepository, Balancer balancer) {
        this(monsterRepository, itemRepository, balancer, RoomGenConfig.defaultConfig(), new UUIDIdGenerator());
    }

    public RoomService(MonsterRepository monsterRepository, ItemRepository itemRepository, Balancer balancer,
                       RoomGenConfig config, IdGenerator idGenerator) {
        this.monsterRepository = Objects.requireNonNull(monsterRepository, "Monster repository cannot be null");
        this.itemRepository = Objects.requireNonNull(itemRepository, "Item repository cannot be null");
        this.balancer = Objects.requireNonNull(balancer, "Balancer cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator cannot be null");
        this.placement = new PlacementEngine(config.newRandom());
        this.batchPlacer = new BatchPlacer(placement, config.getConflictResolution());
        this.cleaner = new RoomCleaner(placement);
        this.inventory = new NpcInventory(idGenerator);
    }

    /**
     * Service backed by the JSON content resources and the standard balancer named in the configuration
     */
    public static RoomService fromConfig(RoomGenConfig config) {
        var ids = new UUIDIdGenerator();
        log.info("Creating room service: {}", config);
        return new RoomService(new JsonMonsterRepository(config.getMonsterResource()),
                               new JsonItemRepository(config.getItemResource(), ids, config.newRandom()),
                               new StandardBalancer(), config, ids);
    }

    public BatchPlacementResult addItemsToRoom(Room room, List<ItemConfig> itemConfigs) {
        requireRoom(room);
        return batchPlacer.addPlaceablesToRoom(room, itemRequests(itemConfigs));
    }

    public BatchPlacementResult addMonstersToRoom(Room room, List<MonsterConfig> monsterConfigs) {
        requireRoom(room);
        return batchPlacer.addPlaceablesToRoom(room, monsterRequests(monsterConfigs));
    }

    public BatchPlacementResult addNpcsToRoom(Room room, List<NpcConfig> npcConfigs) {
        requireRoom(room);
        return batchPlacer.addPlaceablesToRoom(room, npcRequests(npcConfigs));
    }

    public BatchPlacementResult addObstaclesToRoom(Room room, List<ObstacleConfig> obstacleConfigs) {
        requireRoom(room);
        return batchPlacer.addPlaceablesToRoom(room, obstacleRequests(obstacleConfigs));
    }

    public BatchPlacementResult addPlayersToRoom(Room room, List<PlayerConfig> playerConfigs) {
        requireRoom(room);
        return batchPlacer.addPlaceablesToRoom(room, playerRequests(playerConfigs));
    }

    public List<MonsterConfig> balanceMonsterConfigs(List<MonsterConfig> monsterConfigs, Party party,
                                                     EncounterDifficulty difficulty) {
        return balancer.adjustMonsterSelection(monsterConfigs, party, difficulty);
    }

    /**
     * Remove entities of one kind from the room, reporting the XP earned from removed monsters
     */
    public CleanupResult cleanupRoom(Room room, CellType cellType, Collection<String> ids) {
        return cleaner.cleanupRoom(room, cellType, ids);
    }

    public EncounterDifficulty determineRoomDifficulty(Room room, Party party) {
        requireRoom(room);
        return balancer.determineEncounterDifficulty(room.getMonsters(), party);
    }

    /**
     * @throws RoomException with {@link RoomError#INVALID_DIMENSIONS} for a non-positive width or height
     */
    public Room generateRoom(RoomConfig config) {
        var room = Room.create(config);
        log.info("Generated {}", room);
        return room;
    }

    public NpcInventory inventory() {
        return inventory;
    }

    public PlacementEngine placement() {
        return placement;
    }

    /**
     * Create a room and populate it with every kind of entity in a single batch, so players keep their requested cells
     * ahead of monsters, and monsters ahead of items.
     *
     * @return the room and the placement outcome, which reports any entity the room could not hold
     */
    public PopulatedRoom populateRoom(RoomConfig roomConfig, List<MonsterConfig> monsters, List<PlayerConfig> players,
                                      List<ItemConfig> items) {
        var requests = new ArrayList<PlacementRequest>();
        requests.addAll(playerRequests(players));
        requests.addAll(monsterRequests(monsters));
        requests.addAll(itemRequests(items));

        var room = generateRoom(roomConfig);
        return populated(room, batchPlacer.addPlaceablesToRoom(room, requests));
    }

    /**
     * Create a room with monsters scaled toward the difficulty for the party
     *
     * @return the room and the placement outcome of the balanced monsters
     */
    public PopulatedRoom populateRoomWithBalancedMonsters(RoomConfig roomConfig, List<MonsterConfig> monsterConfigs,
                                                          Party party, EncounterDifficulty difficulty) {
        var balanced = balanceMonsterConfigs(monsterConfigs, party, difficulty);
        var room = generateRoom(roomConfig);
        return populated(room, addMonstersToRoom(room, balanced));
    }

    /**
     * Create a treasure room holding the given number of random items and optional guardians.
     *
     * @throws RoomException with {@link RoomError#INVALID_CONFIG} for a negative item count or if the room cannot hold
     *                       the items and guardians
     */
    public PopulatedRoom populateTreasureRoom(RoomConfig roomConfig, int itemCount, List<MonsterConfig> guardians) {
        if (itemCount < 0) {
            throw new RoomException(RoomError.INVALID_CONFIG, "item count cannot be negative: " + itemCount);
        }
        roomConfig.validate();
        var guardianConfigs = nonNull(guardians);
        requireCapacity(roomConfig, itemCount, monsterCount(guardianConfigs), 0);

        var loot = itemCount == 0 ? List.<Item>of() : itemRepository.getRandomItems(itemCount);
        return stockTreasureRoom(roomConfig, List.of(), guardianConfigs, loot);
    }

    /**
     * Create a treasure room stocked with loot scaled to the party, an optional guardian, and the party itself.
     * <p>
     * Item count is one per member plus one per three average levels, scaled by difficulty (0.75, 1.0, 1.25, 1.5) with
     * a minimum of one. Weapon and armor categories step up with the party's level; potions and adventuring gear are
     * always included.
     *
     * @throws RoomException with {@link RoomError#EMPTY_PARTY} for an empty party or {@link RoomError#INVALID_CONFIG}
     *                       if the room cannot hold the items, guardians and party
     */
    public PopulatedRoom populateTreasureRoom(RoomConfig roomConfig, Party party, boolean includeGuardian,
                                              EncounterDifficulty difficulty) {
        if (party == null || party.isEmpty()) {
            throw new RoomException(RoomError.EMPTY_PARTY, "party must have at least one member");
        }
        if (difficulty == null) {
            throw new RoomException(RoomError.INVALID_DIFFICULTY, "difficulty is required");
        }
        roomConfig.validate();

        var avgLevel = party.averageLevel();
        int itemCount = treasureItemCount(party, difficulty);
        var loot = gatherLoot(treasureCategories(avgLevel), itemCount);

        var guardians = new ArrayList<MonsterConfig>();
        if (includeGuardian) {
            var deadly = difficulty == EncounterDifficulty.HARD || difficulty == EncounterDifficulty.DEADLY;
            var guardianCR = Math.max(1.0, deadly ? avgLevel : avgLevel - 2);
            var guardian = MonsterConfig.random("Guardian", null, guardianCR, 1);
            guardians.addAll(balancer.adjustMonsterSelection(List.of(guardian), party, difficulty));
        }
        requireCapacity(roomConfig, loot.size(), monsterCount(guardians), party.size());

        var players = new ArrayList<Player>();
        for (var member : party.members()) {
            players.add(newPlayer(member.name(), member.level()));
        }
        var populated = stockTreasureRoom(roomConfig, players, guardians, loot);
        log.info("Treasure room for party of {} (avg level {}): {} items, {} guardians", party.size(), avgLevel,
                 loot.size(), monsterCount(guardians));
        return populated;
    }

    static List<String> treasureCategories(double avgLevel) {
        var categories = new ArrayList<String>();
        categories.add(avgLevel >= 5 ? "martial-weapons" : "simple-weapons");
        if (avgLevel >= 10) {
            categories.add("heavy-armor");
        } else if (avgLevel >= 5) {
            categories.add("medium-armor");
        } else {
            categories.add("light-armor");
        }
        categories.add("potion");
        categories.add("adventuring-gear");
        return categories;
    }

    static int treasureItemCount(Party party, EncounterDifficulty difficulty) {
        int base = party.size() + (int) (party.averageLevel() / 3);
        double multiplier = switch (difficulty) {
            case EASY -> 0.75;
            case MEDIUM -> 1.0;
            case HARD -> 1.25;
            case DEADLY -> 1.5;
        };
        return Math.max(1, (int) (base * multiplier));
    }

    private List<Item> gatherLoot(List<String> categories, int itemCount) {
        int perCategory = Math.max(1, itemCount / categories.size());
        var loot = new ArrayList<Item>();
        for (var category : categories) {
            try {
                loot.addAll(itemRepository.getRandomItemsByCategory(category, perCategory));
            } catch (RoomException e) {
                log.debug("Skipping treasure category {}: {}", category, e.getMessage());
            }
        }
        if (loot.size() < itemCount) {
            loot.addAll(itemRepository.getRandomItems(itemCount - loot.size()));
        }
        return loot.size() > itemCount ? new ArrayList<>(loot.subList(0, itemCount)) : loot;
    }

    private List<PlacementRequest> itemRequests(List<ItemConfig> configs) {
        var requests = new ArrayList<PlacementRequest>();
        for (var config : nonNull(configs)) {
            for (int i = 0; i < config.count(); i++) {
                var item = itemRepository.getItemByKey(config.key()).withId(idGenerator.generateId());
                requests.add(request(item, config.randomPlace(), config.position()));
            }
        }
        return requests;
    }

    private List<PlacementRequest> monsterRequests(List<MonsterConfig> configs) {
        var requests = new ArrayList<PlacementRequest>();
        for (var config : nonNull(configs)) {
            int xp = monsterXp(config.key());
            for (int i = 0; i < config.count(); i++) {
                var monster = new Monster(idGenerator.generateId(), config.key(), config.name(), config.cr(), xp,
                                          Position.origin());
                requests.add(request(monster, config.randomPlace(), config.position()));
            }
        }
        return requests;
    }

    private int monsterCount(List<MonsterConfig> configs) {
        return configs.stream().mapToInt(MonsterConfig::count).sum();
    }

    private int monsterXp(String key) {
        if (key == null) {
            return 0;
        }
        try {
            return monsterRepository.getMonsterXP(key);
        } catch (RoomException e) {
            log.warn("Failed to get XP for monster {}, awarding none: {}", key, e.getMessage());
            return 0;
        }
    }

    private Player newPlayer(String name, int level) {
        return new Player(idGenerator.generateId(), name, level, Position.origin());
    }

    private <T> List<T> nonNull(List<T> configs) {
        return configs == null ? List.of() : configs;
    }

    private List<PlacementRequest> npcRequests(List<NpcConfig> configs) {
        var requests = new ArrayList<PlacementRequest>();
        for (var config : nonNull(configs)) {
            var carried = new ArrayList<Item>();
            for (var key : config.inventoryKeys()) {
                carried.add(itemRepository.getItemByKey(key).withId(idGenerator.generateId()));
            }
            var npc = new Npc(idGenerator.generateId(), config.key(), config.name(), carried, Position.origin());
            requests.add(request(npc, config.randomPlace(), config.position()));
        }
        return requests;
    }

    private List<PlacementRequest> obstacleRequests(List<ObstacleConfig> configs) {
        var requests = new ArrayList<PlacementRequest>();
        for (var config : nonNull(configs)) {
            for (int i = 0; i < config.count(); i++) {
                var obstacle = new Obstacle(idGenerator.generateId(), config.key(), config.name(), config.blocking(),
                                            Position.origin());
                requests.add(request(obstacle, config.randomPlace(), config.position()));
            }
        }
        return requests;
    }

    private List<PlacementRequest> playerRequests(List<PlayerConfig> configs) {
        var requests = new ArrayList<PlacementRequest>();
        for (var config : nonNull(configs)) {
            requests.add(request(newPlayer(config.name(), config.level()), config.randomPlace(), config.position()));
        }
        return requests;
    }

    private PopulatedRoom populated(Room room, BatchPlacementResult result) {
        if (!result.isCompleteSuccess()) {
            log.warn("Room populated with {} entities unplaced: {}", result.getFailureCount(), result.getFailures());
        }
        return new PopulatedRoom(room, result);
    }

    private PlacementRequest request(Placeable entity, boolean randomPlace, Position position) {
        return new PlacementRequest(entity, randomPlace, position);
    }

    private void requireCapacity(RoomConfig roomConfig, int items, int monsters, int partySize) {
        int available = roomConfig.width() * roomConfig.height() - monsters - partySize;
        if (items > available) {
            throw new RoomException(RoomError.INVALID_CONFIG,
                                    String.format("not enough space in room for %d items, %d monsters and %d party "
                                                  + "members (available space: %d)", items, monsters, partySize,
                                                  available));
        }
    }

    private PopulatedRoom stockTreasureRoom(RoomConfig roomConfig, List<Player> players, List<MonsterConfig> guardians,
                                            List<Item> loot) {
        var requests = new ArrayList<PlacementRequest>();
        for (var player : players) {
            requests.add(PlacementRequest.random(player));
        }
        requests.addAll(monsterRequests(guardians));
        for (var item : loot) {
            requests.add(PlacementRequest.random(item.withId(idGenerator.generateId())));
        }

        var room = generateRoom(roomConfig.withRoomType(RoomType.TREASURE));
        var result = batchPlacer.addPlaceablesToRoom(room, requests);

        var description = room.getDescription();
        room.setDescription(description.isEmpty() ? "A treasure room with valuable items. " + TREASURE_NOTE
                                                  : description + " " + TREASURE_NOTE);
        return populated(room, result);
    }
}
