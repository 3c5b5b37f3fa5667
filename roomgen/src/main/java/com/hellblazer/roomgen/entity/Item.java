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
package com.hellblazer.roomgen.entity;

import com.hellblazer.roomgen.geometry.Position;

import java.util.List;
import java.util.Objects;

/**
 * A treasure or equipment item. Items lie in a room as placeables, or travel in an {@link Npc}'s inventory where their
 * position is meaningless.
 *
 * @author hal.hildebrand
 */
public final class Item implements Placeable {
    private final String       id;
    private final String       key;
    private final String       name;
    private final String       type;
    private final String       category;
    private final int          value;
    private final String       valueUnit;
    private final int          weight;
    private final List<String> properties;
    private final String       damageDice;
    private final String       damageType;
    private final int          armorClass;
    private final boolean      stealthDisadvantage;
    private       Position     position;

    private Item(Builder builder) {
        this.id = builder.id;
        this.key = builder.key;
        this.name = builder.name;
        this.type = builder.type;
        this.category = builder.category;
        this.value = builder.value;
        this.valueUnit = builder.valueUnit;
        this.weight = builder.weight;
        this.properties = List.copyOf(builder.properties);
        this.damageDice = builder.damageDice;
        this.damageType = builder.damageType;
        this.armorClass = builder.armorClass;
        this.stealthDisadvantage = builder.stealthDisadvantage;
        this.position = Objects.requireNonNull(builder.position, "Position cannot be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Item copy() {
        return toBuilder().build();
    }

    public int getArmorClass() {
        return armorClass;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public CellType getCellType() {
        return CellType.ITEM;
    }

    public String getDamageDice() {
        return damageDice;
    }

    public String getDamageType() {
        return damageType;
    }

    /**
     * May be null for an item that has not yet been given an identity
     */
    @Override
    public String getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public List<String> getProperties() {
        return properties;
    }

    public String getType() {
        return type;
    }

    /**
     * Value in {@link #getValueUnit()} currency
     */
    public int getValue() {
        return value;
    }

    public String getValueUnit() {
        return valueUnit;
    }

    public int getWeight() {
        return weight;
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    public boolean isStealthDisadvantage() {
        return stealthDisadvantage;
    }

    @Override
    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "Position cannot be null");
    }

    public Builder toBuilder() {
        return new Builder().withId(id)
                            .withKey(key)
                            .withName(name)
                            .withType(type)
                            .withCategory(category)
                            .withValue(value, valueUnit)
                            .withWeight(weight)
                            .withProperties(properties)
                            .withDamage(damageDice, damageType)
                            .withArmorClass(armorClass)
                            .withStealthDisadvantage(stealthDisadvantage)
                            .withPosition(position);
    }

    /**
     * Copy of this item carrying a different identity
     */
    public Item withId(String newId) {
        return toBuilder().withId(newId).build();
    }

    @Override
    public String toString() {
        return "Item[" + id + ", " + name + " @ " + position + "]";
    }

    /**
     * Builder for Item.
     */
    public static class Builder {
        private String       id;
        private String       key;
        private String       name;
        private String       type;
        private String       category;
        private int          value;
        private String       valueUnit;
        private int          weight;
        private List<String> properties = List.of();
        private String       damageDice;
        private String       damageType;
        private int          armorClass;
        private boolean      stealthDisadvantage;
        private Position     position   = Position.origin();

        public Item build() {
            return new Item(this);
        }

        public Builder withArmorClass(int armorClass) {
            this.armorClass = armorClass;
            return this;
        }

        public Builder withCategory(String category) {
            this.category = category;
            return this;
        }

        public Builder withDamage(String dice, String damageType) {
            this.damageDice = dice;
            this.damageType = damageType;
            return this;
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withKey(String key) {
            this.key = key;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withPosition(Position position) {
            this.position = position;
            return this;
        }

        public Builder withProperties(List<String> properties) {
            this.properties = properties == null ? List.of() : properties;
            return this;
        }

        public Builder withStealthDisadvantage(boolean stealthDisadvantage) {
            this.stealthDisadvantage = stealthDisadvantage;
            return this;
        }

        public Builder withType(String type) {
            this.type = type;
            return this;
        }

        public Builder withValue(int value, String unit) {
            this.value = value;
            this.valueUnit = unit;
            return this;
        }

        public Builder withWeight(int weight) {
            this.weight = weight;
            return this;
        }
    }
}
