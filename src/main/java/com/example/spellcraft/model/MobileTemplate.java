package com.example.spellcraft.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Template defining a type of mobile (NPC/monster).
 * Instances are spawned (or summoned) from it.
 */
public class MobileTemplate {

    private final String key;              // Unique string identifier (e.g., "goblin_warrior")
    private final String name;             // Display name (e.g., "goblin warrior")
    private final int level;
    private final int hpMax;
    private final int mpMax;
    private final EnumMap<CoreStat, Integer> stats;
    private final int armor;

    // Summon eligibility
    private final String typeTag;          // e.g. "animal", "undead"; null when untyped
    private final boolean specialTerrainOnly;

    private final boolean aggressive;

    private MobileTemplate(Builder b) {
        this.key = b.key;
        this.name = b.name != null ? b.name : b.key;
        this.level = Math.max(1, b.level);
        this.hpMax = Math.max(1, b.hpMax);
        this.mpMax = Math.max(0, b.mpMax);
        this.stats = new EnumMap<>(CoreStat.class);
        this.stats.putAll(b.stats);
        this.armor = b.armor;
        this.typeTag = b.typeTag;
        this.specialTerrainOnly = b.specialTerrainOnly;
        this.aggressive = b.aggressive;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public int getLevel() { return level; }
    public int getHpMax() { return hpMax; }
    public int getMpMax() { return mpMax; }
    public Map<CoreStat, Integer> getStats() { return Collections.unmodifiableMap(stats); }
    public int getArmor() { return armor; }
    public String getTypeTag() { return typeTag; }
    public boolean isSpecialTerrainOnly() { return specialTerrainOnly; }
    public boolean isAggressive() { return aggressive; }

    public boolean hasType(String type) {
        return typeTag != null && type != null && typeTag.equalsIgnoreCase(type.trim());
    }

    public static final class Builder {
        private final String key;
        private String name;
        private int level = 1;
        private int hpMax = 10;
        private int mpMax = 0;
        private final EnumMap<CoreStat, Integer> stats = new EnumMap<>(CoreStat.class);
        private int armor;
        private String typeTag;
        private boolean specialTerrainOnly;
        private boolean aggressive;

        private Builder(String key) {
            this.key = key;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder level(int level) { this.level = level; return this; }
        public Builder hpMax(int hpMax) { this.hpMax = hpMax; return this; }
        public Builder mpMax(int mpMax) { this.mpMax = mpMax; return this; }
        public Builder stat(CoreStat stat, int value) { this.stats.put(stat, value); return this; }
        public Builder armor(int armor) { this.armor = armor; return this; }
        public Builder typeTag(String typeTag) { this.typeTag = typeTag; return this; }
        public Builder specialTerrainOnly(boolean v) { this.specialTerrainOnly = v; return this; }
        public Builder aggressive(boolean v) { this.aggressive = v; return this; }

        public MobileTemplate build() {
            return new MobileTemplate(this);
        }
    }
}
