package com.example.spellcraft.spell;

/**
 * Broad spell families. Each family is resolved by its own effect resolver.
 */
public enum SpellFamily {
    DAMAGE("damage"),
    HEAL("heal"),
    BUFF("buff"),
    ENHANCEMENT("enhancement"),
    DEBUFF("debuff"),
    DRAIN("drain"),
    SUMMON("summon");

    public final String key;

    SpellFamily(String key) {
        this.key = key;
    }

    /**
     * Families whose named targets are players rather than mobs.
     */
    public boolean targetsPlayers() {
        return this == HEAL || this == BUFF || this == ENHANCEMENT;
    }

    public boolean isBuff() {
        return this == BUFF || this == ENHANCEMENT;
    }

    /**
     * Parse family from string (case-insensitive). Returns null if unknown.
     */
    public static SpellFamily fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String k = s.trim().toLowerCase();
        for (SpellFamily f : values()) {
            if (f.key.equals(k)) return f;
        }
        return null;
    }
}
