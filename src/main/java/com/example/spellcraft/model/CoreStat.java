package com.example.spellcraft.model;

/**
 * The six core ability scores shared by players and mobs.
 */
public enum CoreStat {
    STRENGTH("str"),
    DEXTERITY("dex"),
    CONSTITUTION("con"),
    INTELLIGENCE("int"),
    WISDOM("wis"),
    CHARISMA("cha");

    public final String abbreviation;

    CoreStat(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    /**
     * Parse a stat from its full name or abbreviation (case-insensitive).
     * Returns the given default when the text is not recognised.
     */
    public static CoreStat fromString(String s, CoreStat defaultStat) {
        if (s == null || s.isBlank()) return defaultStat;
        String key = s.trim().toLowerCase();
        for (CoreStat stat : values()) {
            if (stat.name().equalsIgnoreCase(key) || stat.abbreviation.equals(key)) {
                return stat;
            }
        }
        if (key.equals("intellect")) return INTELLIGENCE;
        return defaultStat;
    }
}
