package com.example.spellcraft.effect;

/**
 * Kinds of timed status effects a character or mob can carry.
 */
public enum StatusKind {
    POISON("poison", true, "no longer poisoned"),
    BURNING("burning", true, "no longer burning"),
    BLEEDING("bleeding", true, "no longer bleeding"),
    ACID("acid", true, "no longer covered in acid"),
    PARALYZE("paralyze", false, "no longer paralyzed"),
    CHARM("charm", false, "no longer charmed"),
    STAT_DRAIN("stat_drain", false, null),
    AC_BONUS("ac_bonus", false, null),
    INVISIBILITY("invisibility", false, "visible again"),
    STAT_BUFF("stat_buff", false, null);

    public final String key;
    public final boolean damageOverTime;
    public final String defaultRemovalText;

    StatusKind(String key, boolean damageOverTime, String defaultRemovalText) {
        this.key = key;
        this.damageOverTime = damageOverTime;
        this.defaultRemovalText = defaultRemovalText;
    }

    /**
     * Parse a kind from its key or enum name (case-insensitive). Returns null if unknown.
     */
    public static StatusKind fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String k = s.trim().toLowerCase();
        for (StatusKind kind : values()) {
            if (kind.key.equals(k) || kind.name().equalsIgnoreCase(k)) return kind;
        }
        if (k.equals("paralysis") || k.equals("paralyzed")) return PARALYZE;
        if (k.equals("invisible")) return INVISIBILITY;
        return null;
    }
}
