package com.example.spellcraft.spell;

public enum AreaOfEffect {
    /** One target: named, or the caster */
    SINGLE,
    /** Every eligible entity in the caster's room */
    AREA;

    public static AreaOfEffect fromString(String s) {
        if (s == null || s.isBlank()) return SINGLE;
        return s.trim().equalsIgnoreCase("area") ? AREA : SINGLE;
    }
}
