package com.example.spellcraft.spell;

/**
 * Level scaling for rolled spell values.
 */
public final class ScalingModel {

    private ScalingModel() {}

    /**
     * base x casterLevel when the spell scales, base otherwise. Saturates at the int range.
     */
    public static int scaledValue(int base, boolean scalesWithLevel, int casterLevel) {
        if (!scalesWithLevel) return base;
        long scaled = (long) base * Math.max(1, casterLevel);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, scaled));
    }

    public static int scaledValue(int base, SpellDefinition spell, int casterLevel) {
        return scaledValue(base, spell.isScalesWithLevel(), casterLevel);
    }
}
