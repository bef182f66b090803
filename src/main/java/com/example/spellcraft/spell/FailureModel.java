package com.example.spellcraft.spell;

import com.example.spellcraft.util.DiceRoller;

/**
 * Chance that a committed cast fizzles.
 *
 * chance = 0.05 + 0.10 * max(0, spellLevel - casterLevel) - 0.01 * ((castingStat - 10) / 2),
 * clamped to [0, maxChance].
 */
public class FailureModel {

    private static final double BASE_FAILURE = 0.05;
    private static final double PER_LEVEL_SHORTFALL = 0.10;
    private static final double PER_STAT_MODIFIER = 0.01;

    private final DiceRoller dice;
    private final double maxChance;

    public FailureModel(DiceRoller dice, double maxChance) {
        this.dice = dice;
        this.maxChance = maxChance;
    }

    public static double failureChance(int spellMinLevel, int casterLevel, int castingStat, double maxChance) {
        double statModifier = (castingStat - 10) / 2.0;
        double chance = BASE_FAILURE
                + PER_LEVEL_SHORTFALL * Math.max(0, spellMinLevel - casterLevel)
                - PER_STAT_MODIFIER * statModifier;
        return Math.max(0.0, Math.min(maxChance, chance));
    }

    public double failureChance(int spellMinLevel, int casterLevel, int castingStat) {
        return failureChance(spellMinLevel, casterLevel, castingStat, maxChance);
    }

    /**
     * @return true if the cast fizzles
     */
    public boolean rollFizzle(int spellMinLevel, int casterLevel, int castingStat) {
        return dice.nextChance() < failureChance(spellMinLevel, casterLevel, castingStat);
    }
}
