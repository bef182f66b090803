package com.example.spellcraft.combat;

import com.example.spellcraft.util.DiceRoller;

/**
 * Dexterity and armor based accuracy model.
 *
 * Hit chance:     baseHitChance + (attacker DEX - defender DEX) * 0.02, clamped to [0.05, 0.95]
 * Dodge chance:   0.05 + max(0, defender DEX - 10) * 0.01, capped at 0.25
 * Deflect chance: armor * 0.03, capped at 0.30
 *
 * Rolled in order: miss, then dodge, then deflect; anything left is a hit.
 */
public class DefaultAccuracyOracle implements CombatAccuracyOracle {

    private static final double MIN_HIT_CHANCE = 0.05;
    private static final double MAX_HIT_CHANCE = 0.95;
    private static final double MAX_DODGE_CHANCE = 0.25;
    private static final double MAX_DEFLECT_CHANCE = 0.30;

    private final DiceRoller dice;

    public DefaultAccuracyOracle(DiceRoller dice) {
        this.dice = dice;
    }

    @Override
    public AttackOutcome checkOutcome(CombatStats attacker, CombatStats defender, int defenderArmor, double baseHitChance) {
        if (dice.nextChance() >= getHitChance(attacker.dexterity(), defender.dexterity(), baseHitChance)) {
            return AttackOutcome.MISS;
        }
        if (dice.nextChance() < getDodgeChance(defender.dexterity())) {
            return AttackOutcome.DODGE;
        }
        if (dice.nextChance() < getDeflectChance(defenderArmor)) {
            return AttackOutcome.DEFLECT;
        }
        return AttackOutcome.HIT;
    }

    public static double getHitChance(int attackerDex, int defenderDex, double baseHitChance) {
        double chance = baseHitChance + (attackerDex - defenderDex) * 0.02;
        return Math.max(MIN_HIT_CHANCE, Math.min(MAX_HIT_CHANCE, chance));
    }

    public static double getDodgeChance(int defenderDex) {
        return Math.min(MAX_DODGE_CHANCE, 0.05 + Math.max(0, defenderDex - 10) * 0.01);
    }

    public static double getDeflectChance(int armor) {
        return Math.min(MAX_DEFLECT_CHANCE, Math.max(0, armor) * 0.03);
    }
}
