package com.example.spellcraft.combat;

/**
 * Decides whether an attack lands. Supplied by the combat subsystem.
 */
@FunctionalInterface
public interface CombatAccuracyOracle {

    AttackOutcome checkOutcome(CombatStats attacker, CombatStats defender, int defenderArmor, double baseHitChance);
}
