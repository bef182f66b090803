package com.example.spellcraft;

import com.example.spellcraft.combat.AttackOutcome;
import com.example.spellcraft.combat.CombatStats;
import com.example.spellcraft.combat.DefaultAccuracyOracle;
import com.example.spellcraft.util.DiceRoller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultAccuracyOracle Tests")
class DefaultAccuracyOracleTest {

    private static final CombatStats AVERAGE = new CombatStats(5, 10, 10, 10, 10, 10, 10);

    private static DefaultAccuracyOracle oracle(double... draws) {
        return new DefaultAccuracyOracle(new DiceRoller(new ScriptedRandom().queueDoubles(draws)));
    }

    @ParameterizedTest
    @CsvSource({
            "10, 10, 0.50, 0.50",
            "15, 10, 0.50, 0.60",
            "10, 20, 0.50, 0.30",
            "40, 10, 0.50, 0.95",
            "10, 40, 0.50, 0.05"
    })
    @DisplayName("Hit chance moves with the dexterity difference and stays in [0.05, 0.95]")
    void hitChance(int attackerDex, int defenderDex, double base, double expected) {
        assertEquals(expected, DefaultAccuracyOracle.getHitChance(attackerDex, defenderDex, base), 1e-9);
    }

    @Test
    @DisplayName("Dodge and deflect chances are capped")
    void caps() {
        assertEquals(0.05, DefaultAccuracyOracle.getDodgeChance(8), 1e-9);
        assertEquals(0.25, DefaultAccuracyOracle.getDodgeChance(40), 1e-9);
        assertEquals(0.15, DefaultAccuracyOracle.getDeflectChance(5), 1e-9);
        assertEquals(0.30, DefaultAccuracyOracle.getDeflectChance(50), 1e-9);
        assertEquals(0.0, DefaultAccuracyOracle.getDeflectChance(-3), 1e-9);
    }

    @Test
    @DisplayName("Rolls are checked as miss, then dodge, then deflect")
    void rollOrder() {
        assertEquals(AttackOutcome.MISS, oracle(0.6).checkOutcome(AVERAGE, AVERAGE, 0, 0.5));
        assertEquals(AttackOutcome.DODGE, oracle(0.1, 0.01).checkOutcome(AVERAGE, AVERAGE, 0, 0.5));
        assertEquals(AttackOutcome.DEFLECT, oracle(0.1, 0.5, 0.1).checkOutcome(AVERAGE, AVERAGE, 5, 0.5));
        assertEquals(AttackOutcome.HIT, oracle(0.1, 0.5, 0.0).checkOutcome(AVERAGE, AVERAGE, 0, 0.5));
    }

    @Test
    @DisplayName("Spells aim with the casting stat in place of dexterity")
    void withDexterity() {
        CombatStats sharp = AVERAGE.withDexterity(18);
        assertEquals(18, sharp.dexterity());
        assertEquals(10, sharp.intelligence());
        assertEquals(AttackOutcome.HIT, oracle(0.6, 0.5, 0.5).checkOutcome(sharp, AVERAGE, 0, 0.5));
    }
}
