package com.example.spellcraft;

import com.example.spellcraft.util.DiceRoller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiceRoller Tests")
class DiceRollerTest {

    private final DiceRoller seeded = new DiceRoller(new Random(42));

    @Test
    @DisplayName("2d6+3 always lands in [5, 15]")
    void twoDSixPlusThreeInRange() {
        for (int i = 0; i < 2000; i++) {
            int v = seeded.roll("2d6+3");
            assertTrue(v >= 5 && v <= 15, "rolled " + v);
        }
    }

    @Test
    @DisplayName("-1d5 always lands in [-5, -1]")
    void negatedRollInRange() {
        for (int i = 0; i < 2000; i++) {
            int v = seeded.roll("-1d5");
            assertTrue(v >= -5 && v <= -1, "rolled " + v);
        }
    }

    @Test
    @DisplayName("Ranges are inclusive at both ends")
    void rangeInclusive() {
        boolean sawLow = false, sawHigh = false;
        for (int i = 0; i < 2000; i++) {
            int v = seeded.roll("3-6");
            assertTrue(v >= 3 && v <= 6, "rolled " + v);
            sawLow |= v == 3;
            sawHigh |= v == 6;
        }
        assertTrue(sawLow && sawHigh);
    }

    @Test
    @DisplayName("Scripted faces are summed with the modifier")
    void scriptedFaces() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom().faces(4, 6));
        assertEquals(4 + 6 - 2, dice.roll("2d6-2"));
    }

    @ParameterizedTest
    @CsvSource({
            "7, 7",
            "+4, 4",
            "-3, -3",
            "' 1 d 1 ', 1",
            "1D1+1, 2"
    })
    @DisplayName("Flat values, signs, spaces and upper case parse")
    void flatAndSigned(String expr, int expected) {
        assertEquals(expected, seeded.roll(expr));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "abc", "d6", "2d", "1d6+x", "3000000000", "99999999999d6", "1d6+3000000000", "1-3000000000" })
    @DisplayName("Unparseable or out-of-range expressions roll 0")
    void garbageRollsZero(String expr) {
        assertEquals(0, seeded.roll(expr));
    }

    @Test
    @DisplayName("Huge dice counts are capped")
    void diceCountCapped() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom());
        assertEquals(1000, dice.roll("5000d1"));
        assertEquals(1000, dice.roll("2000000000d6"));
    }

    @Test
    @DisplayName("Null expression rolls 0")
    void nullRollsZero() {
        assertEquals(0, seeded.roll(null));
    }

    @Test
    @DisplayName("rollMagnitude drops the sign")
    void magnitude() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom().faces(3));
        assertEquals(3, dice.rollMagnitude("-1d5"));
    }

    @Test
    @DisplayName("nextIndex stays inside the bound")
    void nextIndexBound() {
        for (int i = 0; i < 500; i++) {
            int idx = seeded.nextIndex(3);
            assertTrue(idx >= 0 && idx < 3);
        }
        assertEquals(0, seeded.nextIndex(1));
        assertEquals(0, seeded.nextIndex(0));
    }
}
