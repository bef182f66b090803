package com.example.spellcraft;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.MobileTemplate;
import com.example.spellcraft.spell.MobSpellcasting;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
import com.example.spellcraft.util.DiceRoller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MobSpellcasting Tests")
class MobSpellcastingTest {

    private MutableClock clock;
    private ScriptedRandom random;
    private MobSpellcasting casting;
    private Mobile shaman;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(2_000_000L);
        random = new ScriptedRandom();
        MapSpellCatalog spells = new MapSpellCatalog()
                .add(SpellDefinition.builder("flame_bolt", SpellFamily.DAMAGE).manaCost(20).damageDice("2d4").build())
                .add(SpellDefinition.builder("ice_lance", SpellFamily.DAMAGE).manaCost(30).cooldownRounds(30).build())
                .add(SpellDefinition.builder("mend", SpellFamily.HEAL).manaCost(10).healDice("2d6").build())
                .add(SpellDefinition.builder("doom", SpellFamily.DAMAGE).manaCost(500).minLevel(9).build());
        casting = new MobSpellcasting(spells, new DiceRoller(random), clock);
        shaman = new Mobile(7L, MobileTemplate.builder("goblin_shaman").name("goblin shaman")
                .level(5).hpMax(40).stat(CoreStat.INTELLIGENCE, 14).build(), 100);
        casting.initialize(shaman, MobSpellcasting.DEFAULT_SPELL_SKILL);
    }

    @Test
    @DisplayName("Mana pool grows with level and spell skill")
    void manaPool() {
        assertEquals(125, MobSpellcasting.maxManaFor(5, 50));
        assertEquals(125, casting.getMaxMana(shaman));
        assertEquals(125, casting.getCurrentMana(shaman));

        casting.initialize(shaman, 100);
        assertEquals(125, casting.getMaxMana(shaman));
    }

    @Test
    @DisplayName("Casting spends mana, then cooldown and fatigue block recasting")
    void useSpell() {
        assertTrue(casting.useSpell(shaman, "flame_bolt"));
        assertEquals(105, casting.getCurrentMana(shaman));

        assertFalse(casting.canCast(shaman, "mend"));
        clock.advanceSeconds(15);
        assertTrue(casting.canCast(shaman, "flame_bolt"));

        assertTrue(casting.useSpell(shaman, "ice_lance"));
        clock.advanceSeconds(15);
        assertFalse(casting.canCast(shaman, "ice_lance"));
        assertTrue(casting.canCast(shaman, "flame_bolt"));
        clock.advanceSeconds(15);
        assertTrue(casting.canCast(shaman, "ice_lance"));
    }

    @Test
    @DisplayName("Unaffordable, unknown and uninitialized casts are refused without spending")
    void refusals() {
        assertFalse(casting.useSpell(shaman, "doom"));
        assertFalse(casting.canCast(shaman, "no_such_spell"));
        assertEquals(125, casting.getCurrentMana(shaman));

        Mobile rat = new Mobile(8L, MobileTemplate.builder("rat").build(), 100);
        assertFalse(casting.canCast(rat, "flame_bolt"));
    }

    @Test
    @DisplayName("Fatigue is at least 15 seconds, longer for spells above the mob's level")
    void fatigue() {
        assertEquals(15, MobSpellcasting.fatigueSeconds(1, 5));
        assertEquals(15, MobSpellcasting.fatigueSeconds(6, 5));
        assertEquals(60, MobSpellcasting.fatigueSeconds(9, 5));
    }

    @ParameterizedTest
    @CsvSource({
            "5, 10, 1, 50, 0.10",
            "5, 10, 7, 50, 0.40",
            "1, 10, 20, 50, 0.95",
            "10, 20, 1, 100, 0.05",
            "5, 12, 5, 60, 0.07"
    })
    @DisplayName("Mob failure chance follows level, intelligence and skill, clamped to [0.05, 0.95]")
    void failureChance(int mobLevel, int intelligence, int spellLevel, int skill, double expected) {
        assertEquals(expected, MobSpellcasting.failureChance(mobLevel, intelligence, spellLevel, skill), 1e-9);
    }

    @Test
    @DisplayName("rollFailure draws against the mob's failure chance")
    void rollFailure() {
        SpellDefinition bolt = SpellDefinition.builder("x", SpellFamily.DAMAGE).build();
        random.queueDoubles(0.05, 0.07);
        assertTrue(casting.rollFailure(shaman, bolt));
        assertFalse(casting.rollFailure(shaman, bolt));
    }

    @Test
    @DisplayName("A hurt mob prefers heals, otherwise it attacks")
    void chooseSpell() {
        List<String> book = List.of("flame_bolt", "mend", "doom");

        assertEquals(Optional.of("flame_bolt"), casting.chooseSpell(shaman, book, MobSpellcasting.DEFAULT_HEAL_THRESHOLD));

        shaman.setHpCur(10);
        assertEquals(Optional.of("mend"), casting.chooseSpell(shaman, book, MobSpellcasting.DEFAULT_HEAL_THRESHOLD));

        assertTrue(casting.chooseSpell(shaman, List.of("doom"), 0.3).isEmpty());
    }

    @Test
    @DisplayName("Regeneration is a twentieth of the pool and never overfills")
    void regenerate() {
        casting.useSpell(shaman, "flame_bolt");
        casting.regenerate(shaman);
        assertEquals(111, casting.getCurrentMana(shaman));
        casting.regenerate(shaman, 1000);
        assertEquals(125, casting.getCurrentMana(shaman));
    }

    @Test
    @DisplayName("Cleanup forgets the mob")
    void cleanup() {
        casting.cleanup(shaman);
        assertEquals(0, casting.getCurrentMana(shaman));
        assertFalse(casting.canCast(shaman, "flame_bolt"));
    }
}
