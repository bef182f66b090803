package com.example.spellcraft;

import com.example.spellcraft.effect.StatusEffect;
import com.example.spellcraft.effect.StatusKind;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.spell.AreaOfEffect;
import com.example.spellcraft.spell.CasterResourceState;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CastPipeline Tests")
class CastPipelineTest {

    static final SpellDefinition MAGIC_MISSILE = SpellDefinition.builder("magic_missile", SpellFamily.DAMAGE)
            .name("Magic Missile").manaCost(15).cooldownRounds(2).damageDice("1d4+1").requiresTarget(true).build();
    static final SpellDefinition SPARK = SpellDefinition.builder("spark", SpellFamily.DAMAGE)
            .name("Spark").manaCost(1).damageDice("1").requiresTarget(true).build();
    static final SpellDefinition MAGE_ARMOR = SpellDefinition.builder("mage_armor", SpellFamily.BUFF)
            .name("Mage Armor").effect("ac_bonus").bonusAmount(2).manaCost(5).build();
    static final SpellDefinition MASS_HEAL = SpellDefinition.builder("mass_heal", SpellFamily.HEAL)
            .name("Mass Heal").areaOfEffect(AreaOfEffect.AREA).healDice("8").classRestriction("Cleric").build();
    static final SpellDefinition FIREBALL = SpellDefinition.builder("fireball", SpellFamily.DAMAGE)
            .name("Fireball").minLevel(3).areaOfEffect(AreaOfEffect.AREA).damageDice("3d6").build();
    static final SpellDefinition SUMMON = SpellDefinition.builder("summon_animal", SpellFamily.SUMMON)
            .name("Summon Animal").manaCost(10).build();
    static final SpellDefinition BROKEN = SpellDefinition.builder("cure_sleep", SpellFamily.HEAL)
            .name("Cure Sleep").effect("cure_sleep").manaCost(7).build();

    private EngineFixture fx;
    private PlayerCharacter alice;
    private Mobile goblin;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        fx.spell(MAGIC_MISSILE).spell(SPARK).spell(MAGE_ARMOR).spell(MASS_HEAL)
                .spell(FIREBALL).spell(SUMMON).spell(BROKEN);
        alice = fx.caster(1, "Alice", "magic_missile", "spark", "mage_armor", "mass_heal",
                "fireball", "summon_animal", "cure_sleep");
        goblin = fx.mob("goblin", 10);
    }

    private CasterResourceState resources() {
        return fx.engine().getResources().forCaster(1);
    }

    private void assertNothingSpent() {
        assertEquals(100, alice.getMpCur());
        assertTrue(resources().getCooldowns().isEmpty());
        assertEquals(0L, resources().getFatigueUntil());
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("A targeted spell with no target spends nothing")
        void missingTarget() {
            fx.cast(1, "magic missile");
            assertEquals("You need a target to cast Magic Missile. Use: cast Magic Missile <target>", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("A targeted spell at someone who is not here spends nothing")
        void invalidTarget() {
            fx.cast(1, "magic missile", "dragon");
            assertEquals("You don't see 'dragon' here.", fx.messaging.lastTo(1));
            assertNothingSpent();
            assertEquals(10, goblin.getHpCur());
        }

        @Test
        @DisplayName("Blank spell text asks what to cast")
        void blank() {
            fx.cast(1, "   ");
            assertEquals("Cast what?", fx.messaging.lastTo(1));
        }

        @Test
        @DisplayName("Unknown and unlearned spells are told apart")
        void unknownSpell() {
            fx.spell(SpellDefinition.builder("shield", SpellFamily.BUFF).name("Shield").effect("ac_bonus").build());

            fx.cast(1, "frobnicate");
            assertEquals("Unknown spell: frobnicate", fx.messaging.lastTo(1));

            fx.cast(1, "shield");
            assertEquals("You don't know the spell 'Shield'.", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Class-restricted spells reject other classes")
        void classRestriction() {
            fx.cast(1, "mass heal");
            assertEquals("Only Clerics can cast Mass Heal.", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Spells above the class's maximum level are refused")
        void classMaxLevel() {
            alice.setCharacterClass("Fighter");
            fx.cast(1, "fireball");
            assertEquals("As a Fighter, you can only cast spells up to level 1. Fireball is level 3.", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Paralyzed casters cannot cast")
        void paralyzed() {
            alice.getEffects().attach(StatusEffect.builder(StatusKind.PARALYZE, "Hold Person").duration(3).build());
            fx.cast(1, "spark", "goblin");
            assertEquals("You are paralyzed and cannot cast spells!", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Summons cannot be aimed at anyone")
        void summonWithTarget() {
            fx.cast(1, "summon animal", "goblin");
            assertEquals("That spell does not need to be cast at a specific person or creature.", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Summoning is not permitted in safe rooms")
        void summonInSafeRoom() {
            alice.setCurrentRoom(EngineFixture.SAFE_ROOM);
            fx.cast(1, "summon animal");
            assertEquals("Sorry, summoning spells are not permitted here.", fx.messaging.lastTo(1));
            assertNothingSpent();
        }

        @Test
        @DisplayName("Not enough mana")
        void notEnoughMana() {
            alice.setMpCur(10);
            fx.cast(1, "magic missile", "goblin");
            assertEquals("You don't have enough mana to cast Magic Missile. (Need 15, have 10)", fx.messaging.lastTo(1));
            assertEquals(10, alice.getMpCur());
            assertEquals(0L, resources().getFatigueUntil());
        }

        @Test
        @DisplayName("Unknown casters are ignored")
        void unknownCaster() {
            fx.cast(42, "spark", "goblin");
            assertTrue(fx.messaging.toPlayer(42).isEmpty());
            assertEquals(10, goblin.getHpCur());
        }
    }

    @Test
    @DisplayName("A successful cast spends mana, starts the cooldown and fatigues base x cooldown")
    void commitScenario() {
        PlayerCharacter bob = fx.player(2, "Bob", 5, 50, 50, 20, 20);
        bob.learnSpell("magic_missile");

        fx.cast(2, "magic missile", "goblin");

        CasterResourceState state = fx.engine().getResources().forCaster(2);
        assertEquals(5, bob.getMpCur());
        assertEquals(2, state.getCooldownRemaining("magic_missile"));
        assertEquals(20.0, state.getFatigueRemainingSeconds(fx.clock.millis()), 1e-9);
        assertEquals(8, goblin.getHpCur());
    }

    @Test
    @DisplayName("A fizzle still costs mana, cooldown and fatigue")
    void fizzleStillCommits() {
        fx.random.queueDoubles(0.0);

        fx.cast(1, "magic missile", "goblin");

        assertEquals(85, alice.getMpCur());
        assertEquals(2, resources().getCooldownRemaining("magic_missile"));
        assertEquals(fx.clock.millis() + 20_000L, resources().getFatigueUntil());
        assertEquals(10, goblin.getHpCur());
        assertEquals("You attempt to cast Magic Missile, but the spell fizzles and fails!", fx.messaging.lastTo(1));
        assertTrue(fx.messaging.anyToRoomContains(EngineFixture.ROOM, "Alice's spell fizzles and fails!"));
    }

    @Test
    @DisplayName("Cooldown then fatigue block repeat casts until they run out")
    void cooldownAndFatigue() {
        fx.cast(1, "magic missile", "goblin");
        fx.clock.advanceSeconds(25);

        fx.cast(1, "magic missile", "goblin");
        assertEquals("Magic Missile is still on cooldown (2 rounds remaining).", fx.messaging.lastTo(1));

        fx.cast(1, "spark", "goblin");
        assertEquals(84, alice.getMpCur());

        fx.cast(1, "spark", "goblin");
        assertEquals("You are too magically exhausted to cast spells! Wait 10.0 more seconds.", fx.messaging.lastTo(1));
        assertEquals(84, alice.getMpCur());

        fx.engine().tickCooldowns();
        fx.engine().tickCooldowns();
        fx.clock.advanceSeconds(10);
        fx.cast(1, "magic missile", "goblin");
        assertEquals(69, alice.getMpCur());
    }

    @Test
    @DisplayName("A repeated self buff is rejected and adds no second entry")
    void duplicateSelfBuff() {
        fx.cast(1, "mage armor");
        assertEquals(1, alice.getEffects().count(StatusKind.AC_BONUS));
        assertEquals(95, alice.getMpCur());

        fx.clock.advanceSeconds(60);
        fx.cast(1, "mage armor");

        assertEquals("You are already under the effect of Mage Armor!", fx.messaging.lastTo(1));
        assertEquals(1, alice.getEffects().count(StatusKind.AC_BONUS));
        assertEquals(95, alice.getMpCur());
    }

    @ParameterizedTest
    @ValueSource(strings = { "magic missile goblin", "MAGIC MISSILE goblin", "magic_missile goblin", "magicmissile goblin" })
    @DisplayName("Text after the spell name is the target")
    void remainderIsTarget(String text) {
        fx.cast(1, text);
        assertEquals(8, goblin.getHpCur());
        assertEquals(85, alice.getMpCur());
    }

    @Test
    @DisplayName("Longer spell names win over their prefixes")
    void longestNameFirst() {
        fx.spell(SpellDefinition.builder("spark_storm", SpellFamily.DAMAGE).name("Spark Storm")
                .areaOfEffect(AreaOfEffect.AREA).damageDice("4").build());
        alice.learnSpell("spark_storm");

        fx.cast(1, "spark storm");

        assertEquals(6, goblin.getHpCur());
        assertTrue(fx.messaging.anyToPlayerContains(1, "Spark Storm"));
    }

    @Test
    @DisplayName("Bad spell data fails with a generic message after commit")
    void badDataFailsGenerically() {
        fx.cast(1, "cure sleep");
        assertEquals("Something went wrong with your spell.", fx.messaging.lastTo(1));
        assertEquals(93, alice.getMpCur());
    }

    @Test
    @DisplayName("Out-of-range dice in spell data roll 0 instead of breaking the cast")
    void oversizedDiceRollZero() {
        fx.spell(SpellDefinition.builder("meteor", SpellFamily.DAMAGE).name("Meteor")
                .manaCost(5).damageDice("99999999999d6").requiresTarget(true).build());
        alice.learnSpell("meteor");

        assertDoesNotThrow(() -> fx.cast(1, "meteor", "goblin"));

        assertEquals(95, alice.getMpCur());
        assertEquals(10, goblin.getHpCur());
    }

    @Test
    @DisplayName("Known spells missing from the catalog are skipped")
    void knownButMissingFromCatalog() {
        alice.learnSpell("ghost_spell");
        fx.cast(1, "ghost spell");
        assertEquals("Unknown spell: ghost spell", fx.messaging.lastTo(1));
    }
}
