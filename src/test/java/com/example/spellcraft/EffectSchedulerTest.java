package com.example.spellcraft;

import com.example.spellcraft.effect.StatusEffect;
import com.example.spellcraft.effect.StatusKind;
import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.util.TickService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EffectScheduler Tests")
class EffectSchedulerTest {

    private EngineFixture fx;
    private PlayerCharacter alice;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        alice = fx.caster(1, "Alice");
    }

    @Test
    @DisplayName("An effect with one tick left is gone after one tick with exactly one notice")
    void singleTickExpiry() {
        StatusEffect invis = StatusEffect.builder(StatusKind.INVISIBILITY, "Invisibility").duration(1).build();
        fx.engine().applyStatusEffect(alice, invis);

        fx.engine().tick(alice);

        assertTrue(alice.getEffects().isEmpty());
        assertTrue(invis.isRemoved());
        assertEquals(List.of("You are visible again."), fx.messaging.toPlayer(1));

        fx.engine().tick(alice);
        assertEquals(1, fx.messaging.toPlayer(1).size());
    }

    @Test
    @DisplayName("Effects without removal text announce that they wore off")
    void wornOffNotice() {
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.STAT_BUFF, "Heroism").duration(1).build());
        fx.engine().tick(alice);
        assertEquals("The Heroism effect has worn off.", fx.messaging.lastTo(1));
    }

    @Test
    @DisplayName("Poison damages a player each tick and counts down")
    void poisonTicksPlayer() {
        StatusEffect poison = StatusEffect.builder(StatusKind.POISON, "Poison Dart").duration(3).tickDice("2").build();
        fx.engine().applyStatusEffect(alice, poison);

        fx.engine().tick(alice);

        assertEquals(48, alice.getHpCur());
        assertEquals(2, poison.getRemainingDuration());
        assertEquals("You take 2 poison damage!", fx.messaging.lastTo(1));
    }

    @Test
    @DisplayName("A player brought to 0 HP by poison is told so")
    void playerSuccumbs() {
        alice.setHpCur(1);
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.POISON, "x").duration(5).tickDice("3").build());

        fx.engine().tick(alice);

        assertEquals(0, alice.getHpCur());
        assertTrue(fx.messaging.anyToPlayerContains(1, "You have succumbed to poison!"));
    }

    @Test
    @DisplayName("A mob killed by poison is defeated and credited to the caster")
    void mobSuccumbs() {
        Mobile goblin = fx.mob("goblin", 2);
        fx.engine().applyStatusEffect(goblin, StatusEffect.builder(StatusKind.POISON, "Poison Dart")
                .duration(5).tickDice("5").casterId(1).build());
        fx.engine().applyStatusEffect(goblin, StatusEffect.builder(StatusKind.PARALYZE, "Hold Monster").duration(5).build());

        fx.engine().tick(goblin);

        assertTrue(goblin.isDead());
        assertEquals(List.of(goblin), fx.deaths);
        assertTrue(fx.world.listMobs(EngineFixture.ROOM).isEmpty());
        assertTrue(goblin.getEffects().isEmpty());
        assertTrue(fx.messaging.anyToPlayerContains(1, "goblin takes 2 poison damage."));
        assertTrue(fx.messaging.anyToPlayerContains(1, "goblin succumbs to poison!"));
    }

    @Test
    @DisplayName("A cured effect is never ticked again")
    void curedEffectNotTicked() {
        StatusEffect poison = StatusEffect.builder(StatusKind.POISON, "x").duration(5).tickDice("3").build();
        fx.engine().applyStatusEffect(alice, poison);

        assertEquals(1, fx.engine().cure(alice, StatusKind.POISON));
        fx.engine().tick(alice);

        assertEquals(50, alice.getHpCur());
        assertEquals(5, poison.getRemainingDuration());
    }

    @Test
    @DisplayName("Cure removes only the matching kind and reports the count")
    void cureCounts() {
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.POISON, "a").duration(5).build());
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.POISON, "b").duration(5).build());
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.PARALYZE, "c").duration(5).build());

        assertEquals(2, fx.engine().cure(alice, StatusKind.POISON));
        assertEquals(0, fx.engine().cure(alice, StatusKind.POISON));
        assertTrue(alice.isParalyzed());
        assertEquals(1, fx.engine().cure(alice, e -> e.getSource().equals("c")));
        assertFalse(alice.isParalyzed());
    }

    @Test
    @DisplayName("Stat drains give their stats back when they expire")
    void drainRevertsOnExpiry() {
        StatusEffect drain = StatusEffect.builder(StatusKind.STAT_DRAIN, "Feeblemind").duration(1).build();
        alice.setStat(CoreStat.INTELLIGENCE, 7);
        drain.recordDelta(CoreStat.INTELLIGENCE, -3);
        fx.engine().applyStatusEffect(alice, drain);

        fx.engine().tick(alice);

        assertEquals(10, alice.getStat(CoreStat.INTELLIGENCE));
    }

    @Test
    @DisplayName("Enhancements keep their stat gain after expiry by default")
    void enhancementKeptOnExpiry() {
        StatusEffect buff = StatusEffect.builder(StatusKind.STAT_BUFF, "Bulls Strength").duration(1).build();
        alice.setStat(CoreStat.STRENGTH, 13);
        buff.recordDelta(CoreStat.STRENGTH, 3);
        fx.engine().applyStatusEffect(alice, buff);

        fx.engine().tick(alice);

        assertTrue(alice.getEffects().isEmpty());
        assertEquals(13, alice.getStat(CoreStat.STRENGTH));
    }

    @Test
    @DisplayName("Enhancements revert on expiry when configured to")
    void enhancementRevertedWhenConfigured() {
        fx.settings.setRevertEnhancementsOnExpiry(true);
        StatusEffect buff = StatusEffect.builder(StatusKind.STAT_BUFF, "Bulls Strength").duration(1).build();
        alice.setStat(CoreStat.STRENGTH, 13);
        buff.recordDelta(CoreStat.STRENGTH, 3);
        fx.engine().applyStatusEffect(alice, buff);

        fx.engine().tick(alice);

        assertEquals(10, alice.getStat(CoreStat.STRENGTH));
    }

    @Test
    @DisplayName("Armor bonus effects count toward effective armor until they expire")
    void armorBonus() {
        fx.engine().applyStatusEffect(alice, StatusEffect.builder(StatusKind.AC_BONUS, "Mage Armor").magnitude(4).duration(2).build());
        assertEquals(4, alice.getEffectiveArmor());
        fx.engine().tick(alice);
        fx.engine().tick(alice);
        assertEquals(0, alice.getEffectiveArmor());
    }

    @Test
    @DisplayName("startTicking registers the cooldown and effect tasks")
    void startTicking() {
        TickService ticks = new TickService();
        try {
            fx.engine().startTicking(ticks, () -> List.of(alice));
            assertTrue(ticks.isScheduled("cooldown-tick"));
            assertTrue(ticks.isScheduled("effect-scheduler"));
            assertTrue(ticks.cancel("effect-scheduler"));
            assertFalse(ticks.isScheduled("effect-scheduler"));
        } finally {
            ticks.shutdown();
        }
    }

    @Test
    @DisplayName("initialize schedules cooldown rounds alongside effect ticks")
    void initializeSchedulesCooldowns() {
        TickService ticks = new TickService();
        try {
            fx.engine().getScheduler().initialize(ticks, fx.engine().getResources(), () -> List.of(alice));
            assertTrue(ticks.isScheduled("cooldown-tick"));
            assertTrue(ticks.isScheduled("effect-scheduler"));
        } finally {
            ticks.shutdown();
        }
    }
}
