package com.example.spellcraft;

import com.example.spellcraft.effect.StatusKind;
import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.spell.AreaOfEffect;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DebuffEffectResolver Tests")
class DebuffEffectResolverTest {

    private EngineFixture fx;
    private Mobile goblin;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        fx.spell(SpellDefinition.builder("hold_monster", SpellFamily.DEBUFF)
                        .name("Hold Monster").effect("paralyze").effectDuration(3).build())
                .spell(SpellDefinition.builder("charm_monster", SpellFamily.DEBUFF)
                        .name("Charm Monster").effect("charm").build())
                .spell(SpellDefinition.builder("enervation", SpellFamily.DEBUFF)
                        .name("Enervation").effect("drain_body").effectAmount("2").effectDuration(1)
                        .areaOfEffect(AreaOfEffect.AREA).build())
                .spell(SpellDefinition.builder("crushing_hold", SpellFamily.DEBUFF)
                        .name("Crushing Hold").effect("paralyze").damageDice("10").damageType("bludgeoning").build());
        fx.caster(1, "Alice", "hold_monster", "charm_monster", "enervation", "crushing_hold");
        goblin = fx.mob("goblin", 10);
    }

    @Test
    @DisplayName("Paralysis lands on the named mob and provokes it")
    void paralyze() {
        fx.cast(1, "hold monster", "goblin");

        assertTrue(goblin.isParalyzed());
        assertEquals(3, goblin.getEffects().active().get(0).getRemainingDuration());
        assertEquals("You cast Hold Monster at goblin! Goblin is afflicted with paralyze!", fx.messaging.lastTo(1));
        assertEquals(Integer.valueOf(1), goblin.getAggroTarget());
    }

    @Test
    @DisplayName("A single-target debuff needs a target")
    void needsTarget() {
        fx.cast(1, "hold monster");
        assertEquals("You need a target to cast Hold Monster. Use: cast Hold Monster <target>", fx.messaging.lastTo(1));
        assertFalse(goblin.isParalyzed());
    }

    @Test
    @DisplayName("Charm does not draw the mob's attention")
    void charmDoesNotProvoke() {
        fx.cast(1, "charm monster", "gob");
        assertTrue(goblin.getEffects().has(StatusKind.CHARM));
        assertNull(goblin.getAggroTarget());
        assertTrue(fx.messaging.lastTo(1).endsWith("Goblin is afflicted with charm!"));
    }

    @Test
    @DisplayName("Damage that kills skips the affliction and defeats the mob")
    void damageKills() {
        goblin.setHpCur(5);

        fx.cast(1, "crushing hold", "goblin");

        assertTrue(goblin.isDead());
        assertFalse(goblin.isParalyzed());
        assertEquals(List.of(goblin), fx.deaths);
        assertTrue(fx.messaging.anyToPlayerContains(1, "You cast Crushing Hold at goblin! It takes 5 bludgeoning damage!"));
        assertEquals("goblin has been defeated!", fx.messaging.lastTo(1));
    }

    @Test
    @DisplayName("An area stat drain weakens every hostile mob and reverts on expiry")
    void areaStatDrain() {
        Mobile orc = fx.mob("orc", 12);
        Mobile pet = fx.mob("wolf", 10);
        pet.bindToSummoner(1, 1);

        fx.cast(1, "enervation");

        assertEquals(8, goblin.getStat(CoreStat.STRENGTH));
        assertEquals(8, orc.getStat(CoreStat.CONSTITUTION));
        assertEquals(10, pet.getStat(CoreStat.STRENGTH));
        assertEquals("You cast Enervation! Drain body affects all enemies!", fx.messaging.lastTo(1));

        fx.engine().tick(orc);
        assertEquals(10, orc.getStat(CoreStat.CONSTITUTION));
        assertTrue(orc.getEffects().isEmpty());
    }

    @Test
    @DisplayName("An area debuff with nobody to hit says so")
    void areaNoTargets() {
        fx.world.onDeath(goblin, EngineFixture.ROOM, null);
        fx.cast(1, "enervation");
        assertEquals("You cast Enervation, but there are no targets in range.", fx.messaging.lastTo(1));
    }
}
