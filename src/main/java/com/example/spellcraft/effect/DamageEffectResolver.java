package com.example.spellcraft.effect;

import com.example.spellcraft.combat.AttackOutcome;
import com.example.spellcraft.combat.CombatAccuracyOracle;
import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CastContext;
import com.example.spellcraft.spell.ScalingModel;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellMessages;
import com.example.spellcraft.util.DiceRoller;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Direct damage spells. A named target goes through the accuracy oracle; without one the
 * spell hits every mob in the room with a single roll.
 */
public class DamageEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(DamageEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} casts {spell} at {target}!";
    static final String DEFAULT_HIT = "It strikes for {damage} {damage_type} damage!";
    static final String DEFAULT_AREA_CAST = "{caster} casts {spell}!";
    static final String DEFAULT_AREA_HIT = "A wave of {damage_type} energy fills the room!";

    private final CombatAccuracyOracle oracle;
    private final RoomOccupancy rooms;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final DefeatHandler defeats;
    private final EngineSettings settings;
    private final Clock clock;

    public DamageEffectResolver(CombatAccuracyOracle oracle, RoomOccupancy rooms, Messaging messaging,
                                DiceRoller dice, DefeatHandler defeats, EngineSettings settings, Clock clock) {
        this.oracle = oracle;
        this.rooms = rooms;
        this.messaging = messaging;
        this.dice = dice;
        this.defeats = defeats;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void resolve(CastContext ctx) {
        if (ctx.target() != null) {
            resolveSingle(ctx, ctx.target());
        } else {
            resolveArea(ctx);
        }
    }

    private void resolveSingle(CastContext ctx, GameCharacter target) {
        SpellDefinition spell = ctx.spell();
        AttackOutcome outcome = SpellAccuracy.check(oracle, ctx, target, settings.getBaseHitChance());
        if (!outcome.isHit()) {
            SpellAccuracy.reportMiss(messaging, ctx, target, outcome);
            provoke(target, ctx.casterId());
            return;
        }

        int damage = rollDamage(ctx);
        int dealt = target.damage(damage);

        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_CAST)
                .with("caster", ctx.caster().getName())
                .with("target", target.getName())
                .with("spell", spell.getName())
                .with("damage", dealt)
                .with("damage_type", spell.getDamageType());
        SpellMessages hit = SpellMessages.of(spell.getHitMessage(), DEFAULT_HIT)
                .with("caster", ctx.caster().getName())
                .with("target", target.getName())
                .with("spell", spell.getName())
                .with("damage", dealt)
                .with("damage_type", spell.getDamageType());

        String suffix = "";
        if (spell.isPoisonous() && !target.isDefeated()) {
            target.getEffects().attach(poisonFrom(ctx));
            suffix = " " + target.getName() + " is poisoned!";
        }

        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + " " + hit.renderForCaster() + suffix);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + " " + hit.render() + suffix);
        logger.debug("[cast] {} hit {} with {} for {}", ctx.caster().getName(), target.getName(), spell.getId(), dealt);

        if (target instanceof Mobile mob) {
            if (mob.isDefeated()) {
                defeats.defeat(mob, ctx.roomId(), ctx.casterId(), mob.getName() + " has been defeated!");
            } else {
                mob.provokeBy(ctx.casterId(), clock.millis());
            }
        }
    }

    private void resolveArea(CastContext ctx) {
        SpellDefinition spell = ctx.spell();
        List<Mobile> snapshot = new ArrayList<>();
        for (Mobile m : List.copyOf(rooms.listMobs(ctx.roomId()))) {
            if (!m.isDead() && !m.isSummoned()) snapshot.add(m);
        }
        if (snapshot.isEmpty()) {
            messaging.sendToPlayer(ctx.casterId(), "You cast " + spell.getName() + ", but there are no enemies to affect!");
            return;
        }

        int damage = rollDamage(ctx);
        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_AREA_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("damage", damage)
                .with("damage_type", spell.getDamageType());
        SpellMessages hit = SpellMessages.of(spell.getHitMessage(), DEFAULT_AREA_HIT)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("damage", damage)
                .with("damage_type", spell.getDamageType());
        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + " " + hit.renderForCaster());
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + " " + hit.render());

        List<Mobile> defeated = new ArrayList<>();
        for (Mobile mob : snapshot) {
            if (mob.isDead()) continue;
            int dealt = mob.damage(damage);
            String line = "  " + mob.getName() + " takes " + dealt + " " + spell.getDamageType() + " damage!";
            if (spell.isPoisonous() && !mob.isDefeated()) {
                mob.getEffects().attach(poisonFrom(ctx));
                line += " " + mob.getName() + " is poisoned!";
            }
            messaging.sendToPlayer(ctx.casterId(), line);
            messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), line);
            if (mob.isDefeated()) {
                defeated.add(mob);
            } else {
                mob.provokeBy(ctx.casterId(), clock.millis());
            }
        }
        logger.debug("[cast] {} area {} hit {} mob(s), {} defeated",
                ctx.caster().getName(), spell.getId(), snapshot.size(), defeated.size());
        defeats.defeatAll(defeated, ctx.roomId(), ctx.casterId(), "  ");
    }

    private int rollDamage(CastContext ctx) {
        int base = Math.max(0, dice.roll(ctx.spell().getDamageDice()));
        return ScalingModel.scaledValue(base, ctx.spell(), ctx.casterLevel());
    }

    private StatusEffect poisonFrom(CastContext ctx) {
        SpellDefinition spell = ctx.spell();
        int duration = spell.getPoisonDuration() != null ? spell.getPoisonDuration() : settings.getDefaultPoisonDuration();
        String tick = spell.getPoisonDamage() != null ? spell.getPoisonDamage() : settings.getDefaultPoisonDamage();
        return StatusEffect.builder(StatusKind.POISON, spell.getName())
                .duration(duration)
                .tickDice(tick)
                .casterId(ctx.casterId())
                .build();
    }

    private void provoke(GameCharacter target, int casterId) {
        if (target instanceof Mobile mob) {
            mob.provokeBy(casterId, clock.millis());
        }
    }
}
