package com.example.spellcraft.effect;

import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CastContext;
import com.example.spellcraft.spell.EffectKind;
import com.example.spellcraft.spell.ScalingModel;
import com.example.spellcraft.spell.SpellDataException;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
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
 * Paralyze, charm and stat-drain curses on mobs, with an optional damage component.
 * The damage skips the accuracy check.
 */
public class DebuffEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(DebuffEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} casts {spell} at {target}!";
    static final String DEFAULT_HIT = "{target} is afflicted with {effect}!";
    static final String DEFAULT_AREA_CAST = "{caster} casts {spell}!";
    static final String DEFAULT_AREA_HIT = "{effect} affects all enemies!";
    static final String DEFAULT_DRAIN_AMOUNT = "-1d5";

    private final RoomOccupancy rooms;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final DefeatHandler defeats;
    private final EngineSettings settings;
    private final Clock clock;

    public DebuffEffectResolver(RoomOccupancy rooms, Messaging messaging, DiceRoller dice,
                                DefeatHandler defeats, EngineSettings settings, Clock clock) {
        this.rooms = rooms;
        this.messaging = messaging;
        this.dice = dice;
        this.defeats = defeats;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void resolve(CastContext ctx) {
        SpellDefinition spell = ctx.spell();
        EffectKind kind = spell.getEffectKind();
        if (kind == null || !kind.supports(SpellFamily.DEBUFF)) {
            throw new SpellDataException(spell.getId(), "unknown debuff effect '" + spell.getEffect() + "'");
        }
        int damage = rollDamage(ctx);
        if (spell.isArea()) {
            resolveArea(ctx, kind, damage);
        } else {
            resolveSingle(ctx, kind, damage, ctx.target());
        }
    }

    private void resolveSingle(CastContext ctx, EffectKind kind, int damage, GameCharacter target) {
        SpellDefinition spell = ctx.spell();
        if (target == null) {
            // checked before commit; only reachable if the target left mid-cast
            messaging.sendToPlayer(ctx.casterId(), "You cast " + spell.getName() + ", but there are no targets in range.");
            return;
        }
        int dealt = target.damage(damage);
        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_CAST)
                .with("caster", ctx.caster().getName())
                .with("target", target.getName())
                .with("spell", spell.getName())
                .with("damage", dealt)
                .with("damage_type", spell.getDamageType())
                .with("effect", effectName(kind));
        String damageText = dealt > 0 ? " It takes " + dealt + " " + spell.getDamageType() + " damage!" : "";

        if (target.isDefeated()) {
            messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + damageText);
            messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + damageText);
            if (target instanceof Mobile mob) {
                defeats.defeat(mob, ctx.roomId(), ctx.casterId(), mob.getName() + " has been defeated!");
            }
            return;
        }

        afflict(ctx, kind, target);
        String hit = hitLine(ctx, kind, target.getName(), DEFAULT_HIT);
        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + damageText + " " + hit);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + damageText + " " + hit);
        provoke(kind, target, ctx.casterId());
        logger.debug("[cast] {} afflicted {} with {}", ctx.caster().getName(), target.getName(), kind.key);
    }

    private void resolveArea(CastContext ctx, EffectKind kind, int damage) {
        SpellDefinition spell = ctx.spell();
        List<Mobile> snapshot = new ArrayList<>();
        for (Mobile m : List.copyOf(rooms.listMobs(ctx.roomId()))) {
            if (!m.isDead() && !m.isSummoned()) snapshot.add(m);
        }
        if (snapshot.isEmpty()) {
            messaging.sendToPlayer(ctx.casterId(), "You cast " + spell.getName() + ", but there are no targets in range.");
            return;
        }

        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_AREA_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("damage", damage)
                .with("damage_type", spell.getDamageType())
                .with("effect", effectName(kind));
        String hit = hitLine(ctx, kind, "all enemies", DEFAULT_AREA_HIT);
        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + " " + hit);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + " " + hit);

        List<Mobile> defeated = new ArrayList<>();
        for (Mobile mob : snapshot) {
            if (mob.isDead()) continue;
            int dealt = mob.damage(damage);
            if (dealt > 0) {
                String line = "  " + mob.getName() + " takes " + dealt + " " + spell.getDamageType() + " damage!";
                messaging.sendToPlayer(ctx.casterId(), line);
                messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), line);
            }
            if (mob.isDefeated()) {
                defeated.add(mob);
                continue;
            }
            afflict(ctx, kind, mob);
            provoke(kind, mob, ctx.casterId());
        }
        logger.debug("[cast] {} area {} afflicted {} mob(s), {} defeated",
                ctx.caster().getName(), spell.getId(), snapshot.size() - defeated.size(), defeated.size());
        defeats.defeatAll(defeated, ctx.roomId(), ctx.casterId(), "  ");
    }

    private void afflict(CastContext ctx, EffectKind kind, GameCharacter target) {
        SpellDefinition spell = ctx.spell();
        if (kind.isStatDrain()) {
            String amountDice = spell.getEffectAmount() != null ? spell.getEffectAmount() : DEFAULT_DRAIN_AMOUNT;
            int amount = dice.rollMagnitude(amountDice);
            StatusEffect effect = StatusEffect.builder(kind.statusKind(), spell.getName())
                    .effectKey(kind.key)
                    .magnitude(amount)
                    .duration(spell.effectDurationOr(settings.getDefaultDrainDuration()))
                    .casterId(ctx.casterId())
                    .removalText(spell.getRemovalText())
                    .build();
            StatAdjustments.drain(target, effect, kind.stats(), amount);
            target.getEffects().attach(effect);
            return;
        }
        StatusEffect effect = StatusEffect.builder(kind.statusKind(), spell.getName())
                .effectKey(kind.key)
                .magnitude(spell.getBonusAmount())
                .duration(spell.effectDurationOr(settings.getDefaultDebuffDuration()))
                .casterId(ctx.casterId())
                .removalText(spell.getRemovalText())
                .build();
        target.getEffects().attach(effect);
    }

    private int rollDamage(CastContext ctx) {
        String dmg = ctx.spell().getDamageDice();
        if (dmg == null || dmg.isBlank()) return 0;
        return ScalingModel.scaledValue(Math.max(0, dice.roll(dmg)), ctx.spell(), ctx.casterLevel());
    }

    private String hitLine(CastContext ctx, EffectKind kind, String targetName, String fallback) {
        String line = SpellMessages.of(ctx.spell().getHitMessage(), fallback)
                .with("caster", ctx.caster().getName())
                .with("spell", ctx.spell().getName())
                .with("target", targetName)
                .with("effect", effectName(kind))
                .render();
        return line.isEmpty() ? line : Character.toUpperCase(line.charAt(0)) + line.substring(1);
    }

    /**
     * Charmed mobs stay calm; any other affliction draws the mob's attention.
     */
    private void provoke(EffectKind kind, GameCharacter target, int casterId) {
        if (kind == EffectKind.CHARM || !(target instanceof Mobile mob)) return;
        mob.provokeBy(casterId, clock.millis());
    }

    static String effectName(EffectKind kind) {
        return kind.key.replace('_', ' ');
    }
}
