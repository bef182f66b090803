package com.example.spellcraft.effect;

import com.example.spellcraft.combat.AttackOutcome;
import com.example.spellcraft.combat.CombatAccuracyOracle;
import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Single-target drains: mana transfer, life steal and stat drains.
 *
 * Mana and hit points only move, never appear: the caster gains at most what the target
 * actually lost, capped by the caster's own maximum.
 */
public class DrainEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(DrainEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} casts {spell} at {target}!";
    static final String DEFAULT_HIT = "It strikes for {damage} {damage_type} damage!";
    static final String DEFAULT_MANA_AMOUNT = "-1d2";
    static final String DEFAULT_STAT_AMOUNT = "-1d5";

    private final CombatAccuracyOracle oracle;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final DefeatHandler defeats;
    private final EngineSettings settings;
    private final Clock clock;

    public DrainEffectResolver(CombatAccuracyOracle oracle, Messaging messaging, DiceRoller dice,
                               DefeatHandler defeats, EngineSettings settings, Clock clock) {
        this.oracle = oracle;
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
        if (spell.getEffect() != null && !spell.getEffect().isBlank()
                && (kind == null || !kind.supports(SpellFamily.DRAIN))) {
            throw new SpellDataException(spell.getId(), "unknown drain effect '" + spell.getEffect() + "'");
        }
        GameCharacter target = ctx.target();
        if (target == null) {
            throw new SpellDataException(spell.getId(), "drain committed without a target");
        }

        AttackOutcome outcome = SpellAccuracy.check(oracle, ctx, target, settings.getBaseHitChance());
        if (!outcome.isHit()) {
            SpellAccuracy.reportMiss(messaging, ctx, target, outcome);
            if (target instanceof Mobile mob) mob.provokeBy(ctx.casterId(), clock.millis());
            return;
        }

        int dealt = 0;
        if (spell.getDamageDice() != null && !spell.getDamageDice().isBlank()) {
            int base = Math.max(0, dice.roll(spell.getDamageDice()));
            dealt = target.damage(ScalingModel.scaledValue(base, spell, ctx.casterLevel()));
        }

        String extra = kind == null ? "" : drain(ctx, kind, target, dealt);

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
        String casterHit = dealt > 0 || spell.getHitMessage() != null ? " " + hit.renderForCaster() : "";
        String roomHit = dealt > 0 || spell.getHitMessage() != null ? " " + hit.render() : "";
        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + casterHit + extra);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + roomHit);
        logger.debug("[cast] {} drained {} with {} ({} damage)", ctx.caster().getName(), target.getName(), spell.getId(), dealt);

        if (target instanceof Mobile mob) {
            if (mob.isDefeated()) {
                defeats.defeat(mob, ctx.roomId(), ctx.casterId(), mob.getName() + " has been defeated!");
            } else {
                mob.provokeBy(ctx.casterId(), clock.millis());
            }
        }
    }

    /**
     * Apply the drain itself.
     * @return text appended to the caster's message
     */
    private String drain(CastContext ctx, EffectKind kind, GameCharacter target, int dealt) {
        PlayerCharacter caster = ctx.caster();
        SpellDefinition spell = ctx.spell();
        switch (kind) {
            case DRAIN_MANA: {
                String amountDice = spell.getEffectAmount() != null ? spell.getEffectAmount() : DEFAULT_MANA_AMOUNT;
                int rolled = dice.rollMagnitude(amountDice);
                int actual = Math.min(rolled, target.getMpCur());
                target.setMpCur(target.getMpCur() - actual);
                caster.setMpCur(Math.min(caster.getMpCur() + actual, caster.getMpMax()));
                return actual > 0 ? " You drain " + actual + " mana!" : "";
            }
            case DRAIN_HEALTH: {
                int stolen = Math.min(dealt, caster.getHpMax() - caster.getHpCur());
                caster.heal(stolen);
                return stolen > 0 ? " You absorb " + stolen + " HP!" : "";
            }
            default: {
                if (target.isDefeated()) return "";
                String amountDice = spell.getEffectAmount() != null ? spell.getEffectAmount() : DEFAULT_STAT_AMOUNT;
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
                return " " + target.getName() + "'s " + StatAdjustments.describe(kind.stats()) + " weakens!";
            }
        }
    }
}
