package com.example.spellcraft.effect;

import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CastContext;
import com.example.spellcraft.spell.EffectKind;
import com.example.spellcraft.spell.SpellDataException;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
import com.example.spellcraft.spell.SpellMessages;
import com.example.spellcraft.util.DiceRoller;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Buffs (armor bonus, invisibility) and stat enhancements.
 *
 * A target already carrying an entry from the same spell or of the same effect is skipped
 * with a message; in an area cast the others still receive it. Enhancements raise the stat
 * immediately and the timed entry tracks the change.
 */
public class BuffEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(BuffEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} casts {spell} on {target}!";
    static final String DEFAULT_AREA_CAST = "{caster} casts {spell}!";
    static final String DEFAULT_ENHANCE_HIT = "{target} is enhanced!";
    static final String DEFAULT_BUFF_HIT = "{target} gains magical protection!";

    private final RoomOccupancy rooms;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final EngineSettings settings;

    public BuffEffectResolver(RoomOccupancy rooms, Messaging messaging, DiceRoller dice, EngineSettings settings) {
        this.rooms = rooms;
        this.messaging = messaging;
        this.dice = dice;
        this.settings = settings;
    }

    @Override
    public void resolve(CastContext ctx) {
        SpellDefinition spell = ctx.spell();
        EffectKind kind = effectKindOf(spell);

        if (spell.isArea()) {
            SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_AREA_CAST)
                    .with("caster", ctx.caster().getName())
                    .with("spell", spell.getName())
                    .with("target", "everyone");
            messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster());
            messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render());

            int affected = 0;
            for (PlayerCharacter p : List.copyOf(rooms.listPlayers(ctx.roomId()))) {
                if (isDuplicate(spell, kind, p)) {
                    messaging.sendToPlayer(p.getCharacterId(), "You are already under the effect of " + spell.getName() + "!");
                    continue;
                }
                int amount = applyTo(ctx, kind, p);
                String hit = hitLine(ctx, kind, p);
                messaging.sendToPlayer(ctx.casterId(), hit);
                messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), hit);
                notifyEnhanced(kind, p, amount);
                affected++;
            }
            logger.debug("[cast] {} area {} buffed {} player(s)", ctx.caster().getName(), spell.getId(), affected);
            return;
        }

        PlayerCharacter target = ctx.target() instanceof PlayerCharacter p ? p : ctx.caster();
        boolean self = target == ctx.caster();
        if (isDuplicate(spell, kind, target)) {
            String who = self ? "You are" : target.getName() + " is";
            messaging.sendToPlayer(ctx.casterId(), who + " already under the effect of " + spell.getName() + "!");
            return;
        }

        int amount = applyTo(ctx, kind, target);
        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("damage", amount);
        String casterLine = cast.with("target", self ? "yourself" : target.getName()).renderForCaster();
        String roomLine = cast.with("target", self ? "themselves" : target.getName()).render();
        String hit = hitLine(ctx, kind, target);
        messaging.sendToPlayer(ctx.casterId(), casterLine + " " + hit);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), roomLine + " " + hit);
        notifyEnhanced(kind, target, amount);
        logger.debug("[cast] {} {} on {} (+{})", ctx.caster().getName(), spell.getId(), target.getName(), amount);
    }

    static EffectKind effectKindOf(SpellDefinition spell) {
        EffectKind kind = spell.getEffectKind();
        if (kind == null || !kind.supports(SpellFamily.BUFF)) {
            throw new SpellDataException(spell.getId(), "unknown buff effect '" + spell.getEffect() + "'");
        }
        return kind;
    }

    static boolean isDuplicate(SpellDefinition spell, EffectKind kind, PlayerCharacter target) {
        return target.getEffects().hasMatching(spell.getName(), kind.key);
    }

    private int applyTo(CastContext ctx, EffectKind kind, PlayerCharacter target) {
        SpellDefinition spell = ctx.spell();
        int amount = amountFor(spell);
        StatusEffect effect = StatusEffect.builder(kind.statusKind(), spell.getName())
                .effectKey(kind.key)
                .magnitude(amount)
                .duration(spell.effectDurationOr(settings.getDefaultBuffDuration()))
                .casterId(ctx.casterId())
                .removalText(spell.getRemovalText())
                .build();
        if (kind.isStatEnhancement()) {
            StatAdjustments.enhance(target, effect, kind.stats(), amount);
        }
        target.getEffects().attach(effect);
        return amount;
    }

    /**
     * Rolled effect_amount when present, otherwise the flat bonus.
     */
    private int amountFor(SpellDefinition spell) {
        if (spell.getEffectAmount() != null && !spell.getEffectAmount().isBlank()) {
            return dice.rollMagnitude(spell.getEffectAmount());
        }
        return spell.getBonusAmount();
    }

    private String hitLine(CastContext ctx, EffectKind kind, PlayerCharacter target) {
        String fallback = kind.isStatEnhancement() ? DEFAULT_ENHANCE_HIT : DEFAULT_BUFF_HIT;
        return SpellMessages.of(ctx.spell().getHitMessage(), fallback)
                .with("caster", ctx.caster().getName())
                .with("spell", ctx.spell().getName())
                .with("target", target.getName())
                .with("effect", kind.key)
                .render();
    }

    private void notifyEnhanced(EffectKind kind, PlayerCharacter target, int amount) {
        if (!kind.isStatEnhancement() || amount == 0) return;
        String verb = kind.stats().size() > 1 ? " increase by " : " increases by ";
        messaging.sendToPlayer(target.getCharacterId(), "Your " + StatAdjustments.describe(kind.stats()) + verb + amount + "!");
    }
}
