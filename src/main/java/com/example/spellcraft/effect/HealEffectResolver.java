package com.example.spellcraft.effect;

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
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hit point heals and the cures (poison, paralysis, stat drain, hunger, thirst).
 *
 * A single-target cast affects the named player or the caster. An area cast affects every
 * player in the room; each player who needs nothing is told so and left untouched.
 */
public class HealEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(HealEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} casts {spell} on {target}!";
    static final String DEFAULT_AREA_CAST = "{caster} casts {spell}!";
    static final String DEFAULT_HIT = "Healing energy restores {damage} hit points!";

    private final RoomOccupancy rooms;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final EffectScheduler scheduler;

    public HealEffectResolver(RoomOccupancy rooms, Messaging messaging, DiceRoller dice, EffectScheduler scheduler) {
        this.rooms = rooms;
        this.messaging = messaging;
        this.dice = dice;
        this.scheduler = scheduler;
    }

    @Override
    public void resolve(CastContext ctx) {
        EffectKind kind = effectKindOf(ctx.spell());
        if (ctx.spell().isArea()) {
            resolveArea(ctx, kind);
        } else {
            PlayerCharacter target = ctx.target() instanceof PlayerCharacter p ? p : ctx.caster();
            resolveSingle(ctx, kind, target);
        }
    }

    static EffectKind effectKindOf(SpellDefinition spell) {
        EffectKind kind = spell.getEffectKind();
        if (kind == null) {
            if (spell.getEffect() != null && !spell.getEffect().isBlank()) {
                throw new SpellDataException(spell.getId(), "unknown heal effect '" + spell.getEffect() + "'");
            }
            return EffectKind.HEAL_HIT_POINTS;
        }
        if (!kind.supports(SpellFamily.HEAL)) {
            throw new SpellDataException(spell.getId(), "effect '" + kind.key + "' is not a heal effect");
        }
        return kind;
    }

    private void resolveSingle(CastContext ctx, EffectKind kind, PlayerCharacter target) {
        SpellDefinition spell = ctx.spell();
        boolean self = target == ctx.caster();
        int amount = apply(ctx, kind, target, rollHeal(ctx, kind));

        if (amount <= 0) {
            String who = self ? "you are " : target.getName() + " is ";
            messaging.sendToPlayer(ctx.casterId(), "You cast " + spell.getName() + ", but " + who + unneeded(kind) + "!");
            return;
        }

        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("damage", amount);
        String casterLine = cast.with("target", self ? "yourself" : target.getName()).renderForCaster();
        String roomLine = cast.with("target", self ? "themselves" : target.getName()).render();

        String casterResult = resultLine(ctx, kind, amount, self ? "You are" : target.getName() + " is");
        String roomResult = resultLine(ctx, kind, amount, target.getName() + " is");
        messaging.sendToPlayer(ctx.casterId(), casterLine + " " + casterResult);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), roomLine + " " + roomResult);
        logger.debug("[cast] {} {} on {} ({})", ctx.caster().getName(), spell.getId(), target.getName(), amount);
    }

    private void resolveArea(CastContext ctx, EffectKind kind) {
        SpellDefinition spell = ctx.spell();
        List<PlayerCharacter> players = List.copyOf(rooms.listPlayers(ctx.roomId()));

        List<PlayerCharacter> needing = new ArrayList<>();
        List<PlayerCharacter> unaffected = new ArrayList<>();
        for (PlayerCharacter p : players) {
            if (needs(kind, p)) needing.add(p); else unaffected.add(p);
        }

        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_AREA_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("target", "everyone");
        if (needing.isEmpty()) {
            String none = " But no one needs " + (kind == EffectKind.HEAL_HIT_POINTS ? "healing" : "curing") + "!";
            messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + none);
            messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + none);
            return;
        }

        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster());
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render());

        for (PlayerCharacter p : unaffected) {
            messaging.sendToPlayer(p.getCharacterId(), "You are " + unneeded(kind) + ".");
        }
        int heal = rollHeal(ctx, kind);
        for (PlayerCharacter p : needing) {
            int amount = apply(ctx, kind, p, heal);
            messaging.sendToPlayer(p.getCharacterId(), resultLine(ctx, kind, amount, "You are"));
        }
        logger.debug("[cast] {} area {} affected {} of {} player(s)",
                ctx.caster().getName(), spell.getId(), needing.size(), players.size());
    }

    private boolean needs(EffectKind kind, PlayerCharacter p) {
        return switch (kind) {
            case HEAL_HIT_POINTS -> !p.isAtFullHealth();
            case CURE_HUNGER -> p.getHunger() < PlayerCharacter.MAX_SATIATION;
            case CURE_THIRST -> p.getThirst() < PlayerCharacter.MAX_SATIATION;
            default -> p.getEffects().has(kind.statusKind());
        };
    }

    /**
     * Rolled once per cast; every player an area heal reaches gains the same amount.
     */
    private int rollHeal(CastContext ctx, EffectKind kind) {
        if (kind != EffectKind.HEAL_HIT_POINTS) return 0;
        int base = Math.max(0, dice.roll(ctx.spell().getHealDice()));
        return ScalingModel.scaledValue(base, ctx.spell(), ctx.casterLevel());
    }

    /**
     * @return hit points restored, conditions removed or satiation gained; 0 when nothing was needed
     */
    private int apply(CastContext ctx, EffectKind kind, PlayerCharacter p, int heal) {
        switch (kind) {
            case HEAL_HIT_POINTS:
                return p.heal(heal);
            case CURE_HUNGER: {
                int before = p.getHunger();
                p.setHunger(PlayerCharacter.MAX_SATIATION);
                return p.getHunger() - before;
            }
            case CURE_THIRST: {
                int before = p.getThirst();
                p.setThirst(PlayerCharacter.MAX_SATIATION);
                return p.getThirst() - before;
            }
            default:
                return scheduler.cure(p, kind.statusKind());
        }
    }

    private String resultLine(CastContext ctx, EffectKind kind, int amount, String subject) {
        if (kind == EffectKind.HEAL_HIT_POINTS) {
            return SpellMessages.of(ctx.spell().getHitMessage(), DEFAULT_HIT)
                    .with("caster", ctx.caster().getName())
                    .with("spell", ctx.spell().getName())
                    .with("damage", amount)
                    .render();
        }
        return subject + " no longer " + condition(kind) + "!";
    }

    private static String unneeded(EffectKind kind) {
        return kind == EffectKind.HEAL_HIT_POINTS ? "already at full health" : "not " + condition(kind);
    }

    private static String condition(EffectKind kind) {
        return switch (kind) {
            case CURE_POISON -> "poisoned";
            case CURE_PARALYSIS -> "paralyzed";
            case CURE_DRAIN -> "drained";
            case CURE_HUNGER -> "hungry";
            case CURE_THIRST -> "thirsty";
            default -> "hurt";
        };
    }
}
