package com.example.spellcraft.effect;

import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CasterResourceStore;
import com.example.spellcraft.util.DiceRoller;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ticking, expiry and curing of status effects.
 *
 * One tick deals damage-over-time, then counts every effect down by one; effects that
 * reach zero are removed and their owner (if a player) is told. Removal goes through
 * the ledger, so an effect is never ticked after it has been removed.
 */
public class EffectScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EffectScheduler.class);

    private final Messaging messaging;
    private final DiceRoller dice;
    private final DefeatHandler defeats;
    private final EngineSettings settings;
    private volatile boolean initialized = false;

    public EffectScheduler(Messaging messaging, DiceRoller dice, DefeatHandler defeats, EngineSettings settings) {
        this.messaging = messaging;
        this.dice = dice;
        this.defeats = defeats;
        this.settings = settings;
    }

    /**
     * Count spell cooldowns down one round and tick every entity the supplier returns,
     * once per configured interval.
     */
    public synchronized void initialize(TickService tickService, CasterResourceStore cooldowns,
                                        Supplier<? extends Collection<? extends GameCharacter>> entities) {
        if (initialized) return;
        long interval = settings.getTickIntervalMs();
        tickService.scheduleAtFixedRate("cooldown-tick", cooldowns::tickCooldowns, interval, interval);
        tickService.scheduleAtFixedRate("effect-scheduler", () -> {
            for (GameCharacter entity : List.copyOf(entities.get())) {
                try {
                    tick(entity);
                } catch (RuntimeException e) {
                    logger.error("[EffectScheduler] tick error for {}", entity.getName(), e);
                }
            }
        }, interval, interval);
        initialized = true;
    }

    public void attach(GameCharacter entity, StatusEffect effect) {
        entity.getEffects().attach(effect);
        logger.debug("[EffectScheduler] attached {} to {}", effect, entity.getName());
    }

    /**
     * Advance all of the entity's effects by one tick. Does nothing for an entity without effects.
     */
    public void tick(GameCharacter entity) {
        if (entity == null) return;
        StatusEffectLedger ledger = entity.getEffects();
        if (ledger.isEmpty()) return;

        boolean succumbed = false;
        for (StatusEffect effect : ledger.active()) {
            if (effect.isRemoved()) continue;

            if (effect.isDamageOverTime() && !succumbed) {
                succumbed = dealTickDamage(entity, effect);
                if (succumbed && entity instanceof Mobile) {
                    // the mob is gone; nothing left to decay
                    ledger.clear();
                    return;
                }
            }

            if (effect.decay()) {
                expire(entity, effect);
            }
        }
    }

    /**
     * Remove every effect of the given kind.
     * @return number of effects removed
     */
    public int cure(GameCharacter entity, StatusKind kind) {
        return cure(entity, e -> e.getKind() == kind);
    }

    public int cure(GameCharacter entity, Predicate<StatusEffect> filter) {
        if (entity == null) return 0;
        List<StatusEffect> removed = entity.getEffects().removeIf(filter);
        for (StatusEffect effect : removed) {
            if (revertsOnRemoval(effect)) {
                effect.revertDeltas(entity);
            }
        }
        if (!removed.isEmpty()) {
            logger.debug("[EffectScheduler] cured {} effect(s) on {}", removed.size(), entity.getName());
        }
        return removed.size();
    }

    /**
     * Stat drains always give their stats back. Enhancements keep theirs unless configured otherwise.
     */
    boolean revertsOnRemoval(StatusEffect effect) {
        return switch (effect.getKind()) {
            case STAT_DRAIN -> true;
            case STAT_BUFF -> settings.isRevertEnhancementsOnExpiry();
            default -> false;
        };
    }

    /**
     * @return true if the damage brought the entity to 0 HP
     */
    private boolean dealTickDamage(GameCharacter entity, StatusEffect effect) {
        int rolled = Math.max(0, dice.roll(effect.getTickDice()));
        int dealt = entity.damage(rolled);
        String kind = effect.getKind().key;

        if (entity instanceof PlayerCharacter player) {
            if (dealt > 0) {
                messaging.sendToPlayer(player.getCharacterId(), "You take " + dealt + " " + kind + " damage!");
            }
            if (player.isDefeated()) {
                messaging.sendToPlayer(player.getCharacterId(), "You have succumbed to " + kind + "!");
                logger.info("[EffectScheduler] {} reduced to 0 HP by {}", player.getName(), kind);
                return true;
            }
            return false;
        }

        Mobile mob = (Mobile) entity;
        Integer casterId = effect.getCasterId();
        if (dealt > 0 && casterId != null) {
            messaging.sendToPlayer(casterId, mob.getName() + " takes " + dealt + " " + kind + " damage.");
        }
        if (mob.isDefeated()) {
            Integer room = mob.getCurrentRoom();
            if (room == null) {
                logger.warn("[EffectScheduler] {} died to {} outside any room", mob, kind);
                mob.die();
            } else {
                defeats.defeat(mob, room, casterId, mob.getName() + " succumbs to " + kind + "!");
            }
            return true;
        }
        return false;
    }

    private void expire(GameCharacter entity, StatusEffect effect) {
        if (!entity.getEffects().remove(effect)) return;
        if (revertsOnRemoval(effect)) {
            effect.revertDeltas(entity);
        }
        if (entity instanceof PlayerCharacter player) {
            String text = effect.getRemovalText() != null
                    ? "You are " + effect.getRemovalText() + "."
                    : "The " + effect.displayName() + " effect has worn off.";
            messaging.sendToPlayer(player.getCharacterId(), text);
        }
        logger.debug("[EffectScheduler] {} expired on {}", effect.displayName(), entity.getName());
    }
}
