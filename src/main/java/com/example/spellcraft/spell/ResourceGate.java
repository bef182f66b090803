package com.example.spellcraft.spell;

import com.example.spellcraft.model.PlayerCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;

/**
 * Mana, per-spell cooldown and global fatigue checks, plus the single commit step that
 * consumes them. Checks never mutate; commit runs exactly once per accepted cast.
 */
public class ResourceGate {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGate.class);

    private final CasterResourceStore store;
    private final Clock clock;
    private final int fatigueBaseSeconds;

    public ResourceGate(CasterResourceStore store, Clock clock, int fatigueBaseSeconds) {
        this.store = store;
        this.clock = clock;
        this.fatigueBaseSeconds = fatigueBaseSeconds;
    }

    public CastCheck checkCooldown(PlayerCharacter caster, SpellDefinition spell) {
        int remaining = store.forCaster(caster.getCharacterId()).getCooldownRemaining(spell.getId());
        if (remaining > 0) {
            return CastCheck.failure(spell.getName() + " is still on cooldown (" + remaining + " rounds remaining).");
        }
        return CastCheck.success();
    }

    public CastCheck checkFatigue(PlayerCharacter caster) {
        CasterResourceState state = store.forCaster(caster.getCharacterId());
        long now = clock.millis();
        if (state.isFatigued(now)) {
            String seconds = String.format(Locale.ROOT, "%.1f", state.getFatigueRemainingSeconds(now));
            return CastCheck.failure("You are too magically exhausted to cast spells! Wait " + seconds + " more seconds.");
        }
        return CastCheck.success();
    }

    public CastCheck checkMana(PlayerCharacter caster, SpellDefinition spell) {
        if (caster.getMpCur() < spell.getManaCost()) {
            return CastCheck.failure("You don't have enough mana to cast " + spell.getName()
                    + ". (Need " + spell.getManaCost() + ", have " + caster.getMpCur() + ")");
        }
        return CastCheck.success();
    }

    /**
     * Consume the cast's resources: mana, fatigue, then the spell's cooldown.
     * Never rolled back, even if the cast later fizzles.
     */
    public void commit(PlayerCharacter caster, SpellDefinition spell) {
        CasterResourceState state = store.forCaster(caster.getCharacterId());
        long now = clock.millis();

        caster.setMpCur(caster.getMpCur() - spell.getManaCost());
        state.setFatigueUntil(now + fatigueDurationMs(spell));
        if (spell.hasCooldown()) {
            state.startCooldown(spell.getId(), spell.getCooldownRounds());
        }
        logger.debug("[cast] {} committed {}: mana now {}/{}, fatigue until {}",
                caster.getName(), spell.getId(), caster.getMpCur(), caster.getMpMax(), state.getFatigueUntil());
    }

    /**
     * fatigueBaseSeconds x max(1, cooldownRounds), in milliseconds.
     */
    public long fatigueDurationMs(SpellDefinition spell) {
        return fatigueBaseSeconds * 1000L * Math.max(1, spell.getCooldownRounds());
    }
}
