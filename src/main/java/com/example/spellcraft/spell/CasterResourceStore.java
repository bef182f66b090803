package com.example.spellcraft.spell;

/**
 * Owner of every caster's cooldown and fatigue state.
 */
public interface CasterResourceStore {

    /**
     * State for the caster, created on first use.
     */
    CasterResourceState forCaster(int casterId);

    /**
     * Advance every caster's cooldowns by one round.
     */
    void tickCooldowns();
}
