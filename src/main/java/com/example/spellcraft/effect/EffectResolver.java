package com.example.spellcraft.effect;

import com.example.spellcraft.spell.CastContext;

/**
 * Applies a committed cast of one spell family.
 */
@FunctionalInterface
public interface EffectResolver {

    void resolve(CastContext ctx);
}
