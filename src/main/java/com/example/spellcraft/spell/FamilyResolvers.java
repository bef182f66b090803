package com.example.spellcraft.spell;

import com.example.spellcraft.effect.EffectResolver;

/**
 * One resolver per spell family.
 */
public record FamilyResolvers(EffectResolver damage,
                              EffectResolver heal,
                              EffectResolver buff,
                              EffectResolver debuff,
                              EffectResolver drain,
                              EffectResolver summon) {

    public EffectResolver forFamily(SpellFamily family) {
        return switch (family) {
            case DAMAGE -> damage;
            case HEAL -> heal;
            case BUFF, ENHANCEMENT -> buff;
            case DEBUFF -> debuff;
            case DRAIN -> drain;
            case SUMMON -> summon;
        };
    }
}
