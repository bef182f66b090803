package com.example.spellcraft.spell;

import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.PlayerCharacter;

/**
 * A validated, committed cast handed to an effect resolver.
 *
 * @param target entity resolved before commit, or null for self/area/summon casts
 * @param castingStatValue caster's casting stat (aims spells in place of dexterity)
 */
public record CastContext(SpellDefinition spell,
                          PlayerCharacter caster,
                          int roomId,
                          String targetName,
                          GameCharacter target,
                          int castingStatValue) {

    public int casterId() {
        return caster.getCharacterId();
    }

    public int casterLevel() {
        return caster.getLevel();
    }

    public boolean hasTargetName() {
        return targetName != null && !targetName.isBlank();
    }
}
