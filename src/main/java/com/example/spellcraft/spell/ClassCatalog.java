package com.example.spellcraft.spell;

import com.example.spellcraft.model.CharacterClass;
import com.example.spellcraft.model.CoreStat;

/**
 * Per-class casting limits.
 */
public interface ClassCatalog {

    /**
     * @return the class profile, or null for an unknown class
     */
    CharacterClass get(String className);

    /**
     * Highest spell level the class may cast. Unknown classes are unrestricted.
     */
    default int maxCastableSpellLevel(String className) {
        CharacterClass c = get(className);
        return c != null ? c.maxSpellLevel : CharacterClass.DEFAULT_MAX_SPELL_LEVEL;
    }

    /**
     * Stat the class casts with. Unknown classes use intelligence.
     */
    default CoreStat castingStat(String className) {
        CharacterClass c = get(className);
        return c != null ? c.castingStat : CoreStat.INTELLIGENCE;
    }
}
