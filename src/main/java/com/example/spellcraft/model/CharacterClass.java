package com.example.spellcraft.model;

/**
 * Spellcasting profile of a character class (e.g., Wizard, Cleric).
 */
public class CharacterClass {
    public static final int DEFAULT_MAX_SPELL_LEVEL = 99;

    public final String name;
    public final String description;
    public final int maxSpellLevel;       // highest spell level the class may cast
    public final CoreStat castingStat;    // stat used for spell accuracy and failure

    public CharacterClass(String name, String description, int maxSpellLevel, CoreStat castingStat) {
        this.name = name;
        this.description = description;
        this.maxSpellLevel = maxSpellLevel > 0 ? maxSpellLevel : DEFAULT_MAX_SPELL_LEVEL;
        this.castingStat = castingStat != null ? castingStat : CoreStat.INTELLIGENCE;
    }

    @Override
    public String toString() {
        return name;
    }
}
