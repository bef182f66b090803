package com.example.spellcraft.combat;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.GameCharacter;

/**
 * Snapshot of the numbers an accuracy check reads.
 */
public record CombatStats(int level, int strength, int dexterity, int constitution,
                          int intelligence, int wisdom, int charisma) {

    public static CombatStats of(GameCharacter c) {
        return new CombatStats(c.getLevel(),
                c.getStat(CoreStat.STRENGTH),
                c.getStat(CoreStat.DEXTERITY),
                c.getStat(CoreStat.CONSTITUTION),
                c.getStat(CoreStat.INTELLIGENCE),
                c.getStat(CoreStat.WISDOM),
                c.getStat(CoreStat.CHARISMA));
    }

    /**
     * Copy with dexterity replaced; spells aim with the casting stat instead of dexterity.
     */
    public CombatStats withDexterity(int value) {
        return new CombatStats(level, strength, value, constitution, intelligence, wisdom, charisma);
    }
}
