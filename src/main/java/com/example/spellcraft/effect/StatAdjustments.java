package com.example.spellcraft.effect;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.GameCharacter;

import java.util.Set;
import java.util.StringJoiner;

/**
 * Stat changes that ride along with a status effect. Each change is recorded on the
 * effect so it can be reversed exactly.
 */
final class StatAdjustments {

    static final int STAT_FLOOR = 1;

    private StatAdjustments() {}

    /**
     * Lower each stat by amount, never below 1.
     */
    static void drain(GameCharacter target, StatusEffect effect, Set<CoreStat> stats, int amount) {
        for (CoreStat stat : stats) {
            int before = target.getStat(stat);
            int after = Math.max(STAT_FLOOR, before - amount);
            target.setStat(stat, after);
            effect.recordDelta(stat, after - before);
        }
    }

    static void enhance(GameCharacter target, StatusEffect effect, Set<CoreStat> stats, int amount) {
        for (CoreStat stat : stats) {
            target.setStat(stat, target.getStat(stat) + amount);
            effect.recordDelta(stat, amount);
        }
    }

    /**
     * "strength, dexterity and constitution"
     */
    static String describe(Set<CoreStat> stats) {
        StringJoiner sj = new StringJoiner(", ");
        CoreStat[] arr = stats.toArray(new CoreStat[0]);
        for (int i = 0; i < arr.length - 1; i++) {
            sj.add(arr[i].name().toLowerCase());
        }
        String last = arr.length > 0 ? arr[arr.length - 1].name().toLowerCase() : "";
        return arr.length > 1 ? sj + " and " + last : last;
    }
}
