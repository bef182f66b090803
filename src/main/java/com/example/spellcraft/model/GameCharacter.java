package com.example.spellcraft.model;

import com.example.spellcraft.effect.StatusEffectLedger;
import com.example.spellcraft.effect.StatusKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Common state for anything a spell can land on: players and mobs.
 *
 * Hit points and mana are clamped by every mutator, so currentHP stays in [0, hpMax]
 * and currentMana in [0, mpMax].
 */
public abstract class GameCharacter {
    private final String name;

    private int hpMax;
    private int hpCur;

    private int mpMax;
    private int mpCur;

    // Current room (nullable)
    private Integer currentRoom;

    private final EnumMap<CoreStat, Integer> stats = new EnumMap<>(CoreStat.class);
    private int armor;

    private final StatusEffectLedger effects = new StatusEffectLedger();

    protected GameCharacter(String name, int hpMax, int hpCur, int mpMax, int mpCur,
                            Integer currentRoom, Map<CoreStat, Integer> stats, int armor) {
        this.name = name;
        this.hpMax = Math.max(1, hpMax);
        this.mpMax = Math.max(0, mpMax);
        this.hpCur = clamp(hpCur, 0, this.hpMax);
        this.mpCur = clamp(mpCur, 0, this.mpMax);
        this.currentRoom = currentRoom;
        for (CoreStat stat : CoreStat.values()) {
            Integer v = stats != null ? stats.get(stat) : null;
            this.stats.put(stat, v != null ? v : 10);
        }
        this.armor = armor;
    }

    public abstract boolean isPlayer();

    public abstract int getLevel();

    public String getName() { return name; }

    public int getHpMax() { return hpMax; }
    public int getHpCur() { return hpCur; }
    public void setHpCur(int hpCur) { this.hpCur = clamp(hpCur, 0, hpMax); }
    public void setHpMax(int hpMax) {
        this.hpMax = Math.max(1, hpMax);
        this.hpCur = Math.min(this.hpCur, this.hpMax);
    }

    public int getMpMax() { return mpMax; }
    public int getMpCur() { return mpCur; }
    public void setMpCur(int mpCur) { this.mpCur = clamp(mpCur, 0, mpMax); }
    public void setMpMax(int mpMax) {
        this.mpMax = Math.max(0, mpMax);
        this.mpCur = Math.min(this.mpCur, this.mpMax);
    }

    public Integer getCurrentRoom() { return currentRoom; }
    public void setCurrentRoom(Integer currentRoom) { this.currentRoom = currentRoom; }

    public int getStat(CoreStat stat) { return stats.get(stat); }
    public void setStat(CoreStat stat, int value) { stats.put(stat, value); }

    public int getArmor() { return armor; }
    public void setArmor(int armor) { this.armor = armor; }

    /**
     * Armor including active ac_bonus effects.
     */
    public int getEffectiveArmor() {
        return armor + effects.totalMagnitude(StatusKind.AC_BONUS);
    }

    public StatusEffectLedger getEffects() { return effects; }

    /**
     * Heal by the given amount (capped at hpMax).
     * @return hit points actually restored
     */
    public int heal(int amount) {
        if (amount <= 0) return 0;
        int before = hpCur;
        setHpCur(hpCur + amount);
        return hpCur - before;
    }

    /**
     * Apply damage (floored at 0).
     * @return hit points actually removed
     */
    public int damage(int amount) {
        if (amount <= 0) return 0;
        int before = hpCur;
        setHpCur(hpCur - amount);
        return before - hpCur;
    }

    public boolean isAtFullHealth() { return hpCur >= hpMax; }

    public boolean isDefeated() { return hpCur <= 0; }

    public boolean isParalyzed() { return effects.has(StatusKind.PARALYZE); }

    public boolean isInvisible() { return effects.has(StatusKind.INVISIBILITY); }

    /**
     * Case-insensitive substring match against this character's name.
     */
    public boolean nameMatches(String fragment) {
        if (fragment == null || fragment.isBlank() || name == null) return false;
        return name.toLowerCase().contains(fragment.trim().toLowerCase());
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
