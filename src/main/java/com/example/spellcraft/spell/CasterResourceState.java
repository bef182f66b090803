package com.example.spellcraft.spell;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caster spell cooldowns (in rounds) and the global fatigue deadline (wall clock).
 * Mana lives on the character itself.
 */
public class CasterResourceState {

    private final int casterId;

    // spell id -> rounds remaining
    private final Map<String, Integer> cooldowns = new ConcurrentHashMap<>();

    // epoch millis; 0 = not fatigued
    private volatile long fatigueUntil;

    public CasterResourceState(int casterId) {
        this.casterId = casterId;
    }

    public int getCasterId() { return casterId; }

    public int getCooldownRemaining(String spellId) {
        Integer rounds = cooldowns.get(spellId);
        return rounds != null ? rounds : 0;
    }

    public boolean isOnCooldown(String spellId) {
        return getCooldownRemaining(spellId) > 0;
    }

    public void startCooldown(String spellId, int rounds) {
        if (spellId == null || rounds <= 0) return;
        cooldowns.put(spellId, rounds);
    }

    public Map<String, Integer> getCooldowns() {
        return Collections.unmodifiableMap(new HashMap<>(cooldowns));
    }

    /**
     * Advance one round: decrement every cooldown and drop the finished ones.
     */
    public void tickCooldowns() {
        for (Map.Entry<String, Integer> e : cooldowns.entrySet()) {
            int next = e.getValue() - 1;
            if (next <= 0) {
                cooldowns.remove(e.getKey());
            } else {
                e.setValue(next);
            }
        }
    }

    public long getFatigueUntil() { return fatigueUntil; }

    public void setFatigueUntil(long fatigueUntil) { this.fatigueUntil = Math.max(0, fatigueUntil); }

    public boolean isFatigued(long nowMs) {
        return fatigueUntil > 0 && nowMs < fatigueUntil;
    }

    /**
     * @return seconds of fatigue left, or 0 if not fatigued
     */
    public double getFatigueRemainingSeconds(long nowMs) {
        return isFatigued(nowMs) ? (fatigueUntil - nowMs) / 1000.0 : 0.0;
    }

    public boolean isIdle(long nowMs) {
        return cooldowns.isEmpty() && !isFatigued(nowMs);
    }
}
