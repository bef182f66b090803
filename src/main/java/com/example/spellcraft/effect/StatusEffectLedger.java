package com.example.spellcraft.effect;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Ordered list of the status effects carried by one character or mob.
 * Iteration always works on a snapshot, so entries may be removed while a tick is in progress.
 */
public class StatusEffectLedger {

    private final List<StatusEffect> entries = new CopyOnWriteArrayList<>();

    public void attach(StatusEffect effect) {
        if (effect != null) entries.add(effect);
    }

    /**
     * Snapshot of current entries in attach order.
     */
    public List<StatusEffect> active() {
        return List.copyOf(entries);
    }

    public boolean isEmpty() { return entries.isEmpty(); }

    public int size() { return entries.size(); }

    public boolean has(StatusKind kind) {
        for (StatusEffect e : entries) {
            if (e.getKind() == kind) return true;
        }
        return false;
    }

    public int count(StatusKind kind) {
        int n = 0;
        for (StatusEffect e : entries) {
            if (e.getKind() == kind) n++;
        }
        return n;
    }

    /**
     * True if an entry came from the named spell or carries the given effect key.
     */
    public boolean hasMatching(String spellName, String effectKey) {
        for (StatusEffect e : entries) {
            if (spellName != null && spellName.equalsIgnoreCase(e.getSource())) return true;
            if (effectKey != null && effectKey.equalsIgnoreCase(e.getEffectKey())) return true;
        }
        return false;
    }

    public int totalMagnitude(StatusKind kind) {
        int total = 0;
        for (StatusEffect e : entries) {
            if (e.getKind() == kind) total += e.getMagnitude();
        }
        return total;
    }

    /**
     * Remove one entry. Removing an entry twice is a no-op.
     * @return true if the entry was present
     */
    public boolean remove(StatusEffect effect) {
        if (effect == null) return false;
        boolean removed = entries.remove(effect);
        if (removed) effect.markRemoved();
        return removed;
    }

    /**
     * Remove every entry matching the filter.
     * @return the removed entries, in attach order
     */
    public List<StatusEffect> removeIf(Predicate<StatusEffect> filter) {
        List<StatusEffect> removed = new ArrayList<>();
        for (StatusEffect e : entries) {
            if (filter.test(e) && entries.remove(e)) {
                e.markRemoved();
                removed.add(e);
            }
        }
        return removed;
    }

    public void clear() {
        removeIf(e -> true);
    }
}
