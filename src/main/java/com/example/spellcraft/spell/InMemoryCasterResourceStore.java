package com.example.spellcraft.spell;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooldown and fatigue state for all casters, keyed by character ID.
 * Entries with nothing left to track are dropped on tick.
 */
public class InMemoryCasterResourceStore implements CasterResourceStore {

    private final Map<Integer, CasterResourceState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCasterResourceStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CasterResourceState forCaster(int casterId) {
        return states.computeIfAbsent(casterId, CasterResourceState::new);
    }

    @Override
    public void tickCooldowns() {
        long now = clock.millis();
        for (Map.Entry<Integer, CasterResourceState> entry : states.entrySet()) {
            CasterResourceState state = entry.getValue();
            state.tickCooldowns();
            if (state.isIdle(now)) {
                states.remove(entry.getKey(), state);
            }
        }
    }

    public int size() {
        return states.size();
    }
}
