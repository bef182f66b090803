package com.example.spellcraft.world;

import com.example.spellcraft.model.Mobile;

/**
 * Handles a mob reaching 0 HP: loot and experience for the killer, then removal from the room.
 */
public interface MobLifecycle {

    /**
     * @param killerId player credited with the kill, or null when nobody is
     */
    void onDeath(Mobile mob, int roomId, Integer killerId);
}
