package com.example.spellcraft.world;

import java.util.List;

/**
 * Party membership as far as summons are concerned.
 */
public interface PartyRegistry {

    /**
     * Leader of the player's party, or the player themself when ungrouped.
     */
    int leaderOf(int playerId);

    void trackSummon(int leaderId, long summonInstanceId);

    List<Long> trackedSummons(int leaderId);
}
