package com.example.spellcraft.world;

import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;

import java.util.List;

/**
 * Who is in a room. Owned by the world layer; the engine reads it and adds summons to it.
 */
public interface RoomOccupancy {

    /**
     * Live mobs in the room. Callers that mutate mobs while iterating must copy this list first.
     */
    List<Mobile> listMobs(int roomId);

    List<PlayerCharacter> listPlayers(int roomId);

    /** Safe rooms forbid summoning. */
    boolean isSafe(int roomId);

    void addMob(int roomId, Mobile mob);
}
