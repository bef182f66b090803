package com.example.spellcraft.world;

import com.example.spellcraft.model.PlayerCharacter;

import java.util.Optional;

/**
 * Lookup of connected players by character ID.
 */
public interface PlayerDirectory {

    Optional<PlayerCharacter> findPlayer(int characterId);
}
