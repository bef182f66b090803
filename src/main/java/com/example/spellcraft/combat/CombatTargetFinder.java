package com.example.spellcraft.combat;

import com.example.spellcraft.model.Mobile;

import java.util.Optional;

/**
 * Finds the mob an offensive action is aimed at.
 */
@FunctionalInterface
public interface CombatTargetFinder {

    Optional<Mobile> findCombatTarget(int roomId, String nameFragment);
}
