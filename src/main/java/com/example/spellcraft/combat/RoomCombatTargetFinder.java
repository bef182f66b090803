package com.example.spellcraft.combat;

import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.world.RoomOccupancy;

import java.util.List;
import java.util.Optional;

/**
 * Name lookup over the mobs in a room: hostile mobs first, then any other living mob.
 */
public class RoomCombatTargetFinder implements CombatTargetFinder {

    private final RoomOccupancy rooms;

    public RoomCombatTargetFinder(RoomOccupancy rooms) {
        this.rooms = rooms;
    }

    @Override
    public Optional<Mobile> findCombatTarget(int roomId, String nameFragment) {
        if (nameFragment == null || nameFragment.isBlank()) return Optional.empty();
        List<Mobile> mobs = List.copyOf(rooms.listMobs(roomId));
        for (Mobile m : mobs) {
            if (!m.isDead() && m.isHostile() && m.nameMatches(nameFragment)) return Optional.of(m);
        }
        for (Mobile m : mobs) {
            if (!m.isDead() && m.nameMatches(nameFragment)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
