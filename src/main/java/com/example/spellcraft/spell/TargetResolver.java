package com.example.spellcraft.spell;

import com.example.spellcraft.combat.CombatTargetFinder;
import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.world.RoomOccupancy;

import java.util.List;
import java.util.Optional;

/**
 * Turns a typed target name into an entity in the caster's room.
 *
 * Offensive families (damage, drain) go through the combat target finder; debuffs match
 * mobs by name substring; heals and buffs match co-located players by name substring.
 */
public class TargetResolver {

    private final CombatTargetFinder combatTargets;
    private final RoomOccupancy rooms;

    public TargetResolver(CombatTargetFinder combatTargets, RoomOccupancy rooms) {
        this.combatTargets = combatTargets;
        this.rooms = rooms;
    }

    public Optional<GameCharacter> resolve(SpellDefinition spell, int roomId, String targetName) {
        if (targetName == null || targetName.isBlank()) return Optional.empty();
        return switch (spell.getFamily()) {
            case DAMAGE, DRAIN -> combatTargets.findCombatTarget(roomId, targetName).map(GameCharacter.class::cast);
            case DEBUFF -> findMobByName(roomId, targetName).map(GameCharacter.class::cast);
            case HEAL, BUFF, ENHANCEMENT -> findPlayerInRoom(roomId, targetName).map(GameCharacter.class::cast);
            case SUMMON -> Optional.empty();
        };
    }

    public Optional<Mobile> findCombatTarget(int roomId, String nameFragment) {
        return combatTargets.findCombatTarget(roomId, nameFragment);
    }

    public Optional<Mobile> findMobByName(int roomId, String nameFragment) {
        if (nameFragment == null || nameFragment.isBlank()) return Optional.empty();
        for (Mobile m : List.copyOf(rooms.listMobs(roomId))) {
            if (!m.isDead() && m.nameMatches(nameFragment)) return Optional.of(m);
        }
        return Optional.empty();
    }

    /**
     * Exact (case-insensitive) name first, then the first substring match.
     */
    public Optional<PlayerCharacter> findPlayerInRoom(int roomId, String nameFragment) {
        if (nameFragment == null || nameFragment.isBlank()) return Optional.empty();
        String wanted = nameFragment.trim();
        List<PlayerCharacter> players = rooms.listPlayers(roomId);
        for (PlayerCharacter p : players) {
            if (p.getName() != null && p.getName().equalsIgnoreCase(wanted)) return Optional.of(p);
        }
        for (PlayerCharacter p : players) {
            if (p.nameMatches(wanted)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
