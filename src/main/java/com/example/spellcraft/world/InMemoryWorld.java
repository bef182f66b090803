package com.example.spellcraft.world;

import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Room, player and mob bookkeeping held in memory.
 *
 * Death handling removes the mob from its room. Loot and experience are left to
 * an optional reward hook.
 */
public class InMemoryWorld implements RoomOccupancy, PlayerDirectory, MobLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorld.class);

    /**
     * Called before a dead mob is removed, e.g. to drop loot or award experience.
     */
    @FunctionalInterface
    public interface RewardHook {
        void award(Integer killerId, Mobile mob, int roomId);
    }

    private final Map<Integer, Room> rooms = new ConcurrentHashMap<>();
    private final Map<Integer, List<Mobile>> mobsByRoom = new ConcurrentHashMap<>();
    private final Map<Integer, PlayerCharacter> players = new ConcurrentHashMap<>();

    private volatile RewardHook rewardHook;

    public void addRoom(Room room) {
        rooms.put(room.getId(), room);
    }

    public Optional<Room> getRoom(int roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public void addPlayer(PlayerCharacter player) {
        players.put(player.getCharacterId(), player);
    }

    public void removePlayer(int characterId) {
        players.remove(characterId);
    }

    public void setRewardHook(RewardHook rewardHook) {
        this.rewardHook = rewardHook;
    }

    // ========== RoomOccupancy ==========

    @Override
    public List<Mobile> listMobs(int roomId) {
        List<Mobile> mobs = mobsByRoom.get(roomId);
        return mobs == null ? Collections.emptyList() : Collections.unmodifiableList(mobs);
    }

    @Override
    public List<PlayerCharacter> listPlayers(int roomId) {
        List<PlayerCharacter> result = new ArrayList<>();
        for (PlayerCharacter p : players.values()) {
            Integer room = p.getCurrentRoom();
            if (room != null && room == roomId) result.add(p);
        }
        result.sort((a, b) -> Integer.compare(a.getCharacterId(), b.getCharacterId()));
        return result;
    }

    @Override
    public boolean isSafe(int roomId) {
        Room room = rooms.get(roomId);
        return room != null && room.isSafe();
    }

    @Override
    public void addMob(int roomId, Mobile mob) {
        mob.setCurrentRoom(roomId);
        mobsByRoom.computeIfAbsent(roomId, k -> new CopyOnWriteArrayList<>()).add(mob);
    }

    public boolean removeMob(int roomId, Mobile mob) {
        List<Mobile> mobs = mobsByRoom.get(roomId);
        return mobs != null && mobs.remove(mob);
    }

    // ========== PlayerDirectory ==========

    @Override
    public Optional<PlayerCharacter> findPlayer(int characterId) {
        return Optional.ofNullable(players.get(characterId));
    }

    // ========== MobLifecycle ==========

    @Override
    public void onDeath(Mobile mob, int roomId, Integer killerId) {
        RewardHook hook = rewardHook;
        if (hook != null) {
            hook.award(killerId, mob, roomId);
        }
        mob.die();
        if (removeMob(roomId, mob)) {
            logger.debug("[world] removed dead mob {} from room {}", mob, roomId);
        }
    }
}
