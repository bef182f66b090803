package com.example.spellcraft.world;

import com.example.spellcraft.model.Party;
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
 * Party registry kept in memory.
 * Ungrouped players lead their own implicit party, so their summons are tracked on themselves.
 */
public class InMemoryPartyRegistry implements PartyRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPartyRegistry.class);

    /** Quick lookup: character ID -> their current party */
    private final Map<Integer, Party> characterToParty = new ConcurrentHashMap<>();

    /** Summons tracked per leader, including leaders of implicit solo parties */
    private final Map<Integer, List<Long>> summonsByLeader = new ConcurrentHashMap<>();

    /**
     * Create a party led by the given character.
     * @return the new party, or empty if the character is already in one
     */
    public Optional<Party> createParty(int leaderId) {
        if (characterToParty.containsKey(leaderId)) {
            logger.debug("Cannot create party: character {} already in a party", leaderId);
            return Optional.empty();
        }
        Party party = new Party(leaderId);
        characterToParty.put(leaderId, party);
        logger.debug("Created party with leader {}", leaderId);
        return Optional.of(party);
    }

    /**
     * Add a character to the party led by leaderId.
     * @return false if there is no such party or the character is already grouped
     */
    public boolean join(int leaderId, int characterId) {
        Party party = characterToParty.get(leaderId);
        if (party == null || !party.isLeader(leaderId)) return false;
        if (characterToParty.putIfAbsent(characterId, party) != null) return false;
        party.addMember(characterId);
        return true;
    }

    public void leave(int characterId) {
        Party party = characterToParty.remove(characterId);
        if (party != null) {
            party.removeMember(characterId);
        }
    }

    public Optional<Party> getPartyFor(int characterId) {
        return Optional.ofNullable(characterToParty.get(characterId));
    }

    @Override
    public int leaderOf(int playerId) {
        Party party = characterToParty.get(playerId);
        return party != null ? party.getLeaderId() : playerId;
    }

    @Override
    public void trackSummon(int leaderId, long summonInstanceId) {
        summonsByLeader.computeIfAbsent(leaderId, k -> new CopyOnWriteArrayList<>()).add(summonInstanceId);
        Party party = characterToParty.get(leaderId);
        if (party != null) {
            party.addSummon(summonInstanceId);
        }
    }

    @Override
    public List<Long> trackedSummons(int leaderId) {
        List<Long> ids = summonsByLeader.get(leaderId);
        return ids == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(ids));
    }
}
