package com.example.spellcraft.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A player party. Summoned creatures are tracked on the party leader.
 */
public class Party {

    /** Character ID of the party leader */
    private volatile int leaderId;

    /** Character IDs of all members (including leader) */
    private final Set<Integer> memberIds = ConcurrentHashMap.newKeySet();

    /** Instance IDs of summoned mobs owned by this party, in summon order */
    private final List<Long> summonIds = new CopyOnWriteArrayList<>();

    public Party(int leaderId) {
        this.leaderId = leaderId;
        this.memberIds.add(leaderId);
    }

    public int getLeaderId() { return leaderId; }

    public Set<Integer> getMemberIds() {
        return Collections.unmodifiableSet(new HashSet<>(memberIds));
    }

    public boolean isLeader(int characterId) { return leaderId == characterId; }

    public boolean isMember(int characterId) { return memberIds.contains(characterId); }

    public boolean addMember(int characterId) {
        return memberIds.add(characterId);
    }

    /**
     * Remove a member. If the leader leaves, leadership passes to another member.
     * @return true if the character was a member
     */
    public boolean removeMember(int characterId) {
        if (!memberIds.remove(characterId)) return false;
        if (leaderId == characterId && !memberIds.isEmpty()) {
            leaderId = memberIds.iterator().next();
        }
        return true;
    }

    public void addSummon(long instanceId) {
        summonIds.add(instanceId);
    }

    public boolean removeSummon(long instanceId) {
        return summonIds.remove(instanceId);
    }

    public List<Long> getSummonIds() {
        return Collections.unmodifiableList(new ArrayList<>(summonIds));
    }

    public boolean isEmpty() { return memberIds.isEmpty(); }
}
