package com.example.spellcraft.model;

/**
 * A spawned or summoned instance of a MobileTemplate.
 */
public class Mobile extends GameCharacter {

    private final long instanceId;         // Unique instance ID, used for removal on death
    private final String templateKey;
    private final int level;
    private final String typeTag;

    // Hostile mobs are preferred as combat targets; summons are not hostile
    private boolean hostile;

    // Summon ownership
    private Integer summonerId;
    private Integer partyLeaderId;

    // Combat state
    private Integer aggroTarget;           // player character ID
    private long aggroLastAttack;

    private boolean dead;

    /**
     * Create a Mobile instance from a template at full HP/MP.
     */
    public Mobile(long instanceId, MobileTemplate template, Integer roomId) {
        super(template.getName(), template.getHpMax(), template.getHpMax(),
              template.getMpMax(), template.getMpMax(), roomId,
              template.getStats(), template.getArmor());
        this.instanceId = instanceId;
        this.templateKey = template.getKey();
        this.level = template.getLevel();
        this.typeTag = template.getTypeTag();
        this.hostile = template.isAggressive();
    }

    @Override
    public boolean isPlayer() { return false; }

    public long getInstanceId() { return instanceId; }
    public String getTemplateKey() { return templateKey; }
    @Override
    public int getLevel() { return level; }
    public String getTypeTag() { return typeTag; }

    public boolean isHostile() { return hostile; }
    public void setHostile(boolean hostile) { this.hostile = hostile; }

    public Integer getSummonerId() { return summonerId; }
    public Integer getPartyLeaderId() { return partyLeaderId; }
    public boolean isSummoned() { return summonerId != null; }

    /**
     * Mark this mob as a friendly summon owned by the given caster's party.
     */
    public void bindToSummoner(int summonerId, int partyLeaderId) {
        this.summonerId = summonerId;
        this.partyLeaderId = partyLeaderId;
        this.hostile = false;
        this.aggroTarget = null;
    }

    public Integer getAggroTarget() { return aggroTarget; }
    public void setAggroTarget(Integer aggroTarget) { this.aggroTarget = aggroTarget; }
    public long getAggroLastAttack() { return aggroLastAttack; }
    public void setAggroLastAttack(long aggroLastAttack) { this.aggroLastAttack = aggroLastAttack; }

    /**
     * React to being attacked by a player: take them as aggro target if none is set,
     * and refresh the last-attack time while they remain the target.
     */
    public void provokeBy(int playerId, long nowMs) {
        if (aggroTarget == null) {
            aggroTarget = playerId;
        }
        if (aggroTarget == playerId) {
            aggroLastAttack = nowMs;
        }
    }

    public boolean isDead() { return dead; }

    public void die() {
        this.dead = true;
        setHpCur(0);
        this.aggroTarget = null;
    }

    @Override
    public String toString() {
        return getName() + "#" + instanceId;
    }
}
