package com.example.spellcraft.combat;

/**
 * Result of an accuracy check.
 */
public enum AttackOutcome {
    HIT,        // Attack connects
    MISS,       // Attack missed outright
    DODGE,      // Target dodged
    DEFLECT;    // Target's armor deflected it

    public boolean isHit() {
        return this == HIT;
    }
}
