package com.example.spellcraft.effect;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.GameCharacter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A timed effect attached to a character or mob.
 *
 * remainingDuration is counted in ticks and only ever decreases. Once removed
 * from its ledger an effect is flagged and never ticked again.
 */
public class StatusEffect {

    private final String source;           // spell name, or the kind key for traps/items
    private final StatusKind kind;
    private final String effectKey;        // e.g. "enhance_strength", "poison"
    private final int magnitude;
    private int remainingDuration;
    private final Integer casterId;
    private final String removalText;
    private final String tickDice;         // damage per tick for DoT kinds

    // Stat changes applied alongside this effect (signed), reversed when the effect reverts
    private final EnumMap<CoreStat, Integer> appliedDeltas = new EnumMap<>(CoreStat.class);

    private volatile boolean removed;

    private StatusEffect(Builder b) {
        this.source = b.source;
        this.kind = b.kind;
        this.effectKey = b.effectKey != null ? b.effectKey : b.kind.key;
        this.magnitude = b.magnitude;
        this.remainingDuration = Math.max(0, b.duration);
        this.casterId = b.casterId;
        this.removalText = b.removalText != null ? b.removalText : b.kind.defaultRemovalText;
        this.tickDice = b.tickDice;
    }

    public static Builder builder(StatusKind kind, String source) {
        return new Builder(kind, source);
    }

    public String getSource() { return source; }
    public StatusKind getKind() { return kind; }
    public String getEffectKey() { return effectKey; }
    public int getMagnitude() { return magnitude; }
    public int getRemainingDuration() { return remainingDuration; }
    public Integer getCasterId() { return casterId; }
    public String getRemovalText() { return removalText; }
    public String getTickDice() { return tickDice; }
    public boolean isRemoved() { return removed; }

    public boolean isDamageOverTime() {
        return kind.damageOverTime && tickDice != null;
    }

    /**
     * Count down one tick.
     * @return true when the effect has run out
     */
    boolean decay() {
        if (remainingDuration > 0) remainingDuration--;
        return remainingDuration <= 0;
    }

    void markRemoved() {
        this.removed = true;
    }

    /**
     * Record a stat change applied on behalf of this effect.
     */
    public void recordDelta(CoreStat stat, int delta) {
        if (delta != 0) appliedDeltas.merge(stat, delta, Integer::sum);
    }

    public Map<CoreStat, Integer> getAppliedDeltas() {
        return Collections.unmodifiableMap(appliedDeltas);
    }

    /**
     * Undo every recorded stat change on the owner. Safe to call more than once.
     */
    public void revertDeltas(GameCharacter owner) {
        for (Map.Entry<CoreStat, Integer> e : appliedDeltas.entrySet()) {
            owner.setStat(e.getKey(), owner.getStat(e.getKey()) - e.getValue());
        }
        appliedDeltas.clear();
    }

    /**
     * Name shown in "has worn off" messages.
     */
    public String displayName() {
        return source != null && !source.isBlank() ? source : kind.key;
    }

    @Override
    public String toString() {
        return "StatusEffect{" + displayName() + ", " + kind.key + ", " + remainingDuration + " ticks}";
    }

    public static final class Builder {
        private final StatusKind kind;
        private final String source;
        private String effectKey;
        private int magnitude;
        private int duration = 1;
        private Integer casterId;
        private String removalText;
        private String tickDice;

        private Builder(StatusKind kind, String source) {
            if (kind == null) throw new IllegalArgumentException("kind is required");
            this.kind = kind;
            this.source = source;
        }

        public Builder effectKey(String effectKey) { this.effectKey = effectKey; return this; }
        public Builder magnitude(int magnitude) { this.magnitude = magnitude; return this; }
        public Builder duration(int duration) { this.duration = duration; return this; }
        public Builder casterId(Integer casterId) { this.casterId = casterId; return this; }
        public Builder removalText(String removalText) { this.removalText = removalText; return this; }
        public Builder tickDice(String tickDice) { this.tickDice = tickDice; return this; }

        public StatusEffect build() {
            return new StatusEffect(this);
        }
    }
}
