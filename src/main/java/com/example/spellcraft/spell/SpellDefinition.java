package com.example.spellcraft.spell;

/**
 * Immutable spell data, loaded once from the spell catalog.
 */
public class SpellDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final SpellFamily family;
    private final String effect;             // raw effect key as written in data
    private final EffectKind effectKind;     // null when absent or unrecognised
    private final int manaCost;
    private final int cooldownRounds;
    private final AreaOfEffect areaOfEffect;
    private final boolean requiresTarget;
    private final String classRestriction;
    private final int minLevel;
    private final boolean scalesWithLevel;

    // Damage / heal
    private final String damageDice;
    private final String healDice;
    private final String damageType;
    private final Integer poisonDuration;
    private final String poisonDamage;

    // Timed effects
    private final int durationRounds;
    private final Integer effectDuration;
    private final String effectAmount;
    private final int bonusAmount;
    private final String removalText;

    // Summon eligibility
    private final boolean scalesSummonWithLevel;
    private final int minSummonLevel;
    private final int maxSummonLevel;
    private final String summonType;
    private final boolean allowSpecialTerrain;

    // Message templates (null = family default)
    private final String castMessage;
    private final String hitMessage;

    private SpellDefinition(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.description = b.description != null ? b.description : "";
        this.family = b.family;
        this.effect = b.effect;
        this.effectKind = EffectKind.fromString(b.effect);
        this.manaCost = Math.max(0, b.manaCost);
        this.cooldownRounds = Math.max(0, b.cooldownRounds);
        this.areaOfEffect = b.areaOfEffect != null ? b.areaOfEffect : AreaOfEffect.SINGLE;
        this.requiresTarget = b.requiresTarget;
        this.classRestriction = b.classRestriction != null && !b.classRestriction.isBlank() ? b.classRestriction.trim() : null;
        this.minLevel = Math.max(1, b.minLevel);
        this.scalesWithLevel = b.scalesWithLevel;
        this.damageDice = b.damageDice;
        this.healDice = b.healDice;
        this.damageType = b.damageType != null ? b.damageType : "magical";
        this.poisonDuration = b.poisonDuration;
        this.poisonDamage = b.poisonDamage;
        this.durationRounds = Math.max(0, b.durationRounds);
        this.effectDuration = b.effectDuration;
        this.effectAmount = b.effectAmount;
        this.bonusAmount = b.bonusAmount;
        this.removalText = b.removalText;
        this.scalesSummonWithLevel = b.scalesSummonWithLevel;
        this.minSummonLevel = Math.max(1, b.minSummonLevel);
        this.maxSummonLevel = Math.max(this.minSummonLevel, b.maxSummonLevel);
        this.summonType = b.summonType != null && !b.summonType.isBlank() ? b.summonType.trim() : null;
        this.allowSpecialTerrain = b.allowSpecialTerrain;
        this.castMessage = b.castMessage;
        this.hitMessage = b.hitMessage;
    }

    public static Builder builder(String id, SpellFamily family) {
        return new Builder(id, family);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public SpellFamily getFamily() { return family; }
    public String getEffect() { return effect; }
    public EffectKind getEffectKind() { return effectKind; }
    public int getManaCost() { return manaCost; }
    public int getCooldownRounds() { return cooldownRounds; }
    public AreaOfEffect getAreaOfEffect() { return areaOfEffect; }
    public boolean isArea() { return areaOfEffect == AreaOfEffect.AREA; }
    public boolean isRequiresTarget() { return requiresTarget; }
    public String getClassRestriction() { return classRestriction; }
    public int getMinLevel() { return minLevel; }
    public boolean isScalesWithLevel() { return scalesWithLevel; }
    public String getDamageDice() { return damageDice; }
    public String getHealDice() { return healDice; }
    public String getDamageType() { return damageType; }
    public Integer getPoisonDuration() { return poisonDuration; }
    public String getPoisonDamage() { return poisonDamage; }
    public int getDurationRounds() { return durationRounds; }
    public Integer getEffectDuration() { return effectDuration; }
    public String getEffectAmount() { return effectAmount; }
    public int getBonusAmount() { return bonusAmount; }
    public String getRemovalText() { return removalText; }
    public boolean isScalesSummonWithLevel() { return scalesSummonWithLevel; }
    public int getMinSummonLevel() { return minSummonLevel; }
    public int getMaxSummonLevel() { return maxSummonLevel; }
    public String getSummonType() { return summonType; }
    public boolean isAllowSpecialTerrain() { return allowSpecialTerrain; }
    public String getCastMessage() { return castMessage; }
    public String getHitMessage() { return hitMessage; }

    public boolean hasCooldown() {
        return cooldownRounds > 0;
    }

    public boolean isPoisonous() {
        return "poison".equalsIgnoreCase(damageType);
    }

    /**
     * Whether a cast must name its target. Drains and single-target debuffs
     * always do, whatever the data says.
     */
    public boolean needsExplicitTarget() {
        if (family == SpellFamily.SUMMON) return false;
        if (requiresTarget || family == SpellFamily.DRAIN) return true;
        return family == SpellFamily.DEBUFF && !isArea();
    }

    /**
     * Duration for the timed entry this spell attaches, falling back to the given default.
     */
    public int effectDurationOr(int defaultDuration) {
        if (effectDuration != null) return effectDuration;
        return durationRounds > 0 ? durationRounds : defaultDuration;
    }

    @Override
    public String toString() {
        return "SpellDefinition{" + id + ", " + family + "}";
    }

    public static final class Builder {
        private final String id;
        private final SpellFamily family;
        private String name;
        private String description;
        private String effect;
        private int manaCost;
        private int cooldownRounds;
        private AreaOfEffect areaOfEffect = AreaOfEffect.SINGLE;
        private boolean requiresTarget;
        private String classRestriction;
        private int minLevel = 1;
        private boolean scalesWithLevel;
        private String damageDice;
        private String healDice;
        private String damageType;
        private Integer poisonDuration;
        private String poisonDamage;
        private int durationRounds;
        private Integer effectDuration;
        private String effectAmount;
        private int bonusAmount;
        private String removalText;
        private boolean scalesSummonWithLevel;
        private int minSummonLevel = 1;
        private int maxSummonLevel = 1;
        private String summonType;
        private boolean allowSpecialTerrain;
        private String castMessage;
        private String hitMessage;

        private Builder(String id, SpellFamily family) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("spell id is required");
            if (family == null) throw new IllegalArgumentException("spell family is required for " + id);
            this.id = id;
            this.family = family;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder effect(String effect) { this.effect = effect; return this; }
        public Builder manaCost(int manaCost) { this.manaCost = manaCost; return this; }
        public Builder cooldownRounds(int cooldownRounds) { this.cooldownRounds = cooldownRounds; return this; }
        public Builder areaOfEffect(AreaOfEffect areaOfEffect) { this.areaOfEffect = areaOfEffect; return this; }
        public Builder requiresTarget(boolean requiresTarget) { this.requiresTarget = requiresTarget; return this; }
        public Builder classRestriction(String classRestriction) { this.classRestriction = classRestriction; return this; }
        public Builder minLevel(int minLevel) { this.minLevel = minLevel; return this; }
        public Builder scalesWithLevel(boolean scalesWithLevel) { this.scalesWithLevel = scalesWithLevel; return this; }
        public Builder damageDice(String damageDice) { this.damageDice = damageDice; return this; }
        public Builder healDice(String healDice) { this.healDice = healDice; return this; }
        public Builder damageType(String damageType) { this.damageType = damageType; return this; }
        public Builder poisonDuration(Integer poisonDuration) { this.poisonDuration = poisonDuration; return this; }
        public Builder poisonDamage(String poisonDamage) { this.poisonDamage = poisonDamage; return this; }
        public Builder durationRounds(int durationRounds) { this.durationRounds = durationRounds; return this; }
        public Builder effectDuration(Integer effectDuration) { this.effectDuration = effectDuration; return this; }
        public Builder effectAmount(String effectAmount) { this.effectAmount = effectAmount; return this; }
        public Builder bonusAmount(int bonusAmount) { this.bonusAmount = bonusAmount; return this; }
        public Builder removalText(String removalText) { this.removalText = removalText; return this; }
        public Builder scalesSummonWithLevel(boolean v) { this.scalesSummonWithLevel = v; return this; }
        public Builder summonLevels(int min, int max) { this.minSummonLevel = min; this.maxSummonLevel = max; return this; }
        public Builder summonType(String summonType) { this.summonType = summonType; return this; }
        public Builder allowSpecialTerrain(boolean v) { this.allowSpecialTerrain = v; return this; }
        public Builder castMessage(String castMessage) { this.castMessage = castMessage; return this; }
        public Builder hitMessage(String hitMessage) { this.hitMessage = hitMessage; return this; }

        public SpellDefinition build() {
            return new SpellDefinition(this);
        }
    }
}
