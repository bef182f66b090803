package com.example.spellcraft.spell;

import com.example.spellcraft.effect.StatusKind;
import com.example.spellcraft.model.CoreStat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.example.spellcraft.model.CoreStat.*;

/**
 * Sub-variant of a spell family, named by the spell's "effect" field.
 */
public enum EffectKind {
    // Heal family
    HEAL_HIT_POINTS("heal_hit_points", Category.HEAL, null),
    CURE_POISON("cure_poison", Category.HEAL, StatusKind.POISON),
    CURE_HUNGER("cure_hunger", Category.HEAL, null),
    CURE_THIRST("cure_thirst", Category.HEAL, null),
    CURE_PARALYSIS("cure_paralysis", Category.HEAL, StatusKind.PARALYZE),
    CURE_DRAIN("cure_drain", Category.HEAL, StatusKind.STAT_DRAIN),

    // Buff / enhancement family
    AC_BONUS("ac_bonus", Category.BUFF, StatusKind.AC_BONUS),
    INVISIBILITY("invisibility", Category.BUFF, StatusKind.INVISIBILITY),
    ENHANCE_AGILITY("enhance_agility", Category.BUFF, StatusKind.STAT_BUFF, DEXTERITY),
    ENHANCE_DEXTERITY("enhance_dexterity", Category.BUFF, StatusKind.STAT_BUFF, DEXTERITY),
    ENHANCE_STRENGTH("enhance_strength", Category.BUFF, StatusKind.STAT_BUFF, STRENGTH),
    ENHANCE_CONSTITUTION("enhance_constitution", Category.BUFF, StatusKind.STAT_BUFF, CONSTITUTION),
    ENHANCE_PHYSIQUE("enhance_physique", Category.BUFF, StatusKind.STAT_BUFF, CONSTITUTION),
    ENHANCE_VITALITY("enhance_vitality", Category.BUFF, StatusKind.STAT_BUFF, CONSTITUTION),
    ENHANCE_STAMINA("enhance_stamina", Category.BUFF, StatusKind.STAT_BUFF, CONSTITUTION),
    ENHANCE_INTELLIGENCE("enhance_intelligence", Category.BUFF, StatusKind.STAT_BUFF, INTELLIGENCE),
    ENHANCE_WISDOM("enhance_wisdom", Category.BUFF, StatusKind.STAT_BUFF, WISDOM),
    ENHANCE_CHARISMA("enhance_charisma", Category.BUFF, StatusKind.STAT_BUFF, CHARISMA),
    ENHANCE_MENTAL("enhance_mental", Category.BUFF, StatusKind.STAT_BUFF, INTELLIGENCE, WISDOM, CHARISMA),
    ENHANCE_BODY("enhance_body", Category.BUFF, StatusKind.STAT_BUFF, STRENGTH, DEXTERITY, CONSTITUTION),

    // Debuff family
    PARALYZE("paralyze", Category.DEBUFF, StatusKind.PARALYZE),
    CHARM("charm", Category.DEBUFF, StatusKind.CHARM),

    // Drain family (the stat drains may also ride on a debuff)
    DRAIN_MANA("drain_mana", Category.DRAIN, null),
    DRAIN_HEALTH("drain_health", Category.DRAIN, null),
    DRAIN_AGILITY("drain_agility", Category.DRAIN, StatusKind.STAT_DRAIN, DEXTERITY),
    DRAIN_PHYSIQUE("drain_physique", Category.DRAIN, StatusKind.STAT_DRAIN, CONSTITUTION),
    DRAIN_STAMINA("drain_stamina", Category.DRAIN, StatusKind.STAT_DRAIN, CONSTITUTION),
    DRAIN_MENTAL("drain_mental", Category.DRAIN, StatusKind.STAT_DRAIN, INTELLIGENCE, WISDOM, CHARISMA),
    DRAIN_BODY("drain_body", Category.DRAIN, StatusKind.STAT_DRAIN, STRENGTH, DEXTERITY, CONSTITUTION);

    enum Category { HEAL, BUFF, DEBUFF, DRAIN }

    public final String key;
    private final Category category;
    private final StatusKind statusKind;
    private final Set<CoreStat> stats;

    EffectKind(String key, Category category, StatusKind statusKind, CoreStat... stats) {
        this.key = key;
        this.category = category;
        this.statusKind = statusKind;
        this.stats = stats.length == 0
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.of(stats[0], stats));
    }

    /**
     * Status kind this effect attaches (or, for cures, removes). Null when none.
     */
    public StatusKind statusKind() {
        return statusKind;
    }

    /**
     * Core stats touched by enhancement and stat-drain kinds.
     */
    public Set<CoreStat> stats() {
        return stats;
    }

    public boolean isStatDrain() {
        return statusKind == StatusKind.STAT_DRAIN && category == Category.DRAIN;
    }

    public boolean isStatEnhancement() {
        return statusKind == StatusKind.STAT_BUFF;
    }

    /**
     * Whether a spell of the given family may carry this effect.
     */
    public boolean supports(SpellFamily family) {
        return switch (family) {
            case HEAL -> category == Category.HEAL;
            case BUFF, ENHANCEMENT -> category == Category.BUFF;
            case DEBUFF -> category == Category.DEBUFF || isStatDrain();
            case DRAIN -> category == Category.DRAIN;
            case DAMAGE, SUMMON -> false;
        };
    }

    /**
     * Parse from the data key (case-insensitive). Returns null if unknown.
     */
    public static EffectKind fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String k = s.trim().toLowerCase();
        for (EffectKind kind : values()) {
            if (kind.key.equals(k)) return kind;
        }
        if (k.equals("invisible")) return INVISIBILITY;
        return null;
    }
}
