package com.example.spellcraft.spell;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.util.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mana, cooldown and fatigue bookkeeping for spellcasting mobs.
 *
 * Mobs draw from the same spell catalog as players but keep their own mana pool, and
 * their cooldowns run on wall-clock seconds rather than combat rounds.
 */
public class MobSpellcasting {

    private static final Logger logger = LoggerFactory.getLogger(MobSpellcasting.class);

    public static final int DEFAULT_SPELL_SKILL = 50;
    public static final double DEFAULT_HEAL_THRESHOLD = 0.3;
    static final long DEFAULT_COOLDOWN_SECONDS = 10;
    static final long MIN_FATIGUE_SECONDS = 15;

    private final SpellCatalog spells;
    private final DiceRoller dice;
    private final Clock clock;
    private final Map<Long, MobCasterState> states = new ConcurrentHashMap<>();

    public MobSpellcasting(SpellCatalog spells, DiceRoller dice, Clock clock) {
        this.spells = spells;
        this.dice = dice;
        this.clock = clock;
    }

    private static final class MobCasterState {
        private int currentMana;
        private final int maxMana;
        private final int spellSkill;
        private final Map<String, Long> cooldownEnds = new ConcurrentHashMap<>();
        private long fatigueEnd;

        MobCasterState(int maxMana, int spellSkill) {
            this.currentMana = maxMana;
            this.maxMana = maxMana;
            this.spellSkill = spellSkill;
        }
    }

    /**
     * Give the mob a full mana pool. Does nothing if it already has one.
     */
    public void initialize(Mobile mob, int spellSkill) {
        int maxMana = maxManaFor(mob.getLevel(), spellSkill);
        if (states.putIfAbsent(mob.getInstanceId(), new MobCasterState(maxMana, spellSkill)) == null) {
            logger.info("[MobSpellcasting] Initialized {} with {} mana", mob, maxMana);
        }
    }

    public static int maxManaFor(int level, int spellSkill) {
        return 50 + level * 10 + spellSkill / 2;
    }

    public boolean canCast(Mobile mob, String spellId) {
        MobCasterState state = states.get(mob.getInstanceId());
        if (state == null) return false;
        SpellDefinition spell = spells.get(spellId);
        if (spell == null) return false;

        long now = clock.millis();
        if (now < state.fatigueEnd) return false;
        if (state.currentMana < spell.getManaCost()) return false;
        Long cooldownEnd = state.cooldownEnds.get(spellId);
        return cooldownEnd == null || now >= cooldownEnd;
    }

    /**
     * Spend the spell's mana and start its cooldown and the mob's fatigue.
     * @return false (and nothing spent) if the mob cannot cast it right now
     */
    public boolean useSpell(Mobile mob, String spellId) {
        if (!canCast(mob, spellId)) return false;
        MobCasterState state = states.get(mob.getInstanceId());
        SpellDefinition spell = spells.get(spellId);
        long now = clock.millis();

        state.currentMana -= spell.getManaCost();
        long cooldownSeconds = spell.getCooldownRounds() > 0 ? spell.getCooldownRounds() : DEFAULT_COOLDOWN_SECONDS;
        state.cooldownEnds.put(spellId, now + cooldownSeconds * 1000L);
        long fatigueSeconds = fatigueSeconds(spell.getMinLevel(), mob.getLevel());
        state.fatigueEnd = now + fatigueSeconds * 1000L;

        logger.info("[MobSpellcasting] {} cast {}, {}/{} mana, fatigued for {}s",
                mob, spellId, state.currentMana, state.maxMana, fatigueSeconds);
        return true;
    }

    public static long fatigueSeconds(int spellLevel, int mobLevel) {
        return Math.max(MIN_FATIGUE_SECONDS, (long) (spellLevel - mobLevel) * 15L);
    }

    /**
     * Spells from the list the mob could cast right now.
     */
    public List<String> availableSpells(Mobile mob, List<String> spellIds) {
        List<String> out = new ArrayList<>();
        for (String id : spellIds) {
            if (canCast(mob, id)) out.add(id);
        }
        return out;
    }

    /**
     * Pick a spell: a heal when hurt below the threshold, otherwise a random offensive spell.
     */
    public Optional<String> chooseSpell(Mobile mob, List<String> spellIds, double healThreshold) {
        List<String> available = availableSpells(mob, spellIds);
        double healthPercent = mob.getHpMax() > 0 ? (double) mob.getHpCur() / mob.getHpMax() : 0.0;

        if (healthPercent < healThreshold) {
            List<String> heals = filterByHeal(available, true);
            if (!heals.isEmpty()) return Optional.of(heals.get(dice.nextIndex(heals.size())));
        }
        List<String> offensive = filterByHeal(available, false);
        if (offensive.isEmpty()) return Optional.empty();
        return Optional.of(offensive.get(dice.nextIndex(offensive.size())));
    }

    private List<String> filterByHeal(List<String> ids, boolean heals) {
        List<String> out = new ArrayList<>();
        for (String id : ids) {
            SpellDefinition s = spells.get(id);
            if (s != null && (s.getFamily() == SpellFamily.HEAL) == heals) out.add(id);
        }
        return out;
    }

    public static double failureChance(int mobLevel, int intelligence, int spellLevel, int spellSkill) {
        double chance = 0.10
                + 0.15 * Math.max(0, spellLevel - mobLevel)
                - 0.02 * ((intelligence - 10) / 2.0)
                - 0.01 * ((spellSkill - 50) / 10.0);
        return Math.max(0.05, Math.min(0.95, chance));
    }

    /**
     * @return true if the mob's cast fails
     */
    public boolean rollFailure(Mobile mob, SpellDefinition spell) {
        MobCasterState state = states.get(mob.getInstanceId());
        int skill = state != null ? state.spellSkill : DEFAULT_SPELL_SKILL;
        int intelligence = mob.getStat(CoreStat.INTELLIGENCE);
        return dice.nextChance() < failureChance(mob.getLevel(), intelligence, spell.getMinLevel(), skill);
    }

    public void regenerate(Mobile mob) {
        MobCasterState state = states.get(mob.getInstanceId());
        if (state == null) return;
        regenerate(mob, Math.max(1, state.maxMana / 20));
    }

    public void regenerate(Mobile mob, int amount) {
        MobCasterState state = states.get(mob.getInstanceId());
        if (state == null || amount <= 0) return;
        int before = state.currentMana;
        state.currentMana = Math.min(state.maxMana, state.currentMana + amount);
        if (state.currentMana > before) {
            logger.debug("[MobSpellcasting] {} regenerated {} mana", mob, state.currentMana - before);
        }
    }

    public int getCurrentMana(Mobile mob) {
        MobCasterState state = states.get(mob.getInstanceId());
        return state != null ? state.currentMana : 0;
    }

    public int getMaxMana(Mobile mob) {
        MobCasterState state = states.get(mob.getInstanceId());
        return state != null ? state.maxMana : 0;
    }

    /**
     * Forget the mob (on death or despawn).
     */
    public void cleanup(Mobile mob) {
        states.remove(mob.getInstanceId());
    }
}
