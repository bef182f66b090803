package com.example.spellcraft.spell;

import com.example.spellcraft.combat.CombatAccuracyOracle;
import com.example.spellcraft.combat.CombatTargetFinder;
import com.example.spellcraft.combat.DefaultAccuracyOracle;
import com.example.spellcraft.combat.RoomCombatTargetFinder;
import com.example.spellcraft.effect.BuffEffectResolver;
import com.example.spellcraft.effect.DamageEffectResolver;
import com.example.spellcraft.effect.DebuffEffectResolver;
import com.example.spellcraft.effect.DefeatHandler;
import com.example.spellcraft.effect.DrainEffectResolver;
import com.example.spellcraft.effect.EffectScheduler;
import com.example.spellcraft.effect.HealEffectResolver;
import com.example.spellcraft.effect.StatusEffect;
import com.example.spellcraft.effect.StatusKind;
import com.example.spellcraft.effect.SummonEffectResolver;
import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.util.DiceRoller;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.util.TickService;
import com.example.spellcraft.world.CreatureCatalog;
import com.example.spellcraft.world.MobLifecycle;
import com.example.spellcraft.world.PartyRegistry;
import com.example.spellcraft.world.PlayerDirectory;
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Objects;
import java.util.Random;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Entry point for the surrounding server: casting, effect ticks, cures and cooldown rounds.
 *
 * <pre>
 * SpellEngine engine = SpellEngine.builder()
 *         .messaging(sessions)
 *         .world(world, world, world)
 *         .spells(spellCatalog)
 *         .classes(classCatalog)
 *         .creatures(creatureCatalog)
 *         .parties(partyRegistry)
 *         .build();
 * engine.castSpell(playerId, "magic missile", "goblin");
 * </pre>
 */
public class SpellEngine {

    private static final Logger logger = LoggerFactory.getLogger(SpellEngine.class);

    private final CastPipeline pipeline;
    private final EffectScheduler scheduler;
    private final CasterResourceStore resources;
    private final EngineSettings settings;
    private final SummonEffectResolver summons;

    private SpellEngine(Builder b) {
        this.settings = b.settings;
        this.resources = b.resources != null ? b.resources : new InMemoryCasterResourceStore(b.clock);
        DiceRoller dice = new DiceRoller(b.random);
        CombatAccuracyOracle oracle = b.oracle != null ? b.oracle : new DefaultAccuracyOracle(dice);
        CombatTargetFinder finder = b.targetFinder != null ? b.targetFinder : new RoomCombatTargetFinder(b.rooms);

        DefeatHandler defeats = new DefeatHandler(b.messaging, b.lifecycle);
        this.scheduler = new EffectScheduler(b.messaging, dice, defeats, settings);
        this.summons = new SummonEffectResolver(b.creatures, b.rooms, b.parties, b.messaging, dice, settings, b.clock);
        FamilyResolvers resolvers = new FamilyResolvers(
                new DamageEffectResolver(oracle, b.rooms, b.messaging, dice, defeats, settings, b.clock),
                new HealEffectResolver(b.rooms, b.messaging, dice, scheduler),
                new BuffEffectResolver(b.rooms, b.messaging, dice, settings),
                new DebuffEffectResolver(b.rooms, b.messaging, dice, defeats, settings, b.clock),
                new DrainEffectResolver(oracle, b.messaging, dice, defeats, settings, b.clock),
                summons);

        this.pipeline = new CastPipeline(b.spells, b.classes, b.players, b.rooms,
                new TargetResolver(finder, b.rooms),
                new ResourceGate(resources, b.clock, settings.getFatigueBaseSeconds()),
                new FailureModel(dice, settings.getMaxFailureChance()),
                b.messaging, resolvers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void castSpell(int casterId, String spellText, String targetText) {
        pipeline.castSpell(casterId, spellText, targetText);
    }

    public void tick(GameCharacter entity) {
        scheduler.tick(entity);
    }

    /**
     * Remove matching effects from the entity, e.g. when a potion cures poison.
     * @return number of effects removed
     */
    public int cure(GameCharacter entity, Predicate<StatusEffect> filter) {
        return scheduler.cure(entity, filter);
    }

    public int cure(GameCharacter entity, StatusKind kind) {
        return scheduler.cure(entity, kind);
    }

    /**
     * Attach an effect built outside the spell pipeline (traps, consumables).
     */
    public void applyStatusEffect(GameCharacter entity, StatusEffect effect) {
        scheduler.attach(entity, effect);
    }

    /**
     * Advance every caster's cooldowns by one round.
     */
    public void tickCooldowns() {
        resources.tickCooldowns();
    }

    /**
     * Schedule cooldown rounds and effect ticks on the given tick service.
     */
    public void startTicking(TickService tickService, Supplier<? extends Collection<? extends GameCharacter>> entities) {
        long interval = settings.getTickIntervalMs();
        scheduler.initialize(tickService, resources, entities);
        logger.info("[SpellEngine] Ticking every {} ms", interval);
    }

    public CasterResourceStore getResources() {
        return resources;
    }

    public EffectScheduler getScheduler() {
        return scheduler;
    }

    public SummonEffectResolver getSummons() {
        return summons;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public static final class Builder {
        private EngineSettings settings = EngineSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private Random random;
        private Messaging messaging;
        private RoomOccupancy rooms;
        private PlayerDirectory players;
        private MobLifecycle lifecycle;
        private SpellCatalog spells;
        private ClassCatalog classes;
        private CreatureCatalog creatures;
        private PartyRegistry parties;
        private CombatAccuracyOracle oracle;
        private CombatTargetFinder targetFinder;
        private CasterResourceStore resources;

        private Builder() {}

        public Builder settings(EngineSettings settings) { this.settings = settings; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder random(Random random) { this.random = random; return this; }
        public Builder messaging(Messaging messaging) { this.messaging = messaging; return this; }

        public Builder world(RoomOccupancy rooms, PlayerDirectory players, MobLifecycle lifecycle) {
            this.rooms = rooms;
            this.players = players;
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder spells(SpellCatalog spells) { this.spells = spells; return this; }
        public Builder classes(ClassCatalog classes) { this.classes = classes; return this; }
        public Builder creatures(CreatureCatalog creatures) { this.creatures = creatures; return this; }
        public Builder parties(PartyRegistry parties) { this.parties = parties; return this; }
        public Builder oracle(CombatAccuracyOracle oracle) { this.oracle = oracle; return this; }
        public Builder targetFinder(CombatTargetFinder targetFinder) { this.targetFinder = targetFinder; return this; }
        public Builder resources(CasterResourceStore resources) { this.resources = resources; return this; }

        public SpellEngine build() {
            Objects.requireNonNull(settings, "settings");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(messaging, "messaging");
            Objects.requireNonNull(rooms, "rooms");
            Objects.requireNonNull(players, "players");
            Objects.requireNonNull(lifecycle, "lifecycle");
            Objects.requireNonNull(spells, "spells");
            Objects.requireNonNull(classes, "classes");
            Objects.requireNonNull(creatures, "creatures");
            Objects.requireNonNull(parties, "parties");
            return new SpellEngine(this);
        }
    }
}
