package com.example.spellcraft;

import com.example.spellcraft.combat.AttackOutcome;
import com.example.spellcraft.combat.CombatAccuracyOracle;
import com.example.spellcraft.model.CharacterClass;
import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.MobileTemplate;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.model.Room;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellEngine;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.world.InMemoryPartyRegistry;
import com.example.spellcraft.world.InMemoryWorld;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A small world wired to a SpellEngine: one ordinary room, one safe room, scripted dice,
 * a hand-cranked clock and an oracle that hits unless told otherwise.
 */
class EngineFixture {

    static final int ROOM = 100;
    static final int SAFE_ROOM = 200;

    final MutableClock clock = new MutableClock(1_000_000L);
    final ScriptedRandom random = new ScriptedRandom();
    final CapturingMessaging messaging = new CapturingMessaging();
    final InMemoryWorld world = new InMemoryWorld();
    final InMemoryPartyRegistry parties = new InMemoryPartyRegistry();
    final MapSpellCatalog spells = new MapSpellCatalog();
    final List<MobileTemplate> creatures = new ArrayList<>();
    final Map<String, CharacterClass> classes = new HashMap<>();
    final EngineSettings settings = EngineSettings.defaults();
    final List<Mobile> deaths = new ArrayList<>();

    CombatAccuracyOracle oracle = (attacker, defender, armor, base) -> AttackOutcome.HIT;

    private SpellEngine engine;
    private long nextMobId = 1;

    EngineFixture() {
        world.addRoom(new Room(ROOM, "Town Square", false));
        world.addRoom(new Room(SAFE_ROOM, "Temple", true));
        world.setRewardHook((killerId, mob, roomId) -> deaths.add(mob));
        classes.put("wizard", new CharacterClass("Wizard", "", 50, CoreStat.INTELLIGENCE));
        classes.put("cleric", new CharacterClass("Cleric", "", 50, CoreStat.WISDOM));
        classes.put("fighter", new CharacterClass("Fighter", "", 1, CoreStat.INTELLIGENCE));
    }

    SpellEngine engine() {
        if (engine == null) {
            engine = SpellEngine.builder()
                    .settings(settings)
                    .clock(clock)
                    .random(random)
                    .messaging(messaging)
                    .world(world, world, world)
                    .spells(spells)
                    .classes(name -> name == null ? null : classes.get(name.toLowerCase()))
                    .creatures(() -> creatures)
                    .parties(parties)
                    .oracle((a, d, armor, base) -> oracle.checkOutcome(a, d, armor, base))
                    .build();
        }
        return engine;
    }

    EngineFixture spell(SpellDefinition spell) {
        spells.add(spell);
        return this;
    }

    PlayerCharacter player(int id, String name, int level, int hp, int hpMax, int mp, int mpMax) {
        PlayerCharacter p = new PlayerCharacter(id, name, "Wizard", level, hpMax, hp, mpMax, mp,
                ROOM, new EnumMap<>(CoreStat.class), 0);
        world.addPlayer(p);
        return p;
    }

    /** A level 5 wizard with plenty of health and mana who knows the given spells. */
    PlayerCharacter caster(int id, String name, String... spellIds) {
        PlayerCharacter p = player(id, name, 5, 50, 50, 100, 100);
        for (String s : spellIds) p.learnSpell(s);
        return p;
    }

    Mobile mob(String name, int level, int hp, boolean aggressive) {
        MobileTemplate t = MobileTemplate.builder(name.replace(' ', '_'))
                .name(name)
                .level(level)
                .hpMax(hp)
                .mpMax(20)
                .aggressive(aggressive)
                .build();
        Mobile m = new Mobile(nextMobId++, t, ROOM);
        world.addMob(ROOM, m);
        return m;
    }

    Mobile mob(String name, int hp) {
        return mob(name, 1, hp, false);
    }

    void cast(int casterId, String spellText) {
        engine().castSpell(casterId, spellText, null);
    }

    void cast(int casterId, String spellText, String target) {
        engine().castSpell(casterId, spellText, target);
    }
}
