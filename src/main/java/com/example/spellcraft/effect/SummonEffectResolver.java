package com.example.spellcraft.effect;

import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.MobileTemplate;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CastContext;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellMessages;
import com.example.spellcraft.util.DiceRoller;
import com.example.spellcraft.util.EngineSettings;
import com.example.spellcraft.world.CreatureCatalog;
import com.example.spellcraft.world.PartyRegistry;
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Summons a random eligible creature into the caster's room as a friendly party member.
 */
public class SummonEffectResolver implements EffectResolver {

    private static final Logger logger = LoggerFactory.getLogger(SummonEffectResolver.class);

    static final String DEFAULT_CAST = "{caster} intones a summoning spell!";
    static final String DEFAULT_HIT = "{mob_prefix} {mob_name} appears in a puff of reddish smoke!";
    static final String NO_CREATURES = "The summoning spell fails - no creatures answer your call!";
    static final String ROOM_FULL = "The spell succeeds, but the room is too crowded for your summon to appear!";

    private final CreatureCatalog creatures;
    private final RoomOccupancy rooms;
    private final PartyRegistry parties;
    private final Messaging messaging;
    private final DiceRoller dice;
    private final EngineSettings settings;
    private final AtomicLong nextInstanceId;

    public SummonEffectResolver(CreatureCatalog creatures, RoomOccupancy rooms, PartyRegistry parties,
                                Messaging messaging, DiceRoller dice, EngineSettings settings, Clock clock) {
        this.creatures = creatures;
        this.rooms = rooms;
        this.parties = parties;
        this.messaging = messaging;
        this.dice = dice;
        this.settings = settings;
        this.nextInstanceId = new AtomicLong(clock.millis() * 1000L);
    }

    @Override
    public void resolve(CastContext ctx) {
        SpellDefinition spell = ctx.spell();
        SpellMessages cast = SpellMessages.of(spell.getCastMessage(), DEFAULT_CAST)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName());

        List<MobileTemplate> eligible = eligibleTemplates(spell, ctx.casterLevel());
        if (eligible.isEmpty()) {
            logger.error("[summon] No eligible creature templates for spell {} (levels {}-{}, type {})",
                    spell.getId(), minLevel(spell, ctx.casterLevel()), maxLevel(spell, ctx.casterLevel()), spell.getSummonType());
            messaging.sendToPlayer(ctx.casterId(), NO_CREATURES);
            return;
        }
        MobileTemplate template = eligible.get(dice.nextIndex(eligible.size()));

        if (rooms.listMobs(ctx.roomId()).size() >= settings.getMaxRoomMobs()) {
            messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + " " + ROOM_FULL);
            messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render());
            logger.debug("[summon] Room {} is full, {} not created", ctx.roomId(), template.getKey());
            return;
        }

        int leaderId = parties.leaderOf(ctx.casterId());
        Mobile summon = new Mobile(nextInstanceId.incrementAndGet(), template, ctx.roomId());
        summon.bindToSummoner(ctx.casterId(), leaderId);
        summon.setHpCur(summon.getHpMax());
        rooms.addMob(ctx.roomId(), summon);
        parties.trackSummon(leaderId, summon.getInstanceId());

        String hit = SpellMessages.of(spell.getHitMessage(), DEFAULT_HIT)
                .with("caster", ctx.caster().getName())
                .with("spell", spell.getName())
                .with("mob_prefix", SpellMessages.article(template.getName()))
                .with("mob_name", template.getName())
                .render();
        messaging.sendToPlayer(ctx.casterId(), cast.renderForCaster() + " " + hit);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(), cast.render() + " " + hit);
        logger.info("[summon] {} summoned {} (level {}) into room {}",
                ctx.caster().getName(), summon, template.getLevel(), ctx.roomId());
    }

    /**
     * Templates the spell may produce for a caster of the given level.
     */
    public List<MobileTemplate> eligibleTemplates(SpellDefinition spell, int casterLevel) {
        int min = minLevel(spell, casterLevel);
        int max = maxLevel(spell, casterLevel);
        List<MobileTemplate> out = new ArrayList<>();
        for (MobileTemplate t : creatures.all()) {
            if (t.getLevel() < min || t.getLevel() > max) continue;
            if (spell.getSummonType() != null && !t.hasType(spell.getSummonType())) continue;
            if (t.isSpecialTerrainOnly() && !spell.isAllowSpecialTerrain()) continue;
            out.add(t);
        }
        return out;
    }

    static int minLevel(SpellDefinition spell, int casterLevel) {
        return spell.isScalesSummonWithLevel() ? 1 : spell.getMinSummonLevel();
    }

    static int maxLevel(SpellDefinition spell, int casterLevel) {
        return spell.isScalesSummonWithLevel() ? Math.max(1, (casterLevel + 1) / 2) : spell.getMaxSummonLevel();
    }
}
