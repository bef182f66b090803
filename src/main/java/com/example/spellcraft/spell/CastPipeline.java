package com.example.spellcraft.spell;

import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.model.PlayerCharacter;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.world.PlayerDirectory;
import com.example.spellcraft.world.RoomOccupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Validates, commits and dispatches one cast.
 *
 * Every check runs before anything is consumed. Once resources are committed the cast
 * counts as spent, whether it then fizzles, misses or fails on bad data.
 */
public class CastPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CastPipeline.class);

    static final String GENERIC_FAILURE = "Something went wrong with your spell.";

    private final SpellCatalog spells;
    private final ClassCatalog classes;
    private final PlayerDirectory players;
    private final RoomOccupancy rooms;
    private final TargetResolver targets;
    private final ResourceGate gate;
    private final FailureModel failures;
    private final Messaging messaging;
    private final FamilyResolvers resolvers;

    public CastPipeline(SpellCatalog spells, ClassCatalog classes, PlayerDirectory players, RoomOccupancy rooms,
                        TargetResolver targets, ResourceGate gate, FailureModel failures,
                        Messaging messaging, FamilyResolvers resolvers) {
        this.spells = spells;
        this.classes = classes;
        this.players = players;
        this.rooms = rooms;
        this.targets = targets;
        this.gate = gate;
        this.failures = failures;
        this.messaging = messaging;
        this.resolvers = resolvers;
    }

    /**
     * Result of matching the typed text against a spell.
     */
    record SpellMatch(SpellDefinition spell, String remainder) {}

    public void castSpell(int casterId, String spellText, String targetText) {
        Optional<PlayerCharacter> found = players.findPlayer(casterId);
        if (found.isEmpty()) {
            logger.warn("[cast] Unknown caster id {}", casterId);
            return;
        }
        PlayerCharacter caster = found.get();
        Integer roomId = caster.getCurrentRoom();
        if (roomId == null) {
            logger.warn("[cast] {} is not in a room", caster.getName());
            return;
        }
        if (spellText == null || spellText.isBlank()) {
            reject(caster, "Cast what?");
            return;
        }

        // 1. spell lookup
        SpellMatch match = matchKnownSpell(caster, spellText);
        if (match == null) {
            SpellMatch unknown = matchSpell(spells.all(), spellText);
            reject(caster, unknown != null
                    ? "You don't know the spell '" + unknown.spell().getName() + "'."
                    : "Unknown spell: " + spellText.trim());
            return;
        }
        SpellDefinition spell = match.spell();
        String targetName = targetText != null && !targetText.isBlank() ? targetText.trim() : match.remainder();

        // 2. class limits
        String cls = caster.getCharacterClass();
        if (spell.getClassRestriction() != null && !spell.getClassRestriction().equalsIgnoreCase(cls)) {
            reject(caster, "Only " + spell.getClassRestriction() + "s can cast " + spell.getName() + ".");
            return;
        }
        int maxLevel = classes.maxCastableSpellLevel(cls);
        if (spell.getMinLevel() > maxLevel) {
            reject(caster, "As a " + cls + ", you can only cast spells up to level " + maxLevel
                    + ". " + spell.getName() + " is level " + spell.getMinLevel() + ".");
            return;
        }

        // 3. paralysis
        if (caster.isParalyzed()) {
            reject(caster, "You are paralyzed and cannot cast spells!");
            return;
        }

        // 4-5. cooldown and fatigue
        CastCheck check = gate.checkCooldown(caster, spell);
        if (check.isFailure()) {
            reject(caster, check.getFailureMessage());
            return;
        }
        check = gate.checkFatigue(caster);
        if (check.isFailure()) {
            reject(caster, check.getFailureMessage());
            return;
        }

        // 6. target
        GameCharacter target = null;
        boolean hasTargetName = targetName != null && !targetName.isBlank();
        if (spell.getFamily() != SpellFamily.SUMMON
                && (spell.needsExplicitTarget() || (hasTargetName && !spell.isArea()))) {
            if (!hasTargetName) {
                reject(caster, "You need a target to cast " + spell.getName() + ". Use: cast " + spell.getName() + " <target>");
                return;
            }
            Optional<GameCharacter> resolved = targets.resolve(spell, roomId, targetName);
            if (resolved.isEmpty()) {
                reject(caster, "You don't see '" + targetName + "' here.");
                return;
            }
            target = resolved.get();
        }

        // 7. duplicate self-buff
        if (spell.getFamily().isBuff() && !spell.isArea() && target == null) {
            if (alreadyBuffed(caster, spell)) {
                reject(caster, "You are already under the effect of " + spell.getName() + "!");
                return;
            }
        }

        // 8. summon restrictions
        if (spell.getFamily() == SpellFamily.SUMMON) {
            if (hasTargetName) {
                reject(caster, "That spell does not need to be cast at a specific person or creature.");
                return;
            }
            if (rooms.isSafe(roomId)) {
                reject(caster, "Sorry, summoning spells are not permitted here.");
                return;
            }
        }

        // 9. mana
        check = gate.checkMana(caster, spell);
        if (check.isFailure()) {
            reject(caster, check.getFailureMessage());
            return;
        }

        // 10. commit
        gate.commit(caster, spell);

        // 11. fizzle
        int castingStat = caster.getStat(classes.castingStat(cls));
        if (failures.rollFizzle(spell.getMinLevel(), caster.getLevel(), castingStat)) {
            messaging.sendToPlayer(casterId, "You attempt to cast " + spell.getName() + ", but the spell fizzles and fails!");
            messaging.broadcastRoomExcept(roomId, casterId, caster.getName() + "'s spell fizzles and fails!");
            logger.debug("[cast] {} fizzled {}", caster.getName(), spell.getId());
            return;
        }

        // 12. dispatch
        CastContext ctx = new CastContext(spell, caster, roomId, targetName, target, castingStat);
        try {
            resolvers.forFamily(spell.getFamily()).resolve(ctx);
            logger.info("[cast] {} cast {} in room {}", caster.getName(), spell.getId(), roomId);
        } catch (SpellDataException e) {
            logger.error("[cast] Bad data for spell {}: {}", e.getSpellId(), e.getMessage());
            messaging.sendToPlayer(casterId, GENERIC_FAILURE);
        } catch (RuntimeException e) {
            logger.error("[cast] Resolving {} for {} failed", spell.getId(), caster.getName(), e);
            messaging.sendToPlayer(casterId, GENERIC_FAILURE);
        }
    }

    private static boolean alreadyBuffed(PlayerCharacter caster, SpellDefinition spell) {
        String key = spell.getEffectKind() != null ? spell.getEffectKind().key : spell.getEffect();
        return caster.getEffects().hasMatching(spell.getName(), key);
    }

    /**
     * Match against the caster's known spells, longest name first.
     */
    SpellMatch matchKnownSpell(PlayerCharacter caster, String text) {
        List<SpellDefinition> known = new ArrayList<>();
        for (String id : caster.getKnownSpells()) {
            SpellDefinition def = spells.get(id);
            if (def == null) {
                logger.warn("[cast] {} knows spell '{}' which is not in the catalog", caster.getName(), id);
                continue;
            }
            known.add(def);
        }
        return matchSpell(known, text);
    }

    static SpellMatch matchSpell(Iterable<SpellDefinition> candidates, String text) {
        String input = text.trim();
        List<SpellDefinition> sorted = new ArrayList<>();
        candidates.forEach(sorted::add);
        sorted.sort(Comparator.comparingInt((SpellDefinition s) -> s.getName().length()).reversed());

        for (SpellDefinition s : sorted) {
            for (String form : new String[] { s.getName(), s.getId(), s.getId().replace("_", "") }) {
                String remainder = prefixRemainder(input, form);
                if (remainder != null) return new SpellMatch(s, remainder);
            }
        }
        return null;
    }

    /**
     * @return text after the prefix (null if the input does not start with it as whole words)
     */
    private static String prefixRemainder(String input, String prefix) {
        if (prefix == null || prefix.isEmpty() || input.length() < prefix.length()) return null;
        if (!input.regionMatches(true, 0, prefix, 0, prefix.length())) return null;
        if (input.length() == prefix.length()) return "";
        if (!Character.isWhitespace(input.charAt(prefix.length()))) return null;
        return input.substring(prefix.length()).trim();
    }

    private void reject(PlayerCharacter caster, String message) {
        logger.debug("[cast] {} rejected: {}", caster.getName(), message);
        messaging.sendToPlayer(caster.getCharacterId(), message);
    }
}
