package com.example.spellcraft.persistence;

import com.example.spellcraft.spell.AreaOfEffect;
import com.example.spellcraft.spell.SpellCatalog;
import com.example.spellcraft.spell.SpellDefinition;
import com.example.spellcraft.spell.SpellFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.spellcraft.persistence.YamlSupport.getBoolean;
import static com.example.spellcraft.persistence.YamlSupport.getInt;
import static com.example.spellcraft.persistence.YamlSupport.getInteger;
import static com.example.spellcraft.persistence.YamlSupport.getString;

/**
 * Spell catalog loaded from YAML:
 *
 * <pre>
 * spells:
 *   - id: magic_missile
 *     name: Magic Missile
 *     type: damage
 *     mana_cost: 5
 *     damage: 1d4+1
 *     requires_target: true
 * </pre>
 *
 * Rows without an id or with an unknown type are skipped.
 */
public class YamlSpellCatalog implements SpellCatalog {

    private static final Logger logger = LoggerFactory.getLogger(YamlSpellCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/spells.yaml";

    private final Map<String, SpellDefinition> spells = new LinkedHashMap<>();

    private YamlSpellCatalog(List<Map<String, Object>> rows) {
        for (Map<String, Object> row : rows) {
            SpellDefinition def = parse(row);
            if (def == null) continue;
            if (spells.putIfAbsent(def.getId(), def) != null) {
                logger.warn("[YamlSpellCatalog] duplicate spell id '{}', keeping the first", def.getId());
            }
        }
        logger.info("[YamlSpellCatalog] Loaded {} spells", spells.size());
    }

    public static YamlSpellCatalog fromResource(String resourcePath) {
        return new YamlSpellCatalog(YamlSupport.loadRows(resourcePath, "spells"));
    }

    public static YamlSpellCatalog fromStream(InputStream in) {
        return new YamlSpellCatalog(YamlSupport.readRows(in, "spells"));
    }

    @Override
    public SpellDefinition get(String spellId) {
        if (spellId == null) return null;
        return spells.get(spellId);
    }

    @Override
    public Collection<SpellDefinition> all() {
        return Collections.unmodifiableCollection(spells.values());
    }

    static SpellDefinition parse(Map<String, Object> row) {
        String id = getString(row, "id", null);
        if (id == null || id.isBlank()) {
            logger.warn("[YamlSpellCatalog] skipping spell without id: {}", row.get("name"));
            return null;
        }
        String type = getString(row, "type", null);
        SpellFamily family = SpellFamily.fromString(type);
        if (family == null) {
            logger.warn("[YamlSpellCatalog] skipping spell '{}' with unknown type '{}'", id, type);
            return null;
        }

        return SpellDefinition.builder(id.trim(), family)
                .name(getString(row, "name", null))
                .description(getString(row, "description", null))
                .effect(getString(row, "effect", null))
                .manaCost(getInt(row, "mana_cost", 0))
                .cooldownRounds(getInt(row, "cooldown", 0))
                .areaOfEffect(AreaOfEffect.fromString(getString(row, "area_of_effect", null)))
                .requiresTarget(getBoolean(row, "requires_target", false))
                .classRestriction(getString(row, "class_restriction", null))
                .minLevel(getInt(row, "min_level", getInt(row, "level", 1)))
                .scalesWithLevel(getBoolean(row, "scales_with_level", false))
                .damageDice(getString(row, "damage", getString(row, "damage_dice", null)))
                .healDice(getString(row, "heal_amount", getString(row, "heal_dice", null)))
                .damageType(getString(row, "damage_type", null))
                .poisonDuration(getInteger(row, "poison_duration"))
                .poisonDamage(getString(row, "poison_damage", null))
                .durationRounds(getInt(row, "duration", 0))
                .effectDuration(getInteger(row, "effect_duration"))
                .effectAmount(getString(row, "effect_amount", null))
                .bonusAmount(getInt(row, "bonus_amount", 0))
                .removalText(getString(row, "removal_text", null))
                .scalesSummonWithLevel(getBoolean(row, "scales_summon_with_level", false))
                .summonLevels(getInt(row, "min_summon_level", 1), getInt(row, "max_summon_level", 1))
                .summonType(getString(row, "summon_type", null))
                .allowSpecialTerrain(getBoolean(row, "allow_special_terrain", false))
                .castMessage(getString(row, "cast_message", null))
                .hitMessage(getString(row, "hit_message", null))
                .build();
    }
}
