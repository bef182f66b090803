package com.example.spellcraft.persistence;

import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.model.MobileTemplate;
import com.example.spellcraft.world.CreatureCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Creature templates from YAML. Stats go under a nested "stats" map ("str", "dex", ... or full names).
 */
public class YamlCreatureCatalog implements CreatureCatalog {

    private static final Logger logger = LoggerFactory.getLogger(YamlCreatureCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/creatures.yaml";

    private final List<MobileTemplate> templates;

    private YamlCreatureCatalog(List<Map<String, Object>> rows) {
        List<MobileTemplate> out = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String key = YamlSupport.getString(row, "key", YamlSupport.getString(row, "id", null));
            if (key == null || key.isBlank()) {
                logger.warn("[YamlCreatureCatalog] skipping creature without a key: {}", row.get("name"));
                continue;
            }
            MobileTemplate.Builder b = MobileTemplate.builder(key.trim())
                    .name(YamlSupport.getString(row, "name", null))
                    .level(YamlSupport.getInt(row, "level", 1))
                    .hpMax(YamlSupport.getInt(row, "hp", YamlSupport.getInt(row, "hp_max", 10)))
                    .mpMax(YamlSupport.getInt(row, "mp", YamlSupport.getInt(row, "mp_max", 0)))
                    .armor(YamlSupport.getInt(row, "armor", 0))
                    .typeTag(YamlSupport.getString(row, "type", null))
                    .specialTerrainOnly(YamlSupport.getBoolean(row, "special_terrain_only", false))
                    .aggressive(YamlSupport.getBoolean(row, "aggressive", false));
            Map<String, Object> stats = YamlSupport.section(row, "stats");
            for (String statKey : stats.keySet()) {
                CoreStat stat = CoreStat.fromString(statKey, null);
                if (stat == null) {
                    logger.warn("[YamlCreatureCatalog] {} has unknown stat '{}'", key, statKey);
                    continue;
                }
                b.stat(stat, YamlSupport.getInt(stats, statKey, 10));
            }
            out.add(b.build());
        }
        this.templates = Collections.unmodifiableList(out);
        logger.info("[YamlCreatureCatalog] Loaded {} creature templates", templates.size());
    }

    public static YamlCreatureCatalog fromResource(String resourcePath) {
        return new YamlCreatureCatalog(YamlSupport.loadRows(resourcePath, "creatures"));
    }

    public static YamlCreatureCatalog fromStream(InputStream in) {
        return new YamlCreatureCatalog(YamlSupport.readRows(in, "creatures"));
    }

    @Override
    public List<MobileTemplate> all() {
        return templates;
    }
}
