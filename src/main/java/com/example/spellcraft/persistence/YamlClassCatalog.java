package com.example.spellcraft.persistence;

import com.example.spellcraft.model.CharacterClass;
import com.example.spellcraft.model.CoreStat;
import com.example.spellcraft.spell.ClassCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Class casting profiles from YAML, keyed by lower-cased class name.
 */
public class YamlClassCatalog implements ClassCatalog {

    private static final Logger logger = LoggerFactory.getLogger(YamlClassCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/classes.yaml";

    private final Map<String, CharacterClass> classes = new LinkedHashMap<>();

    private YamlClassCatalog(List<Map<String, Object>> rows) {
        for (Map<String, Object> row : rows) {
            String name = YamlSupport.getString(row, "name", null);
            if (name == null || name.isBlank()) {
                logger.warn("[YamlClassCatalog] skipping class without a name");
                continue;
            }
            CharacterClass cls = new CharacterClass(name.trim(),
                    YamlSupport.getString(row, "description", ""),
                    YamlSupport.getInt(row, "max_spell_level", CharacterClass.DEFAULT_MAX_SPELL_LEVEL),
                    CoreStat.fromString(YamlSupport.getString(row, "casting_stat", null), CoreStat.INTELLIGENCE));
            classes.put(cls.name.toLowerCase(), cls);
        }
        logger.info("[YamlClassCatalog] Loaded {} classes", classes.size());
    }

    public static YamlClassCatalog fromResource(String resourcePath) {
        return new YamlClassCatalog(YamlSupport.loadRows(resourcePath, "classes"));
    }

    public static YamlClassCatalog fromStream(InputStream in) {
        return new YamlClassCatalog(YamlSupport.readRows(in, "classes"));
    }

    @Override
    public CharacterClass get(String className) {
        if (className == null) return null;
        return classes.get(className.trim().toLowerCase());
    }

    public int size() {
        return classes.size();
    }
}
