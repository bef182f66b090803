package com.example.spellcraft.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for SnakeYAML maps. A value of the wrong type reads as the default.
 */
public final class YamlSupport {

    private static final Logger logger = LoggerFactory.getLogger(YamlSupport.class);

    private YamlSupport() {}

    /**
     * Load the rows under rootKey from a classpath resource.
     * @return the rows, or an empty list if the resource is missing or malformed
     */
    public static List<Map<String, Object>> loadRows(String resourcePath, String rootKey) {
        try (InputStream in = YamlSupport.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("[YamlSupport] resource {} not found", resourcePath);
                return List.of();
            }
            return readRows(in, rootKey);
        } catch (IOException | RuntimeException e) {
            logger.warn("[YamlSupport] failed to read {}: {}", resourcePath, e.getMessage());
            return List.of();
        }
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> readRows(InputStream in, String rootKey) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(in);
        if (!(loaded instanceof Map)) return List.of();
        Object rows = ((Map<String, Object>) loaded).get(rootKey);
        if (!(rows instanceof List)) return List.of();

        List<Map<String, Object>> out = new ArrayList<>();
        for (Object row : (List<?>) rows) {
            if (row instanceof Map) {
                out.add((Map<String, Object>) row);
            } else {
                logger.warn("[YamlSupport] skipping non-map entry under '{}': {}", rootKey, row);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> section(Map<String, Object> root, String key) {
        Object val = root.get(key);
        return val instanceof Map ? (Map<String, Object>) val : Map.of();
    }

    public static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    public static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    /**
     * Like getInt, but null when the key is absent or unreadable.
     */
    public static Integer getInteger(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    public static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) return Boolean.parseBoolean(((String) val).trim());
        return defaultVal;
    }
}
