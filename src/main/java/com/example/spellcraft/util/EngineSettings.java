package com.example.spellcraft.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import static com.example.spellcraft.persistence.YamlSupport.getBoolean;
import static com.example.spellcraft.persistence.YamlSupport.getDouble;
import static com.example.spellcraft.persistence.YamlSupport.getInt;
import static com.example.spellcraft.persistence.YamlSupport.getString;
import static com.example.spellcraft.persistence.YamlSupport.section;

/**
 * Tunable engine constants, read from a YAML document organised in sections:
 *
 * <pre>
 * combat:
 *   base_hit_chance: 0.50
 * world:
 *   max_room_mobs: 50
 * casting:
 *   fatigue_base_seconds: 10
 *   max_failure_chance: 0.50
 * effects:
 *   default_poison_duration: 5
 *   default_poison_damage: 1d2
 *   default_buff_duration: 10
 *   default_debuff_duration: 5
 *   default_drain_duration: 10
 *   revert_enhancements_on_expiry: false
 * scheduler:
 *   tick_interval_ms: 1000
 * </pre>
 *
 * Missing sections or keys keep their defaults.
 */
public class EngineSettings {

    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    public static final String DEFAULT_RESOURCE = "/config/engine.yaml";

    private double baseHitChance = 0.50;
    private int maxRoomMobs = 50;
    private int fatigueBaseSeconds = 10;
    private double maxFailureChance = 0.50;
    private int defaultPoisonDuration = 5;
    private String defaultPoisonDamage = "1d2";
    private int defaultBuffDuration = 10;
    private int defaultDebuffDuration = 5;
    private int defaultDrainDuration = 10;
    private boolean revertEnhancementsOnExpiry = false;
    private long tickIntervalMs = 1000;

    /** Built-in defaults, no file involved. */
    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    /**
     * Load settings from a classpath resource. A missing or unreadable resource yields defaults.
     */
    public static EngineSettings fromResource(String resourcePath) {
        try (InputStream in = EngineSettings.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("[EngineSettings] resource {} not found, using defaults", resourcePath);
                return defaults();
            }
            return fromStream(in);
        } catch (IOException e) {
            logger.warn("[EngineSettings] failed to read {}, using defaults", resourcePath, e);
            return defaults();
        }
    }

    public static EngineSettings fromStream(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        EngineSettings s = new EngineSettings();
        if (root == null) return s;

        Map<String, Object> combat = section(root, "combat");
        s.baseHitChance = getDouble(combat, "base_hit_chance", s.baseHitChance);

        Map<String, Object> world = section(root, "world");
        s.maxRoomMobs = getInt(world, "max_room_mobs", s.maxRoomMobs);

        Map<String, Object> casting = section(root, "casting");
        s.fatigueBaseSeconds = getInt(casting, "fatigue_base_seconds", s.fatigueBaseSeconds);
        s.maxFailureChance = getDouble(casting, "max_failure_chance", s.maxFailureChance);

        Map<String, Object> effects = section(root, "effects");
        s.defaultPoisonDuration = getInt(effects, "default_poison_duration", s.defaultPoisonDuration);
        s.defaultPoisonDamage = getString(effects, "default_poison_damage", s.defaultPoisonDamage);
        s.defaultBuffDuration = getInt(effects, "default_buff_duration", s.defaultBuffDuration);
        s.defaultDebuffDuration = getInt(effects, "default_debuff_duration", s.defaultDebuffDuration);
        s.defaultDrainDuration = getInt(effects, "default_drain_duration", s.defaultDrainDuration);
        s.revertEnhancementsOnExpiry = getBoolean(effects, "revert_enhancements_on_expiry", s.revertEnhancementsOnExpiry);

        Map<String, Object> scheduler = section(root, "scheduler");
        s.tickIntervalMs = getInt(scheduler, "tick_interval_ms", (int) s.tickIntervalMs);
        return s;
    }

    public double getBaseHitChance() { return baseHitChance; }
    public int getMaxRoomMobs() { return maxRoomMobs; }
    public int getFatigueBaseSeconds() { return fatigueBaseSeconds; }
    public double getMaxFailureChance() { return maxFailureChance; }
    public int getDefaultPoisonDuration() { return defaultPoisonDuration; }
    public String getDefaultPoisonDamage() { return defaultPoisonDamage; }
    public int getDefaultBuffDuration() { return defaultBuffDuration; }
    public int getDefaultDebuffDuration() { return defaultDebuffDuration; }
    public int getDefaultDrainDuration() { return defaultDrainDuration; }
    public boolean isRevertEnhancementsOnExpiry() { return revertEnhancementsOnExpiry; }
    public long getTickIntervalMs() { return tickIntervalMs; }

    // Setters exist so embedders and tests can adjust individual values after loading.
    public EngineSettings setBaseHitChance(double v) { this.baseHitChance = v; return this; }
    public EngineSettings setMaxRoomMobs(int v) { this.maxRoomMobs = Math.max(0, v); return this; }
    public EngineSettings setFatigueBaseSeconds(int v) { this.fatigueBaseSeconds = Math.max(0, v); return this; }
    public EngineSettings setMaxFailureChance(double v) { this.maxFailureChance = Math.max(0.0, Math.min(1.0, v)); return this; }
    public EngineSettings setRevertEnhancementsOnExpiry(boolean v) { this.revertEnhancementsOnExpiry = v; return this; }
}
