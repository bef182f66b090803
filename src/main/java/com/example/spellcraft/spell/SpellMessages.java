package com.example.spellcraft.spell;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Placeholder substitution for spell message templates.
 *
 * Recognised placeholders: {caster}, {target}, {spell}, {damage}, {damage_type},
 * {effect}, {mob_prefix}, {mob_name}. Unknown placeholders are left as written.
 */
public final class SpellMessages {

    private final String template;
    private final Map<String, String> values = new LinkedHashMap<>();

    private SpellMessages(String template) {
        this.template = template;
    }

    /**
     * Start from the spell's template, or the family default when the spell has none.
     */
    public static SpellMessages of(String template, String defaultTemplate) {
        return new SpellMessages(template != null && !template.isBlank() ? template : defaultTemplate);
    }

    public SpellMessages with(String placeholder, Object value) {
        values.put(placeholder, value == null ? "" : String.valueOf(value));
        return this;
    }

    /**
     * Render with every value as given.
     */
    public String render() {
        String out = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace("{" + e.getKey() + "}", e.getValue());
        }
        return out;
    }

    /**
     * Render as the caster sees it: "{caster} casts" becomes "You cast", and any
     * other {caster} becomes "You".
     */
    public String renderForCaster() {
        String out = template
                .replace("{caster} casts", "You cast")
                .replace("{caster} intones", "You intone")
                .replace("{caster}", "You");
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (e.getKey().equals("caster")) continue;
            out = out.replace("{" + e.getKey() + "}", e.getValue());
        }
        return out;
    }

    /**
     * "A" or "An" for a creature name.
     */
    public static String article(String name) {
        if (name == null || name.isEmpty()) return "A";
        char c = Character.toLowerCase(name.charAt(0));
        return "aeiou".indexOf(c) >= 0 ? "An" : "A";
    }
}
