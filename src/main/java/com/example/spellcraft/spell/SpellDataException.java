package com.example.spellcraft.spell;

/**
 * Spell data refers to something that does not exist (an unknown effect kind,
 * no creature template that fits a summon, ...).
 */
public class SpellDataException extends RuntimeException {

    private final String spellId;

    public SpellDataException(String spellId, String message) {
        super(message);
        this.spellId = spellId;
    }

    public String getSpellId() {
        return spellId;
    }
}
