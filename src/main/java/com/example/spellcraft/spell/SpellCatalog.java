package com.example.spellcraft.spell;

import java.util.Collection;

public interface SpellCatalog {

    /**
     * @return the spell with this id, or null
     */
    SpellDefinition get(String spellId);

    Collection<SpellDefinition> all();
}
