package com.example.spellcraft.world;

import com.example.spellcraft.model.MobileTemplate;

import java.util.List;

public interface CreatureCatalog {

    List<MobileTemplate> all();
}
