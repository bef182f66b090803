package com.example.spellcraft.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A connected player character as seen by the spell engine.
 */
public class PlayerCharacter extends GameCharacter {

    public static final int MAX_SATIATION = 100;

    private final int characterId;
    private int level;
    private String characterClass;

    // 0 = starving / parched, 100 = full
    private int hunger = MAX_SATIATION;
    private int thirst = MAX_SATIATION;

    private final Set<String> knownSpells = new LinkedHashSet<>();

    public PlayerCharacter(int characterId, String name, String characterClass, int level,
                           int hpMax, int hpCur, int mpMax, int mpCur,
                           Integer currentRoom, Map<CoreStat, Integer> stats, int armor) {
        super(name, hpMax, hpCur, mpMax, mpCur, currentRoom, stats, armor);
        this.characterId = characterId;
        this.characterClass = characterClass;
        this.level = Math.max(1, level);
    }

    @Override
    public boolean isPlayer() { return true; }

    public int getCharacterId() { return characterId; }

    @Override
    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = Math.max(1, level); }

    public String getCharacterClass() { return characterClass; }
    public void setCharacterClass(String characterClass) { this.characterClass = characterClass; }

    public int getHunger() { return hunger; }
    public void setHunger(int hunger) { this.hunger = Math.max(0, Math.min(MAX_SATIATION, hunger)); }

    public int getThirst() { return thirst; }
    public void setThirst(int thirst) { this.thirst = Math.max(0, Math.min(MAX_SATIATION, thirst)); }

    public Set<String> getKnownSpells() { return Collections.unmodifiableSet(knownSpells); }

    public void learnSpell(String spellId) {
        if (spellId != null && !spellId.isBlank()) knownSpells.add(spellId);
    }

    public boolean knowsSpell(String spellId) { return knownSpells.contains(spellId); }
}
