package com.example.spellcraft.model;

/**
 * Minimal room record: the engine only needs identity and the safe flag.
 */
public class Room {
    private final int id;
    private final String name;
    private final boolean safe;    // no summoning

    public Room(int id, String name, boolean safe) {
        this.id = id;
        this.name = name;
        this.safe = safe;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public boolean isSafe() { return safe; }
}
