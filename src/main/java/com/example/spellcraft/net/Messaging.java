package com.example.spellcraft.net;

/**
 * Outbound text sink provided by the session layer.
 * Calls are fire-and-forget; the engine never waits on delivery.
 */
public interface Messaging {

    void sendToPlayer(int playerId, String text);

    /**
     * Send to every player in the room except one.
     * @param exceptPlayerId player to skip, or null to reach everyone
     */
    void broadcastRoomExcept(int roomId, Integer exceptPlayerId, String text);
}
