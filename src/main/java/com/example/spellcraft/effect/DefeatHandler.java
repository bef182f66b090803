package com.example.spellcraft.effect;

import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.world.MobLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Announces a mob's defeat and hands it to the world for loot and removal.
 * Area resolvers call this only after they have finished iterating their snapshot.
 */
public class DefeatHandler {

    private static final Logger logger = LoggerFactory.getLogger(DefeatHandler.class);

    private final Messaging messaging;
    private final MobLifecycle lifecycle;

    public DefeatHandler(Messaging messaging, MobLifecycle lifecycle) {
        this.messaging = messaging;
        this.lifecycle = lifecycle;
    }

    /**
     * Marks the mob dead before the world sees it, so a mob is only ever defeated once.
     *
     * @param killerId credited player, or null
     * @param announcement line sent to the killer and the room
     */
    public void defeat(Mobile mob, int roomId, Integer killerId, String announcement) {
        if (mob.isDead()) return;
        mob.die();
        if (killerId != null) {
            messaging.sendToPlayer(killerId, announcement);
        }
        messaging.broadcastRoomExcept(roomId, killerId, announcement);
        lifecycle.onDeath(mob, roomId, killerId);
        logger.debug("[defeat] {} defeated in room {} by {}", mob, roomId, killerId);
    }

    public void defeatAll(List<Mobile> mobs, int roomId, Integer killerId, String indent) {
        for (Mobile mob : mobs) {
            defeat(mob, roomId, killerId, indent + mob.getName() + " has been defeated!");
        }
    }
}
