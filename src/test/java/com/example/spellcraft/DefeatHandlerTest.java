package com.example.spellcraft;

import com.example.spellcraft.effect.DefeatHandler;
import com.example.spellcraft.model.Mobile;
import com.example.spellcraft.model.MobileTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefeatHandler Tests")
class DefeatHandlerTest {

    @Test
    @DisplayName("A mob is handed to the world once even when the world does not mark it dead")
    void defeatedOnce() {
        List<Mobile> deaths = new ArrayList<>();
        CapturingMessaging messaging = new CapturingMessaging();
        DefeatHandler defeats = new DefeatHandler(messaging, (mob, roomId, killerId) -> deaths.add(mob));
        Mobile wolf = new Mobile(5L, MobileTemplate.builder("wolf").name("wolf").hpMax(10).build(), 100);

        defeats.defeat(wolf, 100, 1, "wolf has been defeated!");
        defeats.defeat(wolf, 100, 1, "wolf has been defeated!");

        assertEquals(List.of(wolf), deaths);
        assertTrue(wolf.isDead());
        assertEquals(List.of("wolf has been defeated!"), messaging.toPlayer(1));
    }
}
