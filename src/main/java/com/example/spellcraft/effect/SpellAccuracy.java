package com.example.spellcraft.effect;

import com.example.spellcraft.combat.AttackOutcome;
import com.example.spellcraft.combat.CombatAccuracyOracle;
import com.example.spellcraft.combat.CombatStats;
import com.example.spellcraft.model.GameCharacter;
import com.example.spellcraft.net.Messaging;
import com.example.spellcraft.spell.CastContext;

/**
 * Accuracy check shared by damage and drain spells.
 */
final class SpellAccuracy {

    private SpellAccuracy() {}

    /**
     * Spells aim with the caster's casting stat in place of dexterity.
     */
    static AttackOutcome check(CombatAccuracyOracle oracle, CastContext ctx, GameCharacter target, double baseHitChance) {
        CombatStats attacker = CombatStats.of(ctx.caster()).withDexterity(ctx.castingStatValue());
        return oracle.checkOutcome(attacker, CombatStats.of(target), target.getEffectiveArmor(), baseHitChance);
    }

    /**
     * Tell caster and room that the spell did not land.
     */
    static void reportMiss(Messaging messaging, CastContext ctx, GameCharacter target, AttackOutcome outcome) {
        String spell = ctx.spell().getName();
        String t = target.getName();
        String tail = switch (outcome) {
            case MISS -> "it misses " + t + "!";
            case DODGE -> t + " dodges it!";
            case DEFLECT -> t + "'s defenses deflect it!";
            case HIT -> throw new IllegalArgumentException("not a miss: " + outcome);
        };
        messaging.sendToPlayer(ctx.casterId(), "You cast " + spell + ", but " + tail);
        messaging.broadcastRoomExcept(ctx.roomId(), ctx.casterId(),
                ctx.caster().getName() + " casts " + spell + " at " + t + ", but " + tail);
    }
}
