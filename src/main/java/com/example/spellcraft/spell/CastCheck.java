package com.example.spellcraft.spell;

/**
 * Result of a pre-cast check - either success (null message) or a rejection with a reason
 * for the caster. Rejections never change any state.
 */
public final class CastCheck {

    private static final CastCheck OK = new CastCheck(true, null);

    private final boolean success;
    private final String failureMessage;

    private CastCheck(boolean success, String failureMessage) {
        this.success = success;
        this.failureMessage = failureMessage;
    }

    public static CastCheck success() {
        return OK;
    }

    public static CastCheck failure(String message) {
        return new CastCheck(false, message);
    }

    public boolean isSuccess() { return success; }
    public boolean isFailure() { return !success; }
    public String getFailureMessage() { return failureMessage; }
}
