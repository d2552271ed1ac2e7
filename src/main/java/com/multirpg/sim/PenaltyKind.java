package com.multirpg.sim;

/**
 * Disruptive actions that add time to a player's countdown, with their base
 * seconds before level scaling. MESSAGE has no fixed base: the message length
 * is used instead.
 */
public enum PenaltyKind {

    MESSAGE(0,   "talking"),
    NICK   (30,  "nick change"),
    PART   (200, "parting"),
    QUIT   (20,  "quitting"),
    LOGOUT (20,  "LOGOUT"),
    KICK   (250, "being kicked"),
    QUEST  (15,  "angering the gods");

    private final int baseSeconds;
    private final String reason;

    PenaltyKind(int baseSeconds, String reason) {
        this.baseSeconds = baseSeconds;
        this.reason = reason;
    }

    /** Base seconds for this kind; {@code messageLength} only matters for MESSAGE. */
    public int baseSeconds(int messageLength) {
        return this == MESSAGE ? Math.max(0, messageLength) : baseSeconds;
    }

    /** Short phrase used in "Penalty of ... added to your timer for X." */
    public String reason() { return reason; }

    /** Whether the configured {@code limit_pen} cap applies to this kind. */
    public boolean isCapped() { return this != QUEST; }
}
