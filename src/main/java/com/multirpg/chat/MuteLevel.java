package com.multirpg.chat;

/**
 * Delivery filter of a {@link DispatchQueue}. Applied when a message is
 * delivered, never when it is queued.
 */
public enum MuteLevel {

    ALL_ENABLED(0, "all messages enabled"),
    CHANNEL_SUPPRESSED(1, "channel messages disabled"),
    PRIVATE_SUPPRESSED(2, "private messages disabled"),
    ALL_SUPPRESSED(3, "all messages disabled");

    private final int level;
    private final String label;

    MuteLevel(int level, String label) {
        this.level = level;
        this.label = label;
    }

    public int level() { return level; }

    public String label() { return label; }

    /** True when a message of this kind must be dropped at delivery. */
    public boolean suppresses(OutboundMessage.Kind kind) {
        return switch (this) {
            case ALL_ENABLED -> false;
            case CHANNEL_SUPPRESSED -> kind == OutboundMessage.Kind.CHANNEL;
            case PRIVATE_SUPPRESSED -> kind != OutboundMessage.Kind.CHANNEL;
            case ALL_SUPPRESSED -> true;
        };
    }

    /** Strict lookup; levels outside 0-3 are rejected. */
    public static MuteLevel of(int level) {
        for (MuteLevel m : values()) {
            if (m.level == level) return m;
        }
        throw new IllegalArgumentException("mute level must be 0-3: " + level);
    }
}
