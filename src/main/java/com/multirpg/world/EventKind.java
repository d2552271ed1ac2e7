package com.multirpg.world;

/** Kinds of event log entries. The code is what the record store keeps. */
public enum EventKind {
    LEVELUP("levelup"),
    BATTLE("battle"),
    CRITICAL("critical"),
    STEAL("steal"),
    HOG("hog"),
    CALAMITY("calamity"),
    GODSEND("godsend"),
    TEAM_BATTLE("team_battle"),
    QUEST("quest");

    private final String code;

    EventKind(String code) {
        this.code = code;
    }

    public String code() { return code; }

    /** Lenient parse for loading; unknown codes are kept as null by the caller. */
    public static EventKind fromCode(String code) {
        for (EventKind k : values()) {
            if (k.code.equals(code)) return k;
        }
        return null;
    }
}
