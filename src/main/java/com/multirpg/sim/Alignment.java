package com.multirpg.sim;

/**
 * Player alignment. Scales combat power and the odds of a critical strike.
 *
 * GOOD:    ×1.1 power, 1 in 50 critical strike
 * NEUTRAL: ×1.0 power, 1 in 35
 * EVIL:    ×0.9 power, 1 in 20
 */
public enum Alignment {

    GOOD   ('g', 1.1, 50),
    NEUTRAL('n', 1.0, 35),
    EVIL   ('e', 0.9, 20);

    private final char code;
    private final double powerMultiplier;
    private final int criticalOdds;

    Alignment(char code, double powerMultiplier, int criticalOdds) {
        this.code = code;
        this.powerMultiplier = powerMultiplier;
        this.criticalOdds = criticalOdds;
    }

    /** Single-letter code used by the record store. */
    public char code() { return code; }

    /** Apply the alignment modifier to a raw combat sum. */
    public int adjust(int rawPower) {
        return (int) (rawPower * powerMultiplier);
    }

    /** A critical strike lands when {@code randInt(0, odds - 1) < 1}. */
    public int getCriticalOdds() { return criticalOdds; }

    public String label() { return name().toLowerCase(); }

    /** Parse the store code; unknown codes map to NEUTRAL. */
    public static Alignment fromCode(String s) {
        if (s == null || s.isEmpty()) return NEUTRAL;
        char c = Character.toLowerCase(s.charAt(0));
        for (Alignment a : values()) {
            if (a.code == c) return a;
        }
        return NEUTRAL;
    }

    /** Parse a user-typed word ("good", "neutral", "evil"); null if not one of them. */
    public static Alignment fromWord(String s) {
        if (s == null) return null;
        return switch (s.toLowerCase()) {
            case "good" -> GOOD;
            case "neutral" -> NEUTRAL;
            case "evil" -> EVIL;
            default -> null;
        };
    }
}
