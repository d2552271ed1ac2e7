package com.multirpg.sim;

/**
 * Pure time-cost formulas. No state beyond the configured cap.
 */
public final class PenaltyCalculator {

    /** Per-level growth of penalties. */
    public static final double PENALTY_STEP = 1.14;

    /** Seconds to reach level 1. */
    public static final int BASE_TTL = 600;
    /** Per-level growth of the level countdown, up to level 60. */
    public static final double TTL_STEP = 1.16;
    private static final int TTL_STEP_LEVEL_CAP = 60;
    private static final int SECONDS_PER_DAY = 86400;

    private final int limitPen;

    /**
     * @param limitPen cap on any single capped penalty, 0 for unlimited
     */
    public PenaltyCalculator(int limitPen) {
        this.limitPen = Math.max(0, limitPen);
    }

    /**
     * {@code floor(base × 1.14^level)}, at least 0, capped at {@code limit_pen}
     * when that is nonzero.
     */
    public int penalty(int baseSeconds, int level) {
        long pen = scaled(baseSeconds, level);
        if (limitPen > 0 && pen > limitPen) pen = limitPen;
        return (int) pen;
    }

    /** Penalty for an event kind; {@code messageLength} is used for MESSAGE only. */
    public int penalty(PenaltyKind kind, int level, int messageLength) {
        int base = kind.baseSeconds(messageLength);
        if (!kind.isCapped()) return (int) scaled(base, level);
        return penalty(base, level);
    }

    public int getLimitPen() { return limitPen; }

    private static long scaled(int baseSeconds, int level) {
        if (baseSeconds <= 0) return 0;
        double v = baseSeconds * Math.pow(PENALTY_STEP, Math.max(0, level));
        if (v >= Integer.MAX_VALUE) return Integer.MAX_VALUE;
        return (long) v;
    }

    /**
     * Countdown baseline for reaching the level after {@code level}.
     * Grows geometrically to level 60, then one day per level.
     */
    public static int baseTtl(int level) {
        if (level > TTL_STEP_LEVEL_CAP) {
            return (int) (BASE_TTL * Math.pow(TTL_STEP, TTL_STEP_LEVEL_CAP)
                + (double) SECONDS_PER_DAY * (level - TTL_STEP_LEVEL_CAP));
        }
        return (int) (BASE_TTL * Math.pow(TTL_STEP, level));
    }
}
