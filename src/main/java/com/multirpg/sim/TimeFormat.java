package com.multirpg.sim;

/**
 * Durations as players see them: {@code "2 days, 03:04:05"}.
 */
public final class TimeFormat {

    private TimeFormat() { }

    /** Format an absolute number of seconds; the sign is dropped. */
    public static String duration(long seconds) {
        long s = Math.abs(seconds);
        long days = s / 86400;
        s %= 86400;
        long hours = s / 3600;
        s %= 3600;
        long minutes = s / 60;
        s %= 60;
        return String.format("%d day%s, %02d:%02d:%02d", days, days == 1 ? "" : "s", hours, minutes, s);
    }
}
