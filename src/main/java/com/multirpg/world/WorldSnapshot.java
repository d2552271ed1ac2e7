package com.multirpg.world;

import com.multirpg.save.EventRecord;

import java.util.List;

/**
 * Point-in-time copy of the world for the dashboard and for read-only
 * commands. Built under the table lock, immutable afterwards.
 *
 * @param takenAt    epoch seconds
 * @param players    every player, level descending then ttl ascending
 * @param online     online players only, same order
 * @param quest      current quest, or null when none is active
 * @param paused     world pause flag
 * @param muteLevel  last SILENT level
 * @param events     recent events, newest first
 */
public record WorldSnapshot(
    long takenAt,
    List<PlayerView> players,
    List<PlayerView> online,
    QuestView quest,
    boolean paused,
    int muteLevel,
    List<EventRecord> events
) {
    public WorldSnapshot {
        players = List.copyOf(players);
        online = List.copyOf(online);
        events = List.copyOf(events);
    }

    /**
     * Active quest as seen from outside.
     *
     * @param type       TIME or GRID
     * @param text       flavor text
     * @param questers   "user@net" tags
     * @param deadline   TIME: epoch seconds; GRID: 0
     * @param stage      GRID: 1 or 2
     * @param waypoints  GRID: {x1, y1, x2, y2}; TIME: empty
     */
    public record QuestView(QuestState.Type type, String text, List<String> questers,
                            long deadline, int stage, List<Integer> waypoints) {
        public QuestView {
            questers = List.copyOf(questers);
            waypoints = List.copyOf(waypoints);
        }
    }
}
