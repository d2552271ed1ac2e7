package com.multirpg.dashboard;

import com.multirpg.save.EventRecord;
import com.multirpg.world.Item;
import com.multirpg.world.PlayerView;
import com.multirpg.world.WorldSnapshot;

import java.util.List;

/**
 * Message schemas for the dashboard protocol.
 * <p>
 * All messages are JSON, built with static helpers so the dashboard needs no
 * JSON library.
 * <ul>
 *   <li><b>Server → viewer:</b> hello, snapshot</li>
 *   <li><b>Viewer → server:</b> snapshot (request a fresh one)</li>
 * </ul>
 */
public final class Messages {

    public static final String VERSION = "1.0";

    private Messages() {}

    // ---- JSON helpers ----

    /** Escape a string for JSON. */
    static String jsonStr(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 2);
        appendStr(sb, s);
        return sb.toString();
    }

    static void appendStr(StringBuilder sb, String s) {
        if (s == null) {
            sb.append("null");
            return;
        }
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void appendId(StringBuilder sb, Long id) {
        sb.append(id == null ? "null" : id.toString());
    }

    // ---- Hello ----

    public static String buildHello() {
        return "{\"type\":\"hello\",\"version\":" + jsonStr(VERSION)
            + ",\"requests\":[\"snapshot\"]}";
    }

    // ---- Snapshot ----

    /** Full world state: leaderboard, map, quest, controls and recent events. */
    public static String buildSnapshot(WorldSnapshot s) {
        StringBuilder sb = new StringBuilder(1024 + s.players().size() * 256);
        sb.append("{\"type\":\"snapshot\",\"taken_at\":").append(s.takenAt());
        sb.append(",\"paused\":").append(s.paused());
        sb.append(",\"mute_level\":").append(s.muteLevel());

        sb.append(",\"players\":[");
        appendPlayers(sb, s.players());
        sb.append("],\"online\":[");
        List<PlayerView> online = s.online();
        for (int i = 0; i < online.size(); i++) {
            PlayerView p = online.get(i);
            if (i > 0) sb.append(',');
            sb.append("{\"tag\":");
            appendStr(sb, p.tag());
            sb.append(",\"x\":").append(p.x()).append(",\"y\":").append(p.y())
              .append(",\"level\":").append(p.level()).append('}');
        }
        sb.append("],\"quest\":");
        appendQuest(sb, s.quest());
        sb.append(",\"events\":[");
        appendEvents(sb, s.events());
        sb.append("]}");
        return sb.toString();
    }

    private static void appendPlayers(StringBuilder sb, List<PlayerView> players) {
        for (int i = 0; i < players.size(); i++) {
            PlayerView p = players.get(i);
            if (i > 0) sb.append(',');
            sb.append("{\"id\":").append(p.id());
            sb.append(",\"username\":");
            appendStr(sb, p.username());
            sb.append(",\"network\":");
            appendStr(sb, p.network());
            sb.append(",\"class\":");
            appendStr(sb, p.characterClass());
            sb.append(",\"alignment\":");
            appendStr(sb, p.alignment().label());
            sb.append(",\"admin\":").append(p.admin());
            sb.append(",\"online\":").append(p.online());
            sb.append(",\"level\":").append(p.level());
            sb.append(",\"ttl\":").append(p.ttl());
            sb.append(",\"next_ttl\":").append(p.nextTtl());
            sb.append(",\"progress\":").append(p.progressPercent());
            sb.append(",\"x\":").append(p.x()).append(",\"y\":").append(p.y());
            sb.append(",\"item_sum\":").append(p.itemSum());
            sb.append(",\"idled\":").append(p.idled());
            sb.append(",\"last_login\":").append(p.lastLogin());
            sb.append(",\"items\":[");
            List<Item> items = p.items();
            for (int j = 0; j < items.size(); j++) {
                Item item = items.get(j);
                if (j > 0) sb.append(',');
                sb.append("{\"slot\":");
                appendStr(sb, item.slot().label());
                sb.append(",\"level\":").append(item.level());
                sb.append(",\"name\":");
                appendStr(sb, item.name());
                sb.append('}');
            }
            sb.append("]}");
        }
    }

    private static void appendQuest(StringBuilder sb, WorldSnapshot.QuestView q) {
        if (q == null) {
            sb.append("null");
            return;
        }
        sb.append("{\"type\":");
        appendStr(sb, q.type().name().toLowerCase());
        sb.append(",\"text\":");
        appendStr(sb, q.text());
        sb.append(",\"questers\":[");
        for (int i = 0; i < q.questers().size(); i++) {
            if (i > 0) sb.append(',');
            appendStr(sb, q.questers().get(i));
        }
        sb.append("],\"deadline\":").append(q.deadline());
        sb.append(",\"stage\":").append(q.stage());
        sb.append(",\"waypoints\":[");
        for (int i = 0; i < q.waypoints().size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(q.waypoints().get(i));
        }
        sb.append("]}");
    }

    private static void appendEvents(StringBuilder sb, List<EventRecord> events) {
        for (int i = 0; i < events.size(); i++) {
            EventRecord ev = events.get(i);
            if (i > 0) sb.append(',');
            sb.append("{\"id\":").append(ev.id());
            sb.append(",\"kind\":");
            appendStr(sb, ev.kind());
            sb.append(",\"message\":");
            appendStr(sb, ev.message());
            sb.append(",\"player1\":");
            appendId(sb, ev.player1Id());
            sb.append(",\"player2\":");
            appendId(sb, ev.player2Id());
            sb.append(",\"created_at\":").append(ev.createdAt()).append('}');
        }
    }

    // ---- Requests ----

    /**
     * The {@code type} of an incoming request, or null if the message has none.
     * Minimal hand-parser; requests carry no other fields.
     */
    public static String requestType(String json) {
        if (json == null || json.isBlank()) return null;
        return extractString(json.trim(), "type");
    }

    static String extractString(String json, String key) {
        String search = "\"" + key + "\"";
        int idx = json.indexOf(search);
        if (idx < 0) return null;
        idx = json.indexOf(':', idx + search.length());
        if (idx < 0) return null;
        idx++;
        while (idx < json.length() && json.charAt(idx) == ' ') idx++;
        if (idx >= json.length() || json.charAt(idx) != '"') return null;
        idx++;
        int end = json.indexOf('"', idx);
        if (end < 0) return null;
        return json.substring(idx, end);
    }
}
