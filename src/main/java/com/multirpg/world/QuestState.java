package com.multirpg.world;

import org.joml.Vector2i;

import java.util.ArrayList;
import java.util.List;

/**
 * The world's single quest slot. Either idle (waiting for {@link #getNextQuestTime()})
 * or active with four questers.
 * <p>
 * Guarded by the player table lock like everything else in {@link WorldState}.
 */
public class QuestState {

    public enum Type {
        /** Completes when the deadline passes. */
        TIME,
        /** Completes when every quester has stood on both waypoints in turn. */
        GRID
    }

    private boolean active;
    private Type type = Type.TIME;
    private String text = "";
    private final List<Long> questerIds = new ArrayList<>();
    private long deadline;          // TIME: epoch seconds
    private int stage = 1;          // GRID: 1 or 2
    private final Vector2i firstWaypoint = new Vector2i();
    private final Vector2i secondWaypoint = new Vector2i();
    private long nextQuestTime;     // epoch seconds; idle only

    public QuestState(long nextQuestTime) {
        this.nextQuestTime = nextQuestTime;
    }

    public void startTimeQuest(String text, List<Long> questers, long deadline) {
        begin(Type.TIME, text, questers);
        this.deadline = deadline;
    }

    public void startGridQuest(String text, List<Long> questers, int x1, int y1, int x2, int y2) {
        begin(Type.GRID, text, questers);
        this.stage = 1;
        firstWaypoint.set(x1, y1);
        secondWaypoint.set(x2, y2);
    }

    private void begin(Type type, String text, List<Long> questers) {
        this.active = true;
        this.type = type;
        this.text = text;
        questerIds.clear();
        questerIds.addAll(questers);
    }

    /** Drop the quest and schedule the next one. */
    public void end(long nextQuestTime) {
        this.active = false;
        questerIds.clear();
        this.nextQuestTime = nextQuestTime;
    }

    public void advanceStage() { this.stage = 2; }

    public boolean isActive() { return active; }
    public Type getType() { return type; }
    public String getText() { return text; }
    public List<Long> getQuesterIds() { return List.copyOf(questerIds); }
    public boolean isQuester(long playerId) { return active && questerIds.contains(playerId); }
    public long getDeadline() { return deadline; }
    public int getStage() { return stage; }
    public long getNextQuestTime() { return nextQuestTime; }

    public int firstX() { return firstWaypoint.x; }
    public int firstY() { return firstWaypoint.y; }
    public int secondX() { return secondWaypoint.x; }
    public int secondY() { return secondWaypoint.y; }

    /** Waypoint for the current stage. */
    public int targetX() { return stage == 1 ? firstWaypoint.x : secondWaypoint.x; }
    public int targetY() { return stage == 1 ? firstWaypoint.y : secondWaypoint.y; }
}
