package com.multirpg.world;

/**
 * World-level flags shared by the clock, the engines and the admin commands.
 * One instance per process, owned by the {@link PlayerStore} and only touched
 * under its lock.
 */
public class WorldState {

    private boolean paused;
    private int muteLevel;
    private long reportSeconds;   // game seconds elapsed, drives periodic announcements
    private final QuestState quest;

    public WorldState(long firstQuestTime) {
        this.quest = new QuestState(firstQuestTime);
    }

    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }

    /** Last mute level set by SILENT, 0-3. Queues hold the effective value. */
    public int getMuteLevel() { return muteLevel; }
    public void setMuteLevel(int muteLevel) { this.muteLevel = muteLevel; }

    /** Advance the report counter by one tick and return the new value. */
    public long advanceReport(int seconds) {
        reportSeconds += seconds;
        return reportSeconds;
    }

    public QuestState getQuest() { return quest; }
}
