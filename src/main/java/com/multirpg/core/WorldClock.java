package com.multirpg.core;

import com.multirpg.sim.EventEngine;
import com.multirpg.sim.ProgressionEngine;
import com.multirpg.sim.QuestEngine;
import com.multirpg.world.Player;
import com.multirpg.world.PlayerStore;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single scheduling loop. Every {@code interval} seconds one tick runs as
 * one store transaction:
 *
 *   1. capture the online players
 *   2. countdown for all of them, then level-ups
 *   3. daily random events
 *   4. movement and map duels
 *   5. grid quest progress, periodic announcements, quest start/finish
 *
 * After the lock is released the {@code afterTick} hook asks every connection
 * to flush. A paused world does nothing; paused ticks are not replayed.
 */
public class WorldClock {

    private static final Logger LOG = Logger.getLogger(WorldClock.class.getName());

    private final PlayerStore store;
    private final ProgressionEngine progression;
    private final EventEngine events;
    private final QuestEngine quests;
    private final int interval;
    private final Runnable afterTick;

    private ScheduledExecutorService scheduler;

    // ---- Stats ----
    private final AtomicLong ticksRun = new AtomicLong(0);
    private final AtomicLong ticksPaused = new AtomicLong(0);

    /**
     * @param interval  seconds between ticks, also the game time one tick advances
     * @param afterTick runs after each tick with the lock released
     */
    public WorldClock(PlayerStore store, ProgressionEngine progression, EventEngine events,
                      QuestEngine quests, int interval, Runnable afterTick) {
        if (interval < 1) throw new IllegalArgumentException("interval must be at least 1 second");
        this.store = store;
        this.progression = progression;
        this.events = events;
        this.quests = quests;
        this.interval = interval;
        this.afterTick = afterTick != null ? afterTick : () -> { };
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "WorldClock");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.SECONDS);
        LOG.info("[WorldClock] Started, tick every " + interval + "s");
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) scheduler.shutdownNow();
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        LOG.info("[WorldClock] Stopped after " + ticksRun.get() + " ticks");
    }

    /** A failing pass must not cancel the schedule. */
    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "[WorldClock] Tick failed", e);
        }
    }

    /**
     * Run one tick now.
     *
     * @return false when the world is paused and nothing happened
     */
    public boolean tick() {
        AtomicBoolean ran = new AtomicBoolean(false);
        store.mutate(tx -> {
            if (tx.world().isPaused()) return;
            ran.set(true);
            List<Player> online = tx.onlinePlayers();
            if (online.isEmpty()) return;

            List<Player> levelled = progression.countdown(online, interval);
            for (Player p : levelled) {
                progression.levelUp(tx, p, online);
            }

            events.rollDaily(tx, online, interval);
            progression.move(tx, online, interval, events::collision);
            quests.checkGrid(tx);

            long report = tx.world().advanceReport(interval);
            events.periodic(tx, online, report);
            quests.check(tx, online);

            LOG.fine(() -> "[WorldClock] Tick: " + online.size() + " online, " + levelled.size() + " levelled");
        });
        if (!ran.get()) {
            ticksPaused.incrementAndGet();
            return false;
        }
        ticksRun.incrementAndGet();
        afterTick.run();
        return true;
    }

    public int getInterval() { return interval; }
    public long getTicksRun() { return ticksRun.get(); }
    public long getTicksPaused() { return ticksPaused.get(); }
}
