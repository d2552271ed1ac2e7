package com.multirpg.core;

import com.multirpg.chat.AdminCommandHandler;
import com.multirpg.chat.BroadcastRouter;
import com.multirpg.chat.DispatchQueue;
import com.multirpg.chat.IrcConnection;
import com.multirpg.chat.SessionCoordinator;
import com.multirpg.dashboard.DashboardServer;
import com.multirpg.math.GameRandom;
import com.multirpg.save.AsyncRecordWriter;
import com.multirpg.save.RecordStore;
import com.multirpg.save.SqliteRecordStore;
import com.multirpg.save.StoreException;
import com.multirpg.sim.EventEngine;
import com.multirpg.sim.PenaltyCalculator;
import com.multirpg.sim.ProgressionEngine;
import com.multirpg.sim.QuestEngine;
import com.multirpg.world.PasswordHasher;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.WorldState;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Wires every subsystem together and owns their lifecycle.
 * <p>
 * Startup order: record store, player table, durable writer, router, one
 * connection with its queue and coordinator per network, dashboard, world
 * clock. Shutdown runs the other way round and flushes pending writes last.
 */
public class GameServer {

    private static final Logger LOG = Logger.getLogger(GameServer.class.getName());

    /** First quest starts one to two hours after startup. */
    static final int FIRST_QUEST_MIN = 3600;
    static final int FIRST_QUEST_MAX = 7200;

    private final GameConfig config;

    private RecordStore recordStore;
    private AsyncRecordWriter writer;
    private PlayerStore store;
    private BroadcastRouter router;
    private WorldClock clock;
    private DashboardServer dashboard;
    private final List<IrcConnection> connections = new ArrayList<>();

    private boolean running;

    public GameServer(GameConfig config) {
        this.config = config;
    }

    /**
     * Start everything.
     *
     * @throws StoreException if the record store cannot be opened or loaded
     */
    public synchronized void start() throws StoreException {
        if (running) return;

        recordStore = new SqliteRecordStore(Path.of(config.getDbPath()));

        GameRandom random = config.getSeed() != null
            ? new GameRandom(config.getSeed())
            : new GameRandom(System.nanoTime());
        Clock wallClock = Clock.systemUTC();
        long now = wallClock.instant().getEpochSecond();
        WorldState world = new WorldState(now + random.randInt(FIRST_QUEST_MIN, FIRST_QUEST_MAX));
        store = new PlayerStore(world, random, wallClock, new PasswordHasher());
        store.setConfiguredAdmins(config.getAdmins());

        writer = new AsyncRecordWriter(recordStore);
        store.setWriter(writer);
        try {
            store.load(recordStore);
        } catch (StoreException e) {
            writer.shutdown();
            closeRecordStore();
            throw e;
        }

        router = new BroadcastRouter();
        store.setBroadcastSink(router::route);

        PenaltyCalculator penalties = new PenaltyCalculator(config.getLimitPen());
        ProgressionEngine progression = new ProgressionEngine();
        EventEngine events = new EventEngine();
        QuestEngine quests = new QuestEngine(penalties);

        for (NetworkConfig net : config.getNetworks()) {
            IrcConnection conn = new IrcConnection(net, null);
            DispatchQueue queue = new DispatchQueue(net.name(), conn,
                config.getDispatchMinDelayMs(), config.getDispatchMaxBacklog());
            router.register(net.name(), net.channel(), queue);
            AdminCommandHandler admin = new AdminCommandHandler(net.name(), store, events, router);
            conn.setEvents(new SessionCoordinator(net.name(), net.channel(), store, penalties, quests, admin, router));
            connections.add(conn);
        }

        dashboard = new DashboardServer(config.getWebHost(), config.getWebPort(), store::snapshot);
        dashboard.start();

        clock = new WorldClock(store, progression, events, quests, config.getSelfClock(), () -> {
            router.flushAll();
            dashboard.publish();
        });
        clock.start();

        for (IrcConnection conn : connections) conn.start();

        running = true;
        LOG.info("[GameServer] Started: " + connections.size() + " networks, tick every "
            + config.getSelfClock() + "s, seed " + random.getSeed());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        LOG.info("[GameServer] Stopping...");

        clock.stop();
        for (IrcConnection conn : connections) conn.stop();
        router.shutdown();
        dashboard.shutdown();

        if (!writer.flushSync(10, TimeUnit.SECONDS)) {
            LOG.warning("[GameServer] " + writer.getPendingCount() + " writes still pending at shutdown");
        }
        writer.shutdown();
        closeRecordStore();
        LOG.info("[GameServer] Stopped");
    }

    private void closeRecordStore() {
        try {
            recordStore.close();
        } catch (StoreException e) {
            LOG.warning("[GameServer] Closing record store failed: " + e.getMessage());
        }
    }

    public PlayerStore getStore() { return store; }
    public WorldClock getClock() { return clock; }
    public boolean isRunning() { return running; }
}
