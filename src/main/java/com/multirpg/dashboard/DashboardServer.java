package com.multirpg.dashboard;

import com.multirpg.world.WorldSnapshot;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Read-only WebSocket feed of the world for the web dashboard.
 * <p>
 * Viewers get a hello and a snapshot on connect, a fresh snapshot whenever
 * they send {@code {"type":"snapshot"}}, and a pushed one after world ticks.
 * <p>
 * Thread safety: WebSocket callbacks run on java-websocket threads,
 * {@link #publish()} on the world clock thread. Snapshots are immutable.
 */
public class DashboardServer extends WebSocketServer {

    private static final Logger LOG = Logger.getLogger(DashboardServer.class.getName());

    /** Throttle: minimum ms between pushed snapshots. */
    static final long MIN_PUBLISH_INTERVAL_MS = 1000;

    private final Supplier<WorldSnapshot> snapshots;
    private final Set<WebSocket> viewers = Collections.newSetFromMap(new ConcurrentHashMap<>());
    private final AtomicLong lastPublish = new AtomicLong(0);
    private final AtomicLong published = new AtomicLong(0);

    public DashboardServer(String host, int port, Supplier<WorldSnapshot> snapshots) {
        super(new InetSocketAddress(host, port));
        this.snapshots = snapshots;
        setReuseAddr(true);
        setDaemon(true);
    }

    // ---- WebSocket callbacks ----

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        viewers.add(conn);
        LOG.info("[DashboardServer] Viewer connected: " + connId(conn) + " (total: " + viewers.size() + ")");
        try {
            conn.send(Messages.buildHello());
            conn.send(Messages.buildSnapshot(snapshots.get()));
        } catch (Exception e) {
            LOG.warning("[DashboardServer] Failed to greet " + connId(conn) + ": " + e.getMessage());
        }
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        viewers.remove(conn);
        LOG.info("[DashboardServer] Viewer disconnected: " + connId(conn)
            + " (code=" + code + ", total: " + viewers.size() + ")");
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        String type = Messages.requestType(message);
        if ("snapshot".equals(type)) {
            conn.send(Messages.buildSnapshot(snapshots.get()));
        } else {
            LOG.warning("[DashboardServer] Unrecognized message from " + connId(conn) + ": "
                + (message.length() > 100 ? message.substring(0, 100) + "..." : message));
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        String id = conn != null ? connId(conn) : "server";
        LOG.warning("[DashboardServer] Error (" + id + "): " + ex.getMessage());
    }

    @Override
    public void onStart() {
        LOG.info("[DashboardServer] Dashboard feed started on port " + getPort());
    }

    // ---- Push (called after each tick) ----

    /**
     * Push a snapshot to every viewer, at most once per
     * {@link #MIN_PUBLISH_INTERVAL_MS}.
     *
     * @return true if a snapshot was sent
     */
    public boolean publish() {
        if (viewers.isEmpty()) return false;
        long now = System.currentTimeMillis();
        long last = lastPublish.get();
        if (now - last < MIN_PUBLISH_INTERVAL_MS || !lastPublish.compareAndSet(last, now)) return false;

        String json = Messages.buildSnapshot(snapshots.get());
        for (WebSocket viewer : viewers) {
            try {
                viewer.send(json);
            } catch (Exception e) {
                LOG.fine("[DashboardServer] Failed to push to " + connId(viewer));
            }
        }
        published.incrementAndGet();
        return true;
    }

    // ---- Utility ----

    private static String connId(WebSocket conn) {
        if (conn == null || conn.getRemoteSocketAddress() == null) return "unknown";
        return conn.getRemoteSocketAddress().toString();
    }

    /** Graceful shutdown. */
    public void shutdown() {
        LOG.info("[DashboardServer] Shutting down (" + viewers.size() + " viewers, "
            + published.get() + " snapshots pushed)...");
        try {
            stop(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
