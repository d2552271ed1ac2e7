package com.multirpg.chat;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Outbound message buffer for one network connection.
 * <p>
 * Any thread may enqueue; delivery runs on the connection's own dispatch
 * thread via {@link #requestFlush()}, so a slow link never holds up the world
 * clock or another connection. Messages leave in FIFO order, at least
 * {@code minDelayMs} apart. The mute level is checked at delivery: a muted
 * message is dropped, never requeued.
 * <p>
 * The buffer is soft-capped at {@code maxBacklog}: enqueueing beyond it drops
 * the oldest queued message.
 */
public class DispatchQueue {

    private static final Logger LOG = Logger.getLogger(DispatchQueue.class.getName());

    private final String name;
    private final ChatLink link;
    private final long minDelayMs;
    private final int maxBacklog;

    /** Guarded by itself. */
    private final ArrayDeque<OutboundMessage> queue = new ArrayDeque<>();
    private volatile MuteLevel muteLevel = MuteLevel.ALL_ENABLED;

    /** Serializes flushes; also guards lastDeliveryNanos. */
    private final Object flushLock = new Object();
    private long lastDeliveryNanos;
    private boolean delivered;

    private final ExecutorService dispatcher;
    private final AtomicBoolean flushPending = new AtomicBoolean(false);

    // ---- Stats ----
    private final AtomicLong totalEnqueued = new AtomicLong(0);
    private final AtomicLong totalDelivered = new AtomicLong(0);
    private final AtomicLong totalSuppressed = new AtomicLong(0);
    private final AtomicLong totalOverflow = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    /**
     * @param name       connection name, used for the thread and log lines
     * @param minDelayMs minimum gap between two deliveries
     * @param maxBacklog soft cap on queued messages
     */
    public DispatchQueue(String name, ChatLink link, long minDelayMs, int maxBacklog) {
        if (maxBacklog < 1) throw new IllegalArgumentException("maxBacklog must be positive");
        this.name = name;
        this.link = link;
        this.minDelayMs = Math.max(0, minDelayMs);
        this.maxBacklog = maxBacklog;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "Dispatch-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    // ---- Producer side ----

    /** Queue a message, split at 400 characters. Always accepted, even while muted. */
    public void enqueue(String destination, String text, OutboundMessage.Kind kind) {
        for (OutboundMessage m : OutboundMessage.split(destination, text, kind)) {
            enqueue(m);
        }
    }

    public void enqueue(OutboundMessage message) {
        synchronized (queue) {
            if (queue.size() >= maxBacklog) {
                queue.pollFirst();
                totalOverflow.incrementAndGet();
            }
            queue.addLast(message);
        }
        totalEnqueued.incrementAndGet();
    }

    /**
     * Drop everything queued regardless of mute level.
     *
     * @return number of messages dropped
     */
    public int clear() {
        int n;
        synchronized (queue) {
            n = queue.size();
            queue.clear();
        }
        LOG.info("[DispatchQueue] " + name + ": cleared " + n + " messages");
        return n;
    }

    public void setMuteLevel(MuteLevel level) {
        this.muteLevel = level;
    }

    public MuteLevel getMuteLevel() { return muteLevel; }

    // ---- Delivery ----

    /**
     * Schedule {@link #flushDeliver()} on the dispatch thread. Returns at once;
     * requests made while a flush is pending are merged into it.
     */
    public void requestFlush() {
        if (flushPending.compareAndSet(false, true)) {
            try {
                dispatcher.execute(() -> {
                    flushPending.set(false);
                    flushDeliver();
                });
            } catch (RejectedExecutionException e) {
                flushPending.set(false);
                LOG.fine(() -> "[DispatchQueue] " + name + ": flush after shutdown ignored");
            }
        }
    }

    /**
     * Deliver queued messages in order until the queue is empty, dropping the
     * ones the mute level suppresses. Waits between deliveries as needed.
     * Blocks the caller; normally only the dispatch thread calls this.
     *
     * @return number of messages handed to the link
     */
    public int flushDeliver() {
        int sent = 0;
        synchronized (flushLock) {
            while (true) {
                OutboundMessage m;
                synchronized (queue) {
                    m = queue.pollFirst();
                }
                if (m == null) break;
                if (muteLevel.suppresses(m.kind())) {
                    totalSuppressed.incrementAndGet();
                    continue;
                }
                if (!awaitGap()) {
                    synchronized (queue) {
                        queue.addFirst(m);
                    }
                    break;
                }
                try {
                    link.sendLine(m);
                    totalDelivered.incrementAndGet();
                    sent++;
                } catch (IOException e) {
                    totalFailed.incrementAndGet();
                    LOG.warning("[DispatchQueue] " + name + ": send to " + m.destination()
                        + " failed, message dropped: " + e.getMessage());
                }
                lastDeliveryNanos = System.nanoTime();
                delivered = true;
            }
        }
        return sent;
    }

    /** Sleep until {@code minDelayMs} has passed since the last delivery. False if interrupted. */
    private boolean awaitGap() {
        if (!delivered || minDelayMs == 0) return true;
        long waitNs = TimeUnit.MILLISECONDS.toNanos(minDelayMs) - (System.nanoTime() - lastDeliveryNanos);
        if (waitNs <= 0) return true;
        try {
            TimeUnit.NANOSECONDS.sleep(waitNs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void shutdown() {
        dispatcher.shutdownNow();
    }

    // ---- Stats ----

    public int size() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public String getName() { return name; }
    public long getTotalEnqueued() { return totalEnqueued.get(); }
    public long getTotalDelivered() { return totalDelivered.get(); }
    public long getTotalSuppressed() { return totalSuppressed.get(); }
    public long getTotalOverflow() { return totalOverflow.get(); }
    public long getTotalFailed() { return totalFailed.get(); }
}
