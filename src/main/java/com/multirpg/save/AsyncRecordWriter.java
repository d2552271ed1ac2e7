package com.multirpg.save;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes player and event records to the {@link RecordStore} on a dedicated
 * background thread.
 *
 * Key features:
 * - Callers never block on the store (enqueue returns immediately)
 * - Coalescing: a player queued several times is written once, latest wins
 * - A delete replaces any pending save for the same player
 * - Events are written in the order they were appended
 * - A failed write is retried with a growing delay; gameplay never sees it
 *
 * Thread safety:
 * - enqueue methods are called from whichever thread released the player table
 * - the writer thread is the only caller of the record store after startup
 */
public class AsyncRecordWriter {

    private static final Logger LOG = Logger.getLogger(AsyncRecordWriter.class.getName());

    private static final long DEFAULT_INITIAL_BACKOFF_MS = 500;
    private static final long MAX_BACKOFF_MS = 30_000;

    private final RecordStore store;
    private final long initialBackoffMs;

    /** Pending player jobs: player id → latest job. */
    private final Long2ObjectOpenHashMap<PlayerJob> pendingPlayers = new Long2ObjectOpenHashMap<>();

    /** FIFO of player ids (insertion order of first enqueue). */
    private final LongArrayFIFOQueue keyQueue = new LongArrayFIFOQueue();

    /** Events waiting to be appended, oldest first. */
    private final ArrayDeque<EventRecord> pendingEvents = new ArrayDeque<>();

    /** Lock for pendingPlayers, keyQueue and pendingEvents. */
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition workAvailable = queueLock.newCondition();

    private final Thread writerThread;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /** Jobs taken off the queue and not yet written. */
    private int inFlight;

    // ---- Stats (lock-free) ----
    private final AtomicLong playersWritten = new AtomicLong(0);
    private final AtomicLong playersMerged = new AtomicLong(0);
    private final AtomicLong eventsWritten = new AtomicLong(0);
    private final AtomicLong writeFailures = new AtomicLong(0);

    public AsyncRecordWriter(RecordStore store) {
        this(store, DEFAULT_INITIAL_BACKOFF_MS);
    }

    public AsyncRecordWriter(RecordStore store, long initialBackoffMs) {
        this.store = store;
        this.initialBackoffMs = Math.max(1, initialBackoffMs);
        this.writerThread = new Thread(this::writerLoop, "AsyncRecordWriter");
        this.writerThread.setDaemon(true);
        this.writerThread.start();
    }

    /** Queue a player save. Replaces an older pending job for the same player. */
    public void enqueueSave(PlayerRecord record) {
        putPlayerJob(new PlayerJob(record.id(), record));
    }

    /** Queue a player delete. Cancels a pending save for the same player. */
    public void enqueueDelete(long playerId) {
        putPlayerJob(new PlayerJob(playerId, null));
    }

    /** Queue an event append. */
    public void enqueueEvent(EventRecord event) {
        queueLock.lock();
        try {
            pendingEvents.addLast(event);
            workAvailable.signal();
        } finally {
            queueLock.unlock();
        }
    }

    private void putPlayerJob(PlayerJob job) {
        queueLock.lock();
        try {
            PlayerJob existing = pendingPlayers.put(job.playerId, job);
            if (existing == null) {
                keyQueue.enqueue(job.playerId);
            } else {
                playersMerged.incrementAndGet();
            }
            workAvailable.signal();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Background writer loop. Player jobs first, then events, one at a time.
     */
    private void writerLoop() {
        long backoffMs = initialBackoffMs;
        while (!shutdown.get()) {
            PlayerJob playerJob = null;
            EventRecord event = null;

            queueLock.lock();
            try {
                while (keyQueue.isEmpty() && pendingEvents.isEmpty() && !shutdown.get()) {
                    workAvailable.await();
                }
                if (shutdown.get()) break;
                if (!keyQueue.isEmpty()) {
                    playerJob = pendingPlayers.remove(keyQueue.dequeueLong());
                } else {
                    event = pendingEvents.pollFirst();
                }
                if (playerJob != null || event != null) inFlight++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                queueLock.unlock();
            }

            boolean ok = true;
            if (playerJob != null) {
                ok = processPlayer(playerJob);
                if (!ok) requeue(playerJob);
            } else if (event != null) {
                ok = processEvent(event);
                if (!ok) requeue(event);
            }
            finishInFlight(playerJob != null || event != null);

            if (ok) {
                backoffMs = initialBackoffMs;
            } else {
                if (!sleepQuietly(backoffMs)) break;
                backoffMs = Math.min(MAX_BACKOFF_MS, backoffMs * 2);
            }
        }

        // On shutdown, one attempt at everything still queued
        flushRemaining();
    }

    private boolean processPlayer(PlayerJob job) {
        try {
            if (job.record == null) {
                store.deletePlayer(job.playerId);
            } else {
                store.savePlayer(job.record);
            }
            playersWritten.incrementAndGet();
            return true;
        } catch (StoreException e) {
            writeFailures.incrementAndGet();
            LOG.log(Level.WARNING, "[AsyncRecordWriter] Write of player " + job.playerId
                + " failed, will retry: " + e.getMessage(), e);
            return false;
        }
    }

    private boolean processEvent(EventRecord event) {
        try {
            store.appendEvent(event);
            eventsWritten.incrementAndGet();
            return true;
        } catch (StoreException e) {
            writeFailures.incrementAndGet();
            LOG.log(Level.WARNING, "[AsyncRecordWriter] Append of event " + event.id()
                + " failed, will retry: " + e.getMessage(), e);
            return false;
        }
    }

    /** Put a failed player job back unless a newer one arrived meanwhile. */
    private void requeue(PlayerJob job) {
        queueLock.lock();
        try {
            if (!pendingPlayers.containsKey(job.playerId)) {
                pendingPlayers.put(job.playerId, job);
                keyQueue.enqueue(job.playerId);
            }
        } finally {
            queueLock.unlock();
        }
    }

    private void requeue(EventRecord event) {
        queueLock.lock();
        try {
            pendingEvents.addFirst(event);
        } finally {
            queueLock.unlock();
        }
    }

    private void finishInFlight(boolean hadJob) {
        if (!hadJob) return;
        queueLock.lock();
        try {
            inFlight--;
        } finally {
            queueLock.unlock();
        }
    }

    private static boolean sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void flushRemaining() {
        queueLock.lock();
        try {
            while (!keyQueue.isEmpty()) {
                PlayerJob job = pendingPlayers.remove(keyQueue.dequeueLong());
                if (job != null) processPlayer(job);
            }
            EventRecord event;
            while ((event = pendingEvents.pollFirst()) != null) {
                processEvent(event);
            }
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Block until everything queued so far has been written, or the timeout
     * passes. Only for shutdown and tests, never during gameplay.
     *
     * @return true if the queue drained
     */
    public boolean flushSync(long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (getPendingCount() == 0) return true;
            if (!sleepQuietly(1)) return false;
        }
        return getPendingCount() == 0;
    }

    /**
     * Stop the writer thread and flush pending jobs.
     * Blocks until the remaining writes complete (up to 5 seconds).
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        queueLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            queueLock.unlock();
        }
        writerThread.interrupt();
        try {
            writerThread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("[AsyncRecordWriter] Stopped: " + playersWritten.get() + " player writes, "
            + eventsWritten.get() + " events, " + writeFailures.get() + " failures");
    }

    // ---- Stats getters ----

    /** Jobs queued or being written. */
    public int getPendingCount() {
        queueLock.lock();
        try {
            return pendingPlayers.size() + pendingEvents.size() + inFlight;
        } finally {
            queueLock.unlock();
        }
    }

    public long getPlayersWritten() { return playersWritten.get(); }
    public long getPlayersMerged() { return playersMerged.get(); }
    public long getEventsWritten() { return eventsWritten.get(); }
    public long getWriteFailures() { return writeFailures.get(); }

    /** A save (record set) or a delete (record null) for one player. */
    private record PlayerJob(long playerId, PlayerRecord record) {
    }
}
