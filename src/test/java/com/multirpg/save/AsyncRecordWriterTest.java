package com.multirpg.save;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncRecordWriterTest {

    private MemoryRecordStore store;
    private AsyncRecordWriter writer;

    @BeforeEach
    void setUp() {
        store = new MemoryRecordStore();
        writer = new AsyncRecordWriter(store, 5);
    }

    @AfterEach
    void tearDown() {
        writer.shutdown();
    }

    private static PlayerRecord player(long id, int level) {
        return new PlayerRecord(id, "p" + id, "net1", "hash", false, false, null, null, null,
            level, 600, 600, 0, 0, "n", "Tester", Map.of(), 0, 0, 1000, 1000, List.of());
    }

    private static EventRecord event(long id) {
        return new EventRecord(id, "calamity", "event " + id, null, null, id);
    }

    @Test
    void latestSaveWins() {
        for (int level = 1; level <= 200; level++) writer.enqueueSave(player(1, level));

        assertTrue(writer.flushSync(5, TimeUnit.SECONDS));
        assertEquals(200, store.player(1).level());
        assertTrue(store.getSaveCalls() <= 200);
        assertEquals(200, store.getSaveCalls() + writer.getPlayersMerged());
    }

    @Test
    void deleteAfterSaveLeavesNothing() {
        writer.enqueueSave(player(1, 1));
        writer.enqueueDelete(1);

        assertTrue(writer.flushSync(5, TimeUnit.SECONDS));
        assertNull(store.player(1));
    }

    @Test
    void failedWritesAreRetried() {
        store.failNext(2);
        writer.enqueueSave(player(1, 4));

        assertTrue(writer.flushSync(5, TimeUnit.SECONDS));
        assertEquals(4, store.player(1).level());
        assertEquals(2, writer.getWriteFailures());
    }

    @Test
    void eventsKeepTheirOrderAcrossFailures() {
        store.failNext(1);
        for (long id = 1; id <= 5; id++) writer.enqueueEvent(event(id));

        assertTrue(writer.flushSync(5, TimeUnit.SECONDS));
        List<Long> ids = new ArrayList<>();
        for (EventRecord ev : store.events()) ids.add(ev.id());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), ids);
        assertEquals(5, writer.getEventsWritten());
    }

    @Test
    void shutdownWritesWhatIsStillQueued() {
        for (long id = 1; id <= 20; id++) writer.enqueueSave(player(id, 1));
        writer.enqueueEvent(event(1));

        writer.shutdown();

        assertEquals(20, store.playerCount());
        assertEquals(1, store.events().size());
        assertEquals(0, writer.getPendingCount());
    }
}
