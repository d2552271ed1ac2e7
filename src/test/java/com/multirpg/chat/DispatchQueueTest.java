package com.multirpg.chat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchQueueTest {

    private RecordingLink link;
    private DispatchQueue queue;

    @BeforeEach
    void setUp() {
        link = new RecordingLink();
        queue = new DispatchQueue("test", link, 0, 5);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    void deliversInQueueOrder() {
        queue.enqueue("#chan", "one", OutboundMessage.Kind.CHANNEL);
        queue.enqueue("bob", "two", OutboundMessage.Kind.PRIVATE);
        queue.enqueue("bob", "three", OutboundMessage.Kind.NOTICE);

        assertEquals(3, queue.flushDeliver());
        assertEquals(List.of("one", "two", "three"), link.texts());
        assertEquals(0, queue.size());
    }

    @Test
    void clearDropsEverythingEvenWhenUnmuted() {
        queue.enqueue("#chan", "a", OutboundMessage.Kind.CHANNEL);
        queue.enqueue("#chan", "b", OutboundMessage.Kind.CHANNEL);

        assertEquals(2, queue.clear());
        assertEquals(0, queue.flushDeliver());
        assertTrue(link.sent().isEmpty());
    }

    @Test
    void channelMuteDropsOnlyChannelMessages() {
        queue.setMuteLevel(MuteLevel.CHANNEL_SUPPRESSED);
        queue.enqueue("#chan", "public", OutboundMessage.Kind.CHANNEL);
        queue.enqueue("bob", "reply", OutboundMessage.Kind.PRIVATE);

        queue.flushDeliver();

        assertEquals(List.of("reply"), link.texts());
        assertEquals(1, queue.getTotalSuppressed());
    }

    @Test
    void privateMuteDropsRepliesAndNotices() {
        queue.setMuteLevel(MuteLevel.PRIVATE_SUPPRESSED);
        queue.enqueue("bob", "reply", OutboundMessage.Kind.PRIVATE);
        queue.enqueue("bob", "notice", OutboundMessage.Kind.NOTICE);
        queue.enqueue("#chan", "public", OutboundMessage.Kind.CHANNEL);

        queue.flushDeliver();

        assertEquals(List.of("public"), link.texts());
    }

    @Test
    void mutedMessagesAreNotRequeuedAfterUnmute() {
        queue.setMuteLevel(MuteLevel.ALL_SUPPRESSED);
        queue.enqueue("#chan", "lost", OutboundMessage.Kind.CHANNEL);
        assertEquals(0, queue.flushDeliver());

        queue.setMuteLevel(MuteLevel.ALL_ENABLED);
        assertEquals(0, queue.flushDeliver());
        assertTrue(link.sent().isEmpty());
    }

    @Test
    void overflowDropsTheOldestMessage() {
        for (int i = 1; i <= 7; i++) {
            queue.enqueue("#chan", "m" + i, OutboundMessage.Kind.CHANNEL);
        }

        assertEquals(5, queue.size());
        assertEquals(2, queue.getTotalOverflow());
        queue.flushDeliver();
        assertEquals(List.of("m3", "m4", "m5", "m6", "m7"), link.texts());
    }

    @Test
    void longTextIsSplitAtASpaceBeforeFourHundredChars() {
        String text = "x".repeat(390) + " " + "y".repeat(50);
        queue.enqueue("#chan", text, OutboundMessage.Kind.CHANNEL);

        queue.flushDeliver();

        List<String> texts = link.texts();
        assertEquals(2, texts.size());
        assertEquals("x".repeat(390), texts.get(0));
        assertEquals("y".repeat(50), texts.get(1));
    }

    @Test
    void failedSendIsCountedAndTheRestStillGoOut() {
        link.failNext(1);
        queue.enqueue("#chan", "first", OutboundMessage.Kind.CHANNEL);
        queue.enqueue("#chan", "second", OutboundMessage.Kind.CHANNEL);

        assertEquals(1, queue.flushDeliver());
        assertEquals(List.of("second"), link.texts());
        assertEquals(1, queue.getTotalFailed());
    }

    @Test
    void keepsTheMinimumGapBetweenDeliveries() {
        DispatchQueue slow = new DispatchQueue("slow", link, 50, 10);
        try {
            slow.enqueue("#chan", "a", OutboundMessage.Kind.CHANNEL);
            slow.enqueue("#chan", "b", OutboundMessage.Kind.CHANNEL);
            slow.enqueue("#chan", "c", OutboundMessage.Kind.CHANNEL);
            long start = System.nanoTime();
            slow.flushDeliver();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            assertTrue(elapsedMs >= 90, "took " + elapsedMs + "ms");
        } finally {
            slow.shutdown();
        }
    }
}
