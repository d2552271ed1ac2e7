package com.multirpg.chat;

import com.multirpg.sim.PenaltyKind;
import com.multirpg.world.PlayerView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.multirpg.chat.ChatHarness.CHANNEL;
import static com.multirpg.chat.ChatHarness.texts;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminCommandHandlerTest {

    private ChatHarness h;

    @BeforeEach
    void setUp() {
        h = new ChatHarness("Root");
        h.register("Root");
        h.register("bob");
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void nonAdminsAreRefusedAndNothingChanges() {
        h.pm("bob", "PUSH bob 300");
        h.pm("bob", "PAUSE");
        h.pm("bob", "MKADMIN bob");

        assertEquals(List.of("Access denied.", "Access denied.", "Access denied."), h.replies("bob"));
        assertEquals(600, h.player("bob").ttl());
        assertFalse(h.player("bob").admin());
        assertFalse(h.store.snapshot().paused());
    }

    @Test
    void pushTakesAtMostTheRemainingCountdown() {
        h.store.mutate(tx -> tx.findByName("bob").setTtl(5000));

        h.pm("Root", "PUSH bob 1400");
        List<OutboundMessage> out = h.flush();
        assertEquals(List.of("Done."), texts(out, "Root", OutboundMessage.Kind.PRIVATE));
        assertEquals(List.of("Root pushed bob@net1 0 days, 00:23:20 toward level 1. Next level in 0 days, 01:00:00."),
            texts(out, CHANNEL, OutboundMessage.Kind.CHANNEL));
        assertEquals(3600, h.player("bob").ttl());

        h.pm("Root", "PUSH bob 5000");
        out = h.flush();
        assertEquals(List.of("Root pushed bob@net1 0 days, 01:00:00 toward level 1. Next level in 0 days, 00:00:00."),
            texts(out, CHANNEL, OutboundMessage.Kind.CHANNEL));
        assertEquals(0, h.player("bob").ttl());
    }

    @Test
    void pushValidatesItsArguments() {
        h.pm("Root", "PUSH bob");
        h.pm("Root", "PUSH bob lots");
        h.pm("Root", "PUSH nobody 10");

        assertEquals(List.of(
            "Usage: PUSH <username> <seconds>",
            "Usage: PUSH <username> <seconds>",
            "No such username nobody."), h.replies("Root"));
    }

    @Test
    void negativePushAddsTimeWithinBounds() {
        h.pm("Root", "PUSH bob -100");
        h.pm("Root", "PUSH bob -9223372036854775808");
        h.pm("Root", "PUSH bob -" + (AdminCommandHandler.MAX_PUSH_BACK + 1));

        List<String> replies = h.replies("Root");
        assertEquals("Done.", replies.get(0));
        assertEquals(List.of("PUSH can add at most 315360000 seconds.", "PUSH can add at most 315360000 seconds."),
            replies.subList(1, 3));
        assertEquals(700, h.player("bob").ttl());
        assertEquals(0, h.player("bob").level());
    }

    @Test
    void pauseToggles() {
        h.pm("Root", "PAUSE");
        assertEquals(List.of("Game PAUSED: tick loop suspended."), h.replies("Root"));
        assertTrue(h.store.snapshot().paused());

        h.pm("Root", "pause");
        assertEquals(List.of("Game RESUMED: tick loop running."), h.replies("Root"));
        assertFalse(h.store.snapshot().paused());
    }

    @Test
    void silentTwoMutesRepliesButNotTheChannel() {
        h.pm("Root", "SILENT 2");
        h.pm("Root", "WHOAMI");
        h.store.mutate(tx -> tx.broadcastAll("public news"));

        List<OutboundMessage> out = h.flush();
        assertTrue(texts(out, "Root", OutboundMessage.Kind.PRIVATE).isEmpty());
        assertEquals(List.of("public news"), texts(out, CHANNEL, OutboundMessage.Kind.CHANNEL));
        assertEquals(MuteLevel.PRIVATE_SUPPRESSED, h.queue.getMuteLevel());
        assertEquals(2, h.store.snapshot().muteLevel());

        h.pm("Root", "SILENT 0");
        assertEquals(List.of("Silent mode 0: all messages enabled."), h.replies("Root"));
    }

    @Test
    void channelTalkUnderSilentTwoStillCostsTimeButTheNoticeIsDropped() throws Exception {
        h.pm("Root", "SILENT 2");
        h.flush();

        h.session.channelMessage(Sender.of("bob"), "hello there");

        assertTrue(texts(h.flush(), "bob", OutboundMessage.Kind.NOTICE).isEmpty());
        assertEquals(611, h.player("bob").ttl());
        long talked = h.store.transact(tx -> tx.findByName("bob").getPenalty(PenaltyKind.MESSAGE));
        assertEquals(11, talked);
    }

    @Test
    void silentRejectsLevelsOutsideZeroToThree() {
        h.pm("Root", "SILENT 4");
        h.pm("Root", "SILENT loud");

        List<String> replies = h.replies("Root");
        assertEquals(2, replies.size());
        assertTrue(replies.get(0).startsWith("Usage: SILENT <0|1|2|3>"));
        assertEquals(MuteLevel.ALL_ENABLED, h.queue.getMuteLevel());
    }

    @Test
    void clearqReportsTheDroppedCount() {
        h.pm("Root", "CLEARQ");
        List<String> replies = h.replies("Root");
        assertEquals(1, replies.size());
        assertTrue(replies.get(0).matches("Send queue cleared \\(\\d+ messages dropped\\)\\."), replies.get(0));
    }

    @Test
    void chuserRenamesButNeverOntoATakenName() {
        h.pm("Root", "CHUSER bob root");
        assertEquals(List.of("The name root is already taken."), h.replies("Root"));

        h.pm("Root", "CHUSER bob #bob");
        assertEquals(List.of("Character names may not begin with #."), h.replies("Root"));

        h.pm("Root", "CHUSER bob Bobby");
        assertEquals(List.of("Username changed from bob to Bobby."), h.replies("Root"));
        assertNull(h.player("bob"));
        assertNotNull(h.player("Bobby"));
    }

    @Test
    void chpassAndChclass() throws Exception {
        h.pm("Root", "CHPASS bob newpw");
        h.pm("Root", "CHCLASS bob Lord of Ducks");

        assertEquals(List.of("Password for bob changed.", "Class for bob changed to Lord of Ducks."),
            h.replies("Root"));
        assertEquals("Lord of Ducks", h.player("bob").characterClass());
        assertEquals(h.player("bob").id(), h.store.authenticate("bob", "newpw").id());
    }

    @Test
    void delRemovesAnAccount() {
        h.pm("Root", "DEL bob");
        assertEquals(List.of("Account bob removed."), h.replies("Root"));
        assertNull(h.player("bob"));

        h.pm("bob", "WHOAMI");
        assertEquals(List.of("You are not logged in."), h.replies("bob"));
    }

    @Test
    void deloldOnlyRemovesOfflineAccountsPastTheCutoff() throws Exception {
        h.store.create("stale", ChatHarness.NETWORK, "pw", "Ghost");
        h.clock.advance(3 * 86_400);
        h.store.create("recent", ChatHarness.NETWORK, "pw", "Ghost");

        h.pm("Root", "DELOLD 2");

        assertEquals(List.of("1 accounts removed."), h.replies("Root"));
        assertNull(h.player("stale"));
        assertNotNull(h.player("recent"));
        assertNotNull(h.player("bob"));

        h.pm("Root", "DELOLD -1");
        assertEquals(List.of("Usage: DELOLD <days>"), h.replies("Root"));
    }

    @Test
    void mkadminAndDeladmin() {
        h.pm("Root", "MKADMIN bob");
        assertEquals(List.of("bob is now an admin."), h.replies("Root"));

        h.pm("bob", "PAUSE");
        assertEquals(List.of("Game PAUSED: tick loop suspended."), h.replies("bob"));

        h.pm("Root", "DELADMIN bob");
        assertEquals(List.of("bob is no longer an admin."), h.replies("Root"));
        h.pm("bob", "PAUSE");
        assertEquals(List.of("Access denied."), h.replies("bob"));
    }

    @Test
    void handOfGodTouchesSomeoneOnline() {
        h.pm("Root", "HOG");

        assertTrue(h.replies("Root").isEmpty());
        assertEquals("hog", h.store.snapshot().events().get(0).kind());
        PlayerView root = h.player("Root");
        PlayerView bob = h.player("bob");
        assertTrue(root.ttl() != 600 || bob.ttl() != 600);
    }
}
