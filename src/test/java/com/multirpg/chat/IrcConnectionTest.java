package com.multirpg.chat;

import com.multirpg.core.NetworkConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IrcConnectionTest {

    /** Records every callback as one readable string. */
    static class RecordingEvents implements InboundEvents {
        final List<String> calls = new ArrayList<>();

        @Override public void join() { calls.add("join"); }
        @Override public void disconnected() { calls.add("disconnected"); }
        @Override public void channelMember(Sender s) { calls.add("member " + s.userhost()); }
        @Override public void channelListEnd() { calls.add("end of list"); }
        @Override public void privateMessage(Sender s, String text) { calls.add("pm " + s.nick() + " " + text); }
        @Override public void channelMessage(Sender s, String text) { calls.add("chan " + s.nick() + " " + text); }
        @Override public void nickChanged(String oldNick, String newNick) { calls.add("nick " + oldNick + " " + newNick); }
        @Override public void parted(Sender s) { calls.add("part " + s.nick()); }
        @Override public void quit(Sender s) { calls.add("quit " + s.nick()); }
        @Override public void kicked(String targetNick) { calls.add("kick " + targetNick); }
    }

    private RecordingEvents events;
    private IrcConnection conn;

    @BeforeEach
    void setUp() {
        events = new RecordingEvents();
        NetworkConfig net = new NetworkConfig("net1", "irc.example.net", 6667, "#rpg", "RPGBot",
            false, null, null);
        conn = new IrcConnection(net, events);
    }

    @Test
    void privateAndChannelMessagesAreToldApart() throws IOException {
        conn.handleLine(":alice!a@h PRIVMSG RPGBot :login Alice pw");
        conn.handleLine(":alice!a@h PRIVMSG #RPG :hi all");
        conn.handleLine(":alice!a@h NOTICE #rpg :psst");
        conn.handleLine(":alice!a@h PRIVMSG #other :elsewhere");

        assertEquals(List.of("pm alice login Alice pw", "chan alice hi all", "chan alice psst"), events.calls);
    }

    @Test
    void membershipChangesAreForwarded() throws IOException {
        conn.handleLine(":alice!a@h NICK :alice_");
        conn.handleLine(":bob!b@h PART #rpg :bye");
        conn.handleLine(":bob!b@h PART #other");
        conn.handleLine(":carol!c@h QUIT :gone");
        conn.handleLine(":op!o@h KICK #rpg dave :out");

        assertEquals(List.of("nick alice alice_", "part bob", "quit carol", "kick dave"), events.calls);
    }

    @Test
    void ownActionsAreNotPlayerEvents() throws IOException {
        conn.handleLine(":RPGBot!bot@h PRIVMSG #rpg :echo");
        conn.handleLine(":RPGBot!bot@h NICK :RPGBot2");

        assertTrue(events.calls.isEmpty());
        assertEquals("RPGBot2", conn.getCurrentNick());
    }

    @Test
    void ownJoinIsReportedAndAsksForTheMemberList() {
        // the WHO that follows the join has no socket to go to
        IOException e = assertThrows(IOException.class, () -> conn.handleLine(":RPGBot!bot@h JOIN #rpg"));

        assertTrue(e.getMessage().contains("net1"));
        assertEquals(List.of("join"), events.calls);
    }

    @Test
    void whoRepliesBecomeChannelMembers() throws IOException {
        conn.handleLine(":irc.example.net 352 RPGBot #rpg ali home.example irc.example.net alice H :0 Alice");
        conn.handleLine(":irc.example.net 352 RPGBot #rpg bot bot.example irc.example.net RPGBot H :0 Bot");
        conn.handleLine(":irc.example.net 352 RPGBot #other b b.example irc.example.net bob H :0 Bob");
        conn.handleLine(":irc.example.net 315 RPGBot #other :End of /WHO list.");
        conn.handleLine(":irc.example.net 315 RPGBot #rpg :End of /WHO list.");

        assertEquals(List.of("member alice!ali@home.example", "end of list"), events.calls);
    }

    @Test
    void nickInUseAppendsAnUnderscore() {
        assertThrows(IOException.class, () -> conn.handleLine(":irc.example.net 433 * RPGBot :in use"));
        assertEquals("RPGBot_", conn.getCurrentNick());
    }

    @Test
    void writingWithoutAConnectionFails() {
        assertFalse(conn.isConnected());
        IOException e = assertThrows(IOException.class,
            () -> conn.sendLine(new OutboundMessage("#rpg", "hello", OutboundMessage.Kind.CHANNEL)));
        assertTrue(e.getMessage().contains("net1"));
    }

    @Test
    void outboundLinesUseTheRightVerb() {
        assertEquals("PRIVMSG #rpg :hi", new OutboundMessage("#rpg", "hi", OutboundMessage.Kind.CHANNEL).toLine());
        assertEquals("NOTICE bob :hi", new OutboundMessage("bob", "hi", OutboundMessage.Kind.NOTICE).toLine());
    }
}
