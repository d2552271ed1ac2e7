package com.multirpg.chat;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class IrcLineTest {

    @Test
    void privmsgWithPrefixAndTrailing() {
        IrcLine line = IrcLine.parse(":alice!~a@host.example PRIVMSG MultiRPG :REGISTER Alice pw  Wizard");

        assertEquals("alice!~a@host.example", line.prefix());
        assertEquals("PRIVMSG", line.command());
        assertEquals(List.of("MultiRPG", "REGISTER Alice pw  Wizard"), line.params());
        assertEquals("alice", line.nick());
        assertEquals("REGISTER Alice pw  Wizard", line.last());
        assertEquals(new Sender("alice", "alice!~a@host.example"), line.sender());
    }

    @Test
    void commandIsUpperCasedAndServerPrefixIsItsOwnNick() {
        IrcLine line = IrcLine.parse(":irc.example.net 001 MultiRPG :Welcome");
        assertEquals("001", line.command());
        assertEquals("irc.example.net", line.nick());

        assertEquals("PING", IrcLine.parse("ping :token").command());
    }

    @Test
    void lineWithoutPrefixOrParams() {
        IrcLine line = IrcLine.parse("PING");
        assertNull(line.prefix());
        assertNull(line.nick());
        assertEquals(List.of(), line.params());
        assertEquals("", line.last());
        assertEquals("", line.param(3));
    }

    @Test
    void kickKeepsMiddleParams() {
        IrcLine line = IrcLine.parse(":op!o@h KICK #rpg bob :flooding");
        assertEquals("#rpg", line.param(0));
        assertEquals("bob", line.param(1));
        assertEquals("flooding", line.param(2));
    }

    @Test
    void emptyTrailingIsKept() {
        IrcLine line = IrcLine.parse(":bob!b@h PRIVMSG #rpg :");
        assertEquals(List.of("#rpg", ""), line.params());
    }

    @Test
    void blankInputIsIgnored() {
        assertNull(IrcLine.parse(null));
        assertNull(IrcLine.parse("   "));
        assertNull(IrcLine.parse(":prefixonly"));
    }
}
