package com.multirpg.chat;

/**
 * Who sent an inbound event.
 *
 * @param nick     current nick on the network
 * @param userhost full {@code nick!user@host} origin; the nick when the server gave none
 */
public record Sender(String nick, String userhost) {

    public Sender {
        if (nick == null || nick.isEmpty()) throw new IllegalArgumentException("nick required");
        if (userhost == null || userhost.isEmpty()) userhost = nick;
    }

    public static Sender of(String nick) {
        return new Sender(nick, nick);
    }
}
