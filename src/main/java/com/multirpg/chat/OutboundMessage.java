package com.multirpg.chat;

import java.util.ArrayList;
import java.util.List;

/**
 * One line waiting in a {@link DispatchQueue}.
 *
 * @param destination channel or nick
 * @param text        at most {@link #MAX_LENGTH} characters
 * @param kind        what the mute filter looks at
 */
public record OutboundMessage(String destination, String text, Kind kind) {

    /** Longest text sent in one line. */
    public static final int MAX_LENGTH = 400;

    public enum Kind {
        /** PRIVMSG to the channel. */
        CHANNEL,
        /** PRIVMSG to a nick. */
        PRIVATE,
        /** NOTICE to a nick. */
        NOTICE
    }

    public OutboundMessage {
        if (destination == null || text == null || kind == null) {
            throw new IllegalArgumentException("destination, text and kind required");
        }
    }

    /** Raw protocol line, without the line terminator. */
    public String toLine() {
        String verb = kind == Kind.NOTICE ? "NOTICE" : "PRIVMSG";
        return verb + " " + destination + " :" + text;
    }

    /**
     * Split {@code text} into messages of at most {@link #MAX_LENGTH} characters,
     * breaking at the last space before the limit when there is one.
     */
    public static List<OutboundMessage> split(String destination, String text, Kind kind) {
        List<OutboundMessage> out = new ArrayList<>();
        String rest = text;
        while (rest.length() > MAX_LENGTH) {
            int cut = rest.lastIndexOf(' ', MAX_LENGTH);
            if (cut <= 0) cut = MAX_LENGTH;
            out.add(new OutboundMessage(destination, rest.substring(0, cut), kind));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) out.add(new OutboundMessage(destination, rest, kind));
        return out;
    }
}
