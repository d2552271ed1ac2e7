package com.multirpg.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One parsed protocol line: {@code [:prefix] COMMAND param* [:trailing]}.
 * The trailing parameter, when present, is the last element of {@code params}.
 *
 * @param prefix  origin without the leading colon, or null
 * @param command upper-cased command or numeric
 */
public record IrcLine(String prefix, String command, List<String> params) {

    public IrcLine {
        params = List.copyOf(params);
    }

    /** Parse a line without its terminator. Null for blank input. */
    public static IrcLine parse(String raw) {
        if (raw == null) return null;
        String line = raw.strip();
        if (line.isEmpty()) return null;

        String prefix = null;
        int pos = 0;
        if (line.charAt(0) == ':') {
            int sp = line.indexOf(' ');
            if (sp < 0) return null;
            prefix = line.substring(1, sp);
            pos = skipSpaces(line, sp);
        }
        int end = line.indexOf(' ', pos);
        String command = (end < 0 ? line.substring(pos) : line.substring(pos, end)).toUpperCase(Locale.ROOT);
        List<String> params = new ArrayList<>();
        pos = end < 0 ? line.length() : skipSpaces(line, end);
        while (pos < line.length()) {
            if (line.charAt(pos) == ':') {
                params.add(line.substring(pos + 1));
                break;
            }
            end = line.indexOf(' ', pos);
            if (end < 0) {
                params.add(line.substring(pos));
                break;
            }
            params.add(line.substring(pos, end));
            pos = skipSpaces(line, end);
        }
        return new IrcLine(prefix, command, params);
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && s.charAt(i) == ' ') i++;
        return i;
    }

    /** Nick part of the prefix; the whole prefix for a server origin. */
    public String nick() {
        if (prefix == null) return null;
        int bang = prefix.indexOf('!');
        return bang < 0 ? prefix : prefix.substring(0, bang);
    }

    public Sender sender() {
        return new Sender(nick(), prefix);
    }

    /** Parameter {@code i}, or the empty string when absent. */
    public String param(int i) {
        return i < params.size() ? params.get(i) : "";
    }

    public String last() {
        return params.isEmpty() ? "" : params.get(params.size() - 1);
    }
}
