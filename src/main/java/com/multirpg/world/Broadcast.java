package com.multirpg.world;

/**
 * An outbound message produced by game logic, routed to dispatch queues once
 * the player table lock is released.
 *
 * @param scope   who receives it
 * @param network target network for NETWORK, NOTICE and PRIVATE; null for ALL
 * @param nick    target nick for NOTICE and PRIVATE; null otherwise
 * @param text    message text, unsplit
 */
public record Broadcast(Scope scope, String network, String nick, String text) {

    public enum Scope {
        /** Every network's channel. */
        ALL,
        /** One network's channel. */
        NETWORK,
        /** NOTICE to one nick on one network. */
        NOTICE,
        /** PRIVMSG to one nick on one network (command replies). */
        PRIVATE
    }

    public Broadcast {
        if (scope == null || text == null) throw new IllegalArgumentException("scope and text required");
        if (scope != Scope.ALL && network == null) throw new IllegalArgumentException(scope + " needs a network");
        if ((scope == Scope.NOTICE || scope == Scope.PRIVATE) && nick == null) {
            throw new IllegalArgumentException(scope + " needs a nick");
        }
    }

    public static Broadcast all(String text) {
        return new Broadcast(Scope.ALL, null, null, text);
    }

    public static Broadcast network(String network, String text) {
        return new Broadcast(Scope.NETWORK, network, null, text);
    }

    public static Broadcast notice(String network, String nick, String text) {
        return new Broadcast(Scope.NOTICE, network, nick, text);
    }

    public static Broadcast reply(String network, String nick, String text) {
        return new Broadcast(Scope.PRIVATE, network, nick, text);
    }
}
