package com.multirpg.world;

import com.multirpg.math.GameRandom;
import com.multirpg.save.EventRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The view of the player table handed to one transaction body. Only valid
 * while the body runs; every method assumes the table lock is held.
 * <p>
 * Bodies validate before they mutate: a {@link GameException} thrown halfway
 * leaves earlier mutations in place.
 */
public final class StoreTx {

    /** Level descending, then countdown ascending. */
    public static final Comparator<Player> RANKING =
        Comparator.comparingInt(Player::getLevel).reversed()
            .thenComparingLong(Player::getTtl)
            .thenComparingLong(Player::getId);

    private final PlayerStore store;
    private final long now;
    private final List<Broadcast> broadcasts = new ArrayList<>();
    private final List<EventRecord> events = new ArrayList<>();
    private final List<Long> deleted = new ArrayList<>();

    StoreTx(PlayerStore store, long now) {
        this.store = store;
        this.now = now;
    }

    /** Epoch seconds, fixed for the whole transaction. */
    public long now() { return now; }

    public GameRandom random() { return store.random(); }

    public WorldState world() { return store.world(); }

    // ---- Lookup ----

    public Player find(long id) { return store.byId(id); }

    public Player require(long id) throws NotFoundException {
        Player p = store.byId(id);
        if (p == null) throw new NotFoundException("No such player.");
        return p;
    }

    /** Case-insensitive lookup by username, world-wide. */
    public Player findByName(String username) { return store.byName(username); }

    public Player requireByName(String username) throws NotFoundException {
        Player p = store.byName(username);
        if (p == null) throw new NotFoundException("No such username " + username + ".");
        return p;
    }

    /** The online player using {@code nick} on {@code network}, or null. */
    public Player findOnline(String network, String nick) {
        if (nick == null) return null;
        for (Player p : store.allPlayers()) {
            if (p.isOnline() && p.getNetwork().equals(network) && nick.equalsIgnoreCase(p.getCurrentNick())) {
                return p;
            }
        }
        return null;
    }

    /** Online players of one network in id order. */
    public List<Player> onlinePlayers(String network) {
        List<Player> out = new ArrayList<>();
        for (Player p : store.allPlayers()) {
            if (p.isOnline() && p.getNetwork().equals(network)) out.add(p);
        }
        return out;
    }

    /** Suspended players of one network in id order. */
    public List<Player> resumablePlayers(String network) {
        List<Player> out = new ArrayList<>();
        for (Player p : store.allPlayers()) {
            if (p.isResumable() && p.getNetwork().equals(network)) out.add(p);
        }
        return out;
    }

    /** Online players in id order. */
    public List<Player> onlinePlayers() {
        List<Player> out = new ArrayList<>();
        for (Player p : store.allPlayers()) {
            if (p.isOnline()) out.add(p);
        }
        return out;
    }

    /** Every player in id order. */
    public List<Player> allPlayers() { return store.allPlayers(); }

    /** Every player, best first. */
    public List<Player> ranked() {
        List<Player> out = store.allPlayers();
        out.sort(RANKING);
        return out;
    }

    // ---- Mutation ----

    public Player createPlayer(String username, String network, String passwordHash,
                               String characterClass) throws DuplicateNameException {
        return store.insert(username, network, passwordHash, characterClass, now);
    }

    public void setOnline(Player p, String nick, String channel, String address) {
        p.goOnline(nick, channel, address, now);
    }

    public void setOffline(Player p) {
        p.goOffline();
    }

    /** Offline until a channel listing shows the same address again. */
    public void suspend(Player p) {
        p.suspend();
    }

    /** Drop a suspended session for good. */
    public void forgetSession(Player p) {
        p.forgetSession();
    }

    public void rename(Player p, String newName) throws DuplicateNameException {
        store.rename(p, newName);
    }

    /** Remove the player and its items. Events that mention it stay. */
    public void delete(Player p) {
        store.remove(p);
        deleted.add(p.getId());
    }

    public boolean isConfiguredAdmin(String username) {
        return store.isConfiguredAdmin(username);
    }

    // ---- Output ----

    /** Append to the event log. */
    public EventRecord logEvent(EventKind kind, String message, Long player1, Long player2) {
        EventRecord ev = store.appendEvent(kind, message, player1, player2, now);
        events.add(ev);
        return ev;
    }

    /** An event that involves no single player, such as a team battle. */
    public EventRecord logEvent(EventKind kind, String message) {
        return logEvent(kind, message, (Long) null, null);
    }

    public EventRecord logEvent(EventKind kind, String message, Player p) {
        return logEvent(kind, message, p.getId(), null);
    }

    public EventRecord logEvent(EventKind kind, String message, Player p1, Player p2) {
        return logEvent(kind, message, p1.getId(), p2.getId());
    }

    /** Queue a message for routing once the lock is released. */
    public void broadcast(Broadcast b) { broadcasts.add(b); }

    public void broadcastAll(String text) { broadcasts.add(Broadcast.all(text)); }

    public List<Broadcast> broadcasts() { return List.copyOf(broadcasts); }

    List<EventRecord> events() { return events; }

    List<Long> deleted() { return deleted; }
}
