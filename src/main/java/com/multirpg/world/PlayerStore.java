package com.multirpg.world;

import com.multirpg.math.GameRandom;
import com.multirpg.save.AsyncRecordWriter;
import com.multirpg.save.EventRecord;
import com.multirpg.save.PlayerRecord;
import com.multirpg.save.RecordStore;
import com.multirpg.save.StoreException;
import com.multirpg.sim.Alignment;
import com.multirpg.sim.PenaltyCalculator;
import com.multirpg.sim.PenaltyKind;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Authoritative in-memory table of players, the tail of the event log and the
 * {@link WorldState}.
 * <p>
 * Every mutation, from a chat connection or from the world clock, runs inside
 * {@link #transact} under one lock. Changed players, deletes and events are
 * handed to the durable writer before the lock is released, so the writer sees
 * them in commit order; enqueueing never waits on I/O. The collected
 * broadcasts go to the router after the lock is released.
 */
public class PlayerStore {

    private static final Logger LOG = Logger.getLogger(PlayerStore.class.getName());

    /** Events kept in memory for the dashboard. */
    public static final int RECENT_EVENTS = 50;

    /** A transaction body. May fail with a gameplay error. */
    @FunctionalInterface
    public interface Transaction<T> {
        T run(StoreTx tx) throws GameException;
    }

    /** A single-player mutation. */
    @FunctionalInterface
    public interface Delta {
        void apply(Player player, StoreTx tx) throws GameException;
    }

    private final ReentrantLock lock = new ReentrantLock();

    // ---- Guarded by lock ----
    private final Long2ObjectOpenHashMap<Player> players = new Long2ObjectOpenHashMap<>();
    private final Map<String, Player> byName = new HashMap<>();
    private final ArrayDeque<EventRecord> recentEvents = new ArrayDeque<>();
    private long nextPlayerId = 1;
    private long nextEventId = 1;

    private final WorldState world;
    private final GameRandom random;
    private final Clock clock;
    private final PasswordHasher hasher;
    private final Set<String> configuredAdmins = new HashSet<>();

    private volatile AsyncRecordWriter writer;
    private volatile Consumer<List<Broadcast>> broadcastSink = b -> { };

    public PlayerStore(WorldState world, GameRandom random, Clock clock, PasswordHasher hasher) {
        this.world = world;
        this.random = random;
        this.clock = clock;
        this.hasher = hasher;
    }

    // ---- Wiring ----

    public void setWriter(AsyncRecordWriter writer) { this.writer = writer; }

    /** Receives every transaction's broadcasts after the lock is released. */
    public void setBroadcastSink(Consumer<List<Broadcast>> sink) {
        this.broadcastSink = sink != null ? sink : b -> { };
    }

    /** Usernames that get the admin flag on registration or login. */
    public void setConfiguredAdmins(Collection<String> names) {
        lock.lock();
        try {
            configuredAdmins.clear();
            for (String n : names) configuredAdmins.add(n.toLowerCase(Locale.ROOT));
        } finally {
            lock.unlock();
        }
    }

    public PasswordHasher hasher() { return hasher; }

    public long now() { return clock.instant().getEpochSecond(); }

    // ---- Transactions ----

    /**
     * Run {@code body} under the table lock. Changes are queued for the durable
     * writer before the lock is released and broadcasts are routed after it,
     * also when the body fails.
     */
    public <T> T transact(Transaction<T> body) throws GameException {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("nested transaction");
        }
        StoreTx tx = new StoreTx(this, now());
        lock.lock();
        try {
            return body.run(tx);
        } finally {
            try {
                queueWrites(tx);
            } finally {
                lock.unlock();
            }
            routeBroadcasts(tx);
        }
    }

    /** {@link #transact} for bodies that cannot fail, such as the tick pass. */
    public void mutate(Consumer<StoreTx> body) {
        try {
            transact(tx -> {
                body.accept(tx);
                return null;
            });
        } catch (GameException e) {
            throw new IllegalStateException("unexpected gameplay error", e);
        }
    }

    /** Mutate one player. Fails with {@link NotFoundException} when the id is gone. */
    public void applyDelta(long playerId, Delta delta) throws GameException {
        transact(tx -> {
            delta.apply(tx.require(playerId), tx);
            return null;
        });
    }

    // ---- Account operations ----

    /**
     * Create an account. The name is checked world-wide without regard to case.
     * The password is hashed before the lock is taken.
     */
    public PlayerView create(String username, String network, String password,
                             String characterClass) throws GameException {
        String hash = hasher.hash(password);
        return transact(tx -> PlayerView.of(tx.createPlayer(username, network, hash, characterClass)));
    }

    /**
     * Check a name and password. The stored hash is read under the lock and
     * verified outside it.
     */
    public PlayerView authenticate(String username, String password) throws GameException {
        Credentials found = transact(tx -> {
            Player p = tx.findByName(username);
            return p == null ? null : new Credentials(PlayerView.of(p), p.getPasswordHash());
        });
        if (found == null || !hasher.verify(password, found.hash())) {
            throw new InvalidCredentialsException("Wrong username or password.");
        }
        return found.view();
    }

    private record Credentials(PlayerView view, String hash) {
    }

    public void setOnline(long playerId, String nick, String channel, String address) throws GameException {
        applyDelta(playerId, (p, tx) -> tx.setOnline(p, nick, channel, address));
    }

    public void setOffline(long playerId) throws GameException {
        applyDelta(playerId, (p, tx) -> tx.setOffline(p));
    }

    public void delete(long playerId) throws GameException {
        applyDelta(playerId, (p, tx) -> tx.delete(p));
    }

    public void rename(long playerId, String newName) throws GameException {
        applyDelta(playerId, (p, tx) -> tx.rename(p, newName));
    }

    /** Consistent copy of the whole world. Holds the lock only while copying. */
    public WorldSnapshot snapshot() {
        lock.lock();
        try {
            List<Player> ranked = allPlayers();
            ranked.sort(StoreTx.RANKING);
            List<PlayerView> all = new ArrayList<>(ranked.size());
            List<PlayerView> online = new ArrayList<>();
            for (Player p : ranked) {
                PlayerView v = PlayerView.of(p);
                all.add(v);
                if (p.isOnline()) online.add(v);
            }
            List<EventRecord> events = new ArrayList<>(recentEvents);
            return new WorldSnapshot(now(), all, online, questView(), world.isPaused(),
                world.getMuteLevel(), events);
        } finally {
            lock.unlock();
        }
    }

    private WorldSnapshot.QuestView questView() {
        QuestState q = world.getQuest();
        if (!q.isActive()) return null;
        List<String> names = new ArrayList<>();
        for (long id : q.getQuesterIds()) {
            Player p = players.get(id);
            if (p != null) names.add(p.tag());
        }
        List<Integer> waypoints = q.getType() == QuestState.Type.GRID
            ? List.of(q.firstX(), q.firstY(), q.secondX(), q.secondY())
            : List.of();
        return new WorldSnapshot.QuestView(q.getType(), q.getText(), names,
            q.getType() == QuestState.Type.TIME ? q.getDeadline() : 0, q.getStage(), waypoints);
    }

    // ---- Startup ----

    /**
     * Replace the table with the durable store's contents. Everyone comes back
     * offline; players who were online stay resumable until their network's
     * first channel listing.
     */
    public void load(RecordStore source) throws StoreException {
        List<PlayerRecord> records = source.loadPlayers();
        List<EventRecord> events = source.recentEvents(RECENT_EVENTS);
        long maxEventId = source.maxEventId();
        List<PlayerRecord> wentOffline;
        lock.lock();
        try {
            players.clear();
            byName.clear();
            recentEvents.clear();
            long maxId = 0;
            for (PlayerRecord r : records) {
                Player p = restore(r);
                players.put(p.getId(), p);
                byName.put(key(p.getUsername()), p);
                maxId = Math.max(maxId, p.getId());
            }
            nextPlayerId = maxId + 1;
            nextEventId = maxEventId + 1;
            for (EventRecord ev : events) recentEvents.addLast(ev);
            wentOffline = collectChanged();
            AsyncRecordWriter w = writer;
            if (w != null) wentOffline.forEach(w::enqueueSave);
        } finally {
            lock.unlock();
        }
        LOG.info("[PlayerStore] Loaded " + records.size() + " players, "
            + wentOffline.size() + " marked offline, next event id " + nextEventId);
    }

    private static Player restore(PlayerRecord r) throws StoreException {
        Player p = new Player(r.id(), r.username(), r.network(), r.passwordHash(),
            r.characterClass(), r.createdAt());
        p.setAdmin(r.admin());
        p.setAlignment(Alignment.fromCode(r.alignment()));
        p.restoreProgress(r.level(), r.ttl(), r.nextTtl(), r.idled());
        p.restoreSession(r.channel(), r.userhost(), r.onlineSince(), r.lastLogin());
        p.moveTo(r.posX(), r.posY());
        for (PenaltyKind kind : PenaltyKind.values()) {
            p.restorePenalty(kind, r.penalty(kind));
        }
        try {
            for (Item item : r.items()) p.restoreItem(item);
        } catch (ConstraintViolationException e) {
            throw new StoreException("Corrupt item rows for player " + r.id(), e);
        }
        p.takeDirty();
        if (r.online()) p.suspend();
        return p;
    }

    // ---- Package-private table access (lock held) ----

    GameRandom random() { return random; }

    WorldState world() { return world; }

    Player byId(long id) { return players.get(id); }

    Player byName(String username) {
        return username == null ? null : byName.get(key(username));
    }

    /** Copy of all players in id order. */
    List<Player> allPlayers() {
        List<Player> out = new ArrayList<>(players.values());
        out.sort(Comparator.comparingLong(Player::getId));
        return out;
    }

    boolean isConfiguredAdmin(String username) {
        return configuredAdmins.contains(key(username));
    }

    Player insert(String username, String network, String passwordHash,
                  String characterClass, long now) throws DuplicateNameException {
        if (byName.containsKey(key(username))) {
            throw new DuplicateNameException("Sorry, the name " + username + " is already taken.");
        }
        Player p = new Player(nextPlayerId++, username, network, passwordHash, characterClass, now);
        int base = PenaltyCalculator.baseTtl(0);
        p.setTtl(base);
        p.setNextTtl(base);
        p.moveTo(random.nextInt(Player.MAP_WIDTH), random.nextInt(Player.MAP_HEIGHT));
        if (isConfiguredAdmin(username)) p.setAdmin(true);
        players.put(p.getId(), p);
        byName.put(key(username), p);
        return p;
    }

    void rename(Player p, String newName) throws DuplicateNameException {
        Player holder = byName.get(key(newName));
        if (holder != null && holder != p) {
            throw new DuplicateNameException("The name " + newName + " is already taken.");
        }
        byName.remove(key(p.getUsername()));
        p.setUsername(newName);
        byName.put(key(newName), p);
    }

    void remove(Player p) {
        players.remove(p.getId());
        byName.remove(key(p.getUsername()));
    }

    EventRecord appendEvent(EventKind kind, String message, Long p1, Long p2, long now) {
        EventRecord ev = new EventRecord(nextEventId++, kind.code(), message, p1, p2, now);
        recentEvents.addFirst(ev);
        while (recentEvents.size() > RECENT_EVENTS) recentEvents.removeLast();
        return ev;
    }

    private List<PlayerRecord> collectChanged() {
        List<PlayerRecord> out = new ArrayList<>();
        for (Player p : players.values()) {
            if (p.takeDirty()) out.add(toRecord(p));
        }
        return out;
    }

    /** Lock held. A later commit's jobs can never overtake an earlier one's. */
    private void queueWrites(StoreTx tx) {
        List<PlayerRecord> changed = collectChanged();
        AsyncRecordWriter w = writer;
        if (w == null) return;
        for (long id : tx.deleted()) w.enqueueDelete(id);
        for (PlayerRecord r : changed) w.enqueueSave(r);
        for (EventRecord ev : tx.events()) w.enqueueEvent(ev);
    }

    private void routeBroadcasts(StoreTx tx) {
        List<Broadcast> out = tx.broadcasts();
        if (!out.isEmpty()) broadcastSink.accept(out);
    }

    static PlayerRecord toRecord(Player p) {
        Map<PenaltyKind, Long> pens = new EnumMap<>(PenaltyKind.class);
        for (PenaltyKind kind : PenaltyKind.values()) pens.put(kind, p.getPenalty(kind));
        return new PlayerRecord(
            p.getId(), p.getUsername(), p.getNetwork(), p.getPasswordHash(), p.isAdmin(),
            p.isOnline(), p.getCurrentNick(), p.getChannel(), p.getUserhost(),
            p.getLevel(), p.getTtl(), p.getNextTtl(), p.getX(), p.getY(),
            String.valueOf(p.getAlignment().code()), p.getCharacterClass(), pens,
            p.getIdled(), p.getOnlineSince(), p.getCreatedAt(), p.getLastLogin(),
            p.copyItems());
    }

    private static String key(String username) {
        return username.toLowerCase(Locale.ROOT);
    }
}
