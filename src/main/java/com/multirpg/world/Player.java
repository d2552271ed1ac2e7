package com.multirpg.world;

import com.multirpg.sim.Alignment;
import com.multirpg.sim.PenaltyKind;
import org.joml.Vector2i;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A player record: identity, session, progression, position and equipment.
 * <p>
 * Thread safety: none. Instances are only touched while the {@link PlayerStore}
 * lock is held; everything outside the lock sees {@link PlayerView} copies.
 */
public class Player {

    /** Map grid size; positions are clamped to [0, size). */
    public static final int MAP_WIDTH = 500;
    public static final int MAP_HEIGHT = 500;

    // ---- Identity ----
    private final long id;
    private String username;
    private final String network;
    private String passwordHash;
    private boolean admin;
    private String characterClass;
    private Alignment alignment = Alignment.NEUTRAL;

    // ---- Session ----
    private boolean online;
    private String currentNick;
    private String channel;
    private String userhost;
    private long onlineSince;   // epoch seconds, 0 when never online
    /** Went offline because the bot lost its channel; a channel listing may resume the session. */
    private boolean resumable;

    // ---- Progression ----
    private int level;
    private long ttl;
    private long nextTtl;
    private long idled;
    private final Map<PenaltyKind, Long> penalties = new EnumMap<>(PenaltyKind.class);

    // ---- Map ----
    private final Vector2i position = new Vector2i();

    // ---- Equipment ----
    private final Map<ItemSlot, Item> items = new EnumMap<>(ItemSlot.class);

    // ---- Timestamps (epoch seconds) ----
    private final long createdAt;
    private long lastLogin;

    /** Changed since the last durable copy was taken. */
    private boolean dirty = true;

    public Player(long id, String username, String network, String passwordHash,
                  String characterClass, long createdAt) {
        this.id = id;
        this.username = username;
        this.network = network;
        this.passwordHash = passwordHash;
        this.characterClass = characterClass;
        this.createdAt = createdAt;
        this.lastLogin = createdAt;
    }

    // --- Identity ---

    public long getId() { return id; }
    public String getUsername() { return username; }
    void setUsername(String username) { this.username = username; touch(); }
    public String getNetwork() { return network; }
    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String hash) { this.passwordHash = hash; touch(); }
    public boolean isAdmin() { return admin; }
    public void setAdmin(boolean admin) { this.admin = admin; touch(); }
    public String getCharacterClass() { return characterClass; }
    public void setCharacterClass(String characterClass) { this.characterClass = characterClass; touch(); }
    public Alignment getAlignment() { return alignment; }
    public void setAlignment(Alignment alignment) {
        this.alignment = alignment != null ? alignment : Alignment.NEUTRAL;
        touch();
    }

    /** "username@network", the form used in every channel-visible message. */
    public String tag() { return username + "@" + network; }

    /** {@link #tag()} plus map position, used in battle messages. */
    public String tagWithPosition() {
        return tag() + " [" + position.x + "/" + position.y + "]";
    }

    // --- Durable copy bookkeeping ---

    private void touch() { this.dirty = true; }

    /** Return the dirty flag and clear it. */
    boolean takeDirty() {
        boolean d = dirty;
        dirty = false;
        return d;
    }

    /** Session fields and timestamps when loading from the record store. */
    void restoreSession(String channel, String userhost, long onlineSince, long lastLogin) {
        this.channel = channel;
        this.userhost = userhost;
        this.onlineSince = onlineSince;
        this.lastLogin = lastLogin;
    }

    /** Progression fields when loading from the record store. */
    void restoreProgress(int level, long ttl, long nextTtl, long idled) {
        this.level = Math.max(0, level);
        this.ttl = Math.max(0, ttl);
        this.nextTtl = Math.max(0, nextTtl);
        this.idled = Math.max(0, idled);
    }

    // --- Session ---

    public boolean isOnline() { return online; }
    public String getCurrentNick() { return currentNick; }
    public String getChannel() { return channel; }
    public String getUserhost() { return userhost; }
    public long getOnlineSince() { return onlineSince; }
    public boolean isResumable() { return resumable; }
    public long getCreatedAt() { return createdAt; }
    public long getLastLogin() { return lastLogin; }

    /**
     * Mark online. All three session fields must be present: an online player
     * always has a nick, a channel and an origin address.
     */
    void goOnline(String nick, String channel, String userhost, long now) {
        if (nick == null || channel == null || userhost == null) {
            throw new IllegalArgumentException("online session needs nick, channel and address");
        }
        this.online = true;
        this.currentNick = nick;
        this.channel = channel;
        this.userhost = userhost;
        this.onlineSince = now;
        this.lastLogin = now;
        this.resumable = false;
        touch();
    }

    void goOffline() {
        this.online = false;
        this.currentNick = null;
        this.resumable = false;
        touch();
    }

    /** Offline, but the saved address may bring the session back. Not persisted. */
    void suspend() {
        goOffline();
        this.resumable = true;
    }

    void forgetSession() { this.resumable = false; }

    /** Nick change while online. */
    public void setCurrentNick(String nick) {
        if (online && nick == null) throw new IllegalArgumentException("online player needs a nick");
        this.currentNick = nick;
        touch();
    }

    // --- Progression ---

    public int getLevel() { return level; }
    public long getTtl() { return ttl; }
    public long getNextTtl() { return nextTtl; }
    public long getIdled() { return idled; }

    /** Level only moves up; a lower value is ignored. */
    public void setLevel(int level) {
        if (level > this.level) this.level = level;
        touch();
    }

    public void setTtl(long ttl) { this.ttl = Math.max(0, ttl); touch(); }
    public void setNextTtl(long nextTtl) { this.nextTtl = Math.max(0, nextTtl); touch(); }

    /** Seconds idled while online. */
    public void addIdled(long seconds) { this.idled += Math.max(0, seconds); touch(); }

    /** Move the countdown toward the next level; never below zero. */
    public void reduceTtl(long seconds) {
        this.ttl = Math.max(0, ttl - seconds);
        touch();
    }

    /** Add time to the countdown without booking it to a penalty counter. */
    public void addTime(long seconds) {
        this.ttl += Math.max(0, seconds);
        touch();
    }

    /** Add a penalty: the countdown grows and the matching counter is booked. */
    public void addPenalty(PenaltyKind kind, long seconds) {
        long s = Math.max(0, seconds);
        this.ttl += s;
        penalties.merge(kind, s, Long::sum);
        touch();
    }

    public long getPenalty(PenaltyKind kind) {
        return penalties.getOrDefault(kind, 0L);
    }

    /** Restore a counter when loading from the record store. */
    void restorePenalty(PenaltyKind kind, long seconds) {
        penalties.put(kind, Math.max(0, seconds));
    }

    /** Percentage of the current level already idled away, 0-100. */
    public int progressPercent() {
        if (nextTtl <= 0) return 0;
        long done = Math.max(0, nextTtl - ttl);
        return (int) Math.min(100, done * 100 / nextTtl);
    }

    // --- Map ---

    public int getX() { return position.x; }
    public int getY() { return position.y; }

    /** Move to a cell, clamped to the map. */
    public void moveTo(int x, int y) {
        position.set(clamp(x, MAP_WIDTH), clamp(y, MAP_HEIGHT));
        touch();
    }

    /** Same grid cell as {@code other}. */
    public boolean sharesCellWith(Player other) {
        return position.equals(other.position);
    }

    private static int clamp(int v, int size) {
        return Math.max(0, Math.min(size - 1, v));
    }

    // --- Equipment ---

    public Item getItem(ItemSlot slot) { return items.get(slot); }

    public int getItemLevel(ItemSlot slot) {
        Item item = items.get(slot);
        return item != null ? item.level() : 0;
    }

    /** Put an item in its slot, replacing whatever was there. */
    public void equip(Item item) {
        items.put(item.slot(), item);
        touch();
    }

    /** Add an item when loading; a second item for one slot is rejected. */
    void restoreItem(Item item) throws ConstraintViolationException {
        if (items.containsKey(item.slot())) {
            throw new ConstraintViolationException(
                "Player " + id + " already has an item in slot " + item.slot().label());
        }
        items.put(item.slot(), item);
    }

    public List<Item> copyItems() { return new ArrayList<>(items.values()); }

    /** Sum of all item levels. */
    public int itemSum() {
        int sum = 0;
        for (Item item : items.values()) sum += item.level();
        return sum;
    }
}
