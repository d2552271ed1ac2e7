package com.multirpg.save;

import com.multirpg.sim.PenaltyKind;
import com.multirpg.world.ConstraintViolationException;
import com.multirpg.world.Item;
import com.multirpg.world.ItemSlot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SQLite-backed record store.
 *
 * Layout:
 *   players: surrogate id, username unique without regard to case
 *   items:   one row per (player, slot), cascades with its player
 *   events:  append-only, player ids kept as plain informational columns
 */
public final class SqliteRecordStore implements RecordStore {

    private static final Logger LOG = Logger.getLogger(SqliteRecordStore.class.getName());

    /** Penalty counter columns, in {@link PenaltyKind} order. */
    private static final Map<PenaltyKind, String> PENALTY_COLUMNS = new EnumMap<>(PenaltyKind.class);
    static {
        PENALTY_COLUMNS.put(PenaltyKind.MESSAGE, "pen_mesg");
        PENALTY_COLUMNS.put(PenaltyKind.NICK, "pen_nick");
        PENALTY_COLUMNS.put(PenaltyKind.PART, "pen_part");
        PENALTY_COLUMNS.put(PenaltyKind.QUIT, "pen_quit");
        PENALTY_COLUMNS.put(PenaltyKind.LOGOUT, "pen_logout");
        PENALTY_COLUMNS.put(PenaltyKind.KICK, "pen_kick");
        PENALTY_COLUMNS.put(PenaltyKind.QUEST, "pen_quest");
    }

    private final Connection conn;

    public SqliteRecordStore(Path dbPath) throws StoreException {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            this.conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            initPragmas(conn);
            createSchema(conn);
            LOG.info("[SqliteRecordStore] Opened " + dbPath);
        } catch (Exception e) {
            throw new StoreException("Failed to open record store at " + dbPath, e);
        }
    }

    private static void initPragmas(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL");
            s.execute("PRAGMA synchronous=NORMAL");
            s.execute("PRAGMA foreign_keys=ON");
            s.execute("PRAGMA busy_timeout=5000");
        }
    }

    private static void createSchema(Connection c) throws SQLException {
        StringBuilder slots = new StringBuilder();
        for (ItemSlot slot : ItemSlot.values()) {
            if (slots.length() > 0) slots.append(',');
            slots.append('\'').append(slot.label()).append('\'');
        }
        try (Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS players (
                  id            INTEGER PRIMARY KEY,
                  username      TEXT    NOT NULL COLLATE NOCASE UNIQUE,
                  network       TEXT    NOT NULL,
                  password_hash TEXT    NOT NULL,
                  is_admin      INTEGER NOT NULL DEFAULT 0,
                  is_online     INTEGER NOT NULL DEFAULT 0,
                  current_nick  TEXT,
                  channel       TEXT,
                  userhost      TEXT,
                  level         INTEGER NOT NULL DEFAULT 0,
                  ttl           INTEGER NOT NULL DEFAULT 600,
                  next_ttl      INTEGER NOT NULL DEFAULT 600,
                  pos_x         INTEGER NOT NULL DEFAULT 0,
                  pos_y         INTEGER NOT NULL DEFAULT 0,
                  alignment     TEXT    NOT NULL DEFAULT 'n',
                  class         TEXT    NOT NULL,
                  pen_mesg      INTEGER NOT NULL DEFAULT 0,
                  pen_nick      INTEGER NOT NULL DEFAULT 0,
                  pen_part      INTEGER NOT NULL DEFAULT 0,
                  pen_kick      INTEGER NOT NULL DEFAULT 0,
                  pen_quit      INTEGER NOT NULL DEFAULT 0,
                  pen_quest     INTEGER NOT NULL DEFAULT 0,
                  pen_logout    INTEGER NOT NULL DEFAULT 0,
                  idled         INTEGER NOT NULL DEFAULT 0,
                  online_since  INTEGER NOT NULL DEFAULT 0,
                  created_at    INTEGER NOT NULL,
                  last_login    INTEGER NOT NULL
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS items (
                  id        INTEGER PRIMARY KEY AUTOINCREMENT,
                  player_id INTEGER NOT NULL REFERENCES players(id) ON DELETE CASCADE,
                  slot      TEXT    NOT NULL CHECK (slot IN (%s)),
                  level     INTEGER NOT NULL DEFAULT 0,
                  name      TEXT,
                  is_unique INTEGER NOT NULL DEFAULT 0,
                  UNIQUE (player_id, slot)
                )
            """.formatted(slots));
            s.execute("""
                CREATE TABLE IF NOT EXISTS events (
                  id         INTEGER PRIMARY KEY,
                  event_type TEXT    NOT NULL,
                  message    TEXT    NOT NULL,
                  player1_id INTEGER,
                  player2_id INTEGER,
                  created_at INTEGER NOT NULL
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_players_online ON players(is_online)");
            s.execute("CREATE INDEX IF NOT EXISTS idx_events_time ON events(created_at DESC)");
        }
    }

    // ---------- Reads ----------

    @Override
    public synchronized List<PlayerRecord> loadPlayers() throws StoreException {
        Map<Long, List<Item>> itemsByPlayer = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                 "SELECT player_id, slot, level, name, is_unique FROM items")) {
            while (rs.next()) {
                ItemSlot slot = ItemSlot.fromLabel(rs.getString("slot"));
                Item item = new Item(slot, rs.getInt("level"), rs.getString("name"),
                    rs.getInt("is_unique") != 0);
                itemsByPlayer.computeIfAbsent(rs.getLong("player_id"), k -> new ArrayList<>()).add(item);
            }
        } catch (SQLException | ConstraintViolationException e) {
            throw new StoreException("Failed to read items", e);
        }

        List<PlayerRecord> out = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT * FROM players ORDER BY id")) {
            while (rs.next()) {
                long id = rs.getLong("id");
                Map<PenaltyKind, Long> pens = new EnumMap<>(PenaltyKind.class);
                for (var e : PENALTY_COLUMNS.entrySet()) {
                    pens.put(e.getKey(), rs.getLong(e.getValue()));
                }
                out.add(new PlayerRecord(
                    id,
                    rs.getString("username"),
                    rs.getString("network"),
                    rs.getString("password_hash"),
                    rs.getInt("is_admin") != 0,
                    rs.getInt("is_online") != 0,
                    rs.getString("current_nick"),
                    rs.getString("channel"),
                    rs.getString("userhost"),
                    rs.getInt("level"),
                    rs.getLong("ttl"),
                    rs.getLong("next_ttl"),
                    rs.getInt("pos_x"),
                    rs.getInt("pos_y"),
                    rs.getString("alignment"),
                    rs.getString("class"),
                    pens,
                    rs.getLong("idled"),
                    rs.getLong("online_since"),
                    rs.getLong("created_at"),
                    rs.getLong("last_login"),
                    itemsByPlayer.getOrDefault(id, List.of())
                ));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read players", e);
        }
        return out;
    }

    @Override
    public synchronized List<EventRecord> recentEvents(int limit) throws StoreException {
        List<EventRecord> out = new ArrayList<>(limit);
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM events ORDER BY id DESC LIMIT ?")) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EventRecord(
                        rs.getLong("id"),
                        rs.getString("event_type"),
                        rs.getString("message"),
                        nullableLong(rs, "player1_id"),
                        nullableLong(rs, "player2_id"),
                        rs.getLong("created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read events", e);
        }
        return out;
    }

    @Override
    public synchronized long maxEventId() throws StoreException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(id), 0) FROM events")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to read max event id", e);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    // ---------- Writes ----------

    @Override
    public synchronized void savePlayer(PlayerRecord r) throws StoreException {
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO players(id, username, network, password_hash, is_admin, is_online,
                    current_nick, channel, userhost, level, ttl, next_ttl, pos_x, pos_y,
                    alignment, class, pen_mesg, pen_nick, pen_part, pen_kick, pen_quit,
                    pen_quest, pen_logout, idled, online_since, created_at, last_login)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET
                    username=excluded.username, password_hash=excluded.password_hash,
                    is_admin=excluded.is_admin, is_online=excluded.is_online,
                    current_nick=excluded.current_nick, channel=excluded.channel,
                    userhost=excluded.userhost, level=excluded.level, ttl=excluded.ttl,
                    next_ttl=excluded.next_ttl, pos_x=excluded.pos_x, pos_y=excluded.pos_y,
                    alignment=excluded.alignment, class=excluded.class,
                    pen_mesg=excluded.pen_mesg, pen_nick=excluded.pen_nick,
                    pen_part=excluded.pen_part, pen_kick=excluded.pen_kick,
                    pen_quit=excluded.pen_quit, pen_quest=excluded.pen_quest,
                    pen_logout=excluded.pen_logout, idled=excluded.idled,
                    online_since=excluded.online_since, last_login=excluded.last_login
            """)) {
                int i = 1;
                ps.setLong(i++, r.id());
                ps.setString(i++, r.username());
                ps.setString(i++, r.network());
                ps.setString(i++, r.passwordHash());
                ps.setInt(i++, r.admin() ? 1 : 0);
                ps.setInt(i++, r.online() ? 1 : 0);
                ps.setString(i++, r.currentNick());
                ps.setString(i++, r.channel());
                ps.setString(i++, r.userhost());
                ps.setInt(i++, r.level());
                ps.setLong(i++, r.ttl());
                ps.setLong(i++, r.nextTtl());
                ps.setInt(i++, r.posX());
                ps.setInt(i++, r.posY());
                ps.setString(i++, r.alignment());
                ps.setString(i++, r.characterClass());
                ps.setLong(i++, r.penalty(PenaltyKind.MESSAGE));
                ps.setLong(i++, r.penalty(PenaltyKind.NICK));
                ps.setLong(i++, r.penalty(PenaltyKind.PART));
                ps.setLong(i++, r.penalty(PenaltyKind.KICK));
                ps.setLong(i++, r.penalty(PenaltyKind.QUIT));
                ps.setLong(i++, r.penalty(PenaltyKind.QUEST));
                ps.setLong(i++, r.penalty(PenaltyKind.LOGOUT));
                ps.setLong(i++, r.idled());
                ps.setLong(i++, r.onlineSince());
                ps.setLong(i++, r.createdAt());
                ps.setLong(i, r.lastLogin());
                ps.executeUpdate();
            }
            try (PreparedStatement del = conn.prepareStatement("DELETE FROM items WHERE player_id=?")) {
                del.setLong(1, r.id());
                del.executeUpdate();
            }
            try (PreparedStatement ins = conn.prepareStatement(
                    "INSERT INTO items(player_id, slot, level, name, is_unique) VALUES (?,?,?,?,?)")) {
                for (Item item : r.items()) {
                    ins.setLong(1, r.id());
                    ins.setString(2, item.slot().label());
                    ins.setInt(3, item.level());
                    ins.setString(4, item.name());
                    ins.setInt(5, item.unique() ? 1 : 0);
                    ins.addBatch();
                }
                ins.executeBatch();
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            throw new StoreException("Failed to save player " + r.id(), e);
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public synchronized void deletePlayer(long playerId) throws StoreException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM players WHERE id=?")) {
            ps.setLong(1, playerId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to delete player " + playerId, e);
        }
    }

    @Override
    public synchronized void appendEvent(EventRecord ev) throws StoreException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO events(id, event_type, message, player1_id, player2_id, created_at)"
                    + " VALUES (?,?,?,?,?,?)")) {
            ps.setLong(1, ev.id());
            ps.setString(2, ev.kind());
            ps.setString(3, ev.message());
            if (ev.player1Id() != null) ps.setLong(4, ev.player1Id()); else ps.setNull(4, Types.INTEGER);
            if (ev.player2Id() != null) ps.setLong(5, ev.player2Id()); else ps.setNull(5, Types.INTEGER);
            ps.setLong(6, ev.createdAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to append event " + ev.id(), e);
        }
    }

    private void rollbackQuietly() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warning("[SqliteRecordStore] Rollback failed: " + e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warning("[SqliteRecordStore] Could not restore auto-commit: " + e.getMessage());
        }
    }

    @Override
    public synchronized void close() throws StoreException {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new StoreException("Failed to close record store", e);
        }
    }
}
