package com.multirpg.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Static settings, read once at startup from a key=value properties file.
 * Bad values fail with an {@link IllegalArgumentException} naming the key.
 */
public class GameConfig {

    public static final String DEFAULT_FILE = "multirpg.properties";

    static final String DEFAULT_CONTENT = """
        # MultiRPG settings. Edit and restart.

        # Seconds between world ticks
        game.self_clock=5
        # Cap on a single penalty in seconds, 0 = unlimited
        game.limit_pen=0
        # Usernames that get the admin flag when they register or log in
        game.admins=
        # Fixed random seed, leave empty for a random world
        game.seed=
        game.db_path=multirpg.db

        # Dashboard WebSocket
        web.host=0.0.0.0
        web.port=8080

        # Outbound flood control per connection
        dispatch.min_delay_ms=500
        dispatch.max_backlog=2000

        networks=example
        network.example.host=irc.example.net
        network.example.port=6667
        network.example.channel=#multirpg
        network.example.nick=MultiRPG
        network.example.use_ssl=false
        network.example.nickserv_pass=
        network.example.server_pass=
        """;

    private int selfClock = 5;
    private int limitPen = 0;
    private List<String> admins = List.of();
    private Long seed;
    private String dbPath = "multirpg.db";
    private String webHost = "0.0.0.0";
    private int webPort = 8080;
    private long dispatchMinDelayMs = 500;
    private int dispatchMaxBacklog = 2000;
    private List<NetworkConfig> networks = List.of();

    // --- Getters ---

    public int getSelfClock() { return selfClock; }
    public int getLimitPen() { return limitPen; }
    public List<String> getAdmins() { return admins; }
    /** Null when the world should pick its own seed. */
    public Long getSeed() { return seed; }
    public String getDbPath() { return dbPath; }
    public String getWebHost() { return webHost; }
    public int getWebPort() { return webPort; }
    public long getDispatchMinDelayMs() { return dispatchMinDelayMs; }
    public int getDispatchMaxBacklog() { return dispatchMaxBacklog; }
    public List<NetworkConfig> getNetworks() { return networks; }

    // --- Loading ---

    /**
     * Load settings from {@code file}. Returns null if the file doesn't exist.
     */
    public static GameConfig load(Path file) throws IOException {
        if (!Files.exists(file)) return null;
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        }
        return fromProperties(props);
    }

    /** Write the commented default file. */
    public static void writeDefault(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream os = Files.newOutputStream(file)) {
            os.write(DEFAULT_CONTENT.getBytes(StandardCharsets.ISO_8859_1));
        }
    }

    /** Settings the default file would produce. */
    public static GameConfig defaults() {
        Properties props = new Properties();
        try (Reader r = new StringReader(DEFAULT_CONTENT)) {
            props.load(r);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return fromProperties(props);
    }

    public static GameConfig fromProperties(Properties props) {
        GameConfig c = new GameConfig();
        c.selfClock = intValue(props, "game.self_clock", 5, 1, 86_400);
        c.limitPen = intValue(props, "game.limit_pen", 0, 0, Integer.MAX_VALUE);
        c.admins = list(props.getProperty("game.admins", ""));
        String seed = text(props, "game.seed");
        if (seed != null) {
            try {
                c.seed = Long.parseLong(seed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("game.seed is not a number: " + seed);
            }
        }
        c.dbPath = props.getProperty("game.db_path", "multirpg.db").strip();
        c.webHost = props.getProperty("web.host", "0.0.0.0").strip();
        c.webPort = intValue(props, "web.port", 8080, 0, 65_535);
        c.dispatchMinDelayMs = intValue(props, "dispatch.min_delay_ms", 500, 0, 60_000);
        c.dispatchMaxBacklog = intValue(props, "dispatch.max_backlog", 2000, 1, 1_000_000);

        List<NetworkConfig> nets = new ArrayList<>();
        for (String name : list(props.getProperty("networks", ""))) {
            String p = "network." + name + ".";
            nets.add(new NetworkConfig(
                name,
                required(props, p + "host"),
                intValue(props, p + "port", 6667, 1, 65_535),
                required(props, p + "channel"),
                required(props, p + "nick"),
                Boolean.parseBoolean(props.getProperty(p + "use_ssl", "false").strip()),
                text(props, p + "nickserv_pass"),
                text(props, p + "server_pass")));
        }
        c.networks = List.copyOf(nets);
        return c;
    }

    // --- Parsing helpers ---

    private static int intValue(Properties props, String key, int def, int min, int max) {
        String raw = text(props, key);
        if (raw == null) return def;
        int v;
        try {
            v = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw);
        }
        if (v < min || v > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + v);
        }
        return v;
    }

    private static String required(Properties props, String key) {
        String v = text(props, key);
        if (v == null) throw new IllegalArgumentException(key + " is required");
        return v;
    }

    /** Trimmed value, or null when missing or blank. */
    private static String text(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.strip();
        return v.isEmpty() ? null : v;
    }

    private static List<String> list(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String s = part.strip();
            if (!s.isEmpty()) out.add(s);
        }
        return List.copyOf(out);
    }
}
