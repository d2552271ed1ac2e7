package com.multirpg;

import com.multirpg.core.GameConfig;
import com.multirpg.core.GameServer;
import com.multirpg.save.StoreException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for MultiRPG.
 * <p>
 * Usage:
 *   java -jar multirpg.jar                     # uses ./multirpg.properties
 *   java -jar multirpg.jar path/to/config      # explicit config file
 * <p>
 * A missing config file is created with defaults and the process exits so the
 * operator can edit it.
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        installLogging();
        System.out.println("MultiRPG starting...");

        Path configPath = Path.of(args.length > 0 ? args[0] : GameConfig.DEFAULT_FILE);
        GameConfig config;
        try {
            config = GameConfig.load(configPath);
            if (config == null) {
                GameConfig.writeDefault(configPath);
                System.out.println("Wrote default settings to " + configPath.toAbsolutePath()
                    + ". Edit it and start again.");
                System.exit(0);
                return;
            }
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "[Main] Cannot read " + configPath, e);
            System.exit(1);
            return;
        } catch (IllegalArgumentException e) {
            LOG.severe("[Main] Bad setting in " + configPath + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        GameServer server = new GameServer(config);
        try {
            server.start();
        } catch (StoreException e) {
            LOG.log(Level.SEVERE, "[Main] Record store unusable, refusing to start", e);
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            stopped.countDown();
        }, "Shutdown"));
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Use the bundled logging.properties unless one was given on the command line. */
    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
