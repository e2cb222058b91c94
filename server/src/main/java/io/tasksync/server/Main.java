// file: server/src/main/java/io/tasksync/server/Main.java
package io.tasksync.server;

import io.tasksync.storage.H2SyncStorage;
import io.tasksync.storage.InMemorySyncStorage;
import io.tasksync.storage.PostgresSyncStorage;
import io.tasksync.storage.SyncStorage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a tasksync server.
 *
 * Responsibilities:
 *  - Load logging configuration.
 *  - Parse configuration from CLI and environment.
 *  - Open the configured storage backend.
 *  - Create SyncService and WebServer, start listening.
 *  - Close listeners and storage on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();

        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerConfig.usage());
            System.exit(1);
            return;
        }

        // ------ Storage layer -------
        SyncStorage storage = openStorage(cfg);

        // ------ Protocol engine + HTTP layer ------
        WebServer web = start(cfg, storage);
        for (ListenAddress address : cfg.listen()) {
            log.info(() -> "Serving on http://" + address + " (storage=" + cfg.storage().name().toLowerCase() + ")");
        }

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                storage.close();
            }
        }, "tasksync-shutdown"));
    }

    /**
     * Wire the sync service and web server over an open storage and start listening.
     * If the listeners cannot start (e.g. port in use), storage is closed before the error propagates.
     */
    static WebServer start(ServerConfig cfg, SyncStorage storage) {
        try {
            var sync = new SyncService(storage, cfg.clientPolicy(), cfg.snapshotPolicy(), cfg.retention());
            var web = new WebServer(cfg.listen(), sync, cfg.maxBodyBytes());
            web.start();
            return web;
        } catch (RuntimeException e) {
            try {
                storage.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    static SyncStorage openStorage(ServerConfig cfg) {
        return switch (cfg.storage()) {
            case MEMORY -> new InMemorySyncStorage();
            case H2 -> H2SyncStorage.open(Path.of(cfg.dataDir()));
            case POSTGRES -> {
                PostgresSyncStorage pg = PostgresSyncStorage.connect(cfg.connection(), cfg.dbUser(), cfg.dbPassword());
                if (cfg.initSchema()) {
                    pg.initSchema();
                }
                yield pg;
            }
        };
    }

    /** Load logging.properties from the classpath unless the JVM was given its own config. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "could not load logging.properties, using JVM defaults", e);
        }
    }
}
