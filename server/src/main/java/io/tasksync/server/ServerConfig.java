// file: server/src/main/java/io/tasksync/server/ServerConfig.java
package io.tasksync.server;

import io.tasksync.core.RetentionPolicy;
import io.tasksync.core.SnapshotPolicy;
import io.tasksync.core.VersionIds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Server configuration parsed from CLI args with environment-variable fallbacks.
 *
 * Supports:
 *  - listen:           host:port addresses for the HTTP listeners (at least one)
 *  - allowedClientIds: client id allow-list, or null to accept all clients
 *  - createClients:    create unknown clients on first contact
 *  - snapshotVersions: versions since the last snapshot before one is requested
 *  - snapshotDays:     snapshot age in days before a new one is requested
 *  - retention:        what happens to versions once a snapshot is accepted
 *  - storage:          backend kind (memory, h2, postgres)
 *  - dataDir:          directory of the H2 database
 *  - connection:       Postgres JDBC URL, plus optional dbUser/dbPassword
 *  - initSchema:       create the Postgres tables if missing
 *  - maxBodyBytes:     request body limit
 */
public record ServerConfig(
        List<ListenAddress> listen,
        Set<UUID> allowedClientIds,
        boolean createClients,
        int snapshotVersions,
        long snapshotDays,
        RetentionPolicy retention,
        StorageKind storage,
        String dataDir,
        String connection,
        String dbUser,
        String dbPassword,
        boolean initSchema,
        int maxBodyBytes
) {

    /** Storage backend selected with --storage / STORAGE. */
    public enum StorageKind {
        MEMORY, H2, POSTGRES;

        public static StorageKind parse(String text) {
            return switch (text.trim().toLowerCase()) {
                case "memory" -> MEMORY;
                case "h2" -> H2;
                case "postgres" -> POSTGRES;
                default -> throw new IllegalArgumentException("storage must be one of: memory, h2, postgres");
            };
        }
    }

    public ServerConfig {
        if (listen == null || listen.isEmpty()) {
            throw new IllegalArgumentException("at least one --listen address is required");
        }
        listen = List.copyOf(listen);
        allowedClientIds = allowedClientIds == null ? null : Set.copyOf(allowedClientIds);
        if (snapshotVersions <= 0) {
            throw new IllegalArgumentException("snapshot-versions must be > 0");
        }
        if (snapshotDays <= 0) {
            throw new IllegalArgumentException("snapshot-days must be > 0");
        }
        if (storage == StorageKind.POSTGRES && (connection == null || connection.isBlank())) {
            throw new IllegalArgumentException("--connection is required for postgres storage");
        }
        if (maxBodyBytes <= 0 || maxBodyBytes == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("max-body-bytes out of range");
        }
    }

    public ClientPolicy clientPolicy() {
        return new ClientPolicy(createClients, allowedClientIds);
    }

    public SnapshotPolicy snapshotPolicy() {
        return new SnapshotPolicy(snapshotVersions, snapshotDays);
    }

    public static ServerConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv());
    }

    /**
     * Small CLI parser. Flags win over environment variables.
     *
     * Supported flags:
     *   --listen, -l <host:port>           (env LISTEN, repeatable or comma-separated)
     *   --allow-client-id, -C <uuid>       (env CLIENT_ID, repeatable or comma-separated)
     *   --no-create-clients                (env CREATE_CLIENTS=false)
     *   --snapshot-versions <n>            (env SNAPSHOT_VERSIONS)
     *   --snapshot-days <n>                (env SNAPSHOT_DAYS)
     *   --retention <keep-all|prune-on-snapshot>  (env RETENTION)
     *   --storage <memory|h2|postgres>     (env STORAGE)
     *   --data-dir, -d <dir>               (env DATA_DIR)
     *   --connection, -c <jdbc url>        (env CONNECTION)
     *   --db-user <user>                   (env DB_USER)
     *   --db-password <password>           (env DB_PASSWORD)
     *   --init-schema
     *   --max-body-bytes <n>
     *   --help, -h
     *
     * @throws IllegalArgumentException on unknown options or invalid values
     */
    public static ServerConfig fromArgs(String[] args, Map<String, String> env) {
        // Defaults, then environment
        List<ListenAddress> listen = parseListen(env.get("LISTEN"));
        Set<UUID> allowed = parseClientIds(env.get("CLIENT_ID"));
        boolean createClients = env.containsKey("CREATE_CLIENTS") ? parseBool("CREATE_CLIENTS", env.get("CREATE_CLIENTS")) : true;
        int snapshotVersions = env.containsKey("SNAPSHOT_VERSIONS")
                ? parseInt("SNAPSHOT_VERSIONS", env.get("SNAPSHOT_VERSIONS"))
                : SnapshotPolicy.DEFAULT_SNAPSHOT_VERSIONS;
        long snapshotDays = env.containsKey("SNAPSHOT_DAYS")
                ? parseLong("SNAPSHOT_DAYS", env.get("SNAPSHOT_DAYS"))
                : SnapshotPolicy.DEFAULT_SNAPSHOT_DAYS;
        RetentionPolicy retention = env.containsKey("RETENTION")
                ? RetentionPolicy.parse(env.get("RETENTION"))
                : RetentionPolicy.KEEP_ALL;
        StorageKind storage = env.containsKey("STORAGE") ? StorageKind.parse(env.get("STORAGE")) : StorageKind.H2;
        String dataDir = env.getOrDefault("DATA_DIR", "./data");
        String connection = env.get("CONNECTION");
        String dbUser = env.get("DB_USER");
        String dbPassword = env.get("DB_PASSWORD");
        boolean initSchema = false;
        int maxBodyBytes = WebServer.DEFAULT_MAX_BODY_BYTES;

        // Repeatable flags replace the environment value as a whole
        List<ListenAddress> listenFlags = new ArrayList<>();
        Set<UUID> allowFlags = new LinkedHashSet<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--listen", "-l" -> listenFlags.addAll(parseListen(value(args, i++)));

                case "--allow-client-id", "-C" -> allowFlags.addAll(parseClientIds(value(args, i++)));

                case "--no-create-clients" -> createClients = false;

                case "--snapshot-versions" -> snapshotVersions = parseInt(args[i], value(args, i++));

                case "--snapshot-days" -> snapshotDays = parseLong(args[i], value(args, i++));

                case "--retention" -> retention = RetentionPolicy.parse(value(args, i++));

                case "--storage" -> storage = StorageKind.parse(value(args, i++));

                case "--data-dir", "-d" -> dataDir = value(args, i++);

                case "--connection", "-c" -> connection = value(args, i++);

                case "--db-user" -> dbUser = value(args, i++);

                case "--db-password" -> dbPassword = value(args, i++);

                case "--init-schema" -> initSchema = true;

                case "--max-body-bytes" -> maxBodyBytes = parseInt(args[i], value(args, i++));

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (!listenFlags.isEmpty()) listen = listenFlags;
        if (!allowFlags.isEmpty()) allowed = allowFlags;

        return new ServerConfig(
                listen,
                allowed,
                createClients,
                snapshotVersions,
                snapshotDays,
                retention,
                storage,
                dataDir,
                connection,
                dbUser,
                dbPassword,
                initSchema,
                maxBodyBytes
        );
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static List<ListenAddress> parseListen(String text) {
        List<ListenAddress> out = new ArrayList<>();
        if (text == null) return out;
        for (String part : text.split(",")) {
            if (!part.isBlank()) out.add(ListenAddress.parse(part));
        }
        return out;
    }

    private static Set<UUID> parseClientIds(String text) {
        if (text == null || text.isBlank()) return null;
        Set<UUID> out = new LinkedHashSet<>();
        for (String part : text.split(",")) {
            if (part.isBlank()) continue;
            try {
                out.add(VersionIds.parse(part.trim()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid client id: " + part.trim(), e);
            }
        }
        return out;
    }

    private static boolean parseBool(String name, String text) {
        return switch (text.trim().toLowerCase()) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException("Invalid " + name + ": " + text);
        };
    }

    private static int parseInt(String name, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + text, e);
        }
    }

    private static long parseLong(String name, String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + text, e);
        }
    }

    static String usage() {
        return """
            Usage: tasksync-server [options]

            Options:
              --listen,          -l   host:port to listen on, repeatable (env LISTEN, required)
              --allow-client-id, -C   accept only these client ids, repeatable (env CLIENT_ID)
              --no-create-clients     reject unknown clients instead of creating them (env CREATE_CLIENTS)
              --snapshot-versions     versions between snapshot requests (env SNAPSHOT_VERSIONS, default: 100)
              --snapshot-days         days between snapshot requests (env SNAPSHOT_DAYS, default: 14)
              --retention             keep-all | prune-on-snapshot (env RETENTION, default: keep-all)
              --storage               memory | h2 | postgres (env STORAGE, default: h2)
              --data-dir,        -d   H2 database directory (env DATA_DIR, default: ./data)
              --connection,      -c   Postgres JDBC URL (env CONNECTION)
              --db-user               Postgres user (env DB_USER)
              --db-password           Postgres password (env DB_PASSWORD)
              --init-schema           create the Postgres schema if missing
              --max-body-bytes        request body limit (default: 104857600)
              --help,            -h   Show this help message
            """;
    }

    private static void printHelpAndExit() {
        System.out.println(usage());
        System.exit(0);
    }
}
