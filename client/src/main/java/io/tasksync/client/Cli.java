// file: client/src/main/java/io/tasksync/client/Cli.java
package io.tasksync.client;

import io.tasksync.core.SnapshotData;
import io.tasksync.core.SnapshotUrgency;
import io.tasksync.core.VersionIds;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Simple CLI for talking to a running tasksync server over HTTP.
 *
 * Usage:
 *   tasksync-cli [--base-url URL] --client-id UUID add-version  <parent> <file>
 *   tasksync-cli [--base-url URL] --client-id UUID get-child    <parent> [out-file]
 *   tasksync-cli [--base-url URL] --client-id UUID add-snapshot <version> <file>
 *   tasksync-cli [--base-url URL] --client-id UUID snapshot     [out-file]
 *   tasksync-cli [--base-url URL] --client-id UUID walk         [from]
 *
 * The client id may also come from TASKSYNC_CLIENT_ID. "nil" is accepted wherever
 * a version id is expected.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final SyncClient client;
    private final PrintStream out;

    Cli(SyncClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /** Run one command; returns the process exit code. */
    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        try {
            String baseUrl = DEFAULT_BASE_URL;
            String clientId = env.get("TASKSYNC_CLIENT_ID");
            List<String> rest = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--base-url" -> baseUrl = value(args, i++);
                    case "--client-id" -> clientId = value(args, i++);
                    default -> rest.add(args[i]);
                }
            }
            if (rest.isEmpty()) {
                throw new CliException("missing command");
            }
            if (clientId == null) {
                throw new CliException("--client-id is required");
            }

            Cli cli = new Cli(new SyncClient(baseUrl, versionId(clientId)), out);
            String cmd = rest.get(0);
            List<String> params = rest.subList(1, rest.size());
            switch (cmd) {
                case "add-version" -> {
                    requireParams(params, 2, 2, "add-version requires <parent> <file>");
                    cli.addVersion(versionId(params.get(0)), Path.of(params.get(1)));
                }
                case "get-child" -> {
                    requireParams(params, 1, 2, "get-child requires <parent> [out-file]");
                    cli.getChild(versionId(params.get(0)), params.size() > 1 ? Path.of(params.get(1)) : null);
                }
                case "add-snapshot" -> {
                    requireParams(params, 2, 2, "add-snapshot requires <version> <file>");
                    cli.addSnapshot(versionId(params.get(0)), Path.of(params.get(1)));
                }
                case "snapshot" -> {
                    requireParams(params, 0, 1, "snapshot takes at most [out-file]");
                    cli.snapshot(params.isEmpty() ? null : Path.of(params.get(0)));
                }
                case "walk" -> {
                    requireParams(params, 0, 1, "walk takes at most [from]");
                    cli.walk(params.isEmpty() ? VersionIds.NIL : versionId(params.get(0)));
                }
                default -> throw new CliException("unknown command: " + cmd);
            }
            return 0;
        } catch (CliException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        } catch (SyncClientException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("interrupted");
            return 2;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void addVersion(UUID parent, Path file) throws IOException, InterruptedException {
        var result = client.addVersion(parent, Files.readAllBytes(file));
        if (result instanceof SyncClient.AddVersionResult.Accepted accepted) {
            out.println("version " + accepted.versionId());
            if (accepted.snapshotUrgency() != SnapshotUrgency.NONE) {
                out.println("snapshot requested (" + accepted.snapshotUrgency().name().toLowerCase() + ")");
            }
        } else {
            var conflict = (SyncClient.AddVersionResult.Conflict) result;
            out.println("conflict: latest version is " + conflict.expectedParentVersionId());
        }
    }

    private void getChild(UUID parent, Path outFile) throws IOException, InterruptedException {
        var result = client.getChildVersion(parent);
        if (result instanceof SyncClient.ChildVersion.Found found) {
            out.println("version " + found.versionId() + " (parent " + found.parentVersionId() + ", "
                    + found.historySegment().length + " bytes)");
            if (outFile != null) {
                Files.write(outFile, found.historySegment());
            }
        } else if (result instanceof SyncClient.ChildVersion.Gone) {
            out.println("(gone)");
        } else {
            out.println("(not found)");
        }
    }

    private void addSnapshot(UUID version, Path file) throws IOException, InterruptedException {
        boolean accepted = client.addSnapshot(version, Files.readAllBytes(file));
        out.println(accepted ? "snapshot accepted" : "snapshot dropped (not the latest version)");
    }

    private void snapshot(Path outFile) throws IOException, InterruptedException {
        SnapshotData snap = client.getSnapshot();
        if (snap == null) {
            out.println("(no snapshot)");
            return;
        }
        out.println("snapshot at " + snap.versionId() + " (" + snap.data().length + " bytes)");
        if (outFile != null) {
            Files.write(outFile, snap.data());
        }
    }

    /** Follow child links from {@code from} and print every version until the end of the chain. */
    private void walk(UUID from) throws IOException, InterruptedException {
        UUID cursor = from;
        int count = 0;
        while (true) {
            var result = client.getChildVersion(cursor);
            if (result instanceof SyncClient.ChildVersion.Found found) {
                out.println(found.versionId());
                cursor = found.versionId();
                count++;
            } else {
                if (result instanceof SyncClient.ChildVersion.Gone) {
                    out.println("(gone at " + cursor + ")");
                }
                break;
            }
        }
        out.println(count + " versions, latest " + cursor);
    }

    private static UUID versionId(String text) {
        return "nil".equalsIgnoreCase(text) ? VersionIds.NIL : VersionIds.parse(text);
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException(args[i] + " requires a value");
        }
        return args[i + 1];
    }

    private static void requireParams(List<String> params, int min, int max, String msg) {
        if (params.size() < min || params.size() > max) {
            throw new CliException(msg);
        }
    }

    private static String usage() {
        return """
                Usage:
                  tasksync-cli [--base-url URL] --client-id UUID add-version  <parent> <file>
                  tasksync-cli [--base-url URL] --client-id UUID get-child    <parent> [out-file]
                  tasksync-cli [--base-url URL] --client-id UUID add-snapshot <version> <file>
                  tasksync-cli [--base-url URL] --client-id UUID snapshot     [out-file]
                  tasksync-cli [--base-url URL] --client-id UUID walk         [from]
                """;
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
