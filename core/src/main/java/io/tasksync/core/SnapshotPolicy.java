// file: core/src/main/java/io/tasksync/core/SnapshotPolicy.java
package io.tasksync.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides how urgently a client should upload a snapshot.
 * <p>
 * Two independent signals, combined by taking the maximum:
 *  - versions since the last snapshot, against {@code snapshotVersions};
 *  - days since the last snapshot, against {@code snapshotDays}.
 * Each signal is LOW at the threshold and HIGH at 1.5x the threshold.
 * A client that never uploaded a snapshot is always HIGH.
 * <p>
 * The count passed in is the post-increment one, so once a threshold is crossed the
 * request repeats on every add-version until a snapshot is accepted.
 */
public final class SnapshotPolicy {
    public static final int DEFAULT_SNAPSHOT_VERSIONS = 100;
    public static final long DEFAULT_SNAPSHOT_DAYS = 14;

    private final int snapshotVersions;
    private final long snapshotDays;
    // HIGH bounds, computed once in long arithmetic
    private final long highVersions;
    private final long highDays;
    private final Clock clock;

    public SnapshotPolicy(int snapshotVersions, long snapshotDays, Clock clock) {
        if (snapshotVersions <= 0) throw new IllegalArgumentException("snapshotVersions must be > 0");
        if (snapshotDays <= 0) throw new IllegalArgumentException("snapshotDays must be > 0");
        if (clock == null) throw new IllegalArgumentException("clock must not be null");
        this.snapshotVersions = snapshotVersions;
        this.snapshotDays = snapshotDays;
        this.highVersions = (long) snapshotVersions * 3 / 2;
        this.highDays = snapshotDays > Long.MAX_VALUE / 3 ? Long.MAX_VALUE : snapshotDays * 3 / 2;
        this.clock = clock;
    }

    public SnapshotPolicy(int snapshotVersions, long snapshotDays) {
        this(snapshotVersions, snapshotDays, Clock.systemUTC());
    }

    public static SnapshotPolicy defaults() {
        return new SnapshotPolicy(DEFAULT_SNAPSHOT_VERSIONS, DEFAULT_SNAPSHOT_DAYS);
    }

    public int snapshotVersions() {
        return snapshotVersions;
    }

    public long snapshotDays() {
        return snapshotDays;
    }

    /** Urgency for a client as it stands right after a committed add-version. */
    public SnapshotUrgency urgencyFor(Client client) {
        if (client.snapshot() == null) {
            return SnapshotUrgency.HIGH;
        }
        Instant now = clock.instant();
        long days = Duration.between(client.snapshot().timestamp(), now).toDays();
        return SnapshotUrgency.max(forDays(days), forVersionsSince(client.versionsSinceSnapshot()));
    }

    SnapshotUrgency forDays(long days) {
        if (days >= highDays) {
            return SnapshotUrgency.HIGH;
        } else if (days >= snapshotDays) {
            return SnapshotUrgency.LOW;
        }
        return SnapshotUrgency.NONE;
    }

    SnapshotUrgency forVersionsSince(int versionsSince) {
        if (versionsSince >= highVersions) {
            return SnapshotUrgency.HIGH;
        } else if (versionsSince >= snapshotVersions) {
            return SnapshotUrgency.LOW;
        }
        return SnapshotUrgency.NONE;
    }
}
