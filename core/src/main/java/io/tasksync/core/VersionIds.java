// file: core/src/main/java/io/tasksync/core/VersionIds.java
package io.tasksync.core;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Version identifier helpers.
 * <p>
 * The nil UUID stands for "no version": the parent of the first version in a chain,
 * and the head of a client that has no versions yet.
 */
public final class VersionIds {

    public static final UUID NIL = new UUID(0L, 0L);

    // 8-4-4-4-12 hex digits; UUID.fromString alone also takes short forms like "0-0-0-0-0"
    private static final Pattern CANONICAL =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private VersionIds() {
        // utility
    }

    /**
     * Fresh, server-generated version id.
     * {@link UUID#randomUUID()} draws from a {@link java.security.SecureRandom}, so ids
     * cannot be predicted or forced by clients.
     */
    public static UUID newVersionId() {
        return UUID.randomUUID();
    }

    public static boolean isNil(UUID id) {
        return NIL.equals(id);
    }

    /**
     * Parse a version id from its canonical text form.
     *
     * @throws IllegalArgumentException if the text is not a canonical 36-character UUID
     */
    public static UUID parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("version id must not be empty");
        }
        String trimmed = text.trim();
        if (!CANONICAL.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("invalid version id: " + text);
        }
        return UUID.fromString(trimmed);
    }
}
