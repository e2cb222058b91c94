// file: core/src/test/java/io/tasksync/core/VersionTest.java
package io.tasksync.core;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VersionTest {

    @Test
    void segment_bytes_are_copied_on_the_way_in_and_out() {
        byte[] raw = {1, 2, 3};
        Version v = new Version(UUID.randomUUID(), VersionIds.NIL, raw);

        raw[0] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, v.historySegment());

        v.historySegment()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, v.historySegment());
    }

    @Test
    void versions_with_same_fields_are_equal() {
        UUID id = UUID.randomUUID();
        UUID parent = UUID.randomUUID();
        assertEquals(new Version(id, parent, new byte[]{7}), new Version(id, parent, new byte[]{7}));
        assertNotEquals(new Version(id, parent, new byte[]{7}), new Version(id, parent, new byte[]{8}));
    }

    @Test
    void nil_id_is_all_zero_and_fresh_ids_are_not_nil() {
        assertEquals("00000000-0000-0000-0000-000000000000", VersionIds.NIL.toString());
        assertTrue(VersionIds.isNil(VersionIds.NIL));
        assertFalse(VersionIds.isNil(VersionIds.newVersionId()));
        assertNotEquals(VersionIds.newVersionId(), VersionIds.newVersionId());
    }

    @Test
    void parse_rejects_garbage() {
        UUID id = UUID.randomUUID();
        assertEquals(id, VersionIds.parse(id.toString()));
        assertThrows(IllegalArgumentException.class, () -> VersionIds.parse("not-a-uuid"));
        assertThrows(IllegalArgumentException.class, () -> VersionIds.parse(" "));
    }

    @Test
    void parse_requires_the_canonical_form() {
        assertEquals(VersionIds.NIL, VersionIds.parse("00000000-0000-0000-0000-000000000000"));
        UUID mixed = VersionIds.parse("AbCdEf01-2345-6789-abcd-ef0123456789");
        assertEquals("abcdef01-2345-6789-abcd-ef0123456789", mixed.toString());

        assertThrows(IllegalArgumentException.class, () -> VersionIds.parse("0-0-0-0-0"));
        assertThrows(IllegalArgumentException.class, () -> VersionIds.parse("1-2-3-4-5"));
        assertThrows(IllegalArgumentException.class,
                () -> VersionIds.parse("00000000000000000000000000000000"));
        assertThrows(IllegalArgumentException.class,
                () -> VersionIds.parse("00000000-0000-0000-0000-0000000000000"));
        assertThrows(IllegalArgumentException.class,
                () -> VersionIds.parse("0000000g-0000-0000-0000-000000000000"));
    }

    @Test
    void fresh_client_has_empty_chain_and_no_snapshot() {
        Client c = Client.fresh(UUID.randomUUID());
        assertEquals(VersionIds.NIL, c.latestVersionId());
        assertFalse(c.hasVersions());
        assertFalse(c.hasSnapshot());
        assertEquals(0, c.versionsSinceSnapshot());
    }

    @Test
    void retention_policy_parses_cli_spelling() {
        assertEquals(RetentionPolicy.KEEP_ALL, RetentionPolicy.parse("keep-all"));
        assertEquals(RetentionPolicy.PRUNE_ON_SNAPSHOT, RetentionPolicy.parse(" Prune-On-Snapshot "));
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicy.parse("forever"));
    }
}
