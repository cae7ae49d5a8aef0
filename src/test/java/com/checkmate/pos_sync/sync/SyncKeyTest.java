package com.checkmate.pos_sync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SyncKeyTest {

    @Test
    @DisplayName("Formats as lineLogId-sessionId-localId")
    void formatsComponentsInOrder() {
        assertEquals("12-345-6", SyncKey.of(12, 345, 6).format());
        assertEquals("12-345-6", SyncKey.of(12, 345, 6).toString());
    }

    @Test
    @DisplayName("Parses what it formats")
    void parsesFormattedKey() {
        Optional<SyncKey> parsed = SyncKey.tryParse("7-88-1000");

        assertTrue(parsed.isPresent());
        assertEquals(7, parsed.get().getLineLogId());
        assertEquals(88, parsed.get().getSessionId());
        assertEquals(1000, parsed.get().getLocalId());
    }

    @Test
    @DisplayName("Keys that are not three non-negative integers do not parse")
    void rejectsMalformedKeys() {
        assertTrue(SyncKey.tryParse(null).isEmpty());
        assertTrue(SyncKey.tryParse("").isEmpty());
        assertTrue(SyncKey.tryParse("1-2").isEmpty());
        assertTrue(SyncKey.tryParse("1-2-3-4").isEmpty());
        assertTrue(SyncKey.tryParse("a-2-3").isEmpty());
        assertTrue(SyncKey.tryParse("1--3").isEmpty());
        assertTrue(SyncKey.tryParse("1-2-" + "9".repeat(70)).isEmpty());
    }

    @Test
    @DisplayName("Negative components are rejected when building a key")
    void rejectsNegativeComponents() {
        assertThrows(IllegalArgumentException.class, () -> SyncKey.of(-1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> SyncKey.of(1, -2, 3));
        assertThrows(IllegalArgumentException.class, () -> SyncKey.of(1, 2, -3));
    }
}
