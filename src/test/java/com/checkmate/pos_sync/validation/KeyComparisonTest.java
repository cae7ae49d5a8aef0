package com.checkmate.pos_sync.validation;

import com.checkmate.pos_sync.validation.SyncValidationResponse.KeyComparison;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyComparisonTest {

    @Test
    @DisplayName("Differences in both directions keep first-seen order")
    void differencesKeepOrder() {
        KeyComparison comparison = KeyComparison.keys(
                List.of("1-1-3", "1-1-1", "1-1-2"),
                List.of("1-1-1", "1-2-9", "1-2-8"));

        assertEquals(3, comparison.getClientCount());
        assertEquals(3, comparison.getServerCount());
        assertEquals(List.of("1-1-3", "1-1-2"), comparison.getMissingFromServer());
        assertEquals(List.of("1-2-9", "1-2-8"), comparison.getMissingFromClient());
    }

    @Test
    @DisplayName("Repeated client keys are reported once")
    void repeatedKeys() {
        KeyComparison comparison = KeyComparison.keys(List.of("1-1-5", "1-1-5"), List.of());

        assertEquals(2, comparison.getClientCount());
        assertEquals(List.of("1-1-5"), comparison.getMissingFromServer());
    }

    @Test
    @DisplayName("Count comparison carries no key lists")
    void countsOnly() {
        KeyComparison comparison = KeyComparison.counts(2, 5);

        assertEquals(2, comparison.getClientCount());
        assertEquals(5, comparison.getServerCount());
        assertNull(comparison.getMissingFromServer());
        assertNull(comparison.getMissingFromClient());
    }

    @Test
    @DisplayName("Mode defaults to count")
    void modeDefault() {
        assertEquals(ValidationMode.COUNT, ValidationMode.parse(null));
        assertEquals(ValidationMode.FULL, ValidationMode.parse("Full"));
        assertEquals("full", ValidationMode.FULL.tag());
    }
}
