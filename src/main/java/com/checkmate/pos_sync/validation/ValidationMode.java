package com.checkmate.pos_sync.validation;

import java.util.Locale;

/**
 * COUNT compares totals only and can confirm sync only for a station with
 * nothing recorded. FULL compares the actual sync keys.
 */
public enum ValidationMode {
    COUNT,
    FULL;

    public static ValidationMode parse(String value) {
        if (value == null || value.isBlank()) {
            return COUNT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
