package com.checkmate.pos_sync.deletion;

import java.util.Locale;
import java.util.Optional;

/**
 * Table a station names when deleting a record. Stations that do not name one
 * get transactions searched first, then payments.
 */
public enum DeletionTarget {
    TRANSACTIONS,
    PAYMENTS;

    public static Optional<DeletionTarget> parse(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(valueOf(tableName.trim().toUpperCase(Locale.ROOT)));
    }
}
