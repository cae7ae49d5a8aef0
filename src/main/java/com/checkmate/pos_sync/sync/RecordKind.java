package com.checkmate.pos_sync.sync;

/**
 * Kinds of records a station uploads. Each kind has its own sync key space.
 */
public enum RecordKind {
    TRANSACTION("sale_records"),
    PAYMENT("payment_records"),
    DELETION("deletion_log");

    private final String table;

    RecordKind(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    public String tag() {
        return name().toLowerCase();
    }
}
