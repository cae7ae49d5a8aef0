package com.checkmate.pos_sync.sync;

/**
 * The server broke one of its own invariants while applying a batch. The batch
 * transaction is rolled back and the station retries it later.
 */
public class SyncFaultException extends RuntimeException {

    public SyncFaultException(String message) {
        super(message);
    }

    public SyncFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
