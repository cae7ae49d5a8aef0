package com.checkmate.pos_sync.sync;

import java.util.Map;

/**
 * A batch failed validation before any item was processed. Rejects the whole request.
 */
public class InvalidBatchException extends RuntimeException {

    private final Map<String, String> details;

    public InvalidBatchException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
