package com.checkmate.pos_sync.line;

/**
 * Derived from the open/close timestamps of a line log. Moves forward only.
 */
public enum LineLogStatus {
    NOT_OPENED,
    OPEN,
    CLOSED
}
