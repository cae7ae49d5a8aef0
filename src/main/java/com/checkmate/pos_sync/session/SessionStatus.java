package com.checkmate.pos_sync.session;

/**
 * Lifecycle of a station session.
 *
 * ACTIVE → SYNCING → SYNCED, and any non-terminal state → ABANDONED.
 * Only ACTIVE sessions resolve from a bearer token.
 */
public enum SessionStatus {
    /**
     * Issued at login; the station may upload.
     */
    ACTIVE,

    /**
     * Station is draining its offline buffer ahead of handing off the line.
     */
    SYNCING,

    /**
     * Station reported everything uploaded. Terminal.
     */
    SYNCED,

    /**
     * Logged out, superseded by a newer login, or timed out. Terminal.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this == SYNCED || this == ABANDONED;
    }

    public boolean canTransitionTo(SessionStatus target) {
        return switch (this) {
            case ACTIVE -> target == SYNCING || target == SYNCED || target == ABANDONED;
            case SYNCING -> target == SYNCED || target == ABANDONED;
            case SYNCED, ABANDONED -> false;
        };
    }
}
