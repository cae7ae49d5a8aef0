package com.checkmate.pos_sync.session;

/**
 * No usable session for the request. The message is the same whatever failed,
 * so callers cannot tell a missing header from an expired or revoked token.
 */
public class UnauthenticatedException extends RuntimeException {

    public static final String MESSAGE = "Invalid or expired session";

    public UnauthenticatedException() {
        super(MESSAGE);
    }
}
