package com.checkmate.pos_sync.session;

import lombok.Value;

import java.time.Instant;

/**
 * Authorization grant binding one station and one user, and optionally one
 * line log, to a bearer token and a set of abilities.
 */
@Value
public class StationSession {
    long id;
    long stationId;
    long userId;
    String username;
    Long lineLogId;
    Abilities abilities;
    SessionStatus status;
    Instant openedAt;
    Instant lastActivityAt;
    Instant closedAt;

    public boolean permitsLine(String lineCode) {
        return abilities.permitsLine(lineCode);
    }
}
