package com.checkmate.pos_sync.line;

import com.checkmate.pos_sync.session.SessionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Session drain state of one line log. A line is ready to close once it is open
 * and no session bound to it is still active or syncing.
 */
@Value
public class LineSyncInfo {

    @JsonProperty("lineLogId")
    Long lineLogId;

    @JsonProperty("lineCode")
    String lineCode;

    @JsonProperty("lineDate")
    LocalDate lineDate;

    @JsonProperty("status")
    LineLogStatus status;

    @JsonProperty("activeSessions")
    long activeSessions;

    @JsonProperty("syncingSessions")
    long syncingSessions;

    @JsonProperty("syncedSessions")
    long syncedSessions;

    @JsonProperty("abandonedSessions")
    long abandonedSessions;

    @JsonProperty("totalSessions")
    long totalSessions;

    @JsonProperty("readyToClose")
    boolean readyToClose;

    static LineSyncInfo of(Long lineLogId, String lineCode, LocalDate lineDate,
                           LineLogStatus status, Map<SessionStatus, Long> counts) {
        long active = counts.getOrDefault(SessionStatus.ACTIVE, 0L);
        long syncing = counts.getOrDefault(SessionStatus.SYNCING, 0L);
        long synced = counts.getOrDefault(SessionStatus.SYNCED, 0L);
        long abandoned = counts.getOrDefault(SessionStatus.ABANDONED, 0L);
        boolean ready = status == LineLogStatus.OPEN && active + syncing == 0;
        return new LineSyncInfo(lineLogId, lineCode, lineDate, status,
                active, syncing, synced, abandoned, active + syncing + synced + abandoned, ready);
    }
}
