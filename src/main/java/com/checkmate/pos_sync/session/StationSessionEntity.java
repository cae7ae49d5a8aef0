package com.checkmate.pos_sync.session;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for station sessions.
 *
 * Status only moves forward through {@link SessionStatus#canTransitionTo};
 * entering a terminal state stamps closed_at. The token never changes.
 */
@Entity
@Table(
    name = "station_sessions",
    indexes = {
        @Index(name = "idx_station_sessions_user_status", columnList = "user_id, sync_status"),
        @Index(name = "idx_station_sessions_line_log", columnList = "line_log_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StationSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "station_id", nullable = false, updatable = false)
    private Long stationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "username", nullable = false, updatable = false, length = 64)
    private String username;

    @Column(name = "line_log_id")
    private Long lineLogId;

    @Column(name = "token", nullable = false, unique = true, updatable = false, length = 64)
    private String token;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "abilities", nullable = false, columnDefinition = "jsonb")
    private List<String> abilities;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false, length = 16)
    private SessionStatus syncStatus;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    static StationSessionEntity open(long stationId, long userId, String username,
                                     String token, List<String> abilities) {
        return new StationSessionEntity(
            null,
            stationId,
            userId,
            username,
            null,
            token,
            new ArrayList<>(abilities),
            SessionStatus.ACTIVE,
            null, // openedAt - set by @PrePersist
            null, // lastActivityAt - set by @PrePersist
            null
        );
    }

    @PrePersist
    void onCreate() {
        this.openedAt = Instant.now();
        this.lastActivityAt = this.openedAt;
    }

    void moveTo(SessionStatus target) {
        if (!syncStatus.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Cannot move session %d from %s to %s", id, syncStatus, target));
        }
        this.syncStatus = target;
        if (target.isTerminal()) {
            this.closedAt = Instant.now();
        }
    }

    void bindLineLog(long lineLogId) {
        this.lineLogId = lineLogId;
    }

    public StationSession toDomain() {
        return new StationSession(
            id,
            stationId,
            userId,
            username,
            lineLogId,
            Abilities.of(abilities),
            syncStatus,
            openedAt,
            lastActivityAt,
            closedAt
        );
    }
}
