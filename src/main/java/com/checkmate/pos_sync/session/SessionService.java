package com.checkmate.pos_sync.session;

import com.checkmate.pos_sync.observability.CorrelationContext;
import com.checkmate.pos_sync.observability.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Identity and session store.
 *
 * Every protected operation starts with {@link #requireSession(String)}, called by
 * {@link SessionInterceptor} before the request body is read. A token
 * resolves only while its session is ACTIVE and not closed; anything else is
 * reported with the same {@link UnauthenticatedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final StationSessionRepository sessionRepository;
    private final SyncMetrics syncMetrics;

    /**
     * Issues a new active session on behalf of the login flow.
     *
     * Any other active session of the same user is abandoned first, so a user
     * holds at most one active session at a time.
     */
    @Transactional
    public IssuedSession issue(StationEntity station, long userId, String username, List<String> abilities) {
        int superseded = sessionRepository.abandonActiveForUser(
                userId, Instant.now(), SessionStatus.ACTIVE, SessionStatus.ABANDONED);
        if (superseded > 0) {
            log.info("Abandoned {} earlier session(s) of user {} on new login", superseded, username);
        }

        String token = newToken();
        StationSessionEntity saved = sessionRepository.save(
                StationSessionEntity.open(station.getId(), userId, username, token, abilities));

        log.info("Issued session: sessionId={}, stationId={}, user={}, abilities={}",
                saved.getId(), station.getId(), username, abilities);
        return new IssuedSession(token, saved.toDomain());
    }

    /**
     * Resolves a bearer token and refreshes the session's last activity.
     */
    @Transactional
    public Optional<StationSession> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<StationSessionEntity> found =
                sessionRepository.findByTokenAndSyncStatusAndClosedAtIsNull(token.trim(), SessionStatus.ACTIVE);
        found.ifPresent(entity -> sessionRepository.touch(entity.getId(), Instant.now()));
        return found.map(StationSessionEntity::toDomain);
    }

    /**
     * Resolves the session named by an {@code Authorization: Bearer} header and
     * publishes it to MDC for the rest of the request.
     *
     * @throws UnauthenticatedException for every failure, without saying which
     */
    @Transactional
    public StationSession requireSession(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            syncMetrics.recordAuthRejected("missing_token");
            throw new UnauthenticatedException();
        }
        StationSession session = resolve(authorizationHeader.substring(BEARER_PREFIX.length()))
            .orElseThrow(() -> {
                syncMetrics.recordAuthRejected("unknown_token");
                return new UnauthenticatedException();
            });

        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, String.valueOf(session.getId()));
        MDC.put(CorrelationContext.STATION_ID_MDC_KEY, String.valueOf(session.getStationId()));
        return session;
    }

    /**
     * @throws LineAccessDeniedException if no ability of the session covers the line
     */
    public void requireLine(StationSession session, String lineCode) {
        if (!session.permitsLine(lineCode)) {
            syncMetrics.recordAuthRejected("line_denied");
            log.warn("Session {} denied for line {} (abilities={})",
                    session.getId(), lineCode, session.getAbilities().getValues());
            throw new LineAccessDeniedException(lineCode);
        }
    }

    public void requireLines(StationSession session, Collection<String> lineCodes) {
        lineCodes.forEach(lineCode -> requireLine(session, lineCode));
    }

    /**
     * Logout. The token stops resolving immediately.
     */
    @Transactional
    public void revoke(StationSession session) {
        StationSessionEntity entity = load(session.getId());
        if (entity.getSyncStatus().isTerminal()) {
            return;
        }
        entity.moveTo(SessionStatus.ABANDONED);
        log.info("Session {} revoked", session.getId());
    }

    /**
     * @throws IllegalStateException if the state machine does not allow the move
     */
    @Transactional
    public StationSession transition(long sessionId, SessionStatus target) {
        StationSessionEntity entity = load(sessionId);
        SessionStatus from = entity.getSyncStatus();
        entity.moveTo(target);
        log.info("Session {} moved from {} to {}", sessionId, from, target);
        return entity.toDomain();
    }

    @Transactional
    public StationSession bindLineLog(StationSession session, long lineLogId) {
        StationSessionEntity entity = load(session.getId());
        entity.bindLineLog(lineLogId);
        return entity.toDomain();
    }

    /**
     * Abandons active sessions with no activity since the cutoff.
     *
     * @return number of sessions expired
     */
    @Transactional
    public int expireIdleSince(Instant cutoff) {
        return sessionRepository.abandonIdleSince(cutoff, Instant.now(), SessionStatus.ACTIVE, SessionStatus.ABANDONED);
    }

    @Transactional(readOnly = true)
    public Optional<StationSession> findById(long sessionId) {
        return sessionRepository.findById(sessionId).map(StationSessionEntity::toDomain);
    }

    /**
     * Station of each known session id. Unknown ids are absent from the map.
     */
    @Transactional(readOnly = true)
    public Map<Long, Long> stationIdsBySession(Collection<Long> sessionIds) {
        if (sessionIds.isEmpty()) {
            return Map.of();
        }
        return sessionRepository.findByIdIn(sessionIds).stream()
            .collect(Collectors.toMap(StationSessionEntity::getId, StationSessionEntity::getStationId));
    }

    /**
     * Session counts per status for a line log. Statuses with no session are absent.
     */
    @Transactional(readOnly = true)
    public Map<SessionStatus, Long> countByStatus(long lineLogId) {
        return sessionRepository.countByStatusForLineLog(lineLogId).stream()
            .collect(Collectors.toMap(row -> (SessionStatus) row[0], row -> (Long) row[1]));
    }

    private StationSessionEntity load(long sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }

    private static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * A freshly issued session and the token to hand to the station. The token
     * is not part of {@link StationSession}.
     */
    public record IssuedSession(String token, StationSession session) {
    }
}
