package com.checkmate.pos_sync.line;

import com.checkmate.pos_sync.session.Abilities;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.SessionStatus;
import com.checkmate.pos_sync.session.StationSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Daily line log lifecycle: NOT_OPENED → OPEN → CLOSED.
 *
 * Callers have already checked the session's ability for the line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LineLogService {

    private final LineLogRepository lineLogRepository;
    private final SessionService sessionService;
    private final ObjectMapper objectMapper;

    /**
     * Returns the log for the line and day, creating it if no station has yet.
     */
    @Transactional
    public LineLogEntity findOrCreate(String mealType, int lineNum, LocalDate lineDate) {
        String meal = normalizeMealType(mealType);
        lineLogRepository.insertIfAbsent(meal, lineNum, lineDate);
        return lineLogRepository.findByMealTypeAndLineNumAndLineDate(meal, lineNum, lineDate)
            .orElseThrow(() -> new IllegalStateException(
                "Line log for " + meal + lineNum + " on " + lineDate + " missing after insert"));
    }

    /**
     * Opens the line for the day (if not already open) and binds the calling
     * session to its log. The returned log id and session id are what the
     * station puts into the sync keys it generates.
     *
     * @throws IllegalStateException if the day's log is already closed
     */
    @Transactional
    public OpenedLine openForSession(StationSession session, String mealType, int lineNum,
                                     LocalDate lineDate, JsonNode startTill) {
        LineLogEntity lineLog = findOrCreate(mealType, lineNum, lineDate);
        if (!lineLog.open(session.getUserId(), toJson(startTill))) {
            throw new IllegalStateException(String.format(
                "Line %s is already closed for %s", lineCode(lineLog), lineDate));
        }
        StationSession bound = sessionService.bindLineLog(session, lineLog.getId());

        log.info("Line {} open for {}: lineLogId={}, sessionId={}",
                lineCode(lineLog), lineDate, lineLog.getId(), bound.getId());
        return new OpenedLine(lineLog.getId(), lineCode(lineLog), lineDate, lineLog.getStatus(), bound.getId());
    }

    @Transactional(readOnly = true)
    public LineSyncInfo syncInfo(String mealType, int lineNum, LocalDate lineDate) {
        String meal = normalizeMealType(mealType);
        return lineLogRepository.findByMealTypeAndLineNumAndLineDate(meal, lineNum, lineDate)
            .map(this::syncInfo)
            .orElseGet(() -> LineSyncInfo.of(null, Abilities.lineCode(meal, lineNum), lineDate,
                    LineLogStatus.NOT_OPENED, Map.of()));
    }

    /**
     * Closes the line for the day.
     *
     * @throws IllegalStateException unless the line is open and no session is still active or syncing
     */
    @Transactional
    public LineSyncInfo close(StationSession session, String mealType, int lineNum,
                              LocalDate lineDate, JsonNode endTill) {
        LineLogEntity lineLog = existing(mealType, lineNum, lineDate);
        LineSyncInfo before = syncInfo(lineLog);
        if (!before.isReadyToClose()) {
            throw new IllegalStateException(String.format(
                "Line %s is not ready to close: status=%s, active=%d, syncing=%d",
                before.getLineCode(), before.getStatus(), before.getActiveSessions(), before.getSyncingSessions()));
        }
        lineLog.close(session.getUserId(), toJson(endTill));
        log.info("Line {} closed for {} by user {}", before.getLineCode(), lineDate, session.getUsername());
        return syncInfo(lineLog);
    }

    /**
     * Moves a station session bound to this line through its drain states.
     *
     * @throws IllegalArgumentException if the session is not bound to the day's log for this line
     * @throws IllegalStateException if the state machine does not allow the move
     */
    @Transactional
    public StationSession transitionSession(String mealType, int lineNum, LocalDate lineDate,
                                            long sessionId, SessionStatus target) {
        LineLogEntity lineLog = existing(mealType, lineNum, lineDate);
        StationSession bound = sessionService.findById(sessionId)
            .filter(s -> lineLog.getId().equals(s.getLineLogId()))
            .orElseThrow(() -> new IllegalArgumentException(
                "Session " + sessionId + " is not bound to line " + lineCode(lineLog) + " on " + lineDate));
        return sessionService.transition(bound.getId(), target);
    }

    private LineSyncInfo syncInfo(LineLogEntity lineLog) {
        return LineSyncInfo.of(lineLog.getId(), lineCode(lineLog), lineLog.getLineDate(),
                lineLog.getStatus(), sessionService.countByStatus(lineLog.getId()));
    }

    private LineLogEntity existing(String mealType, int lineNum, LocalDate lineDate) {
        String meal = normalizeMealType(mealType);
        return lineLogRepository.findByMealTypeAndLineNumAndLineDate(meal, lineNum, lineDate)
            .orElseThrow(() -> new IllegalArgumentException(
                "Line " + Abilities.lineCode(meal, lineNum) + " has no log for " + lineDate));
    }

    private String toJson(JsonNode till) {
        if (till == null || till.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(till);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Till snapshot is not serializable", e);
        }
    }

    private static String lineCode(LineLogEntity lineLog) {
        return Abilities.lineCode(lineLog.getMealType(), lineLog.getLineNum());
    }

    private static String normalizeMealType(String mealType) {
        if (mealType == null || mealType.isBlank() || mealType.trim().length() != 1) {
            throw new IllegalArgumentException("Meal type must be a single letter");
        }
        return mealType.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * The log a session was bound to on opening a line.
     */
    public record OpenedLine(long lineLogId, String lineCode, LocalDate lineDate,
                             LineLogStatus status, long sessionId) {
    }
}
