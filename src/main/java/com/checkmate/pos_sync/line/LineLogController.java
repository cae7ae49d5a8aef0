package com.checkmate.pos_sync.line;

import com.checkmate.pos_sync.session.Abilities;
import com.checkmate.pos_sync.session.SessionInterceptor;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.SessionStatus;
import com.checkmate.pos_sync.session.StationSession;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Line open/close and drain tracking. Every call needs a session whose
 * abilities cover the line in the path.
 */
@RestController
@RequestMapping("/api/pos/lines/{mealType}/{lineNum}")
@RequiredArgsConstructor
@Slf4j
public class LineLogController {

    private final SessionService sessionService;
    private final LineLogService lineLogService;

    @PostMapping("/open")
    public ResponseEntity<LineLogService.OpenedLine> open(
            @PathVariable("mealType") String mealType,
            @PathVariable("lineNum") int lineNum,
            @RequestBody(required = false) TillRequest request,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        requireLine(session, mealType, lineNum);
        TillRequest body = request != null ? request : new TillRequest(null, null);
        return ResponseEntity.ok(lineLogService.openForSession(
                session, mealType, lineNum, dayOf(body.getLineDate()), body.getTill()));
    }

    @GetMapping("/sync-info")
    public ResponseEntity<LineSyncInfo> syncInfo(
            @PathVariable("mealType") String mealType,
            @PathVariable("lineNum") int lineNum,
            @RequestParam(value = "lineDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate lineDate,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        requireLine(session, mealType, lineNum);
        return ResponseEntity.ok(lineLogService.syncInfo(mealType, lineNum, dayOf(lineDate)));
    }

    @PostMapping("/close")
    public ResponseEntity<LineSyncInfo> close(
            @PathVariable("mealType") String mealType,
            @PathVariable("lineNum") int lineNum,
            @RequestBody(required = false) TillRequest request,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        requireLine(session, mealType, lineNum);
        TillRequest body = request != null ? request : new TillRequest(null, null);
        return ResponseEntity.ok(lineLogService.close(
                session, mealType, lineNum, dayOf(body.getLineDate()), body.getTill()));
    }

    /**
     * Moves a station session on this line to SYNCING, SYNCED or ABANDONED.
     */
    @PostMapping("/sessions/{sessionId}/status")
    public ResponseEntity<Map<String, Object>> moveSession(
            @PathVariable("mealType") String mealType,
            @PathVariable("lineNum") int lineNum,
            @PathVariable("sessionId") long sessionId,
            @Valid @RequestBody SessionStatusRequest request,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        requireLine(session, mealType, lineNum);
        SessionStatus target = SessionStatus.valueOf(request.getStatus().toUpperCase(Locale.ROOT));
        StationSession moved = lineLogService.transitionSession(
                mealType, lineNum, dayOf(request.getLineDate()), sessionId, target);
        return ResponseEntity.ok(Map.of(
                "sessionId", moved.getId(),
                "status", moved.getStatus()));
    }

    private void requireLine(StationSession session, String mealType, int lineNum) {
        sessionService.requireLine(session, Abilities.lineCode(mealType, lineNum));
    }

    private static LocalDate dayOf(LocalDate lineDate) {
        return lineDate != null ? lineDate : LocalDate.now();
    }

    /**
     * Optional body of open and close: the day (defaults to today) and a till
     * count snapshot, stored as-is.
     */
    @Value
    public static class TillRequest {
        @JsonProperty("lineDate")
        LocalDate lineDate;

        @JsonProperty("till")
        JsonNode till;
    }

    @Value
    public static class SessionStatusRequest {
        @NotBlank(message = "Status is required")
        @Pattern(regexp = "(?i)^(syncing|synced|abandoned)$", message = "Status must be syncing, synced or abandoned")
        @JsonProperty("status")
        String status;

        @JsonProperty("lineDate")
        LocalDate lineDate;
    }
}
