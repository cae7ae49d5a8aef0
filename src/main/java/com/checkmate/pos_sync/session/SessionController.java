package com.checkmate.pos_sync.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/pos")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionService sessionService;

    /**
     * Current session as the station sees it: who is logged in, which line log
     * it is bound to, and what it may do.
     */
    @GetMapping("/session")
    public ResponseEntity<Map<String, Object>> current(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", session.getId());
        body.put("stationId", session.getStationId());
        body.put("username", session.getUsername());
        body.put("lineLogId", session.getLineLogId());
        body.put("abilities", session.getAbilities().getValues());
        body.put("line", session.getAbilities().valueOf(Abilities.LINE).orElse(null));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {
        sessionService.revoke(session);
        return ResponseEntity.ok(Map.of("success", true));
    }
}
