package com.checkmate.pos_sync.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Passive session expiry: sessions idle longer than the inactivity timeout are
 * abandoned. Nothing in flight is cancelled; the next request with that token
 * simply fails to resolve.
 */
@Component
@Slf4j
public class SessionExpiryScheduler {

    private final SessionService sessionService;
    private final Duration inactivityTimeout;

    public SessionExpiryScheduler(SessionService sessionService,
                                  @Value("${pos.session.inactivity-timeout:PT12H}") Duration inactivityTimeout) {
        this.sessionService = sessionService;
        this.inactivityTimeout = inactivityTimeout;
    }

    @Scheduled(fixedRateString = "${pos.session.expiry-check-interval-ms:60000}")
    public void expireIdleSessions() {
        try {
            int expired = sessionService.expireIdleSince(Instant.now().minus(inactivityTimeout));
            if (expired > 0) {
                log.info("Expired {} idle station session(s) (timeout={})", expired, inactivityTimeout);
            }
        } catch (Exception e) {
            log.error("Session expiry run failed", e);
        }
    }
}
