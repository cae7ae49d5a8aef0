package com.checkmate.pos_sync.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatusTest {

    @Test
    @DisplayName("ACTIVE can move to every other state")
    void activeTransitions() {
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.SYNCING));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.SYNCED));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.ABANDONED));
        assertFalse(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.ACTIVE));
    }

    @Test
    @DisplayName("SYNCING cannot go back to ACTIVE")
    void syncingTransitions() {
        assertTrue(SessionStatus.SYNCING.canTransitionTo(SessionStatus.SYNCED));
        assertTrue(SessionStatus.SYNCING.canTransitionTo(SessionStatus.ABANDONED));
        assertFalse(SessionStatus.SYNCING.canTransitionTo(SessionStatus.ACTIVE));
    }

    @Test
    @DisplayName("Terminal states allow no transition")
    void terminalStates() {
        for (SessionStatus terminal : new SessionStatus[]{SessionStatus.SYNCED, SessionStatus.ABANDONED}) {
            assertTrue(terminal.isTerminal());
            for (SessionStatus target : SessionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
        assertFalse(SessionStatus.ACTIVE.isTerminal());
        assertFalse(SessionStatus.SYNCING.isTerminal());
    }
}
