package com.checkmate.pos_sync.roster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BillingIdentityTest {

    private static final RosterAccount STUDENT =
            new RosterAccount(1L, 12345L, 5001L, "HS", "F", "FREE");

    @Test
    @DisplayName("Roster account wins over station hints")
    void rosterWins() {
        BillingIdentity identity = BillingIdentity.resolve(Optional.of(STUDENT),
                new ClientHints(12345L, 9999L, "MS"));

        assertEquals(12345L, identity.getAccountId());
        assertEquals(5001L, identity.getFamilyId());
        assertEquals("HS", identity.getSchool());
        assertEquals("F", identity.getApprovalMethod());
        assertEquals("FREE", identity.getApprovalCode());
        assertTrue(identity.isFromRoster());
    }

    @Test
    @DisplayName("Unknown account falls back to station hints without approval")
    void fallsBackToHints() {
        BillingIdentity identity = BillingIdentity.resolve(Optional.empty(),
                new ClientHints(777L, 9999L, "MS"));

        assertEquals(777L, identity.getAccountId());
        assertEquals(9999L, identity.getFamilyId());
        assertEquals("MS", identity.getSchool());
        assertNull(identity.getApprovalMethod());
        assertNull(identity.getApprovalCode());
        assertFalse(identity.isFromRoster());
    }

    @Test
    @DisplayName("Cash identity bills the placeholder under the synthetic family id")
    void cashIdentity() {
        RosterAccount placeholder = new RosterAccount(2L, 999999999L, null, "HS", "F", "FREE");

        BillingIdentity identity = BillingIdentity.forCash(placeholder, 9500003L);

        assertEquals(999999999L, identity.getAccountId());
        assertEquals(9500003L, identity.getFamilyId());
        assertNull(identity.getSchool());
        assertNull(identity.getApprovalMethod());
        assertNull(identity.getApprovalCode());
    }

    @Test
    @DisplayName("Dropping approval keeps everything else")
    void withoutApproval() {
        BillingIdentity identity = BillingIdentity.fromRoster(STUDENT).withoutApproval();

        assertNull(identity.getApprovalMethod());
        assertNull(identity.getApprovalCode());
        assertEquals(5001L, identity.getFamilyId());
        assertTrue(identity.isFromRoster());
    }
}
