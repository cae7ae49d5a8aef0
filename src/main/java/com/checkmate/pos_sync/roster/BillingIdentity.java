package com.checkmate.pos_sync.roster;

import lombok.Value;

import java.util.Optional;

/**
 * Who a record is billed to: account, billing group (family), school, and the
 * subsidy approval the account carries, if any.
 *
 * The account is recorded by its external id, the id stations know it by.
 */
@Value
public class BillingIdentity {
    Long accountId;
    Long familyId;
    String school;
    String approvalMethod;
    String approvalCode;
    boolean fromRoster;

    /**
     * Always returns a usable identity. Roster data wins; without it the station's
     * own hints are used and no approval is claimed, so a sale is never dropped
     * because the server's roster copy is behind.
     */
    public static BillingIdentity resolve(Optional<RosterAccount> rosterAccount, ClientHints hints) {
        return rosterAccount
            .map(BillingIdentity::fromRoster)
            .orElseGet(() -> new BillingIdentity(
                hints.getAccountId(),
                hints.getFamilyId(),
                hints.getSchool(),
                null,
                null,
                false));
    }

    public static BillingIdentity fromRoster(RosterAccount account) {
        return new BillingIdentity(
            account.getExternalId(),
            account.getFamilyId(),
            account.getSchool(),
            account.getApprovalMethod(),
            account.getApprovalCode(),
            true);
    }

    /**
     * Cash placeholder account billed under a synthetic family id. A cash buyer
     * is anonymous, so no school or approval is ever taken from the placeholder.
     */
    public static BillingIdentity forCash(RosterAccount placeholder, Long syntheticFamilyId) {
        return new BillingIdentity(
            placeholder.getExternalId(),
            syntheticFamilyId,
            null,
            null,
            null,
            true);
    }

    public BillingIdentity withoutApproval() {
        return new BillingIdentity(accountId, familyId, school, null, null, fromRoster);
    }
}
