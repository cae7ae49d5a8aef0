package com.checkmate.pos_sync.roster;

import lombok.Value;

/**
 * An account as the roster knows it, with its billing group and approval status.
 */
@Value
public class RosterAccount {
    long accountId;
    long externalId;
    Long familyId;
    String school;
    String approvalMethod;
    String approvalCode;
}
