package com.checkmate.pos_sync.roster;

import lombok.Value;

/**
 * What the station itself believes about an account, sent alongside each record.
 * Used only when the roster has no matching account.
 */
@Value
public class ClientHints {
    long accountId;
    Long familyId;
    String school;
}
