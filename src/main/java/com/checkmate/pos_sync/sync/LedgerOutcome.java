package com.checkmate.pos_sync.sync;

import lombok.Value;

/**
 * Result of offering a sync key to the ledger: either this call created the
 * record, or an earlier call already had.
 */
@Value
public class LedgerOutcome {
    long serverId;
    boolean duplicate;

    public static LedgerOutcome created(long serverId) {
        return new LedgerOutcome(serverId, false);
    }

    public static LedgerOutcome duplicate(long serverId) {
        return new LedgerOutcome(serverId, true);
    }
}
