package com.checkmate.pos_sync.sync.event;

import com.checkmate.pos_sync.deletion.DeletedRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Event published when a station deletes a sale or payment. The server id is
 * the audit row's; the original's id and key are carried alongside.
 */
@Value
public class RecordDeletedEvent implements SyncEvent {
    UUID eventId;
    long serverId;
    String syncKey;
    String recordKind;
    long originalId;
    String originalSyncKey;
    Long accountId;
    BigDecimal amount;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    long deletingUserId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RecordDeleted";
    public static final String AGGREGATE_TYPE = "DeletionLog";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static RecordDeletedEvent of(long serverId, String syncKey, DeletedRecord original, long deletingUserId) {
        return new RecordDeletedEvent(
            UUID.randomUUID(),
            serverId,
            syncKey,
            original.getKind().tag(),
            original.getId(),
            original.getSyncKey(),
            original.getAccountId(),
            original.getAmount(),
            original.getLineType(),
            original.getLineNum(),
            original.getLineDate(),
            deletingUserId,
            Instant.now()
        );
    }
}
