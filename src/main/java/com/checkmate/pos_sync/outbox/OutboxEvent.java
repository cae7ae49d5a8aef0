package com.checkmate.pos_sync.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox for the reporting feed.
 *
 * Written in the same transaction as the record it describes, then published
 * to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "SaleRecord"
    String aggregateId;        // server id of the record
    String eventType;          // e.g. "SaleRecorded"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
