package com.checkmate.pos_sync.sync.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events fed to reporting.
 *
 * All sync events share these common properties:
 * - Event ID for deduplication by consumers
 * - Server id and sync key of the record the event is about
 * - Timestamp of when the event occurred
 */
public interface SyncEvent {

    UUID getEventId();

    /**
     * Server id of the record. Used as the outbox aggregate id and Kafka key.
     */
    long getServerId();

    String getSyncKey();

    Instant getOccurredAt();

    String getEventType();

    @JsonIgnore
    String getAggregateType();
}
