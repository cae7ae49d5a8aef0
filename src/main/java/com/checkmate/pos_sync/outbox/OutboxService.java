package com.checkmate.pos_sync.outbox;

import com.checkmate.pos_sync.sync.SyncFaultException;
import com.checkmate.pos_sync.sync.event.SyncEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes sync events to the outbox inside the upload's transaction.
 *
 * If the batch commits, its events are guaranteed to be written; if it rolls
 * back, they are rolled back with it. Publishing to Kafka is done separately
 * by {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the current transaction. There must be one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(SyncEvent event) {
        String jsonPayload = serializePayload(event);

        OutboxEvent outboxEvent = OutboxEvent.create(
                event.getAggregateType(), Long.toString(event.getServerId()), event.getEventType(), jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getServerId());

        return saved.toDomain();
    }

    /**
     * Unpublished events below the retry limit, locked with SKIP LOCKED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SyncFaultException("Failed to serialize event payload", e);
        }
    }
}
