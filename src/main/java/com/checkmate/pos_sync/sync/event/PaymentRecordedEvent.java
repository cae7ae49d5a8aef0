package com.checkmate.pos_sync.sync.event;

import com.checkmate.pos_sync.payment.PaymentRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when an uploaded payment is recorded for the first time.
 */
@Value
public class PaymentRecordedEvent implements SyncEvent {
    UUID eventId;
    long serverId;
    String syncKey;
    Long accountId;
    Long familyId;
    String school;
    String method;
    BigDecimal amount;
    String memo;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentRecorded";
    public static final String AGGREGATE_TYPE = "PaymentRecord";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static PaymentRecordedEvent of(long serverId, PaymentRecord payment) {
        return new PaymentRecordedEvent(
            UUID.randomUUID(),
            serverId,
            payment.getSyncKey(),
            payment.getAccountId(),
            payment.getFamilyId(),
            payment.getSchool(),
            payment.getMethod().name(),
            payment.getAmount(),
            payment.getMemo(),
            payment.getLineType(),
            payment.getLineNum(),
            payment.getLineDate(),
            Instant.now()
        );
    }
}
