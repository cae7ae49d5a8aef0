package com.checkmate.pos_sync.sync.event;

import com.checkmate.pos_sync.transaction.SaleRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Event published when an uploaded sale is recorded for the first time.
 */
@Value
public class SaleRecordedEvent implements SyncEvent {
    UUID eventId;
    long serverId;
    String syncKey;
    Long accountId;
    Long familyId;
    String school;
    String itemId;
    String itemType;
    String transactionCode;
    BigDecimal price;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    boolean cash;
    Instant transactionAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SaleRecorded";
    public static final String AGGREGATE_TYPE = "SaleRecord";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static SaleRecordedEvent of(long serverId, SaleRecord sale, boolean cash) {
        return new SaleRecordedEvent(
            UUID.randomUUID(),
            serverId,
            sale.getSyncKey(),
            sale.getAccountId(),
            sale.getFamilyId(),
            sale.getSchool(),
            sale.getItemId(),
            sale.getItemType(),
            sale.getTransactionCode(),
            sale.getPrice(),
            sale.getLineType(),
            sale.getLineNum(),
            sale.getLineDate(),
            cash,
            sale.getTransactionAt(),
            Instant.now()
        );
    }
}
