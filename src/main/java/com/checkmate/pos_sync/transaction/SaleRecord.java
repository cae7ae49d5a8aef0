package com.checkmate.pos_sync.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One sold item as stored in sale_records.
 *
 * {@code lineType} is the meal type letter and {@code lineNum} the line the
 * station sold on. {@code stationAccountToken} is the account token exactly as
 * the station sent it, a cash code included.
 */
@Value
@Builder
public class SaleRecord {
    Long id;
    String syncKey;
    Long userId;
    Long accountId;
    Long familyId;
    String school;
    String itemId;
    String itemType;
    String transactionCode;
    String approvalMethod;
    String approvalCode;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    BigDecimal price;
    String stationAccountToken;
    Long lineLogId;
    Long stationSessionId;
    Instant transactionAt;
    Instant createdAt;
}
