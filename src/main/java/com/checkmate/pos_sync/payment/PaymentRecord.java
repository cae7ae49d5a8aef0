package com.checkmate.pos_sync.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One payment as stored in payment_records.
 */
@Value
@Builder
public class PaymentRecord {
    Long id;
    String syncKey;
    Long userId;
    Long accountId;
    Long familyId;
    String school;
    PaymentMethod method;
    BigDecimal amount;
    String memo;
    String checkNumber;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    String stationAccountToken;
    Long lineLogId;
    Long stationSessionId;
    Instant createdAt;
}
