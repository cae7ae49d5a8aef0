package com.checkmate.pos_sync.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * An account's sales and payments for one day and meal, from every station.
 */
@Value
public class AccountActivity {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("transactions")
    List<SaleView> transactions;

    @JsonProperty("payments")
    List<PaymentView> payments;

    @JsonProperty("currentStationSessionId")
    long currentStationSessionId;

    @Value
    public static class SaleView {
        long serverId;
        String syncKey;
        Long studentId;
        String itemId;
        String itemName;
        String itemType;
        BigDecimal price;
        Instant timestampUTC;
        Instant createdAt;
        int lineNum;
        Long stationSessionId;
        String stationName;
        Long stationId;
        @JsonProperty("isOtherStation")
        boolean otherStation;
    }

    @Value
    public static class PaymentView {
        long serverId;
        String syncKey;
        Long studentId;
        String paymentType;
        BigDecimal amount;
        String memo;
        Instant createdAt;
        Long stationSessionId;
        String stationName;
        Long stationId;
        @JsonProperty("isOtherStation")
        boolean otherStation;
    }
}
