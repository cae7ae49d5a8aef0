package com.checkmate.pos_sync.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What a station holds locally for one account, day and meal.
 *
 * Count mode uses the two counts; full mode uses the two key lists.
 */
@Value
@Builder
@AllArgsConstructor
public class SyncValidationRequest {

    @NotNull(message = "Student id is required")
    @JsonProperty("studentId")
    Long studentId;

    @NotNull(message = "Line date is required")
    @JsonProperty("lineDate")
    LocalDate lineDate;

    @NotBlank(message = "Meal type is required")
    @Pattern(regexp = "^[A-Za-z]$", message = "Meal type must be a single letter")
    @JsonProperty("mealType")
    String mealType;

    @Pattern(regexp = "(?i)^(count|full)$", message = "Mode must be count or full")
    @JsonProperty("mode")
    String mode;

    @PositiveOrZero(message = "Transaction count must not be negative")
    @JsonProperty("transactionCount")
    Integer transactionCount;

    @PositiveOrZero(message = "Payment count must not be negative")
    @JsonProperty("paymentCount")
    Integer paymentCount;

    @JsonProperty("transactionSyncKeys")
    List<String> transactionSyncKeys;

    @JsonProperty("paymentSyncKeys")
    List<String> paymentSyncKeys;
}
