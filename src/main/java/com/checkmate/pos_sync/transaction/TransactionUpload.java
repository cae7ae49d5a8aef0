package com.checkmate.pos_sync.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One sale recorded offline by a station.
 */
@Value
@Builder
@AllArgsConstructor
public class TransactionUpload {

    @NotBlank(message = "Sync key is required")
    @Size(max = 64, message = "Sync key must be at most 64 characters")
    @JsonProperty("syncKey")
    String syncKey;

    @NotNull(message = "Local id is required")
    @JsonProperty("localId")
    Long localId;

    @NotBlank(message = "Student id is required")
    @Size(max = 32, message = "Student id must be at most 32 characters")
    @JsonProperty("studentId")
    String studentId;

    @NotBlank(message = "Item id is required")
    @Size(max = 8, message = "Item id must be at most 8 characters")
    @JsonProperty("itemId")
    String itemId;

    @NotNull(message = "Price is required")
    @JsonProperty("price")
    BigDecimal price;

    @NotNull(message = "Line date is required")
    @JsonProperty("lineDate")
    LocalDate lineDate;

    @NotNull(message = "Line log id is required")
    @JsonProperty("lineLogId")
    Long lineLogId;

    @NotNull(message = "Station session id is required")
    @JsonProperty("stationSessionId")
    Long stationSessionId;

    @NotBlank(message = "Meal type is required")
    @Pattern(regexp = "^[A-Za-z]$", message = "Meal type must be a single letter")
    @JsonProperty("mealType")
    String mealType;

    @NotNull(message = "Line number is required")
    @PositiveOrZero(message = "Line number must not be negative")
    @JsonProperty("lineNum")
    Integer lineNum;

    @JsonProperty("userId")
    Long userId;

    @JsonProperty("familyId")
    Long familyId;

    @Size(max = 16, message = "School code must be at most 16 characters")
    @JsonProperty("schoolCode")
    String schoolCode;

    @Size(max = 1, message = "Transaction code must be a single character")
    @JsonProperty("transactionCode")
    String transactionCode;

    @Size(max = 1, message = "Item type must be a single character")
    @JsonProperty("itemType")
    String itemType;

    @JsonProperty("timestampUTC")
    Instant timestampUTC;
}
