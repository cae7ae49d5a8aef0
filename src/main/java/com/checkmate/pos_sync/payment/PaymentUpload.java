package com.checkmate.pos_sync.payment;

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
import java.time.LocalDate;

/**
 * One cash or check payment taken offline by a station.
 */
@Value
@Builder
@AllArgsConstructor
public class PaymentUpload {

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

    @NotBlank(message = "Payment type is required")
    @Pattern(regexp = "(?i)^(cash|check)$", message = "Payment type must be cash or check")
    @JsonProperty("paymentType")
    String paymentType;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 64, message = "Memo must be at most 64 characters")
    @JsonProperty("memo")
    String memo;

    @Size(max = 32, message = "Check number must be at most 32 characters")
    @JsonProperty("checkNumber")
    String checkNumber;

    @NotNull(message = "Line date is required")
    @JsonProperty("lineDate")
    LocalDate lineDate;

    @NotBlank(message = "Meal type is required")
    @Pattern(regexp = "^[A-Za-z]$", message = "Meal type must be a single letter")
    @JsonProperty("mealType")
    String mealType;

    @NotNull(message = "Line number is required")
    @PositiveOrZero(message = "Line number must not be negative")
    @JsonProperty("lineNum")
    Integer lineNum;

    @JsonProperty("lineLogId")
    Long lineLogId;

    @JsonProperty("stationSessionId")
    Long stationSessionId;

    @JsonProperty("userId")
    Long userId;

    @JsonProperty("familyId")
    Long familyId;

    @Size(max = 16, message = "School code must be at most 16 characters")
    @JsonProperty("schoolCode")
    String schoolCode;
}
