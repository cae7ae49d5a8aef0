package com.checkmate.pos_sync.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class PaymentBatchRequest {

    @NotNull(message = "Payments are required")
    @Valid
    @JsonProperty("payments")
    List<PaymentUpload> payments;
}
