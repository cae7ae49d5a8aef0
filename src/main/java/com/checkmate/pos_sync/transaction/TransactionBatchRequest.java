package com.checkmate.pos_sync.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class TransactionBatchRequest {

    @NotNull(message = "Transactions are required")
    @Valid
    @JsonProperty("transactions")
    List<TransactionUpload> transactions;
}
