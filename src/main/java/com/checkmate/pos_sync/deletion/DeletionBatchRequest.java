package com.checkmate.pos_sync.deletion;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class DeletionBatchRequest {

    @NotNull(message = "Deletions are required")
    @Valid
    @JsonProperty("deletions")
    List<DeletionUpload> deletions;
}
