package com.checkmate.pos_sync.deletion;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A station's request to delete a record it uploaded earlier, itself
 * identified by a sync key so replays are harmless.
 */
@Value
@Builder
@AllArgsConstructor
public class DeletionUpload {

    @NotBlank(message = "Sync key is required")
    @Size(max = 64, message = "Sync key must be at most 64 characters")
    @JsonProperty("syncKey")
    String syncKey;

    @NotNull(message = "Local id is required")
    @JsonProperty("localId")
    Long localId;

    @NotBlank(message = "Original sync key is required")
    @Size(max = 64, message = "Original sync key must be at most 64 characters")
    @JsonProperty("originalSyncKey")
    String originalSyncKey;

    @Pattern(regexp = "(?i)^(transactions|payments)$", message = "Table name must be transactions or payments")
    @JsonProperty("tableName")
    String tableName;
}
