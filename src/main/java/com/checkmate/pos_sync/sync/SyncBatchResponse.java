package com.checkmate.pos_sync.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.function.Predicate;

/**
 * Response body of every upload endpoint.
 *
 * A batch-level warning reports an expected configuration problem that failed
 * some items without aborting the batch.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncBatchResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("results")
    List<SyncItemResult> results;

    @JsonProperty("warning")
    String warning;

    @JsonProperty("warningMessage")
    String warningMessage;

    @JsonProperty("cashTransactionsFailed")
    Boolean cashTransactionsFailed;

    public static SyncBatchResponse of(List<SyncItemResult> results) {
        return new SyncBatchResponse(true, List.copyOf(results), null, null, null);
    }

    public static SyncBatchResponse withCashWarning(List<SyncItemResult> results, String warning, String warningMessage) {
        return new SyncBatchResponse(true, List.copyOf(results), warning, warningMessage, true);
    }

    public long count(Predicate<SyncItemResult> filter) {
        return results.stream().filter(filter).count();
    }
}
