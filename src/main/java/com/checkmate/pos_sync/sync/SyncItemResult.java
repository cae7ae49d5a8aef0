package com.checkmate.pos_sync.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Outcome of one uploaded item, echoed back with the station's local id.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncItemResult {

    @JsonProperty("localId")
    Long localId;

    @JsonProperty("syncKey")
    String syncKey;

    @JsonProperty("serverId")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    Long serverId;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("duplicate")
    Boolean duplicate;

    @JsonProperty("notFound")
    Boolean notFound;

    @JsonProperty("error")
    String error;

    @JsonProperty("errorMessage")
    String errorMessage;

    public static SyncItemResult created(Long localId, String syncKey, long serverId) {
        return new SyncItemResult(localId, syncKey, serverId, true, null, null, null, null);
    }

    public static SyncItemResult duplicate(Long localId, String syncKey, long serverId) {
        return new SyncItemResult(localId, syncKey, serverId, true, true, null, null, null);
    }

    public static SyncItemResult of(Long localId, String syncKey, LedgerOutcome outcome) {
        return outcome.isDuplicate()
            ? duplicate(localId, syncKey, outcome.getServerId())
            : created(localId, syncKey, outcome.getServerId());
    }

    public static SyncItemResult notFound(Long localId, String syncKey) {
        return new SyncItemResult(localId, syncKey, null, true, null, true, null, null);
    }

    public static SyncItemResult failed(Long localId, String syncKey, String error, String errorMessage) {
        return new SyncItemResult(localId, syncKey, null, false, null, null, error, errorMessage);
    }

    @JsonIgnore
    public boolean isDuplicateResult() {
        return Boolean.TRUE.equals(duplicate);
    }
}
