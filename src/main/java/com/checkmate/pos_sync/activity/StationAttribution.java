package com.checkmate.pos_sync.activity;

import com.checkmate.pos_sync.sync.SyncKey;
import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Which station recorded a record, as seen from the station asking.
 *
 * The session id is read from the record's sync key and mapped to its
 * station. Records whose key cannot be parsed, or whose session is unknown,
 * count as another station's.
 */
@Value
public class StationAttribution {

    public static final String THIS_STATION = "This Station";

    Long stationSessionId;
    Long stationId;
    String stationName;
    boolean otherStation;

    public static StationAttribution of(String syncKey, long callerStationId, Map<Long, Long> stationsBySession) {
        Long sessionId = SyncKey.tryParse(syncKey).map(SyncKey::getSessionId).orElse(null);
        Long stationId = sessionId != null ? stationsBySession.get(sessionId) : null;
        boolean other = !Objects.equals(stationId, callerStationId);
        return new StationAttribution(sessionId, stationId, other ? "St" + stationId : THIS_STATION, other);
    }
}
