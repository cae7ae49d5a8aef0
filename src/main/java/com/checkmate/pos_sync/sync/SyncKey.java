package com.checkmate.pos_sync.sync;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client-generated identity of one offline-recorded item.
 *
 * Stations build keys as {@code {lineLogId}-{sessionId}-{localId}}. The ledger
 * only ever compares keys as opaque strings; the structure is read back when
 * attributing a record to the station session that produced it.
 */
@Value
public class SyncKey {

    public static final int MAX_LENGTH = 64;

    private static final Pattern FORMAT = Pattern.compile("^(\\d{1,18})-(\\d{1,18})-(\\d{1,18})$");

    long lineLogId;
    long sessionId;
    long localId;

    public static SyncKey of(long lineLogId, long sessionId, long localId) {
        if (lineLogId < 0 || sessionId < 0 || localId < 0) {
            throw new IllegalArgumentException("Sync key components must be non-negative");
        }
        return new SyncKey(lineLogId, sessionId, localId);
    }

    /**
     * Parses a key produced by {@link #format()}.
     *
     * @return empty if the value is not three dash-separated non-negative integers
     */
    public static Optional<SyncKey> tryParse(String value) {
        if (value == null || value.length() > MAX_LENGTH) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new SyncKey(
            Long.parseLong(matcher.group(1)),
            Long.parseLong(matcher.group(2)),
            Long.parseLong(matcher.group(3))
        ));
    }

    public String format() {
        return lineLogId + "-" + sessionId + "-" + localId;
    }

    @Override
    public String toString() {
        return format();
    }
}
