package com.checkmate.pos_sync.session;

import lombok.Value;

/**
 * What identifies a device across logins: the station-generated device id,
 * the browser it runs in, and whether that browser is in private mode.
 */
@Value
public class StationFingerprint {
    String deviceId;
    String browser;
    boolean privateMode;

    public static StationFingerprint of(String deviceId, String browser, boolean privateMode) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device id is required");
        }
        return new StationFingerprint(deviceId.trim(), browser == null ? "" : browser.trim(), privateMode);
    }
}
