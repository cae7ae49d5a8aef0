package com.checkmate.pos_sync.session;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A physical POS device, identified by its (device id, browser, private mode) fingerprint.
 * Stations are never deleted.
 */
@Entity
@Table(
    name = "stations",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_stations_fingerprint",
        columnNames = {"device_id", "browser", "private_mode"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, updatable = false, length = 100)
    private String deviceId;

    @Column(name = "browser", nullable = false, updatable = false, length = 100)
    private String browser;

    @Column(name = "private_mode", nullable = false, updatable = false)
    private boolean privateMode;

    @Column(name = "mac_address", length = 32)
    private String macAddress;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    static StationEntity register(String deviceId, String browser, boolean privateMode,
                                  String macAddress, String ipAddress) {
        StationEntity station = new StationEntity();
        station.deviceId = deviceId;
        station.browser = browser;
        station.privateMode = privateMode;
        station.macAddress = blankToNull(macAddress);
        station.ipAddress = ipAddress;
        return station;
    }

    @PrePersist
    void onCreate() {
        this.firstSeenAt = Instant.now();
        this.lastSeenAt = this.firstSeenAt;
    }

    /**
     * Records a later contact. A missing MAC never erases a known one.
     */
    void seen(String macAddress, String ipAddress) {
        if (macAddress != null && !macAddress.isBlank()) {
            this.macAddress = macAddress;
        }
        this.ipAddress = ipAddress;
        this.lastSeenAt = Instant.now();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
