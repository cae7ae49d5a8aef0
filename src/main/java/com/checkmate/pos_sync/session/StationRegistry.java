package com.checkmate.pos_sync.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registry of physical POS stations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StationRegistry {

    private final StationRepository stationRepository;

    /**
     * Returns the station for a device fingerprint, registering it on first contact.
     * On later contact the IP address and last-seen time are refreshed, and the
     * MAC address only when one is supplied.
     */
    @Transactional
    public StationEntity findOrCreateByDevice(StationFingerprint fingerprint, String macAddress, String ipAddress) {
        return stationRepository.findByDeviceIdAndBrowserAndPrivateMode(
                fingerprint.getDeviceId(), fingerprint.getBrowser(), fingerprint.isPrivateMode())
            .map(station -> {
                station.seen(macAddress, ipAddress);
                return station;
            })
            .orElseGet(() -> {
                StationEntity created = stationRepository.saveAndFlush(StationEntity.register(
                    fingerprint.getDeviceId(),
                    fingerprint.getBrowser(),
                    fingerprint.isPrivateMode(),
                    macAddress,
                    ipAddress));
                log.info("Registered new station: stationId={}, deviceId={}, browser={}, privateMode={}",
                        created.getId(), fingerprint.getDeviceId(), fingerprint.getBrowser(),
                        fingerprint.isPrivateMode());
                return created;
            });
    }
}
