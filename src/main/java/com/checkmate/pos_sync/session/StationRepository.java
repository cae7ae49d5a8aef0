package com.checkmate.pos_sync.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StationRepository extends JpaRepository<StationEntity, Long> {

    Optional<StationEntity> findByDeviceIdAndBrowserAndPrivateMode(String deviceId, String browser, boolean privateMode);
}
