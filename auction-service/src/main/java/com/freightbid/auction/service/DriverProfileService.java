package com.freightbid.auction.service;

import com.freightbid.auction.entity.DriverProfile;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.model.DriverLocationRequest;
import com.freightbid.auction.repository.DriverProfileRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Driver location and availability, fed by the driver-facing collaborator,
 * plus profile reads. Reputation counters are owned by {@link ReputationScorer}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverProfileService {

    private final DriverProfileRepository driverProfileRepository;
    private final AuctionLockManager lockManager;
    private final EntityManager entityManager;

    @Transactional(readOnly = true)
    public DriverProfile getProfile(String driverId) {
        return driverProfileRepository.findById(driverId)
                .orElseThrow(() -> new NotFoundException("DRIVER_NOT_FOUND", "Driver " + driverId + " not found"));
    }

    public DriverProfile updateLocation(String driverId, DriverLocationRequest req) {
        return lockManager.withDriverLock(driverId, () -> {
            DriverProfile profile = getOrCreate(driverId);
            profile.setCurrentLat(req.getLat());
            profile.setCurrentLng(req.getLng());
            profile.setLocationUpdatedAt(Instant.now());
            if (req.getAvailable() != null) {
                profile.setAvailable(req.getAvailable());
            }
            return driverProfileRepository.save(profile);
        });
    }

    public void setAvailable(String driverId, boolean available) {
        lockManager.withDriverLock(driverId, () -> {
            DriverProfile profile = getOrCreate(driverId);
            profile.setAvailable(available);
            log.debug("Driver {} available={}", driverId, available);
            return driverProfileRepository.save(profile);
        });
    }

    /**
     * Callers must hold the driver lock. An existing profile is re-read from the
     * database, since the surrounding transaction may have loaded it before the
     * lock was taken.
     */
    DriverProfile getOrCreate(String driverId) {
        return driverProfileRepository.findById(driverId).map(this::reload).orElseGet(() -> {
            log.info("Creating profile for new driver {}", driverId);
            return driverProfileRepository.save(DriverProfile.builder()
                    .driverId(driverId)
                    .reputationScore(ReputationCalculator.toStored(ReputationCalculator.NEUTRAL))
                    .available(true)
                    .build());
        });
    }

    private DriverProfile reload(DriverProfile profile) {
        entityManager.flush();
        entityManager.refresh(profile);
        return profile;
    }
}
