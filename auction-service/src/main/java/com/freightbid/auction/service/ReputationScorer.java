package com.freightbid.auction.service;

import com.freightbid.auction.entity.DriverProfile;
import com.freightbid.auction.repository.DriverProfileRepository;
import com.freightbid.shared.enums.CancellationStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-driver trust score in [0,1]. {@link #recordCompletion} and
 * {@link #recordCancellation} are the only writers of the reputation counters;
 * both serialise on the driver lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReputationScorer {

    private final DriverProfileRepository driverProfileRepository;
    private final DriverProfileService driverProfileService;
    private final ReputationCalculator calculator;
    private final AuctionLockManager lockManager;

    /**
     * Current score; drivers without a profile get the neutral default. Reads a
     * projection rather than the entity, so a ranking pass never holds a profile
     * that a later write under the driver lock could find stale.
     */
    @Transactional(readOnly = true)
    public double score(String driverId) {
        return driverProfileRepository.findReputationCounters(driverId)
                .map(calculator::score)
                .orElse(ReputationCalculator.NEUTRAL);
    }

    /** Creates the profile with the neutral score if the driver has none yet. */
    public void ensureProfile(String driverId) {
        lockManager.withDriverLock(driverId, () -> driverProfileService.getOrCreate(driverId));
    }

    public double recordCompletion(String driverId, boolean onTime) {
        return lockManager.withDriverLock(driverId, () -> {
            DriverProfile p = driverProfileService.getOrCreate(driverId);
            p.setCompletedJobs(p.getCompletedJobs() + 1);
            if (onTime) {
                p.setOnTimeJobs(p.getOnTimeJobs() + 1);
            } else {
                p.setLateJobs(p.getLateJobs() + 1);
            }
            double score = refresh(p);
            log.info("Driver {} completed a job (onTime={}), reputation now {}", driverId, onTime, p.getReputationScore());
            return score;
        });
    }

    public double recordCancellation(String driverId, CancellationStage stage) {
        return lockManager.withDriverLock(driverId, () -> {
            DriverProfile p = driverProfileService.getOrCreate(driverId);
            p.setCancellationCount(p.getCancellationCount() + 1);
            switch (stage) {
                case PRE_MATCH -> p.setPreMatchCancellations(p.getPreMatchCancellations() + 1);
                case POST_MATCH -> p.setPostMatchCancellations(p.getPostMatchCancellations() + 1);
                case POST_PICKUP -> p.setPostPickupFailures(p.getPostPickupFailures() + 1);
            }
            double score = refresh(p);
            log.info("Driver {} cancellation at {}, reputation now {}", driverId, stage, p.getReputationScore());
            return score;
        });
    }

    private double refresh(DriverProfile p) {
        double score = calculator.score(p);
        p.setReputationScore(ReputationCalculator.toStored(score));
        driverProfileRepository.save(p);
        return score;
    }
}
