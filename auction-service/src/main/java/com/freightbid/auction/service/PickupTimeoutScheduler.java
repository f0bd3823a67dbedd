package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.Match;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.exception.AuctionException;
import com.freightbid.auction.repository.MatchRepository;
import com.freightbid.auction.repository.ShipmentRepository;
import com.freightbid.shared.enums.ExecutionStatus;
import com.freightbid.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Polls for assigned matches whose pickup window has passed by more than the
 * configured grace and treats them as driver cancellations before pickup.
 * In production this would be event-driven via delayed messages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PickupTimeoutScheduler {

    private final MatchRepository matchRepository;
    private final ShipmentRepository shipmentRepository;
    private final DispatchTracker dispatchTracker;
    private final FeatureFlagService featureFlagService;
    private final AuctionProperties properties;

    @Scheduled(fixedDelayString = "${auction.dispatch.no-show-check-interval-ms:30000}")
    public void checkMissedPickups() {
        if (!featureFlagService.isEnabled(FeatureFlagService.NO_SHOW_SWEEP_ENABLED, true)) {
            return;
        }
        sweep(Instant.now());
    }

    int sweep(Instant now) {
        Instant cutoff = now.minus(properties.getDispatch().getNoShowGrace());
        List<Match> assigned = matchRepository.findByExecutionStatus(ExecutionStatus.ASSIGNED);
        int reassigned = 0;
        for (Match match : assigned) {
            Instant pickupEnd = shipmentRepository.findById(match.getShipmentId())
                    .map(Shipment::getPickupWindowEnd)
                    .orElse(null);
            // a match committed late still gets the full grace
            if (pickupEnd == null || !pickupEnd.isBefore(cutoff) || !match.getCommittedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                if (dispatchTracker.handleNoShow(match.getId())) {
                    reassigned++;
                }
            } catch (AuctionException e) {
                log.warn("No-show handling for match {} failed [{}]: {}", match.getId(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("No-show handling for match {} failed unexpectedly", match.getId(), e);
            }
        }
        return reassigned;
    }
}
