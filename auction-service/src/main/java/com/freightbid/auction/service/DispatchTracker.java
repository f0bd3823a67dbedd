package com.freightbid.auction.service;

import com.freightbid.auction.entity.Match;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.exception.ValidationException;
import com.freightbid.auction.metrics.AuctionMetrics;
import com.freightbid.auction.repository.BidRepository;
import com.freightbid.auction.repository.MatchRepository;
import com.freightbid.shared.enums.BidStatus;
import com.freightbid.shared.enums.CancellationStage;
import com.freightbid.shared.enums.ExecutionStatus;
import com.freightbid.shared.enums.ShipmentStatus;
import com.freightbid.shared.events.DispatchEscalationEvent;
import com.freightbid.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Drives a committed match through execution:
 * ASSIGNED -> PICKED_UP -> IN_TRANSIT -> DELIVERED, with ASSIGNED -> CANCELLED
 * (driver drops the load, shipment goes back to auction) and
 * PICKED_UP | IN_TRANSIT -> FAILED (escalated to ops).
 *
 * Every terminal outcome is fed to the reputation scorer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchTracker {

    private static final Set<ExecutionStatus> DELIVERABLE = EnumSet.of(ExecutionStatus.PICKED_UP, ExecutionStatus.IN_TRANSIT);

    private final MatchRepository matchRepository;
    private final BidRepository bidRepository;
    private final ShipmentLedger ledger;
    private final AuctionCoordinator coordinator;
    private final ReputationScorer reputationScorer;
    private final DriverProfileService driverProfileService;
    private final AuctionLockManager lockManager;
    private final AuctionEventPublisher eventPublisher;
    private final AuctionMetrics metrics;

    public Match reportPickup(UUID shipmentId, String driverId) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Match match = assignedMatch(shipmentId, driverId);
            requireState(match, EnumSet.of(ExecutionStatus.ASSIGNED));

            Instant now = Instant.now();
            match.setExecutionStatus(ExecutionStatus.PICKED_UP);
            match.setPickedUpAt(now);
            matchRepository.save(match);
            ledger.transition(shipmentId, ShipmentStatus.MATCHED, ShipmentStatus.IN_TRANSIT, "PICKED_UP", driverId);

            log.info("Driver {} picked up shipment {}", driverId, shipmentId);
            return match;
        });
    }

    public Match reportInTransit(UUID shipmentId, String driverId) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Match match = assignedMatch(shipmentId, driverId);
            requireState(match, EnumSet.of(ExecutionStatus.PICKED_UP));
            match.setExecutionStatus(ExecutionStatus.IN_TRANSIT);
            log.info("Shipment {} in transit with driver {}", shipmentId, driverId);
            return matchRepository.save(match);
        });
    }

    /** On time means delivered no later than the shipment's delivery deadline. */
    public Match reportDelivery(UUID shipmentId, String driverId) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Match match = assignedMatch(shipmentId, driverId);
            requireState(match, DELIVERABLE);

            Instant now = Instant.now();
            match.setExecutionStatus(ExecutionStatus.DELIVERED);
            match.setDeliveredAt(now);
            match.setClosedReason("DELIVERED");
            matchRepository.save(match);

            Shipment shipment = ledger.transition(shipmentId, ShipmentStatus.IN_TRANSIT, ShipmentStatus.DELIVERED,
                    "DELIVERED", driverId);
            boolean onTime = !now.isAfter(shipment.getDeliveryWindowEnd());
            reputationScorer.recordCompletion(driverId, onTime);
            driverProfileService.setAvailable(driverId, true);

            metrics.recordDelivered();
            log.info("Shipment {} delivered by driver {} (onTime={})", shipmentId, driverId, onTime);
            return match;
        });
    }

    /**
     * Before pickup the match is cancelled and the shipment re-auctioned in a
     * new round; after pickup the match fails and ops are alerted.
     */
    public Match reportUnableToFulfill(UUID shipmentId, String driverId, String reason) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Match match = assignedMatch(shipmentId, driverId);
            String why = reason != null ? reason : "DRIVER_UNABLE";
            if (match.getExecutionStatus() == ExecutionStatus.ASSIGNED) {
                cancelBeforePickup(match, why);
                metrics.recordDriverCancelled();
            } else {
                requireState(match, DELIVERABLE);
                failAfterPickup(match, why);
            }
            return match;
        });
    }

    /** No-show sweep entry point: re-auctions the load if the match is still waiting for pickup. */
    public boolean handleNoShow(UUID matchId) {
        UUID shipmentId = matchRepository.findById(matchId)
                .map(Match::getShipmentId)
                .orElseThrow(() -> new NotFoundException("MATCH_NOT_FOUND", "Match " + matchId + " not found"));

        return lockManager.withShipmentLock(shipmentId, () -> {
            Match match = matchRepository.findById(matchId).orElseThrow();
            if (match.getExecutionStatus() != ExecutionStatus.ASSIGNED) {
                return false;
            }
            log.warn("Driver {} did not pick up shipment {} in time, re-auctioning", match.getDriverId(), shipmentId);
            cancelBeforePickup(match, "NO_SHOW");
            metrics.recordNoShow();
            return true;
        });
    }

    private void cancelBeforePickup(Match match, String reason) {
        Instant now = Instant.now();
        match.setExecutionStatus(ExecutionStatus.CANCELLED);
        match.setClosedReason(reason);
        matchRepository.save(match);
        withdrawWinningBid(match, now);

        Shipment shipment = ledger.transition(match.getShipmentId(), ShipmentStatus.MATCHED, ShipmentStatus.BIDDING,
                reason, match.getDriverId());
        coordinator.startNextRound(shipment, now);

        reputationScorer.recordCancellation(match.getDriverId(), CancellationStage.POST_MATCH);
        driverProfileService.setAvailable(match.getDriverId(), true);
        log.info("Match {} cancelled before pickup ({}), shipment {} back to auction round {}",
                match.getId(), reason, shipment.getId(), shipment.getCurrentRound());
    }

    /** The next round commits its own winner, so the dropped one no longer counts as WON. */
    private void withdrawWinningBid(Match match, Instant now) {
        bidRepository.findById(match.getWinningBidId()).ifPresent(bid -> {
            bid.setStatus(BidStatus.WITHDRAWN);
            bid.setStatusChangedAt(now);
            bidRepository.save(bid);
        });
    }

    private void failAfterPickup(Match match, String reason) {
        Instant now = Instant.now();
        ExecutionStatus last = match.getExecutionStatus();
        match.setExecutionStatus(ExecutionStatus.FAILED);
        match.setClosedReason(reason);
        matchRepository.save(match);

        Shipment shipment = ledger.transition(match.getShipmentId(), ShipmentStatus.IN_TRANSIT, ShipmentStatus.FAILED,
                reason, match.getDriverId());
        reputationScorer.recordCancellation(match.getDriverId(), CancellationStage.POST_PICKUP);
        driverProfileService.setAvailable(match.getDriverId(), true);

        eventPublisher.publish(KafkaTopics.DISPATCH_ESCALATION, shipment.getId().toString(),
                DispatchEscalationEvent.builder()
                        .matchId(match.getId().toString())
                        .shipmentId(shipment.getId().toString())
                        .shipperId(shipment.getShipperId())
                        .driverId(match.getDriverId())
                        .lastExecutionStatus(last)
                        .reason(reason)
                        .raisedAt(now)
                        .build());

        metrics.recordFailed();
        log.warn("Shipment {} failed after pickup with driver {} ({}), escalated", shipment.getId(), match.getDriverId(), reason);
    }

    private Match assignedMatch(UUID shipmentId, String driverId) {
        Match match = coordinator.activeMatch(shipmentId)
                .orElseThrow(() -> new ConflictException("NO_ACTIVE_MATCH", "Shipment " + shipmentId + " has no active match"));
        if (!match.getDriverId().equals(driverId)) {
            throw new ValidationException("NOT_ASSIGNED_DRIVER",
                    "Driver " + driverId + " is not the assigned driver for shipment " + shipmentId);
        }
        return match;
    }

    private static void requireState(Match match, Set<ExecutionStatus> expected) {
        if (!expected.contains(match.getExecutionStatus())) {
            throw new ConflictException("INVALID_EXECUTION_STATE",
                    "Match " + match.getId() + " is " + match.getExecutionStatus() + ", expected one of " + expected);
        }
    }
}
