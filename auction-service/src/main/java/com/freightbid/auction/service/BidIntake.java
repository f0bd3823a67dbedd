package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.AuctionWindow;
import com.freightbid.auction.entity.Bid;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.exception.AuctionClosedException;
import com.freightbid.auction.exception.AuctionException;
import com.freightbid.auction.exception.BidRejectedException;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.exception.RejectionReason;
import com.freightbid.auction.exception.ValidationException;
import com.freightbid.auction.metrics.AuctionMetrics;
import com.freightbid.auction.model.SubmitBidRequest;
import com.freightbid.auction.repository.AuctionWindowRepository;
import com.freightbid.auction.repository.BidRepository;
import com.freightbid.shared.enums.AuctionState;
import com.freightbid.shared.enums.BidStatus;
import com.freightbid.shared.enums.CancellationStage;
import com.freightbid.shared.enums.ShipmentStatus;
import com.freightbid.shared.events.BidOutbidEvent;
import com.freightbid.shared.featureflag.FeatureFlagService;
import com.freightbid.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts, validates and stores bids.
 *
 * Intake flow:
 *  1. Static checks (price, floor, ETA) and the bid-intake kill switch
 *  2. Acquire the shipment lock, the same boundary close() uses
 *  3. Re-check the round's window: a closed window rejects the bid even if close raced in
 *  4. Enforce one ACTIVE bid per driver and shipment
 *  5. Persist, then notify the previous lowest bidder they were outbid
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BidIntake {

    private final BidRepository bidRepository;
    private final AuctionWindowRepository windowRepository;
    private final ShipmentLedger ledger;
    private final ReputationScorer reputationScorer;
    private final AuctionLockManager lockManager;
    private final AuctionEventPublisher eventPublisher;
    private final FeatureFlagService featureFlagService;
    private final AuctionProperties properties;
    private final AuctionMetrics metrics;

    public Bid submit(SubmitBidRequest req) {
        try {
            validate(req);
            if (featureFlagService.isEnabled(FeatureFlagService.BID_INTAKE_PAUSED, false)) {
                metrics.recordKillSwitchRejection();
                throw new AuctionException(AuctionException.SERVICE_UNAVAILABLE,
                        "Bid intake is temporarily paused. Please try again shortly.");
            }
            return lockManager.withShipmentLock(req.getShipmentId(), () -> store(req, Instant.now()));
        } catch (BidRejectedException e) {
            metrics.recordBidRejected(e.getReason());
            throw e;
        }
    }

    private Bid store(SubmitBidRequest req, Instant now) {
        Shipment shipment = ledger.get(req.getShipmentId());
        Optional<AuctionWindow> window = windowRepository.findByShipmentIdAndRound(shipment.getId(), shipment.getCurrentRound());

        if (window.isPresent() && window.get().acceptsNoBids(now)) {
            throw new AuctionClosedException(shipment.getId());
        }
        if (shipment.getStatus() != ShipmentStatus.BIDDING
                || window.isEmpty() || window.get().getState() != AuctionState.OPEN) {
            throw new BidRejectedException(RejectionReason.SHIPMENT_NOT_BIDDING,
                    "Shipment " + shipment.getId() + " is " + shipment.getStatus() + " and not accepting bids");
        }
        if (bidRepository.existsByShipmentIdAndDriverIdAndStatus(shipment.getId(), req.getDriverId(), BidStatus.ACTIVE)) {
            throw new BidRejectedException(RejectionReason.DUPLICATE_ACTIVE_BID,
                    "Driver " + req.getDriverId() + " already has an active bid on shipment " + shipment.getId());
        }

        Optional<Bid> previousLowest = bidRepository
                .findByShipmentIdAndRoundAndStatus(shipment.getId(), shipment.getCurrentRound(), BidStatus.ACTIVE)
                .stream()
                .min(Comparator.comparing(Bid::getPrice).thenComparing(Bid::getSubmittedAt));

        reputationScorer.ensureProfile(req.getDriverId());

        Bid bid = bidRepository.save(Bid.builder()
                .shipmentId(shipment.getId())
                .round(shipment.getCurrentRound())
                .driverId(req.getDriverId())
                .price(req.getPrice())
                .etaMinutes(req.getEtaMinutes())
                .driverLat(req.getDriverLat())
                .driverLng(req.getDriverLng())
                .message(req.getMessage())
                .submittedAt(now)
                .status(BidStatus.ACTIVE)
                .build());

        previousLowest
                .filter(prev -> !prev.getDriverId().equals(bid.getDriverId()))
                .filter(prev -> bid.getPrice().compareTo(prev.getPrice()) < 0)
                .ifPresent(prev -> eventPublisher.publish(KafkaTopics.BID_OUTBID, shipment.getId().toString(),
                        BidOutbidEvent.builder()
                                .shipmentId(shipment.getId().toString())
                                .outbidBidId(prev.getId().toString())
                                .outbidDriverId(prev.getDriverId())
                                .outbidPrice(prev.getPrice())
                                .newLowestPrice(bid.getPrice())
                                .occurredAt(now)
                                .build()));

        metrics.recordBidAccepted();
        log.info("Bid {} accepted: driver {} offered {} on shipment {} (round {})",
                bid.getId(), bid.getDriverId(), bid.getPrice(), shipment.getId(), bid.getRound());
        return bid;
    }

    /**
     * Withdraws an ACTIVE bid while its window is still open. Counts as a
     * pre-match cancellation for the driver.
     */
    public Bid withdraw(UUID bidId, String driverId) {
        UUID shipmentId = bidRepository.findById(bidId)
                .map(Bid::getShipmentId)
                .orElseThrow(() -> bidNotFound(bidId));

        return lockManager.withShipmentLock(shipmentId, () -> {
            Bid bid = bidRepository.findById(bidId).orElseThrow(() -> bidNotFound(bidId));
            if (!bid.getDriverId().equals(driverId)) {
                throw new ValidationException("NOT_BID_OWNER", "Bid " + bidId + " does not belong to driver " + driverId);
            }
            Instant now = Instant.now();
            boolean closed = windowRepository.findByShipmentIdAndRound(shipmentId, bid.getRound())
                    .map(w -> w.acceptsNoBids(now))
                    .orElse(true);
            if (closed) {
                throw new AuctionClosedException(shipmentId);
            }
            if (bid.getStatus() != BidStatus.ACTIVE) {
                throw new ValidationException("BID_NOT_ACTIVE", "Bid " + bidId + " is " + bid.getStatus());
            }

            bid.setStatus(BidStatus.WITHDRAWN);
            bid.setStatusChangedAt(now);
            bidRepository.save(bid);
            reputationScorer.recordCancellation(driverId, CancellationStage.PRE_MATCH);

            metrics.recordBidWithdrawn();
            log.info("Bid {} withdrawn by driver {} from shipment {}", bidId, driverId, shipmentId);
            return bid;
        });
    }

    @Transactional(readOnly = true)
    public List<Bid> bidsForDriver(String driverId) {
        return bidRepository.findByDriverIdOrderBySubmittedAtDesc(driverId);
    }

    /** All bids of a shipment, lowest price first. */
    @Transactional(readOnly = true)
    public List<Bid> bidsForShipment(UUID shipmentId) {
        return bidRepository.findByShipmentIdOrderByPriceAscSubmittedAtAsc(shipmentId);
    }

    @Transactional(readOnly = true)
    public long activeBidCount(UUID shipmentId) {
        return bidRepository.countByShipmentIdAndStatus(shipmentId, BidStatus.ACTIVE);
    }

    private void validate(SubmitBidRequest req) {
        BigDecimal price = req.getPrice();
        if (price == null || price.signum() <= 0) {
            throw new BidRejectedException(RejectionReason.INVALID_PRICE, "Bid price must be positive");
        }
        BigDecimal floor = properties.getBidding().getPriceFloor();
        if (floor != null && price.compareTo(floor) < 0) {
            throw new BidRejectedException(RejectionReason.PRICE_BELOW_FLOOR,
                    "Bid price " + price + " is below the floor of " + floor);
        }
        if (req.getEtaMinutes() == null || req.getEtaMinutes() < 0) {
            throw new BidRejectedException(RejectionReason.INVALID_ETA, "ETA to pickup must be zero or more minutes");
        }
    }

    private static NotFoundException bidNotFound(UUID bidId) {
        return new NotFoundException("BID_NOT_FOUND", "Bid " + bidId + " not found");
    }
}
