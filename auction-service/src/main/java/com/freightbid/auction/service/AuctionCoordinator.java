package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.AuctionWindow;
import com.freightbid.auction.entity.Bid;
import com.freightbid.auction.entity.Match;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.exception.ValidationException;
import com.freightbid.auction.metrics.AuctionMetrics;
import com.freightbid.auction.model.CloseResult;
import com.freightbid.auction.model.MatchResponse;
import com.freightbid.auction.model.PostShipmentRequest;
import com.freightbid.auction.model.RankedBid;
import com.freightbid.auction.repository.AuctionWindowRepository;
import com.freightbid.auction.repository.BidRepository;
import com.freightbid.auction.repository.MatchRepository;
import com.freightbid.shared.enums.AuctionState;
import com.freightbid.shared.enums.BidStatus;
import com.freightbid.shared.enums.ExecutionStatus;
import com.freightbid.shared.enums.ShipmentStatus;
import com.freightbid.shared.events.AuctionOpenedEvent;
import com.freightbid.shared.events.AuctionResultEvent;
import com.freightbid.shared.events.MatchCommittedEvent;
import com.freightbid.shared.util.KafkaTopics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Auction lifecycle per shipment: PENDING -> OPEN -> CLOSING -> COMMITTED | VOID.
 *
 * Open, close and cancel all run under the per-shipment lock, so a timer close,
 * a shipper close and a racing bid submission are serialised. Close is
 * idempotent: a committed or voided round answers with its stored outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuctionCoordinator {

    static final Set<ExecutionStatus> ACTIVE_EXECUTION =
            EnumSet.of(ExecutionStatus.ASSIGNED, ExecutionStatus.PICKED_UP, ExecutionStatus.IN_TRANSIT);

    private final ShipmentLedger ledger;
    private final AuctionWindowRepository windowRepository;
    private final BidRepository bidRepository;
    private final MatchRepository matchRepository;
    private final BidRankingService rankingService;
    private final DriverProfileService driverProfileService;
    private final AuctionLockManager lockManager;
    private final AuctionEventPublisher eventPublisher;
    private final AuctionProperties properties;
    private final AuctionMetrics metrics;

    /**
     * Creates the shipment, publishes it and either opens bidding right away or
     * schedules a PENDING window for {@code biddingOpensAt}.
     */
    @Transactional
    public Shipment post(PostShipmentRequest req, String idempotencyKey) {
        Shipment shipment = ledger.create(req, idempotencyKey);
        if (shipment.getStatus() != ShipmentStatus.DRAFT) {
            return shipment;
        }
        shipment = ledger.transition(shipment.getId(), ShipmentStatus.DRAFT, ShipmentStatus.OPEN, "PUBLISHED");

        Long duration = resolveDuration(req.getBiddingDurationSeconds());
        Instant now = Instant.now();
        if (req.getBiddingOpensAt() != null && req.getBiddingOpensAt().isAfter(now)) {
            shipment.setCurrentRound(shipment.getCurrentRound() + 1);
            windowRepository.save(AuctionWindow.builder()
                    .shipmentId(shipment.getId())
                    .round(shipment.getCurrentRound())
                    .state(AuctionState.PENDING)
                    .opensAt(req.getBiddingOpensAt())
                    .durationSeconds(duration)
                    .build());
            log.info("Shipment {} scheduled to open for bidding at {}", shipment.getId(), req.getBiddingOpensAt());
            return shipment;
        }
        openInternal(shipment, duration, now);
        return shipment;
    }

    /**
     * Moves an OPEN shipment to BIDDING. A null or zero duration leaves the
     * window open until the shipper closes it.
     */
    public Shipment open(UUID shipmentId, Long durationSeconds) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Shipment shipment = ledger.get(shipmentId);
            if (shipment.getStatus() != ShipmentStatus.OPEN) {
                throw new ConflictException("SHIPMENT_NOT_OPEN",
                        "Shipment " + shipmentId + " is " + shipment.getStatus() + ", only OPEN shipments can start an auction");
            }
            Long duration = durationSeconds == null || durationSeconds == 0 ? null : durationSeconds;
            return openInternal(shipment, duration, Instant.now());
        });
    }

    /** Opens a PENDING window whose start time has come; no-op if it was opened or cancelled meanwhile. */
    public void openScheduled(UUID windowId) {
        UUID shipmentId = windowRepository.findById(windowId)
                .map(AuctionWindow::getShipmentId)
                .orElseThrow(() -> new NotFoundException("WINDOW_NOT_FOUND", "Auction window " + windowId + " not found"));

        lockManager.withShipmentLock(shipmentId, () -> {
            AuctionWindow window = windowRepository.findById(windowId).orElseThrow();
            Shipment shipment = ledger.get(shipmentId);
            if (window.getState() != AuctionState.PENDING || shipment.getStatus() != ShipmentStatus.OPEN
                    || window.getRound() != shipment.getCurrentRound()) {
                log.debug("Skipping scheduled open of window {} ({}, shipment {})", windowId, window.getState(), shipment.getStatus());
                return null;
            }
            return openInternal(shipment, window.getDurationSeconds(), Instant.now());
        });
    }

    /**
     * Closes the current round, ranks ACTIVE bids and commits the winner, all in
     * one transaction under the shipment lock.
     */
    public CloseResult close(UUID shipmentId) {
        Timer.Sample sample = Timer.start();
        CloseResult result = lockManager.withShipmentLock(shipmentId, () -> closeInternal(shipmentId, Instant.now()));
        if (!result.isReplay()) {
            sample.stop(metrics.getCloseLatencyTimer());
        }
        return result;
    }

    /**
     * Shipper cancellation. Before a match the auction is voided and all ACTIVE
     * bids lose; after a match but before pickup the match is cancelled without
     * penalising the driver. Cancelling after pickup is rejected.
     */
    public Shipment cancel(UUID shipmentId, String shipperId, String reason) {
        return lockManager.withShipmentLock(shipmentId, () -> {
            Shipment shipment = ledger.get(shipmentId);
            if (!shipment.getShipperId().equals(shipperId)) {
                throw new ValidationException("NOT_SHIPMENT_OWNER",
                        "Shipment " + shipmentId + " does not belong to shipper " + shipperId);
            }
            String why = reason != null ? reason : "SHIPPER_CANCELLED";
            Instant now = Instant.now();

            switch (shipment.getStatus()) {
                case DRAFT, OPEN, BIDDING -> {
                    voidOpenWindow(shipment, now);
                    loseActiveBids(shipment, null, now);
                    shipment = ledger.transition(shipmentId, shipment.getStatus(), ShipmentStatus.CANCELLED, why);
                }
                case MATCHED -> {
                    Match match = activeMatch(shipmentId)
                            .orElseThrow(() -> new ConflictException("MATCH_MISSING", "Matched shipment " + shipmentId + " has no active match"));
                    if (match.getExecutionStatus() != ExecutionStatus.ASSIGNED) {
                        throw new ConflictException("ALREADY_PICKED_UP", "Shipment " + shipmentId + " has already been picked up");
                    }
                    match.setExecutionStatus(ExecutionStatus.CANCELLED);
                    match.setClosedReason(why);
                    matchRepository.save(match);
                    driverProfileService.setAvailable(match.getDriverId(), true);
                    shipment = ledger.transition(shipmentId, ShipmentStatus.MATCHED, ShipmentStatus.CANCELLED, why, match.getDriverId());
                }
                case CANCELLED -> {
                    return shipment;
                }
                default -> throw new ConflictException("CANNOT_CANCEL",
                        "Shipment " + shipmentId + " is " + shipment.getStatus() + " and can no longer be cancelled");
            }
            metrics.recordShipperCancelled();
            return shipment;
        });
    }

    /** Ranking of the current round's ACTIVE bids without committing anything. */
    @Transactional(readOnly = true)
    public List<RankedBid> previewRanking(UUID shipmentId) {
        Shipment shipment = ledger.get(shipmentId);
        List<Bid> bids = bidRepository.findByShipmentIdAndRoundAndStatus(shipmentId, shipment.getCurrentRound(), BidStatus.ACTIVE);
        return rankingService.rank(shipment, bids);
    }

    /** The active match, or the most recent one once execution has ended. */
    @Transactional(readOnly = true)
    public Match findMatch(UUID shipmentId) {
        ledger.get(shipmentId);
        return latestMatch(shipmentId)
                .orElseThrow(() -> new NotFoundException("MATCH_NOT_FOUND", "Shipment " + shipmentId + " has no match"));
    }

    @Transactional(readOnly = true)
    public Optional<Match> latestMatch(UUID shipmentId) {
        return activeMatch(shipmentId)
                .or(() -> matchRepository.findByShipmentIdOrderByCommittedAtDesc(shipmentId).stream().findFirst());
    }

    Optional<Match> activeMatch(UUID shipmentId) {
        return matchRepository.findByShipmentIdAndExecutionStatusIn(shipmentId, ACTIVE_EXECUTION);
    }

    /**
     * Starts the next auction round for a shipment that is already BIDDING,
     * used after a driver drops a match before pickup. Caller holds the shipment lock.
     */
    void startNextRound(Shipment shipment, Instant now) {
        createOpenWindow(shipment, resolveDuration(null), now);
    }

    // --- helpers ---

    private Shipment openInternal(Shipment shipment, Long durationSeconds, Instant now) {
        Optional<AuctionWindow> pending = windowRepository
                .findByShipmentIdAndRound(shipment.getId(), shipment.getCurrentRound())
                .filter(w -> w.getState() == AuctionState.PENDING);

        shipment = ledger.transition(shipment.getId(), ShipmentStatus.OPEN, ShipmentStatus.BIDDING, "AUCTION_OPENED");
        if (pending.isPresent()) {
            AuctionWindow window = pending.get();
            activate(window, durationSeconds, now);
            announce(shipment, windowRepository.save(window));
        } else {
            createOpenWindow(shipment, durationSeconds, now);
        }
        return shipment;
    }

    private void createOpenWindow(Shipment shipment, Long durationSeconds, Instant now) {
        shipment.setCurrentRound(shipment.getCurrentRound() + 1);
        AuctionWindow window = AuctionWindow.builder()
                .shipmentId(shipment.getId())
                .round(shipment.getCurrentRound())
                .build();
        activate(window, durationSeconds, now);
        announce(shipment, windowRepository.save(window));
    }

    private void activate(AuctionWindow window, Long durationSeconds, Instant now) {
        window.setState(AuctionState.OPEN);
        window.setOpenedAt(now);
        window.setDurationSeconds(durationSeconds);
        window.setClosesAt(durationSeconds != null ? now.plusSeconds(durationSeconds) : null);
    }

    private void announce(Shipment shipment, AuctionWindow window) {
        eventPublisher.publish(KafkaTopics.AUCTION_OPENED, shipment.getId().toString(),
                AuctionOpenedEvent.builder()
                        .shipmentId(shipment.getId().toString())
                        .shipperId(shipment.getShipperId())
                        .round(window.getRound())
                        .originLabel(shipment.getOriginLabel())
                        .destinationLabel(shipment.getDestinationLabel())
                        .originLat(shipment.getOriginLat())
                        .originLng(shipment.getOriginLng())
                        .reservePrice(shipment.getReservePrice())
                        .openedAt(window.getOpenedAt())
                        .closesAt(window.getClosesAt())
                        .build());
        log.info("Auction opened for shipment {} round {} (closes {})",
                shipment.getId(), window.getRound(), window.getClosesAt() != null ? window.getClosesAt() : "on shipper action");
    }

    private CloseResult closeInternal(UUID shipmentId, Instant now) {
        Shipment shipment = ledger.get(shipmentId);
        AuctionWindow window = windowRepository.findByShipmentIdAndRound(shipmentId, shipment.getCurrentRound())
                .orElseThrow(() -> new ValidationException("NO_AUCTION", "Shipment " + shipmentId + " has no auction to close"));

        switch (window.getState()) {
            case COMMITTED -> {
                Match match = matchRepository.findById(window.getMatchId()).orElseThrow();
                log.info("Close replay for shipment {} round {}: already committed", shipmentId, window.getRound());
                return result(shipment, window, match, List.of(), true);
            }
            case VOID -> {
                log.info("Close replay for shipment {} round {}: already void", shipmentId, window.getRound());
                return result(shipment, window, null, List.of(), true);
            }
            case PENDING -> throw new ValidationException("AUCTION_NOT_OPEN",
                    "Auction for shipment " + shipmentId + " has not opened yet");
            default -> { }
        }

        window.setState(AuctionState.CLOSING);
        windowRepository.save(window);

        List<Bid> bids = bidRepository.findByShipmentIdAndRoundAndStatus(shipmentId, window.getRound(), BidStatus.ACTIVE);
        List<RankedBid> ranking = rankingService.rank(shipment, bids);

        if (ranking.isEmpty()) {
            window.setState(AuctionState.VOID);
            window.setClosedAt(now);
            windowRepository.save(window);
            ShipmentStatus target = shipment.isRelistOnNoBids() ? ShipmentStatus.OPEN : ShipmentStatus.CANCELLED;
            shipment = ledger.transition(shipmentId, ShipmentStatus.BIDDING, target, "NO_BIDS");
            metrics.recordAuctionVoid();
            log.info("Auction for shipment {} round {} closed with no bids, shipment now {}", shipmentId, window.getRound(), target);
            return result(shipment, window, null, ranking, false);
        }

        Map<UUID, Bid> byId = bids.stream().collect(Collectors.toMap(Bid::getId, Function.identity()));
        Bid winner = byId.get(ranking.get(0).getBidId());

        Match match = matchRepository.save(Match.builder()
                .shipmentId(shipmentId)
                .round(window.getRound())
                .winningBidId(winner.getId())
                .driverId(winner.getDriverId())
                .price(winner.getPrice())
                .committedAt(now)
                .executionStatus(ExecutionStatus.ASSIGNED)
                .build());

        winner.setStatus(BidStatus.WON);
        winner.setStatusChangedAt(now);
        bidRepository.save(winner);
        publishResult(shipment, window.getRound(), winner, winner, now);
        loseActiveBids(shipment, winner, now);

        shipment = ledger.transition(shipmentId, ShipmentStatus.BIDDING, ShipmentStatus.MATCHED,
                "AUCTION_COMMITTED", winner.getDriverId());

        window.setState(AuctionState.COMMITTED);
        window.setMatchId(match.getId());
        window.setClosedAt(now);
        windowRepository.save(window);

        driverProfileService.setAvailable(winner.getDriverId(), false);

        eventPublisher.publish(KafkaTopics.MATCH_COMMITTED, shipmentId.toString(),
                MatchCommittedEvent.builder()
                        .matchId(match.getId().toString())
                        .shipmentId(shipmentId.toString())
                        .shipperId(shipment.getShipperId())
                        .driverId(match.getDriverId())
                        .bidId(winner.getId().toString())
                        .round(match.getRound())
                        .price(match.getPrice())
                        .currency(properties.getBidding().getCurrency())
                        .committedAt(now)
                        .build());

        metrics.recordAuctionCommitted();
        log.info("Auction for shipment {} round {} committed: driver {} at {} ({} bids)",
                shipmentId, window.getRound(), match.getDriverId(), match.getPrice(), ranking.size());
        return result(shipment, window, match, ranking, false);
    }

    private void voidOpenWindow(Shipment shipment, Instant now) {
        windowRepository.findByShipmentIdAndRound(shipment.getId(), shipment.getCurrentRound())
                .filter(w -> w.getState() == AuctionState.OPEN || w.getState() == AuctionState.PENDING)
                .ifPresent(w -> {
                    w.setState(AuctionState.VOID);
                    w.setClosedAt(now);
                    windowRepository.save(w);
                });
    }

    /** Marks every other ACTIVE bid of the current round LOST and tells each bidder. */
    private void loseActiveBids(Shipment shipment, Bid winner, Instant now) {
        List<Bid> active = bidRepository.findByShipmentIdAndRoundAndStatus(
                shipment.getId(), shipment.getCurrentRound(), BidStatus.ACTIVE);
        for (Bid bid : active) {
            if (winner != null && bid.getId().equals(winner.getId())) {
                continue;
            }
            bid.setStatus(BidStatus.LOST);
            bid.setStatusChangedAt(now);
            bidRepository.save(bid);
            publishResult(shipment, bid.getRound(), bid, winner, now);
        }
    }

    private void publishResult(Shipment shipment, int round, Bid bid, Bid winner, Instant now) {
        String topic = bid.getStatus() == BidStatus.WON ? KafkaTopics.AUCTION_WON : KafkaTopics.AUCTION_LOST;
        eventPublisher.publish(topic, shipment.getId().toString(),
                AuctionResultEvent.builder()
                        .shipmentId(shipment.getId().toString())
                        .round(round)
                        .bidId(bid.getId().toString())
                        .driverId(bid.getDriverId())
                        .outcome(bid.getStatus())
                        .offeredPrice(bid.getPrice())
                        .winningPrice(winner != null ? winner.getPrice() : null)
                        .decidedAt(now)
                        .build());
    }

    private CloseResult result(Shipment shipment, AuctionWindow window, Match match,
                               List<RankedBid> ranking, boolean replay) {
        return CloseResult.builder()
                .shipmentId(shipment.getId())
                .round(window.getRound())
                .state(window.getState())
                .shipmentStatus(shipment.getStatus())
                .match(MatchResponse.from(match))
                .ranking(ranking)
                .replay(replay)
                .build();
    }

    /** Null request means the configured default; 0 means explicit close only. */
    private Long resolveDuration(Long requested) {
        if (requested == null) {
            long def = properties.getWindow().getDefaultDurationSeconds();
            return def > 0 ? def : null;
        }
        return requested == 0 ? null : requested;
    }
}
