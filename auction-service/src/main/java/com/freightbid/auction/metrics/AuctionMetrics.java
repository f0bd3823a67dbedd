package com.freightbid.auction.metrics;

import com.freightbid.auction.exception.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for the auction core.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   auction_bids_total{outcome="accepted|rejected|withdrawn", reason="..."}
 *   auction_closed_total{result="committed|void"}
 *   auction_close_latency_seconds{quantile="0.5|0.95|0.99"}
 *   auction_dispatch_total{outcome="delivered|cancelled|failed|no_show"}
 *   auction_kill_switch_rejections_total
 *   auction_lock_contention_total
 */
@Component
public class AuctionMetrics {

    private final MeterRegistry registry;
    private final Counter bidAcceptedCounter;
    private final Counter bidWithdrawnCounter;
    private final Counter auctionCommittedCounter;
    private final Counter auctionVoidCounter;
    private final Counter deliveredCounter;
    private final Counter driverCancelledCounter;
    private final Counter failedCounter;
    private final Counter noShowCounter;
    private final Counter shipperCancelledCounter;
    private final Counter killSwitchCounter;
    private final Counter lockContentionCounter;
    private final Counter backhaulDegradedCounter;
    private final Timer closeLatencyTimer;

    public AuctionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.bidAcceptedCounter = Counter.builder("auction.bids")
                .tag("outcome", "accepted")
                .tag("reason", "none")
                .description("Bids accepted into an open auction")
                .register(registry);

        this.bidWithdrawnCounter = Counter.builder("auction.bids")
                .tag("outcome", "withdrawn")
                .tag("reason", "none")
                .description("Bids withdrawn by their driver")
                .register(registry);

        this.auctionCommittedCounter = Counter.builder("auction.closed")
                .tag("result", "committed")
                .description("Auction rounds closed with a winner")
                .register(registry);

        this.auctionVoidCounter = Counter.builder("auction.closed")
                .tag("result", "void")
                .description("Auction rounds closed without bids")
                .register(registry);

        this.deliveredCounter = dispatchCounter("delivered");
        this.driverCancelledCounter = dispatchCounter("cancelled");
        this.failedCounter = dispatchCounter("failed");
        this.noShowCounter = dispatchCounter("no_show");

        this.shipperCancelledCounter = Counter.builder("auction.shipper_cancellations")
                .description("Shipments cancelled by their shipper")
                .register(registry);

        this.killSwitchCounter = Counter.builder("auction.kill_switch_rejections")
                .description("Bids rejected because bid intake was paused")
                .register(registry);

        this.lockContentionCounter = Counter.builder("auction.lock_contention")
                .description("Operations rejected because a shipment or driver lock was busy")
                .register(registry);

        this.backhaulDegradedCounter = Counter.builder("auction.backhaul_degraded")
                .description("Backhaul lookups that failed and fell back to a zero bonus")
                .register(registry);

        this.closeLatencyTimer = Timer.builder("auction.close.latency")
                .description("Time to rank and commit an auction round")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(5))
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(registry);
    }

    private Counter dispatchCounter(String outcome) {
        return Counter.builder("auction.dispatch")
                .tag("outcome", outcome)
                .description("Match executions reaching a terminal state")
                .register(registry);
    }

    public void recordBidAccepted()          { bidAcceptedCounter.increment(); }
    public void recordBidWithdrawn()         { bidWithdrawnCounter.increment(); }
    public void recordAuctionCommitted()     { auctionCommittedCounter.increment(); }
    public void recordAuctionVoid()          { auctionVoidCounter.increment(); }
    public void recordDelivered()            { deliveredCounter.increment(); }
    public void recordDriverCancelled()      { driverCancelledCounter.increment(); }
    public void recordFailed()               { failedCounter.increment(); }
    public void recordNoShow()               { noShowCounter.increment(); }
    public void recordShipperCancelled()     { shipperCancelledCounter.increment(); }
    public void recordKillSwitchRejection()  { killSwitchCounter.increment(); }
    public void recordLockContention()       { lockContentionCounter.increment(); }
    public void recordBackhaulDegraded()     { backhaulDegradedCounter.increment(); }
    public Timer getCloseLatencyTimer()      { return closeLatencyTimer; }

    public void recordBidRejected(RejectionReason reason) {
        // tags are resolved per call; the registry returns the existing meter
        registry.counter("auction.bids", "outcome", "rejected", "reason", reason.name()).increment();
    }
}
