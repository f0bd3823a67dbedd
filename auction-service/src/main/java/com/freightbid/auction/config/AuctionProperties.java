package com.freightbid.auction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables for the auction core, bound from the {@code auction.*} namespace.
 * Field defaults mirror application.yml so that unit tests can use {@code new AuctionProperties()}.
 */
@Data
@ConfigurationProperties(prefix = "auction")
public class AuctionProperties {

    private final Ranking ranking = new Ranking();
    private final Backhaul backhaul = new Backhaul();
    private final Bidding bidding = new Bidding();
    private final Window window = new Window();
    private final Lock lock = new Lock();
    private final Reputation reputation = new Reputation();
    private final Dispatch dispatch = new Dispatch();
    private final Redis redis = new Redis();

    @Data
    public static class Ranking {
        private double priceWeight = 0.50;
        private double reputationWeight = 0.25;
        private double proximityWeight = 0.15;
        private double backhaulWeight = 0.10;
        /** ETA at which the proximity score halves. */
        private double proximityHalfLifeMinutes = 120;
    }

    @Data
    public static class Backhaul {
        private double radiusKm = 75;
        private int maxResults = 5;
        /** Bonus multiplier when the driver has not yet bid on the chained load. */
        private double opportunityFactor = 0.5;
    }

    @Data
    public static class Bidding {
        private BigDecimal priceFloor = new BigDecimal("50.00");
        private String currency = "USD";
    }

    @Data
    public static class Window {
        private long defaultDurationSeconds = 3600;
        /** Cadence of the open/close sweep; read by the scheduler annotation. */
        private long sweepIntervalMs = 1000;
    }

    @Data
    public static class Lock {
        private long waitMillis = 2000;
        private long leaseMillis = 30000;
    }

    @Data
    public static class Reputation {
        /** Pseudo-count of neutral (0.5) history every driver starts with. */
        private double priorWeight = 4.0;
        /** Credit a late completion earns relative to an on-time one. */
        private double lateCredit = 0.5;
        private double preMatchWeight = 0.25;
        private double postMatchWeight = 1.0;
        private double postPickupWeight = 2.0;
    }

    @Data
    public static class Dispatch {
        private Duration noShowGrace = Duration.ofMinutes(60);
        private long noShowCheckIntervalMs = 30000;
    }

    @Data
    public static class Redis {
        private String address = "redis://localhost:6379";
    }
}
