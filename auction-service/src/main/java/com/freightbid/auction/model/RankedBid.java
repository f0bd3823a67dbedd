package com.freightbid.auction.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One scored bid with its per-factor breakdown. Factors are all in [0,1].
 */
@Data
@Builder
public class RankedBid {
    private int rank;
    private UUID bidId;
    private String driverId;
    private BigDecimal price;
    private Instant submittedAt;
    private double priceScore;
    private double reputation;
    private double proximity;
    private double backhaulBonus;
    private double score;
}
