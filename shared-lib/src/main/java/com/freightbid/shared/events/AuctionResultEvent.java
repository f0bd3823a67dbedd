package com.freightbid.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.freightbid.shared.enums.BidStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-bidder auction outcome. Published to auction.won for the winner and
 * auction.lost for every other bidder of the round.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionResultEvent {

    public static final String TOPIC_WON  = "auction.won";
    public static final String TOPIC_LOST = "auction.lost";

    private String shipmentId;
    private int round;
    private String bidId;
    private String driverId;
    private BidStatus outcome;
    private BigDecimal offeredPrice;
    private BigDecimal winningPrice;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant decidedAt;
}
