package com.freightbid.auction.model;

import com.freightbid.shared.enums.AuctionState;
import com.freightbid.shared.enums.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of closing an auction round. {@code match} is null when the round was voided.
 */
@Data
@Builder
public class CloseResult {
    private UUID shipmentId;
    private int round;
    private AuctionState state;
    private ShipmentStatus shipmentStatus;
    private MatchResponse match;
    private List<RankedBid> ranking;
    /** True when the round had already been closed and this call returned the stored outcome. */
    private boolean replay;

    public boolean isCommitted() {
        return state == AuctionState.COMMITTED;
    }
}
