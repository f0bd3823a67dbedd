package com.freightbid.auction.model;

import com.freightbid.auction.entity.Match;
import com.freightbid.shared.enums.ExecutionStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class MatchResponse {
    private UUID matchId;
    private UUID shipmentId;
    private int round;
    private UUID winningBidId;
    private String driverId;
    private BigDecimal price;
    private ExecutionStatus executionStatus;
    private Instant committedAt;
    private Instant pickedUpAt;
    private Instant deliveredAt;
    private String closedReason;

    public static MatchResponse from(Match m) {
        if (m == null) {
            return null;
        }
        return MatchResponse.builder()
                .matchId(m.getId())
                .shipmentId(m.getShipmentId())
                .round(m.getRound())
                .winningBidId(m.getWinningBidId())
                .driverId(m.getDriverId())
                .price(m.getPrice())
                .executionStatus(m.getExecutionStatus())
                .committedAt(m.getCommittedAt())
                .pickedUpAt(m.getPickedUpAt())
                .deliveredAt(m.getDeliveredAt())
                .closedReason(m.getClosedReason())
                .build();
    }
}
