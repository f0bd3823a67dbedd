package com.freightbid.auction.model;

import com.freightbid.auction.entity.Bid;
import com.freightbid.shared.enums.BidStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class BidResponse {
    private UUID bidId;
    private UUID shipmentId;
    private String driverId;
    private int round;
    private BigDecimal price;
    private int etaMinutes;
    private String message;
    private BidStatus status;
    private Instant submittedAt;

    public static BidResponse from(Bid b) {
        return BidResponse.builder()
                .bidId(b.getId())
                .shipmentId(b.getShipmentId())
                .driverId(b.getDriverId())
                .round(b.getRound())
                .price(b.getPrice())
                .etaMinutes(b.getEtaMinutes())
                .message(b.getMessage())
                .status(b.getStatus())
                .submittedAt(b.getSubmittedAt())
                .build();
    }
}
