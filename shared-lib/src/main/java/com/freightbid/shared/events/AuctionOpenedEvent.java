package com.freightbid.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionOpenedEvent {

    public static final String TOPIC = "auction.opened";

    private String shipmentId;
    private String shipperId;
    private int round;
    private String originLabel;
    private String destinationLabel;
    private double originLat;
    private double originLng;
    private BigDecimal reservePrice;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant openedAt;

    /** Null when the shipper closes the auction explicitly. */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant closesAt;
}
