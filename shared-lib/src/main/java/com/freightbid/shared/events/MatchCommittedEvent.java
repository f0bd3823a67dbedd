package com.freightbid.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Settlement trigger for the payments collaborator: the shipment was matched
 * to a driver at the given price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchCommittedEvent {

    public static final String TOPIC = "match.committed";

    private String matchId;
    private String shipmentId;
    private String shipperId;
    private String driverId;
    private String bidId;
    private int round;
    private BigDecimal price;
    private String currency;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant committedAt;
}
