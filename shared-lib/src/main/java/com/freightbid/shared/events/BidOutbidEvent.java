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
public class BidOutbidEvent {

    public static final String TOPIC = "bid.outbid";

    private String shipmentId;
    private String outbidBidId;
    private String outbidDriverId;
    private BigDecimal outbidPrice;
    private BigDecimal newLowestPrice;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant occurredAt;
}
