package com.freightbid.auction.model;

import com.freightbid.auction.entity.ShipmentEvent;
import com.freightbid.shared.enums.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ShipmentEventResponse {
    private ShipmentStatus fromStatus;
    private ShipmentStatus toStatus;
    private String reason;
    private Instant occurredAt;

    public static ShipmentEventResponse from(ShipmentEvent e) {
        return ShipmentEventResponse.builder()
                .fromStatus(e.getFromStatus())
                .toStatus(e.getToStatus())
                .reason(e.getReason())
                .occurredAt(e.getOccurredAt())
                .build();
    }
}
