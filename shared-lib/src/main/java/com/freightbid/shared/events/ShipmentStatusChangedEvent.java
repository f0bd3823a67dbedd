package com.freightbid.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.freightbid.shared.enums.ShipmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShipmentStatusChangedEvent {

    public static final String TOPIC = "shipment.status_changed";

    private String shipmentId;
    private String shipperId;
    private String driverId;
    private ShipmentStatus fromStatus;
    private ShipmentStatus toStatus;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
