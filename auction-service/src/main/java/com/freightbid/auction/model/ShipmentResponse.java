package com.freightbid.auction.model;

import com.freightbid.auction.entity.Shipment;
import com.freightbid.shared.enums.CargoType;
import com.freightbid.shared.enums.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ShipmentResponse {
    private UUID shipmentId;
    private String shipperId;
    private String originLabel;
    private double originLat;
    private double originLng;
    private String destinationLabel;
    private double destinationLat;
    private double destinationLng;
    private double weightTons;
    private CargoType cargoType;
    private String description;
    private Instant pickupWindowStart;
    private Instant pickupWindowEnd;
    private Instant deliveryWindowStart;
    private Instant deadline;
    private BigDecimal reservePrice;
    private boolean relistOnNoBids;
    private int round;
    private ShipmentStatus status;
    private long bidCount;
    private Instant createdAt;

    public static ShipmentResponse from(Shipment s) {
        return from(s, 0);
    }

    public static ShipmentResponse from(Shipment s, long bidCount) {
        return ShipmentResponse.builder()
                .shipmentId(s.getId())
                .shipperId(s.getShipperId())
                .originLabel(s.getOriginLabel())
                .originLat(s.getOriginLat())
                .originLng(s.getOriginLng())
                .destinationLabel(s.getDestinationLabel())
                .destinationLat(s.getDestinationLat())
                .destinationLng(s.getDestinationLng())
                .weightTons(s.getWeightTons())
                .cargoType(s.getCargoType())
                .description(s.getDescription())
                .pickupWindowStart(s.getPickupWindowStart())
                .pickupWindowEnd(s.getPickupWindowEnd())
                .deliveryWindowStart(s.getDeliveryWindowStart())
                .deadline(s.getDeliveryWindowEnd())
                .reservePrice(s.getReservePrice())
                .relistOnNoBids(s.isRelistOnNoBids())
                .round(s.getCurrentRound())
                .status(s.getStatus())
                .bidCount(bidCount)
                .createdAt(s.getCreatedAt())
                .build();
    }
}
