package com.freightbid.auction.model;

import com.freightbid.shared.enums.CargoType;
import jakarta.validation.constraints.*;
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
public class PostShipmentRequest {

    @NotBlank
    private String shipperId;

    @NotBlank
    private String originLabel;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double originLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double originLng;

    @NotBlank
    private String destinationLabel;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double destinationLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double destinationLng;

    @NotNull
    @Positive
    private Double weightTons;

    @Builder.Default
    private CargoType cargoType = CargoType.GENERAL;

    @Size(max = 1000)
    private String description;

    private Instant pickupWindowStart;

    private Instant pickupWindowEnd;

    private Instant deliveryWindowStart;

    /** Delivery deadline; on-time completion is measured against it. */
    @NotNull
    private Instant deliveryWindowEnd;

    @Positive
    private BigDecimal reservePrice;

    @Builder.Default
    private boolean relistOnNoBids = true;

    /** When set in the future, bidding opens at this instant instead of immediately. */
    private Instant biddingOpensAt;

    /** Bidding window length. Null uses the configured default; 0 means close only on shipper action. */
    @PositiveOrZero
    private Long biddingDurationSeconds;
}
