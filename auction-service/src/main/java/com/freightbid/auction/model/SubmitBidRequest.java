package com.freightbid.auction.model;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Price and ETA are deliberately not bean-validated: range checks belong to
 * bid intake so that they surface with their rejection reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitBidRequest {

    @NotNull
    private UUID shipmentId;

    @NotBlank
    private String driverId;

    @NotNull
    private BigDecimal price;

    @NotNull
    private Integer etaMinutes;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double driverLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double driverLng;

    @Size(max = 500)
    private String message;
}
