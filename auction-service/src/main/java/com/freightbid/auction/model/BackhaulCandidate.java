package com.freightbid.auction.model;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/** An open load whose origin lies near another shipment's destination. */
@Data
@Builder
public class BackhaulCandidate {
    private UUID shipmentId;
    private String originLabel;
    private double distanceKm;
}
