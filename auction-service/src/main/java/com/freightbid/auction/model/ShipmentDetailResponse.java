package com.freightbid.auction.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Shipment with its bids (lowest price first) and the current match, if any. */
@Data
@Builder
public class ShipmentDetailResponse {
    private ShipmentResponse shipment;
    private List<BidResponse> bids;
    private MatchResponse match;
}
