package com.freightbid.auction.exception;

public enum RejectionReason {
    INVALID_PRICE,
    PRICE_BELOW_FLOOR,
    SHIPMENT_NOT_BIDDING,
    DUPLICATE_ACTIVE_BID,
    INVALID_ETA
}
