package com.freightbid.auction.exception;

public class BidRejectedException extends ValidationException {

    private final RejectionReason reason;

    public BidRejectedException(RejectionReason reason, String message) {
        super(reason.name(), message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
