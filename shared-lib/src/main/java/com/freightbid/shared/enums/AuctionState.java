package com.freightbid.shared.enums;

public enum AuctionState {
    PENDING,
    OPEN,
    CLOSING,
    COMMITTED,
    VOID;

    public boolean isClosed() {
        return this == CLOSING || this == COMMITTED || this == VOID;
    }
}
