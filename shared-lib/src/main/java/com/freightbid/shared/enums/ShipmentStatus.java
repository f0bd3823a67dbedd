package com.freightbid.shared.enums;

public enum ShipmentStatus {
    DRAFT,
    OPEN,
    BIDDING,
    MATCHED,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED || this == FAILED;
    }
}
