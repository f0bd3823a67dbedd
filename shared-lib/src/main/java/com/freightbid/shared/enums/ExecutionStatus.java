package com.freightbid.shared.enums;

/**
 * Execution state of a committed match, advanced by the dispatch tracker.
 */
public enum ExecutionStatus {
    ASSIGNED,
    PICKED_UP,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED || this == FAILED;
    }

    public boolean isPostPickup() {
        return this == PICKED_UP || this == IN_TRANSIT;
    }
}
