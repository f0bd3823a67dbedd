package com.freightbid.shared.enums;

public enum BidStatus {
    ACTIVE,
    WITHDRAWN,
    LOST,
    WON
}
