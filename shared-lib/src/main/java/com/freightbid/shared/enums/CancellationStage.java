package com.freightbid.shared.enums;

public enum CancellationStage {
    PRE_MATCH,
    POST_MATCH,
    POST_PICKUP
}
