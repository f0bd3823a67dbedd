package com.freightbid.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String AUCTION_OPENED           = "auction.opened";
    public static final String BID_OUTBID               = "bid.outbid";
    public static final String AUCTION_WON              = "auction.won";
    public static final String AUCTION_LOST             = "auction.lost";
    public static final String SHIPMENT_STATUS_CHANGED  = "shipment.status_changed";
    public static final String MATCH_COMMITTED          = "match.committed";
    public static final String DISPATCH_ESCALATION      = "dispatch.escalation";
}
