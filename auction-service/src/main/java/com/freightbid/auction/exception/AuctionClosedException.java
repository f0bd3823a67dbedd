package com.freightbid.auction.exception;

import java.util.UUID;

/** The auction round no longer accepts bids or withdrawals. */
public class AuctionClosedException extends AuctionException {

    public AuctionClosedException(UUID shipmentId) {
        super("AUCTION_CLOSED", "Auction for shipment " + shipmentId + " is already closed");
    }
}
