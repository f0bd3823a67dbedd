package com.freightbid.auction.exception;

/**
 * Concurrent modification or lock contention. The caller may retry with fresh state.
 */
public class ConflictException extends AuctionException {

    public ConflictException(String code, String message) {
        super(code, message);
    }
}
