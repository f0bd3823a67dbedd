package com.freightbid.auction.exception;

/** Input or state is not acceptable for the requested operation. */
public class ValidationException extends AuctionException {

    public ValidationException(String code, String message) {
        super(code, message);
    }
}
