package com.freightbid.auction.exception;

/**
 * Root of all business failures raised by the auction core. The code is
 * returned to callers verbatim in the error envelope.
 */
public class AuctionException extends RuntimeException {

    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";

    private final String code;

    public AuctionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
