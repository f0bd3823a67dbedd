package com.freightbid.auction.exception;

public class NotFoundException extends AuctionException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }
}
