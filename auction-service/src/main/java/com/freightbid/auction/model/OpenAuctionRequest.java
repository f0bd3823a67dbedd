package com.freightbid.auction.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenAuctionRequest {

    /** Null or 0 keeps the window open until the shipper closes it. */
    @PositiveOrZero
    private Long durationSeconds;
}
