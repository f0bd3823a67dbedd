package com.freightbid.auction.controller;

import com.freightbid.auction.model.BidResponse;
import com.freightbid.auction.model.SubmitBidRequest;
import com.freightbid.auction.service.BidIntake;
import com.freightbid.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/bids")
@RequiredArgsConstructor
public class BidController {

    private final BidIntake bidIntake;

    @PostMapping
    public ResponseEntity<ApiResponse<BidResponse>> submitBid(@Valid @RequestBody SubmitBidRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BidResponse.from(bidIntake.submit(request))));
    }

    @PostMapping("/{bidId}/withdraw")
    public ResponseEntity<ApiResponse<BidResponse>> withdrawBid(
            @PathVariable("bidId") UUID bidId,
            @RequestParam("driverId") String driverId) {

        return ResponseEntity.ok(ApiResponse.ok(BidResponse.from(bidIntake.withdraw(bidId, driverId))));
    }

    @GetMapping("/driver/{driverId}")
    public ResponseEntity<ApiResponse<List<BidResponse>>> bidsForDriver(@PathVariable("driverId") String driverId) {
        List<BidResponse> bids = bidIntake.bidsForDriver(driverId).stream().map(BidResponse::from).toList();
        return ResponseEntity.ok(ApiResponse.ok(bids));
    }
}
