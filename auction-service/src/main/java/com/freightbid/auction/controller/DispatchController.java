package com.freightbid.auction.controller;

import com.freightbid.auction.entity.Match;
import com.freightbid.auction.model.MatchResponse;
import com.freightbid.auction.model.ReportRequest;
import com.freightbid.auction.service.AuctionCoordinator;
import com.freightbid.auction.service.DispatchTracker;
import com.freightbid.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/** Driver-side execution reports on a matched shipment. */
@RestController
@RequestMapping("/api/v1/shipments/{shipmentId}/dispatch")
@RequiredArgsConstructor
public class DispatchController {

    private final DispatchTracker dispatchTracker;
    private final AuctionCoordinator coordinator;

    @GetMapping
    public ResponseEntity<ApiResponse<MatchResponse>> getMatch(@PathVariable("shipmentId") UUID shipmentId) {
        return ResponseEntity.ok(ApiResponse.ok(MatchResponse.from(coordinator.findMatch(shipmentId))));
    }

    @PostMapping("/pickup")
    public ResponseEntity<ApiResponse<MatchResponse>> reportPickup(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody ReportRequest request) {

        return ok(dispatchTracker.reportPickup(shipmentId, request.getDriverId()));
    }

    @PostMapping("/in-transit")
    public ResponseEntity<ApiResponse<MatchResponse>> reportInTransit(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody ReportRequest request) {

        return ok(dispatchTracker.reportInTransit(shipmentId, request.getDriverId()));
    }

    @PostMapping("/delivery")
    public ResponseEntity<ApiResponse<MatchResponse>> reportDelivery(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody ReportRequest request) {

        return ok(dispatchTracker.reportDelivery(shipmentId, request.getDriverId()));
    }

    @PostMapping("/unable")
    public ResponseEntity<ApiResponse<MatchResponse>> reportUnableToFulfill(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody ReportRequest request) {

        return ok(dispatchTracker.reportUnableToFulfill(shipmentId, request.getDriverId(), request.getReason()));
    }

    private static ResponseEntity<ApiResponse<MatchResponse>> ok(Match match) {
        return ResponseEntity.ok(ApiResponse.ok(MatchResponse.from(match)));
    }
}
