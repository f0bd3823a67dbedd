package com.freightbid.auction.controller;

import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.model.*;
import com.freightbid.auction.service.AuctionCoordinator;
import com.freightbid.auction.service.BidIntake;
import com.freightbid.auction.service.ShipmentLedger;
import com.freightbid.shared.dto.ApiResponse;
import com.freightbid.shared.enums.ShipmentStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/shipments")
@RequiredArgsConstructor
public class ShipmentController {

    private final AuctionCoordinator coordinator;
    private final ShipmentLedger ledger;
    private final BidIntake bidIntake;

    @PostMapping
    public ResponseEntity<ApiResponse<ShipmentResponse>> postShipment(
            @Valid @RequestBody PostShipmentRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        Shipment shipment = coordinator.post(request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(ShipmentResponse.from(shipment)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShipmentResponse>>> listShipments(
            @RequestParam(value = "status", required = false) ShipmentStatus status) {

        List<ShipmentResponse> shipments = ledger.list(status).stream().map(ShipmentResponse::from).toList();
        return ResponseEntity.ok(ApiResponse.ok(shipments));
    }

    /** Shipper's own loads, each with its live bid count. */
    @GetMapping("/shipper/{shipperId}")
    public ResponseEntity<ApiResponse<List<ShipmentResponse>>> listForShipper(
            @PathVariable("shipperId") String shipperId) {

        List<ShipmentResponse> shipments = ledger.listForShipper(shipperId).stream()
                .map(s -> ShipmentResponse.from(s, bidIntake.activeBidCount(s.getId())))
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(shipments));
    }

    @GetMapping("/{shipmentId}")
    public ResponseEntity<ApiResponse<ShipmentDetailResponse>> getShipment(@PathVariable("shipmentId") UUID shipmentId) {
        Shipment shipment = ledger.get(shipmentId);
        List<BidResponse> bids = bidIntake.bidsForShipment(shipmentId).stream().map(BidResponse::from).toList();
        MatchResponse match = coordinator.latestMatch(shipmentId).map(MatchResponse::from).orElse(null);
        ShipmentDetailResponse detail = ShipmentDetailResponse.builder()
                .shipment(ShipmentResponse.from(shipment, bidIntake.activeBidCount(shipmentId)))
                .bids(bids)
                .match(match)
                .build();
        return ResponseEntity.ok(ApiResponse.ok(detail));
    }

    @PostMapping("/{shipmentId}/open")
    public ResponseEntity<ApiResponse<ShipmentResponse>> openAuction(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody(required = false) OpenAuctionRequest request) {

        Long duration = request != null ? request.getDurationSeconds() : null;
        return ResponseEntity.ok(ApiResponse.ok(ShipmentResponse.from(coordinator.open(shipmentId, duration))));
    }

    @PostMapping("/{shipmentId}/close")
    public ResponseEntity<ApiResponse<CloseResult>> closeAuction(@PathVariable("shipmentId") UUID shipmentId) {
        return ResponseEntity.ok(ApiResponse.ok(coordinator.close(shipmentId)));
    }

    @PostMapping("/{shipmentId}/cancel")
    public ResponseEntity<ApiResponse<ShipmentResponse>> cancelShipment(
            @PathVariable("shipmentId") UUID shipmentId,
            @Valid @RequestBody CancelRequest request) {

        Shipment shipment = coordinator.cancel(shipmentId, request.getRequesterId(), request.getReason());
        return ResponseEntity.ok(ApiResponse.ok(ShipmentResponse.from(shipment)));
    }

    @GetMapping("/{shipmentId}/ranking")
    public ResponseEntity<ApiResponse<List<RankedBid>>> previewRanking(@PathVariable("shipmentId") UUID shipmentId) {
        return ResponseEntity.ok(ApiResponse.ok(coordinator.previewRanking(shipmentId)));
    }

    @GetMapping("/{shipmentId}/events")
    public ResponseEntity<ApiResponse<List<ShipmentEventResponse>>> history(@PathVariable("shipmentId") UUID shipmentId) {
        List<ShipmentEventResponse> events = ledger.history(shipmentId).stream().map(ShipmentEventResponse::from).toList();
        return ResponseEntity.ok(ApiResponse.ok(events));
    }
}
