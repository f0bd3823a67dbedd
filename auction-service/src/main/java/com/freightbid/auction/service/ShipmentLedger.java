package com.freightbid.auction.service;

import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.entity.ShipmentEvent;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.exception.ValidationException;
import com.freightbid.auction.model.PostShipmentRequest;
import com.freightbid.auction.repository.ShipmentEventRepository;
import com.freightbid.auction.repository.ShipmentRepository;
import com.freightbid.shared.enums.ShipmentStatus;
import com.freightbid.shared.events.ShipmentStatusChangedEvent;
import com.freightbid.shared.util.H3Util;
import com.freightbid.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.freightbid.shared.enums.ShipmentStatus.*;

/**
 * Authoritative shipment store and status state machine.
 *
 * Every status change goes through {@link #transition}, a compare-and-swap on
 * the current status executed in the caller's transaction. Successful
 * transitions are appended to the audit trail and announced on
 * shipment.status_changed after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShipmentLedger {

    private static final Map<ShipmentStatus, Set<ShipmentStatus>> ALLOWED = new EnumMap<>(ShipmentStatus.class);

    static {
        ALLOWED.put(DRAFT, EnumSet.of(OPEN, CANCELLED));
        ALLOWED.put(OPEN, EnumSet.of(BIDDING, CANCELLED));
        ALLOWED.put(BIDDING, EnumSet.of(MATCHED, OPEN, CANCELLED));
        ALLOWED.put(MATCHED, EnumSet.of(IN_TRANSIT, BIDDING, CANCELLED));
        ALLOWED.put(IN_TRANSIT, EnumSet.of(DELIVERED, FAILED));
        ALLOWED.put(DELIVERED, EnumSet.noneOf(ShipmentStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(ShipmentStatus.class));
        ALLOWED.put(FAILED, EnumSet.noneOf(ShipmentStatus.class));
    }

    private final ShipmentRepository shipmentRepository;
    private final ShipmentEventRepository shipmentEventRepository;
    private final AuctionEventPublisher eventPublisher;

    public static boolean isAllowed(ShipmentStatus from, ShipmentStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Creates a DRAFT shipment. A repeated idempotency key returns the record
     * created by the first call.
     */
    @Transactional
    public Shipment create(PostShipmentRequest req, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<Shipment> existing = shipmentRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotent replay of shipment post for key {}", idempotencyKey);
                return existing.get();
            }
        }
        validateWindows(req);

        Shipment shipment = Shipment.builder()
                .shipperId(req.getShipperId())
                .originLabel(req.getOriginLabel())
                .originLat(req.getOriginLat())
                .originLng(req.getOriginLng())
                .originCell(H3Util.backhaulCell(req.getOriginLat(), req.getOriginLng()))
                .destinationLabel(req.getDestinationLabel())
                .destinationLat(req.getDestinationLat())
                .destinationLng(req.getDestinationLng())
                .weightTons(req.getWeightTons())
                .cargoType(req.getCargoType())
                .description(req.getDescription())
                .pickupWindowStart(req.getPickupWindowStart())
                .pickupWindowEnd(req.getPickupWindowEnd())
                .deliveryWindowStart(req.getDeliveryWindowStart())
                .deliveryWindowEnd(req.getDeliveryWindowEnd())
                .reservePrice(req.getReservePrice())
                .relistOnNoBids(req.isRelistOnNoBids())
                .currentRound(0)
                .status(DRAFT)
                .idempotencyKey(idempotencyKey)
                .build();

        shipment = shipmentRepository.save(shipment);
        appendEvent(shipment.getId(), null, DRAFT, "POSTED");
        log.info("Shipment {} created by shipper {} ({} -> {})",
                shipment.getId(), shipment.getShipperId(), shipment.getOriginLabel(), shipment.getDestinationLabel());
        return shipment;
    }

    @Transactional(readOnly = true)
    public Shipment get(UUID shipmentId) {
        return shipmentRepository.findById(shipmentId)
                .orElseThrow(() -> new NotFoundException("SHIPMENT_NOT_FOUND", "Shipment " + shipmentId + " not found"));
    }

    public Shipment transition(UUID shipmentId, ShipmentStatus from, ShipmentStatus to, String reason) {
        return transition(shipmentId, from, to, reason, null);
    }

    /**
     * Compare-and-swap status change. Must run inside the caller's transaction
     * so the change commits or rolls back together with the rest of the unit of work.
     *
     * @throws ValidationException if {@code from -> to} is not an edge of the state machine
     * @throws ConflictException   if the stored status is not {@code from}, or the row changed concurrently
     */
    @Transactional
    public Shipment transition(UUID shipmentId, ShipmentStatus from, ShipmentStatus to,
                               String reason, String driverId) {
        if (!isAllowed(from, to)) {
            throw new ValidationException("ILLEGAL_TRANSITION",
                    "Shipment cannot move from " + from + " to " + to);
        }
        Shipment shipment = get(shipmentId);
        if (shipment.getStatus() != from) {
            throw new ConflictException("STALE_STATUS",
                    "Shipment " + shipmentId + " is " + shipment.getStatus() + ", expected " + from);
        }

        shipment.setStatus(to);
        try {
            shipment = shipmentRepository.saveAndFlush(shipment);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictException("CONCURRENT_MODIFICATION",
                    "Shipment " + shipmentId + " was modified concurrently, retry with fresh state");
        }

        Instant now = Instant.now();
        appendEvent(shipmentId, from, to, reason);
        eventPublisher.publish(KafkaTopics.SHIPMENT_STATUS_CHANGED, shipmentId.toString(),
                ShipmentStatusChangedEvent.builder()
                        .shipmentId(shipmentId.toString())
                        .shipperId(shipment.getShipperId())
                        .driverId(driverId)
                        .fromStatus(from)
                        .toStatus(to)
                        .reason(reason)
                        .changedAt(now)
                        .build());

        log.info("Shipment {} {} -> {} ({})", shipmentId, from, to, reason);
        return shipment;
    }

    @Transactional(readOnly = true)
    public List<Shipment> list(ShipmentStatus status) {
        return status == null
                ? shipmentRepository.findAllByOrderByCreatedAtDesc()
                : shipmentRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public List<Shipment> listForShipper(String shipperId) {
        return shipmentRepository.findByShipperIdOrderByCreatedAtDesc(shipperId);
    }

    @Transactional(readOnly = true)
    public List<ShipmentEvent> history(UUID shipmentId) {
        get(shipmentId);
        return shipmentEventRepository.findByShipmentIdOrderByOccurredAtAsc(shipmentId);
    }

    private void appendEvent(UUID shipmentId, ShipmentStatus from, ShipmentStatus to, String reason) {
        shipmentEventRepository.save(ShipmentEvent.builder()
                .shipmentId(shipmentId)
                .fromStatus(from)
                .toStatus(to)
                .reason(reason)
                .occurredAt(Instant.now())
                .build());
    }

    private void validateWindows(PostShipmentRequest req) {
        if (req.getPickupWindowStart() != null && req.getPickupWindowEnd() != null
                && req.getPickupWindowEnd().isBefore(req.getPickupWindowStart())) {
            throw new ValidationException("INVALID_PICKUP_WINDOW", "Pickup window ends before it starts");
        }
        if (req.getDeliveryWindowStart() != null
                && req.getDeliveryWindowEnd().isBefore(req.getDeliveryWindowStart())) {
            throw new ValidationException("INVALID_DELIVERY_WINDOW", "Delivery window ends before it starts");
        }
        if (req.getPickupWindowStart() != null && req.getDeliveryWindowEnd().isBefore(req.getPickupWindowStart())) {
            throw new ValidationException("INVALID_DELIVERY_WINDOW", "Delivery deadline is before pickup");
        }
    }
}
