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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShipmentLedgerTest {

    @Mock private ShipmentRepository shipmentRepository;
    @Mock private ShipmentEventRepository shipmentEventRepository;
    @Mock private AuctionEventPublisher eventPublisher;

    @InjectMocks
    private ShipmentLedger ledger;

    private Shipment shipment;

    @BeforeEach
    void setUp() {
        shipment = Shipment.builder()
                .id(UUID.randomUUID())
                .shipperId("shp_1")
                .status(ShipmentStatus.BIDDING)
                .currentRound(1)
                .build();
    }

    @Test
    @DisplayName("Transition with the expected current status updates, audits and announces")
    void transitionSucceeds() {
        when(shipmentRepository.findById(shipment.getId())).thenReturn(Optional.of(shipment));
        when(shipmentRepository.saveAndFlush(shipment)).thenReturn(shipment);

        Shipment result = ledger.transition(shipment.getId(), ShipmentStatus.BIDDING, ShipmentStatus.MATCHED,
                "AUCTION_CLOSED", "drv_1");

        assertThat(result.getStatus()).isEqualTo(ShipmentStatus.MATCHED);

        ArgumentCaptor<ShipmentEvent> audit = ArgumentCaptor.forClass(ShipmentEvent.class);
        verify(shipmentEventRepository).save(audit.capture());
        assertThat(audit.getValue().getFromStatus()).isEqualTo(ShipmentStatus.BIDDING);
        assertThat(audit.getValue().getToStatus()).isEqualTo(ShipmentStatus.MATCHED);
        assertThat(audit.getValue().getReason()).isEqualTo("AUCTION_CLOSED");

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publish(eq(KafkaTopics.SHIPMENT_STATUS_CHANGED), eq(shipment.getId().toString()), event.capture());
        ShipmentStatusChangedEvent changed = (ShipmentStatusChangedEvent) event.getValue();
        assertThat(changed.getDriverId()).isEqualTo("drv_1");
        assertThat(changed.getToStatus()).isEqualTo(ShipmentStatus.MATCHED);
    }

    @Test
    @DisplayName("Stale expected status → STALE_STATUS conflict and nothing written")
    void staleStatusRejected() {
        shipment.setStatus(ShipmentStatus.MATCHED);
        when(shipmentRepository.findById(shipment.getId())).thenReturn(Optional.of(shipment));

        assertThatThrownBy(() -> ledger.transition(shipment.getId(), ShipmentStatus.BIDDING, ShipmentStatus.MATCHED, "CLOSE"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("STALE_STATUS");
        verify(shipmentRepository, never()).saveAndFlush(any());
        verify(eventPublisher, never()).publish(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Edges outside the state machine are rejected before loading the row")
    void illegalEdgeRejected() {
        assertThatThrownBy(() -> ledger.transition(shipment.getId(), ShipmentStatus.DELIVERED, ShipmentStatus.BIDDING, "REOPEN"))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("ILLEGAL_TRANSITION");
        verify(shipmentRepository, never()).findById(any());
    }

    @Test
    @DisplayName("Optimistic lock failure on save → CONCURRENT_MODIFICATION conflict")
    void concurrentModification() {
        when(shipmentRepository.findById(shipment.getId())).thenReturn(Optional.of(shipment));
        when(shipmentRepository.saveAndFlush(shipment))
                .thenThrow(new ObjectOptimisticLockingFailureException(Shipment.class, shipment.getId()));

        assertThatThrownBy(() -> ledger.transition(shipment.getId(), ShipmentStatus.BIDDING, ShipmentStatus.CANCELLED, "SHIPPER_CANCELLED"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("CONCURRENT_MODIFICATION");
        verify(shipmentEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unknown shipment → NotFoundException")
    void unknownShipment() {
        UUID id = UUID.randomUUID();
        when(shipmentRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.get(id)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Terminal statuses have no outgoing edges")
    void terminalStatuses() {
        for (ShipmentStatus terminal : EnumSet.of(ShipmentStatus.DELIVERED, ShipmentStatus.CANCELLED, ShipmentStatus.FAILED)) {
            for (ShipmentStatus to : ShipmentStatus.values()) {
                assertThat(ShipmentLedger.isAllowed(terminal, to)).as("%s -> %s", terminal, to).isFalse();
            }
        }
        assertThat(ShipmentLedger.isAllowed(ShipmentStatus.MATCHED, ShipmentStatus.BIDDING)).isTrue();
        assertThat(ShipmentLedger.isAllowed(ShipmentStatus.IN_TRANSIT, ShipmentStatus.CANCELLED)).isFalse();
    }

    @Test
    @DisplayName("Create stores a DRAFT shipment in round 0 with its origin backhaul cell")
    void createDraft() {
        when(shipmentRepository.findByIdempotencyKey("idem-1")).thenReturn(Optional.empty());
        when(shipmentRepository.save(any(Shipment.class))).thenAnswer(inv -> {
            Shipment s = inv.getArgument(0);
            s.setId(UUID.randomUUID());
            return s;
        });

        Shipment created = ledger.create(request().build(), "idem-1");

        assertThat(created.getStatus()).isEqualTo(ShipmentStatus.DRAFT);
        assertThat(created.getCurrentRound()).isZero();
        assertThat(created.getOriginCell()).isEqualTo(H3Util.backhaulCell(41.8781, -87.6298));
        assertThat(created.isRelistOnNoBids()).isTrue();
        verify(shipmentEventRepository).save(any(ShipmentEvent.class));
    }

    @Test
    @DisplayName("Repeated idempotency key returns the first shipment without creating another")
    void createIdempotent() {
        when(shipmentRepository.findByIdempotencyKey("idem-1")).thenReturn(Optional.of(shipment));

        assertThat(ledger.create(request().build(), "idem-1")).isSameAs(shipment);
        verify(shipmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Delivery deadline before pickup start → INVALID_DELIVERY_WINDOW")
    void createRejectsInvertedWindows() {
        Instant pickup = Instant.now().plusSeconds(86_400);
        PostShipmentRequest req = request()
                .pickupWindowStart(pickup)
                .deliveryWindowEnd(pickup.minusSeconds(3600))
                .build();

        assertThatThrownBy(() -> ledger.create(req, null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_DELIVERY_WINDOW");
        verify(shipmentRepository, never()).save(any());
    }

    private static PostShipmentRequest.PostShipmentRequestBuilder request() {
        return PostShipmentRequest.builder()
                .shipperId("shp_1")
                .originLabel("Chicago, IL")
                .originLat(41.8781)
                .originLng(-87.6298)
                .destinationLabel("Indianapolis, IN")
                .destinationLat(39.7684)
                .destinationLng(-86.1581)
                .weightTons(12.0)
                .deliveryWindowEnd(Instant.now().plusSeconds(3 * 86_400));
    }
}
