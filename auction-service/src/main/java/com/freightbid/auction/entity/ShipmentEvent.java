package com.freightbid.auction.entity;

import com.freightbid.shared.enums.ShipmentStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record appended by the ledger on every successful status transition.
 */
@Entity
@Immutable
@Table(name = "shipment_events",
        indexes = @Index(name = "idx_shipment_event_shipment", columnList = "shipment_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShipmentEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "shipment_id", nullable = false)
    private UUID shipmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status")
    private ShipmentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false)
    private ShipmentStatus toStatus;

    @Column(name = "reason")
    private String reason;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
