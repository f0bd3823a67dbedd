package com.freightbid.auction.entity;

import com.freightbid.shared.enums.CargoType;
import com.freightbid.shared.enums.ShipmentStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "shipments",
        indexes = {
                @Index(name = "idx_shipment_shipper", columnList = "shipper_id"),
                @Index(name = "idx_shipment_status", columnList = "status"),
                @Index(name = "idx_shipment_origin_cell", columnList = "origin_cell"),
                @Index(name = "idx_shipment_idempotency", columnList = "idempotency_key", unique = true)
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Shipment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Optimistic lock version. Status changes go through ShipmentLedger.transition,
     * which compares the expected status and lets a stale version fail the flush.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "shipper_id", nullable = false)
    private String shipperId;

    @Column(name = "origin_label", nullable = false)
    private String originLabel;

    @Column(name = "origin_lat", nullable = false)
    private double originLat;

    @Column(name = "origin_lng", nullable = false)
    private double originLng;

    /** H3 cell of the origin at the backhaul resolution; indexed for chained-load lookups. */
    @Column(name = "origin_cell", length = 32)
    private String originCell;

    @Column(name = "destination_label", nullable = false)
    private String destinationLabel;

    @Column(name = "destination_lat", nullable = false)
    private double destinationLat;

    @Column(name = "destination_lng", nullable = false)
    private double destinationLng;

    @Column(name = "weight_tons", nullable = false)
    private double weightTons;

    @Enumerated(EnumType.STRING)
    @Column(name = "cargo_type", nullable = false)
    private CargoType cargoType;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "pickup_window_start")
    private Instant pickupWindowStart;

    @Column(name = "pickup_window_end")
    private Instant pickupWindowEnd;

    @Column(name = "delivery_window_start")
    private Instant deliveryWindowStart;

    @Column(name = "delivery_window_end", nullable = false)
    private Instant deliveryWindowEnd;

    @Column(name = "reserve_price", precision = 12, scale = 2)
    private BigDecimal reservePrice;

    /** Shipper preference when an auction closes with no bids: re-list (true) or cancel. */
    @Column(name = "relist_on_no_bids", nullable = false)
    private boolean relistOnNoBids;

    @Column(name = "current_round", nullable = false)
    private int currentRound;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ShipmentStatus status;

    @Column(name = "idempotency_key", unique = true)
    private String idempotencyKey;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
