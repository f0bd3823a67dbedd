package com.freightbid.auction.entity;

import com.freightbid.shared.enums.BidStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bids",
        indexes = {
                @Index(name = "idx_bid_shipment_round", columnList = "shipment_id, auction_round"),
                @Index(name = "idx_bid_driver", columnList = "driver_id"),
                @Index(name = "idx_bid_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Bid {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "shipment_id", nullable = false)
    private UUID shipmentId;

    /** Auction round of the shipment this bid was placed in; a re-auction starts a new round. */
    @Column(name = "auction_round", nullable = false)
    private int round;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "driver_lat")
    private Double driverLat;

    @Column(name = "driver_lng")
    private Double driverLng;

    @Column(name = "eta_minutes", nullable = false)
    private int etaMinutes;

    @Column(name = "message", length = 500)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BidStatus status;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;
}
