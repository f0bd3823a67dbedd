package com.freightbid.auction.entity;

import com.freightbid.shared.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "matches",
        uniqueConstraints = @UniqueConstraint(name = "uq_match_shipment_round", columnNames = {"shipment_id", "auction_round"}),
        indexes = {
                @Index(name = "idx_match_shipment", columnList = "shipment_id"),
                @Index(name = "idx_match_driver", columnList = "driver_id"),
                @Index(name = "idx_match_status", columnList = "execution_status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "shipment_id", nullable = false)
    private UUID shipmentId;

    @Column(name = "auction_round", nullable = false)
    private int round;

    @Column(name = "winning_bid_id", nullable = false, unique = true)
    private UUID winningBidId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_status", nullable = false)
    private ExecutionStatus executionStatus;

    @Column(name = "picked_up_at")
    private Instant pickedUpAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "closed_reason")
    private String closedReason;
}
