package com.freightbid.auction.entity;

import com.freightbid.shared.enums.AuctionState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Bidding window of one auction round. Kept after the round ends so that a
 * repeated close can answer with the committed match.
 */
@Entity
@Table(name = "auction_windows",
        uniqueConstraints = @UniqueConstraint(name = "uq_window_shipment_round", columnNames = {"shipment_id", "auction_round"}),
        indexes = {
                @Index(name = "idx_window_state", columnList = "state"),
                @Index(name = "idx_window_closes_at", columnList = "closes_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class AuctionWindow {

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

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AuctionState state;

    /** Scheduled opening for PENDING windows. */
    @Column(name = "opens_at")
    private Instant opensAt;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    /** Null means the window only closes on an explicit shipper action. */
    @Column(name = "closes_at")
    private Instant closesAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "match_id")
    private UUID matchId;

    public boolean isExpired(Instant now) {
        return closesAt != null && !now.isBefore(closesAt);
    }

    /** True once no further bids may be accepted into this window. */
    public boolean acceptsNoBids(Instant now) {
        return state.isClosed() || (state == AuctionState.OPEN && isExpired(now));
    }
}
