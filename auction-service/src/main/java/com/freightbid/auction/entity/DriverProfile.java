package com.freightbid.auction.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Driver trust record. Counters are the full input of the reputation formula;
 * {@code reputationScore} caches its result on a 0-100 scale.
 */
@Entity
@Table(name = "driver_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "driverId")
public class DriverProfile {

    @Id
    @Column(name = "driver_id", length = 64)
    private String driverId;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "reputation_score", nullable = false)
    private double reputationScore;

    @Column(name = "completed_jobs", nullable = false)
    private int completedJobs;

    @Column(name = "on_time_jobs", nullable = false)
    private int onTimeJobs;

    @Column(name = "late_jobs", nullable = false)
    private int lateJobs;

    @Column(name = "cancellation_count", nullable = false)
    private int cancellationCount;

    @Column(name = "pre_match_cancellations", nullable = false)
    private int preMatchCancellations;

    @Column(name = "post_match_cancellations", nullable = false)
    private int postMatchCancellations;

    @Column(name = "post_pickup_failures", nullable = false)
    private int postPickupFailures;

    @Column(name = "current_lat")
    private Double currentLat;

    @Column(name = "current_lng")
    private Double currentLng;

    @Column(name = "location_updated_at")
    private Instant locationUpdatedAt;

    @Column(name = "available", nullable = false)
    private boolean available;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
