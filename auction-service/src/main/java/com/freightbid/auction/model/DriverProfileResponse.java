package com.freightbid.auction.model;

import com.freightbid.auction.entity.DriverProfile;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DriverProfileResponse {
    private String driverId;
    private double reputationScore;
    private int completedJobs;
    private int onTimeJobs;
    private int lateJobs;
    private int cancellationCount;
    private int preMatchCancellations;
    private int postMatchCancellations;
    private int postPickupFailures;
    private Double currentLat;
    private Double currentLng;
    private boolean available;

    public static DriverProfileResponse from(DriverProfile p) {
        return DriverProfileResponse.builder()
                .driverId(p.getDriverId())
                .reputationScore(p.getReputationScore())
                .completedJobs(p.getCompletedJobs())
                .onTimeJobs(p.getOnTimeJobs())
                .lateJobs(p.getLateJobs())
                .cancellationCount(p.getCancellationCount())
                .preMatchCancellations(p.getPreMatchCancellations())
                .postMatchCancellations(p.getPostMatchCancellations())
                .postPickupFailures(p.getPostPickupFailures())
                .currentLat(p.getCurrentLat())
                .currentLng(p.getCurrentLng())
                .available(p.isAvailable())
                .build();
    }
}
