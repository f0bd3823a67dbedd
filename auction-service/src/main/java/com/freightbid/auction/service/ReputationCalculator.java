package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.DriverProfile;
import com.freightbid.auction.model.ReputationCounters;
import org.springframework.stereotype.Component;

/**
 * Pure reputation formula: a Bayesian ratio of credited jobs to weighted history.
 *
 * <pre>
 *   score = (onTime + lateCredit * late + prior * 0.5)
 *         / (onTime + late + preW * preMatch + postW * postMatch + pickupW * postPickup + prior)
 * </pre>
 *
 * With positive weights and {@code lateCredit < 1} the result lies strictly in (0,1),
 * starts at 0.5, falls with every cancellation and rises with every on-time job.
 */
@Component
public class ReputationCalculator {

    public static final double NEUTRAL = 0.5;

    private final AuctionProperties.Reputation cfg;

    public ReputationCalculator(AuctionProperties properties) {
        this.cfg = properties.getReputation();
    }

    public double score(int onTime, int late, int preMatch, int postMatch, int postPickup) {
        double prior = cfg.getPriorWeight();
        double credited = onTime + cfg.getLateCredit() * late + prior * NEUTRAL;
        double weighted = onTime + late
                + cfg.getPreMatchWeight() * preMatch
                + cfg.getPostMatchWeight() * postMatch
                + cfg.getPostPickupWeight() * postPickup
                + prior;
        if (weighted <= 0) {
            return NEUTRAL;
        }
        return Math.min(1.0, Math.max(0.0, credited / weighted));
    }

    public double score(DriverProfile p) {
        return score(p.getOnTimeJobs(), p.getLateJobs(), p.getPreMatchCancellations(),
                p.getPostMatchCancellations(), p.getPostPickupFailures());
    }

    public double score(ReputationCounters c) {
        return score(c.getOnTimeJobs(), c.getLateJobs(), c.getPreMatchCancellations(),
                c.getPostMatchCancellations(), c.getPostPickupFailures());
    }

    /** Profiles store the score on a 0-100 scale. */
    public static double toStored(double score) {
        return Math.round(score * 10_000) / 100.0;
    }
}
