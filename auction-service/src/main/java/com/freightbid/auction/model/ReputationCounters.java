package com.freightbid.auction.model;

/**
 * Read-only view of the reputation inputs of a driver profile. Never attached
 * to a persistence context, so reading it does not pin a profile version.
 */
public interface ReputationCounters {

    int getOnTimeJobs();

    int getLateJobs();

    int getPreMatchCancellations();

    int getPostMatchCancellations();

    int getPostPickupFailures();
}
