package com.freightbid.auction.repository;

import com.freightbid.auction.entity.DriverProfile;
import com.freightbid.auction.model.ReputationCounters;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DriverProfileRepository extends JpaRepository<DriverProfile, String> {

    @Query("SELECT p.onTimeJobs AS onTimeJobs, p.lateJobs AS lateJobs, "
            + "p.preMatchCancellations AS preMatchCancellations, p.postMatchCancellations AS postMatchCancellations, "
            + "p.postPickupFailures AS postPickupFailures FROM DriverProfile p WHERE p.driverId = :driverId")
    Optional<ReputationCounters> findReputationCounters(@Param("driverId") String driverId);
}
