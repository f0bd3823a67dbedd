package com.freightbid.auction.repository;

import com.freightbid.auction.entity.Bid;
import com.freightbid.shared.enums.BidStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BidRepository extends JpaRepository<Bid, UUID> {

    List<Bid> findByShipmentIdAndRoundAndStatus(UUID shipmentId, int round, BidStatus status);

    List<Bid> findByShipmentIdAndStatus(UUID shipmentId, BidStatus status);

    List<Bid> findByShipmentIdOrderByPriceAscSubmittedAtAsc(UUID shipmentId);

    boolean existsByShipmentIdAndDriverIdAndStatus(UUID shipmentId, String driverId, BidStatus status);

    List<Bid> findByDriverIdOrderBySubmittedAtDesc(String driverId);

    /** ACTIVE bids a driver holds on any of the given shipments; used for backhaul chaining. */
    List<Bid> findByDriverIdAndStatusAndShipmentIdIn(String driverId, BidStatus status, Collection<UUID> shipmentIds);

    long countByShipmentIdAndStatus(UUID shipmentId, BidStatus status);
}
