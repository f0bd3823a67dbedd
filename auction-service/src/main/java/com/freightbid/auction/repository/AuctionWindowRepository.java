package com.freightbid.auction.repository;

import com.freightbid.auction.entity.AuctionWindow;
import com.freightbid.shared.enums.AuctionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AuctionWindowRepository extends JpaRepository<AuctionWindow, UUID> {

    Optional<AuctionWindow> findByShipmentIdAndRound(UUID shipmentId, int round);

    List<AuctionWindow> findByStateAndClosesAtLessThanEqual(AuctionState state, Instant now);

    List<AuctionWindow> findByStateAndOpensAtLessThanEqual(AuctionState state, Instant now);
}
