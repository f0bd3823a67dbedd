package com.freightbid.auction.repository;

import com.freightbid.auction.entity.Match;
import com.freightbid.shared.enums.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<Match, UUID> {

    Optional<Match> findByShipmentIdAndExecutionStatusIn(UUID shipmentId, Collection<ExecutionStatus> statuses);

    Optional<Match> findByShipmentIdAndRound(UUID shipmentId, int round);

    List<Match> findByShipmentIdOrderByCommittedAtDesc(UUID shipmentId);

    List<Match> findByExecutionStatus(ExecutionStatus status);
}
