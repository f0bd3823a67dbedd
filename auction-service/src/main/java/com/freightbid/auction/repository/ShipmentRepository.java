package com.freightbid.auction.repository;

import com.freightbid.auction.entity.Shipment;
import com.freightbid.shared.enums.ShipmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShipmentRepository extends JpaRepository<Shipment, UUID> {

    Optional<Shipment> findByIdempotencyKey(String idempotencyKey);

    List<Shipment> findByStatusOrderByCreatedAtDesc(ShipmentStatus status);

    List<Shipment> findAllByOrderByCreatedAtDesc();

    List<Shipment> findByShipperIdOrderByCreatedAtDesc(String shipperId);

    /** Backhaul candidates: shipments whose origin falls in one of the given H3 cells. */
    List<Shipment> findByOriginCellInAndStatusInAndIdNot(Collection<String> originCells,
                                                         Collection<ShipmentStatus> statuses,
                                                         UUID excludedId);
}
