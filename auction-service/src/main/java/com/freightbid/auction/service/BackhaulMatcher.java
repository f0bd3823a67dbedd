package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.Bid;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.metrics.AuctionMetrics;
import com.freightbid.auction.model.BackhaulCandidate;
import com.freightbid.auction.repository.BidRepository;
import com.freightbid.auction.repository.ShipmentRepository;
import com.freightbid.shared.enums.BidStatus;
import com.freightbid.shared.enums.ShipmentStatus;
import com.freightbid.shared.featureflag.FeatureFlagService;
import com.freightbid.shared.util.H3Util;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Finds chained loads: open shipments whose origin lies near another
 * shipment's destination, so a driver can avoid an empty return leg.
 *
 * Search: H3 cells around the destination, candidate shipments by origin cell,
 * exact haversine filter, nearest first. Reads only and never takes shipment locks.
 */
@Slf4j
@Service
public class BackhaulMatcher {

    private static final Set<ShipmentStatus> CHAINABLE = EnumSet.of(ShipmentStatus.OPEN, ShipmentStatus.BIDDING);

    private final ShipmentRepository shipmentRepository;
    private final BidRepository bidRepository;
    private final FeatureFlagService featureFlagService;
    private final AuctionProperties properties;
    private final AuctionMetrics metrics;
    private final TransactionTemplate isolatedRead;

    public BackhaulMatcher(ShipmentRepository shipmentRepository,
                           BidRepository bidRepository,
                           FeatureFlagService featureFlagService,
                           AuctionProperties properties,
                           AuctionMetrics metrics,
                           PlatformTransactionManager transactionManager) {
        this.shipmentRepository = shipmentRepository;
        this.bidRepository = bidRepository;
        this.featureFlagService = featureFlagService;
        this.properties = properties;
        this.metrics = metrics;
        // a failed lookup must not mark the caller's transaction rollback-only
        this.isolatedRead = new TransactionTemplate(transactionManager);
        this.isolatedRead.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.isolatedRead.setReadOnly(true);
    }

    public List<BackhaulCandidate> findChainedLoads(Shipment shipment) {
        AuctionProperties.Backhaul cfg = properties.getBackhaul();
        List<String> cells = H3Util.backhaulCellsWithin(
                shipment.getDestinationLat(), shipment.getDestinationLng(), cfg.getRadiusKm());

        return shipmentRepository.findByOriginCellInAndStatusInAndIdNot(cells, CHAINABLE, shipment.getId())
                .stream()
                .map(s -> BackhaulCandidate.builder()
                        .shipmentId(s.getId())
                        .originLabel(s.getOriginLabel())
                        .distanceKm(H3Util.distanceKm(shipment.getDestinationLat(), shipment.getDestinationLng(),
                                s.getOriginLat(), s.getOriginLng()))
                        .build())
                .filter(c -> c.getDistanceKm() <= cfg.getRadiusKm())
                .sorted(Comparator.comparingDouble(BackhaulCandidate::getDistanceKm)
                        .thenComparing(BackhaulCandidate::getShipmentId))
                .limit(cfg.getMaxResults())
                .toList();
    }

    /**
     * Backhaul bonus in [0,1] per driver. A chained load at distance d is worth
     * {@code 1 - d/radius}; the bonus is the best such value, at full strength
     * where the driver already holds an ACTIVE bid on that load and scaled by
     * the opportunity factor otherwise. Drivers missing from the map get 0.
     *
     * Runs in its own read-only transaction. Any failure, including an
     * unreachable flag store, degrades to an empty map.
     */
    public Map<String, Double> bonuses(Shipment shipment, Collection<String> driverIds) {
        try {
            return isolatedRead.execute(status -> computeBonuses(shipment, driverIds));
        } catch (RuntimeException e) {
            metrics.recordBackhaulDegraded();
            log.warn("Backhaul lookup failed for shipment {}, ranking without bonus: {}", shipment.getId(), e.getMessage());
            return Map.of();
        }
    }

    private Map<String, Double> computeBonuses(Shipment shipment, Collection<String> driverIds) {
        if (!featureFlagService.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)) {
            return Map.of();
        }
        List<BackhaulCandidate> chained = findChainedLoads(shipment);
        if (chained.isEmpty()) {
            return Map.of();
        }

        AuctionProperties.Backhaul cfg = properties.getBackhaul();
        List<UUID> chainedIds = chained.stream().map(BackhaulCandidate::getShipmentId).toList();
        Map<String, Double> result = new HashMap<>();
        for (String driverId : driverIds) {
            Set<UUID> bidOn = bidRepository.findByDriverIdAndStatusAndShipmentIdIn(driverId, BidStatus.ACTIVE, chainedIds)
                    .stream()
                    .map(Bid::getShipmentId)
                    .collect(Collectors.toSet());
            double best = 0.0;
            for (BackhaulCandidate c : chained) {
                double decay = Math.max(0.0, 1.0 - c.getDistanceKm() / cfg.getRadiusKm());
                double value = bidOn.contains(c.getShipmentId()) ? decay : decay * cfg.getOpportunityFactor();
                best = Math.max(best, value);
            }
            result.put(driverId, Math.min(1.0, best));
        }
        return result;
    }
}
