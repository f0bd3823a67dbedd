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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Backhaul search and bonus. Geometry uses real H3 cells around Chicago; the
 * repository returns whatever the cell query would.
 */
@ExtendWith(MockitoExtension.class)
class BackhaulMatcherTest {

    // Load delivered into Chicago
    private static final double DEST_LAT = 41.8781;
    private static final double DEST_LNG = -87.6298;

    @Mock private ShipmentRepository shipmentRepository;
    @Mock private BidRepository bidRepository;
    @Mock private FeatureFlagService featureFlagService;
    @Mock private PlatformTransactionManager transactionManager;
    @Mock private TransactionStatus transactionStatus;

    private SimpleMeterRegistry registry;
    private BackhaulMatcher matcher;
    private Shipment delivered;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        matcher = new BackhaulMatcher(shipmentRepository, bidRepository, featureFlagService,
                new AuctionProperties(), new AuctionMetrics(registry), transactionManager);
        lenient().when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        delivered = Shipment.builder()
                .id(UUID.randomUUID())
                .destinationLat(DEST_LAT)
                .destinationLng(DEST_LNG)
                .build();
    }

    @Test
    @DisplayName("Nearby open loads are returned nearest first; loads beyond the radius are dropped")
    void findsChainedLoadsWithinRadius() {
        Shipment near = openLoad(41.90, -87.65);     // ~3 km
        Shipment mid = openLoad(42.10, -87.70);      // ~25 km
        Shipment far = openLoad(43.20, -87.90);      // ~148 km
        when(shipmentRepository.findByOriginCellInAndStatusInAndIdNot(anyCollection(), anyCollection(), eq(delivered.getId())))
                .thenReturn(List.of(far, mid, near));

        List<BackhaulCandidate> chained = matcher.findChainedLoads(delivered);

        assertThat(chained).extracting(BackhaulCandidate::getShipmentId).containsExactly(near.getId(), mid.getId());
    }

    @Test
    @DisplayName("Search cells include the destination's own backhaul cell")
    void searchCellsCoverDestination() {
        when(shipmentRepository.findByOriginCellInAndStatusInAndIdNot(anyCollection(), anyCollection(), any()))
                .thenAnswer(inv -> {
                    assertThat(inv.<Collection<String>>getArgument(0))
                            .contains(H3Util.backhaulCell(DEST_LAT, DEST_LNG));
                    assertThat(inv.<Collection<ShipmentStatus>>getArgument(1))
                            .containsExactlyInAnyOrder(ShipmentStatus.OPEN, ShipmentStatus.BIDDING);
                    return List.of();
                });

        assertThat(matcher.findChainedLoads(delivered)).isEmpty();
    }

    @Test
    @DisplayName("Driver already bidding on the chained load gets the full decay bonus, others the opportunity share")
    void bonusDependsOnDriverBid() {
        Shipment next = openLoad(42.10, -87.70);
        double d = H3Util.distanceKm(DEST_LAT, DEST_LNG, next.getOriginLat(), next.getOriginLng());
        double decay = 1.0 - d / 75.0;

        when(featureFlagService.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)).thenReturn(true);
        when(shipmentRepository.findByOriginCellInAndStatusInAndIdNot(anyCollection(), anyCollection(), any()))
                .thenReturn(List.of(next));
        when(bidRepository.findByDriverIdAndStatusAndShipmentIdIn(eq("drv_chain"), eq(BidStatus.ACTIVE), anyCollection()))
                .thenReturn(List.of(Bid.builder().shipmentId(next.getId()).driverId("drv_chain").build()));
        when(bidRepository.findByDriverIdAndStatusAndShipmentIdIn(eq("drv_other"), eq(BidStatus.ACTIVE), anyCollection()))
                .thenReturn(List.of());

        Map<String, Double> bonuses = matcher.bonuses(delivered, List.of("drv_chain", "drv_other"));

        assertThat(bonuses.get("drv_chain")).isCloseTo(decay, within(1e-9));
        assertThat(bonuses.get("drv_other")).isCloseTo(decay * 0.5, within(1e-9));
        assertThat(bonuses.values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Flag off → no bonus and no search")
    void flagDisablesBonus() {
        when(featureFlagService.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)).thenReturn(false);

        assertThat(matcher.bonuses(delivered, List.of("drv_a"))).isEmpty();
        verifyNoInteractions(shipmentRepository, bidRepository);
    }

    @Test
    @DisplayName("Lookup failure degrades to zero bonus instead of failing the ranking")
    void failureDegradesToZero() {
        when(featureFlagService.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)).thenReturn(true);
        when(shipmentRepository.findByOriginCellInAndStatusInAndIdNot(anyCollection(), anyCollection(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThat(matcher.bonuses(delivered, List.of("drv_a"))).isEmpty();
        assertThat(registry.counter("auction.backhaul_degraded").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Bonus lookup runs in its own read-only transaction, rolled back alone on failure")
    void lookupIsolatedFromCaller() {
        when(featureFlagService.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)).thenReturn(true);
        when(shipmentRepository.findByOriginCellInAndStatusInAndIdNot(anyCollection(), anyCollection(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        matcher.bonuses(delivered, List.of("drv_a"));

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior()).isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        assertThat(definition.getValue().isReadOnly()).isTrue();
        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
    }

    private static Shipment openLoad(double lat, double lng) {
        return Shipment.builder()
                .id(UUID.randomUUID())
                .originLabel("origin " + lat)
                .originLat(lat)
                .originLng(lng)
                .status(ShipmentStatus.OPEN)
                .build();
    }
}
