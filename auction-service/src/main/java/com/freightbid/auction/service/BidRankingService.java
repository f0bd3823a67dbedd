package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.Bid;
import com.freightbid.auction.entity.Shipment;
import com.freightbid.auction.model.RankedBid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-factor bid ranking.
 *
 * <pre>
 *   score = wPrice * priceScore + wReputation * reputation + wProximity * proximity + wBackhaul * backhaul
 *   priceScore = ref / (ref + price)      ref = reserve price, else highest bid in the set
 *   proximity  = 0.5 ^ (etaMinutes / halfLifeMinutes)
 * </pre>
 *
 * Ties are broken by earlier submission, then driver id, then bid id, so the
 * order is total and identical inputs always give the same winner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BidRankingService {

    static final Comparator<RankedBid> ORDER = Comparator
            .comparingDouble(RankedBid::getScore).reversed()
            .thenComparing(RankedBid::getSubmittedAt)
            .thenComparing(RankedBid::getDriverId)
            .thenComparing(RankedBid::getBidId);

    private final ReputationScorer reputationScorer;
    private final BackhaulMatcher backhaulMatcher;
    private final AuctionProperties properties;

    public List<RankedBid> rank(Shipment shipment, List<Bid> bids) {
        if (bids.isEmpty()) {
            return List.of();
        }
        Set<String> drivers = bids.stream().map(Bid::getDriverId).collect(Collectors.toSet());
        Map<String, Double> reputations = new HashMap<>();
        for (String driverId : drivers) {
            reputations.put(driverId, reputationScorer.score(driverId));
        }
        Map<String, Double> backhaul = backhaulMatcher.bonuses(shipment, drivers);
        return rank(bids, shipment.getReservePrice(), reputations, backhaul);
    }

    /** Deterministic core: same bids and factor inputs give the same ranking. */
    public List<RankedBid> rank(List<Bid> bids, BigDecimal reservePrice,
                                Map<String, Double> reputations, Map<String, Double> backhaul) {
        AuctionProperties.Ranking w = properties.getRanking();
        BigDecimal reference = reservePrice != null
                ? reservePrice
                : bids.stream().map(Bid::getPrice).max(BigDecimal::compareTo).orElse(BigDecimal.ONE);

        List<RankedBid> scored = new ArrayList<>(bids.size());
        for (Bid bid : bids) {
            double priceScore = priceScore(reference, bid.getPrice());
            double reputation = clamp(reputations.getOrDefault(bid.getDriverId(), ReputationCalculator.NEUTRAL));
            double proximity = proximityScore(bid.getEtaMinutes(), w.getProximityHalfLifeMinutes());
            double bonus = clamp(backhaul.getOrDefault(bid.getDriverId(), 0.0));

            double score = w.getPriceWeight() * priceScore
                    + w.getReputationWeight() * reputation
                    + w.getProximityWeight() * proximity
                    + w.getBackhaulWeight() * bonus;

            scored.add(RankedBid.builder()
                    .bidId(bid.getId())
                    .driverId(bid.getDriverId())
                    .price(bid.getPrice())
                    .submittedAt(bid.getSubmittedAt())
                    .priceScore(priceScore)
                    .reputation(reputation)
                    .proximity(proximity)
                    .backhaulBonus(bonus)
                    .score(score)
                    .build());
        }

        scored.sort(ORDER);
        for (int i = 0; i < scored.size(); i++) {
            scored.get(i).setRank(i + 1);
        }
        return scored;
    }

    static double priceScore(BigDecimal reference, BigDecimal price) {
        BigDecimal denominator = reference.add(price);
        if (denominator.signum() <= 0) {
            return 0.0;
        }
        return clamp(reference.divide(denominator, 10, RoundingMode.HALF_UP).doubleValue());
    }

    static double proximityScore(int etaMinutes, double halfLifeMinutes) {
        if (halfLifeMinutes <= 0) {
            return 0.0;
        }
        return clamp(Math.pow(0.5, Math.max(0, etaMinutes) / halfLifeMinutes));
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
