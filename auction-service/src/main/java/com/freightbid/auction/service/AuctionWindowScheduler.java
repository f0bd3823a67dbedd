package com.freightbid.auction.service;

import com.freightbid.auction.entity.AuctionWindow;
import com.freightbid.auction.exception.AuctionException;
import com.freightbid.auction.repository.AuctionWindowRepository;
import com.freightbid.shared.enums.AuctionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Timer side of the auction lifecycle: opens PENDING windows whose start has
 * come and closes OPEN windows that have expired. Shipper-initiated closes go
 * through the same idempotent {@link AuctionCoordinator#close}.
 *
 * A failure on one window is logged and the sweep moves on; the window is
 * picked up again on the next tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionWindowScheduler {

    private final AuctionWindowRepository windowRepository;
    private final AuctionCoordinator coordinator;

    @Scheduled(fixedDelayString = "${auction.window.sweep-interval-ms:1000}")
    public void sweep() {
        Instant now = Instant.now();
        openDueWindows(now);
        closeExpiredWindows(now);
    }

    void openDueWindows(Instant now) {
        List<AuctionWindow> due = windowRepository.findByStateAndOpensAtLessThanEqual(AuctionState.PENDING, now);
        for (AuctionWindow window : due) {
            try {
                coordinator.openScheduled(window.getId());
            } catch (AuctionException e) {
                log.warn("Scheduled open of shipment {} round {} failed [{}]: {}",
                        window.getShipmentId(), window.getRound(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Scheduled open of shipment {} round {} failed unexpectedly",
                        window.getShipmentId(), window.getRound(), e);
            }
        }
    }

    void closeExpiredWindows(Instant now) {
        List<AuctionWindow> expired = windowRepository.findByStateAndClosesAtLessThanEqual(AuctionState.OPEN, now);
        for (AuctionWindow window : expired) {
            try {
                coordinator.close(window.getShipmentId());
            } catch (AuctionException e) {
                log.warn("Timed close of shipment {} round {} failed [{}]: {}",
                        window.getShipmentId(), window.getRound(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Timed close of shipment {} round {} failed unexpectedly",
                        window.getShipmentId(), window.getRound(), e);
            }
        }
    }
}
