package com.freightbid.auction.service;

import com.freightbid.auction.entity.AuctionWindow;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.repository.AuctionWindowRepository;
import com.freightbid.shared.enums.AuctionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuctionWindowSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private AuctionWindowRepository windowRepository;
    @Mock private AuctionCoordinator coordinator;

    @InjectMocks
    private AuctionWindowScheduler scheduler;

    @Test
    @DisplayName("Expired OPEN windows are closed through the coordinator; failures on one do not skip the rest")
    void closesExpiredWindows() {
        AuctionWindow busy = window(AuctionState.OPEN);
        AuctionWindow stale = window(AuctionState.OPEN);
        AuctionWindow last = window(AuctionState.OPEN);
        when(windowRepository.findByStateAndClosesAtLessThanEqual(AuctionState.OPEN, NOW)).thenReturn(List.of(busy, stale, last));
        when(coordinator.close(busy.getShipmentId())).thenThrow(new ConflictException("SHIPMENT_BUSY", "busy"));
        when(coordinator.close(stale.getShipmentId()))
                .thenThrow(new ObjectOptimisticLockingFailureException(AuctionWindow.class, stale.getId()));

        scheduler.closeExpiredWindows(NOW);

        verify(coordinator).close(last.getShipmentId());
    }

    @Test
    @DisplayName("PENDING windows whose start has come are opened")
    void opensDueWindows() {
        AuctionWindow pending = window(AuctionState.PENDING);
        when(windowRepository.findByStateAndOpensAtLessThanEqual(AuctionState.PENDING, NOW)).thenReturn(List.of(pending));

        scheduler.openDueWindows(NOW);

        verify(coordinator).openScheduled(pending.getId());
    }

    @Test
    @DisplayName("An unexpected failure opening one window does not stop the others")
    void openFailureDoesNotStopSweep() {
        AuctionWindow broken = window(AuctionState.PENDING);
        AuctionWindow next = window(AuctionState.PENDING);
        when(windowRepository.findByStateAndOpensAtLessThanEqual(AuctionState.PENDING, NOW)).thenReturn(List.of(broken, next));
        doThrow(new NoSuchElementException("No value present")).when(coordinator).openScheduled(broken.getId());

        scheduler.openDueWindows(NOW);

        verify(coordinator).openScheduled(next.getId());
    }

    private static AuctionWindow window(AuctionState state) {
        return AuctionWindow.builder()
                .id(UUID.randomUUID())
                .shipmentId(UUID.randomUUID())
                .round(1)
                .state(state)
                .build();
    }
}
