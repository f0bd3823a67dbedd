package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.entity.DriverProfile;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.metrics.AuctionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuctionLockManagerTest {

    @Mock private RedissonClient redissonClient;
    @Mock private TransactionTemplate transactionTemplate;
    @Mock private RLock lock;

    private SimpleMeterRegistry registry;
    private AuctionLockManager lockManager;
    private final UUID shipmentId = UUID.randomUUID();

    @BeforeEach
    void setUp() throws InterruptedException {
        registry = new SimpleMeterRegistry();
        lockManager = new AuctionLockManager(redissonClient, transactionTemplate, new AuctionProperties(),
                new AuctionMetrics(registry));
        when(redissonClient.getLock("lock:shipment:" + shipmentId)).thenReturn(lock);
        lenient().when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(true);
    }

    @Test
    @DisplayName("Work runs in a fresh transaction and the lock is released after commit")
    @SuppressWarnings("unchecked")
    void runsWorkInTransaction() {
        when(transactionTemplate.execute(any())).thenAnswer(inv -> ((TransactionCallback<Object>) inv.getArgument(0)).doInTransaction(null));
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        assertThat(lockManager.withShipmentLock(shipmentId, () -> "closed")).isEqualTo("closed");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("Version clash detected at commit → CONCURRENT_MODIFICATION conflict, lock still released")
    void commitTimeVersionClashIsConflict() {
        when(transactionTemplate.execute(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(DriverProfile.class, "drv_1"));
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        assertThatThrownBy(() -> lockManager.withShipmentLock(shipmentId, () -> "closed"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("CONCURRENT_MODIFICATION");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("Lock not acquired in time → SHIPMENT_BUSY without starting a transaction")
    void busyLock() throws InterruptedException {
        when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(false);

        assertThatThrownBy(() -> lockManager.withShipmentLock(shipmentId, () -> "closed"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("SHIPMENT_BUSY");
        verify(transactionTemplate, never()).execute(any());
        assertThat(registry.counter("auction.lock_contention").count()).isEqualTo(1.0);
    }
}
