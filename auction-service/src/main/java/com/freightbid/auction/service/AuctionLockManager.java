package com.freightbid.auction.service;

import com.freightbid.auction.config.AuctionProperties;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.metrics.AuctionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-shipment and per-driver critical sections backed by Redisson locks.
 *
 * A lock is always held until the transaction doing the guarded work has
 * completed, so the next holder reads committed state:
 *  - no transaction active: a new one is opened inside the lock and committed before unlocking
 *  - transaction active: the work joins it and the unlock runs after completion
 *
 * Lock order is shipment before driver; a shipment lock is never nested in another.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionLockManager {

    static final String SHIPMENT_LOCK_PREFIX = "lock:shipment:";
    static final String DRIVER_LOCK_PREFIX = "lock:driver:";

    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;
    private final AuctionProperties properties;
    private final AuctionMetrics metrics;

    public <T> T withShipmentLock(UUID shipmentId, Supplier<T> work) {
        return withLock(SHIPMENT_LOCK_PREFIX + shipmentId, "SHIPMENT_BUSY",
                "Shipment " + shipmentId + " is being modified, retry shortly", work);
    }

    public <T> T withDriverLock(String driverId, Supplier<T> work) {
        return withLock(DRIVER_LOCK_PREFIX + driverId, "DRIVER_BUSY",
                "Driver " + driverId + " is being updated, retry shortly", work);
    }

    private <T> T withLock(String key, String busyCode, String busyMessage, Supplier<T> work) {
        RLock lock = redissonClient.getLock(key);
        acquire(lock, key, busyCode, busyMessage);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    release(lock);
                }
            });
            return work.get();
        }

        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            // version clash detected at commit, after the guarded work returned
            log.warn("Commit under {} lost an optimistic lock race: {}", key, e.getMessage());
            throw new ConflictException("CONCURRENT_MODIFICATION",
                    "State under " + key + " was modified concurrently, retry with fresh state");
        } finally {
            release(lock);
        }
    }

    private void acquire(RLock lock, String key, String busyCode, String busyMessage) {
        AuctionProperties.Lock cfg = properties.getLock();
        boolean acquired;
        try {
            acquired = lock.tryLock(cfg.getWaitMillis(), cfg.getLeaseMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException(busyCode, "Interrupted while waiting for " + key);
        }
        if (!acquired) {
            metrics.recordLockContention();
            log.warn("Could not acquire {} within {}ms", key, cfg.getWaitMillis());
            throw new ConflictException(busyCode, busyMessage);
        }
    }

    private void release(RLock lock) {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
