package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.exception.PeriodLockedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises mutating operations on the same pay period within this process.
 * Different periods proceed concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodLockService {

    private final ReconciliationProperties properties;
    // One entry per period id for the life of the process, never evicted. A released lock may
    // still be held by a waiting caller, so removing it could hand out a second lock for the same period.
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T executeWithLock(String periodId, Supplier<T> operation) {
        ReentrantLock lock = locks.computeIfAbsent(periodId, key -> new ReentrantLock(true));
        long waitSeconds = properties.getLockWaitSeconds();
        boolean lockAcquired = false;

        try {
            log.debug("Attempting to acquire period lock: {}", periodId);
            lockAcquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);

            if (!lockAcquired) {
                log.warn("Failed to acquire period lock: {} within {} seconds", periodId, waitSeconds);
                throw new PeriodLockedException(periodId);
            }

            log.debug("Period lock acquired: {}", periodId);
            return operation.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeriodLockedException(periodId, e);

        } finally {
            if (lockAcquired) {
                lock.unlock();
                log.debug("Period lock released: {}", periodId);
            }
        }
    }

    public boolean isLocked(String periodId) {
        ReentrantLock lock = locks.get(periodId);
        return lock != null && lock.isLocked();
    }
}
