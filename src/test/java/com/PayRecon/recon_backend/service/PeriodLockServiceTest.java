package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.exception.PeriodLockedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PeriodLockService")
class PeriodLockServiceTest {

    private PeriodLockService lockService;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setLockWaitSeconds(0);
        lockService = new PeriodLockService(properties);
    }

    @Test
    @DisplayName("Should run the operation and release the lock")
    void shouldRunAndRelease() {
        String result = lockService.executeWithLock("2025-11-30", () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(lockService.isLocked("2025-11-30")).isFalse();
    }

    @Test
    @DisplayName("Should hand the same period lock to every later operation")
    void shouldReuseReleasedLock() {
        lockService.executeWithLock("2025-11-30", () -> "first");

        // Nested call succeeds only if the outer and inner calls share one reentrant lock
        String result = lockService.executeWithLock("2025-11-30",
                () -> lockService.executeWithLock("2025-11-30", () -> "second"));

        assertThat(result).isEqualTo("second");
        assertThat(lockService.isLocked("2025-11-30")).isFalse();
    }

    @Test
    @DisplayName("Should release the lock when the operation throws")
    void shouldReleaseOnFailure() {
        assertThatThrownBy(() -> lockService.executeWithLock("2025-11-30", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockService.isLocked("2025-11-30")).isFalse();
    }

    @Test
    @DisplayName("Should reject a second operation on a busy period but not on another period")
    void shouldSerialisePerPeriod() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> holder = executor.submit(() -> lockService.executeWithLock("2025-11-30", () -> {
                holding.countDown();
                try {
                    return release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> lockService.executeWithLock("2025-11-30", () -> "second"))
                    .isInstanceOf(PeriodLockedException.class)
                    .hasMessageContaining("2025-11-30");
            assertThat(lockService.executeWithLock("2025-11-16", () -> "other")).isEqualTo("other");

            release.countDown();
            assertThat(holder.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
