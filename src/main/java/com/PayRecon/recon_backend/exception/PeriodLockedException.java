package com.PayRecon.recon_backend.exception;

import org.springframework.http.HttpStatus;

public class PeriodLockedException extends ApiException {
    public PeriodLockedException(String periodId) {
        super(String.format("Period %s is busy with another operation, try again shortly", periodId),
                HttpStatus.CONFLICT,
                "PERIOD_LOCKED");
    }

    public PeriodLockedException(String periodId, Throwable cause) {
        super(String.format("Interrupted while waiting for period %s", periodId),
                HttpStatus.CONFLICT,
                "PERIOD_LOCKED",
                cause);
    }
}
