package com.PayRecon.recon_backend.exception;

import com.PayRecon.recon_backend.enums.SourceSystem;
import org.springframework.http.HttpStatus;

/**
 * A required fact set has not been ingested for the period.
 */
public class DataUnavailableException extends ApiException {
    public DataUnavailableException(String periodId, SourceSystem source) {
        super(String.format("No %s data available for period %s", source.getDisplayName(), periodId),
                HttpStatus.CONFLICT,
                "DATA_UNAVAILABLE");
    }
}
