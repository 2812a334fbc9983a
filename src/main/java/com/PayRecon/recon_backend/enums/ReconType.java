package com.PayRecon.recon_backend.enums;

public enum ReconType {
    HOURS,
    COST,
    COMPLETENESS
}
