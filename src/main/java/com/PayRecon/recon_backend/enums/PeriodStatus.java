package com.PayRecon.recon_backend.enums;

public enum PeriodStatus {
    INCOMPLETE,
    UPLOADED,
    RECONCILING,
    REVIEW,
    APPROVED,
    POSTED
}
