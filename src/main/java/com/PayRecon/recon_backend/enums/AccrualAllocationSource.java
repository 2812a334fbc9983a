package com.PayRecon.recon_backend.enums;

public enum AccrualAllocationSource {
    TIMESHEET,
    DEFAULT_COST_CENTER,
    NONE
}
