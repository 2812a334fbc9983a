package com.PayRecon.recon_backend.enums;

public enum WageSource {
    PRO_RATED_AUTO_PAY,
    TIMESHEET_COST
}
