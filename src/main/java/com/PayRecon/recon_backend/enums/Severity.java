package com.PayRecon.recon_backend.enums;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    public boolean countsAsFailure() {
        return this == CRITICAL || this == WARNING;
    }
}
