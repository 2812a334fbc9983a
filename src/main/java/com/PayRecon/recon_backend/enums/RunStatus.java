package com.PayRecon.recon_backend.enums;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
