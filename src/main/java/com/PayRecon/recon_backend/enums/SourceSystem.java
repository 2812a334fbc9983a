package com.PayRecon.recon_backend.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three independently produced fact sets of a pay period.
 */
@Getter
@RequiredArgsConstructor
public enum SourceSystem {
    TIMESHEET("Tanda Timesheet"),
    PAYROLL("Micropay IQB"),
    JOURNAL("Micropay Journal");

    private final String displayName;
}
