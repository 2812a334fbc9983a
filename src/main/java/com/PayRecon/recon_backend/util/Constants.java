package com.PayRecon.recon_backend.util;

import java.util.List;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Payroll transaction types
    public static final String TX_HOURS_BY_RATE = "Hours By Rate";
    public static final String TX_ANNUAL_LEAVE = "Annual Leave";
    public static final String TX_SICK_LEAVE = "Sick Leave";
    public static final String TX_SUPER = "Super";
    public static final List<String> TX_OTHER_LEAVE = List.of(
            "Long Service Leave", "Other Leave", "User Defined Leave");

    // Pay component of ordinary hours under "Hours By Rate"
    public static final String PAY_COMP_NORMAL = "Normal";

    // Source names used in exception descriptions
    public static final String WORKED_SOURCE_NAME = "Tanda";
    public static final String PAID_SOURCE_NAME = "IQB";

    // Pagination Constants
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    // Validation report
    public static final int MAX_VALIDATION_EXAMPLES = 20;

    // Success Messages
    public static final String SUCCESS_CREATED = "Created successfully";
    public static final String SUCCESS_UPDATED = "Updated successfully";
}
