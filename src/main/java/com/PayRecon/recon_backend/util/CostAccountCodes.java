package com.PayRecon.recon_backend.util;

import java.util.Optional;

/**
 * Cost account codes have the form {@code <location>-<department>}, e.g. {@code 458-5010}.
 */
public class CostAccountCodes {

    private CostAccountCodes() {
        // Utility class, no instantiation
    }

    public static Optional<String> locationCode(String costAccount) {
        if (costAccount == null || !costAccount.contains("-")) {
            return Optional.empty();
        }
        return Optional.of(costAccount.substring(0, costAccount.indexOf('-')));
    }

    /**
     * First two digits of the department segment.
     */
    public static Optional<String> departmentCode(String costAccount) {
        if (costAccount == null || !costAccount.contains("-")) {
            return Optional.empty();
        }
        String department = costAccount.substring(costAccount.indexOf('-') + 1);
        if (department.length() < 2) {
            return Optional.empty();
        }
        return Optional.of(department.substring(0, 2));
    }
}
