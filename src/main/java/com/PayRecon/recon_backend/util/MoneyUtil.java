package com.PayRecon.recon_backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtil {

    private MoneyUtil() {
        // Utility class, no instantiation
    }

    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    public static BigDecimal round(BigDecimal value) {
        return nullToZero(value).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * {@code part / whole * 100} to 2 dp, or zero when the base is zero.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return nullToZero(part).multiply(ONE_HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal absoluteDifference(BigDecimal a, BigDecimal b) {
        return nullToZero(a).subtract(nullToZero(b)).abs();
    }

    public static String formatCurrency(BigDecimal value) {
        return String.format("$%,.2f", round(value));
    }

    public static String formatHours(BigDecimal value) {
        return String.format("%.2f", round(value));
    }
}
