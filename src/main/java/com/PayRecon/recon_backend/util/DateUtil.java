package com.PayRecon.recon_backend.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

public class DateUtil {

    private DateUtil() {
        // Utility class, no instantiation
    }

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    public static final DateTimeFormatter DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final int FORTNIGHT_DAYS = 14;

    public static String formatDate(LocalDate date) {
        return date != null ? date.format(DATE_FORMATTER) : null;
    }

    public static String formatDateTime(LocalDateTime dateTime) {
        return dateTime != null ? dateTime.format(DATETIME_FORMATTER) : null;
    }

    /**
     * Number of days between two dates, both ends included.
     */
    public static int inclusiveDays(LocalDate start, LocalDate end) {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * Period ids are the period end date, e.g. {@code 2025-10-05}.
     */
    public static Optional<LocalDate> parsePeriodEnd(String periodId) {
        if (periodId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(periodId.trim(), DATE_FORMATTER));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static LocalDate fortnightStart(LocalDate periodEnd) {
        return periodEnd.minusDays(FORTNIGHT_DAYS - 1);
    }
}
