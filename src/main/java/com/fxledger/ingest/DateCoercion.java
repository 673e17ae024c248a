package com.fxledger.ingest;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Reads the calendar date out of the date text found in broker reports and rate tables.
 *
 * <p>Accepted: {@code 2024-01-05}, {@code 2024-01-05T10:30:00}, {@code 2024-01-05 10:30},
 * {@code 05.01.2024} and {@code 05.01.2024 10:30:00}. Any time part is dropped.
 */
public final class DateCoercion {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DAY_FIRST_DATE = Pattern.compile("\\d{1,2}\\.\\d{1,2}\\.\\d{4}");
    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("d.M.yyyy");

    private DateCoercion() {}

    /** Returns {@code null} for null/blank input; throws {@link DateTimeParseException} otherwise. */
    public static LocalDate parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        String datePart = trimmed.split("[T ]", 2)[0];
        if (ISO_DATE.matcher(datePart).matches()) {
            return LocalDate.parse(datePart);
        }
        if (DAY_FIRST_DATE.matcher(datePart).matches()) {
            return LocalDate.parse(datePart, DAY_FIRST);
        }
        throw new DateTimeParseException("Unrecognized date", text, 0);
    }
}
