package com.fhirsls.core.fhir;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Parsing and formatting for FHIR date, dateTime and instant values.
 *
 * Partial dates resolve to the first instant they cover, in UTC: "2024" is
 * 2024-01-01T00:00:00Z and "2024-03" is 2024-03-01T00:00:00Z. A dateTime
 * without an offset is read as UTC.
 */
public final class FhirDates {

    private FhirDates() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            if (text.length() == 4) {
                return Optional.of(LocalDate.of(Integer.parseInt(text), 1, 1)
                        .atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            if (text.length() == 7) {
                return Optional.of(YearMonth.parse(text).atDay(1)
                        .atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            if (text.length() == 10) {
                return Optional.of(LocalDate.parse(text)
                        .atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            if (hasOffset(text)) {
                return Optional.of(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
            }
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Formats an instant as a FHIR instant with millisecond precision.
     */
    public static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS).toString();
    }

    private static boolean hasOffset(String text) {
        if (text.endsWith("Z") || text.endsWith("z")) {
            return true;
        }
        int timeStart = text.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = text.substring(timeStart);
        return time.indexOf('+') > 0 || time.indexOf('-') > 0;
    }
}
