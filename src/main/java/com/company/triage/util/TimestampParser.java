package com.company.triage.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 parsing for alert timestamps. Values without an offset are read as UTC,
 * and a single space may stand in for the date-time separator.
 */
public class TimestampParser {

    private TimestampParser() {
    }

    /**
     * Parse an ISO-8601 timestamp into an absolute instant.
     *
     * @param text e.g. "2024-01-15T10:30:00Z", "2024-01-15T10:30:00+02:00" or "2024-01-15T10:30:00"
     * @return the parsed instant
     * @throws DateTimeParseException if the text is not ISO-8601
     */
    public static Instant parse(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp is null", "", 0);
        }
        String trimmed = text.trim();
        // "2024-01-15 10:30:00" -> "2024-01-15T10:30:00"
        if (trimmed.length() > 10 && trimmed.charAt(10) == ' ') {
            trimmed = trimmed.substring(0, 10) + 'T' + trimmed.substring(11);
        }

        try {
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException offsetFailure) {
            try {
                return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException localFailure) {
                // Bare dates last; the error reported is the one for the full form
                try {
                    return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE)
                            .atStartOfDay(ZoneOffset.UTC)
                            .toInstant();
                } catch (DateTimeParseException dateFailure) {
                    throw offsetFailure;
                }
            }
        }
    }
}
