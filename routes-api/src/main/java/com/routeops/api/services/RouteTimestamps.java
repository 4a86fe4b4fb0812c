package com.routeops.api.services;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parsing of route timestamps. Everything is normalized to UTC.
 */
public final class RouteTimestamps {

    private RouteTimestamps() {
    }

    /**
     * Parse an ISO-8601 timestamp.
     * A value with an offset is converted to UTC, a value without one is read as UTC.
     *
     * @param value ISO-8601 text, e.g. {@code 2025-01-01T00:00Z}
     * @return the instant at offset UTC
     * @throws DateTimeParseException if the text is not ISO-8601
     */
    public static OffsetDateTime parseUtc(String value) {
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                .atOffset(ZoneOffset.UTC);
        }
    }
}
