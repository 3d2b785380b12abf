package com.teknorix.jobcatalog.catalog.util;

import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Checks for required request values. Failures surface as 400 responses.
 */
public final class RequestValues {
    // column widths in V1__catalog_schema.sql
    public static final int MAX_TEXT_LENGTH = 200;
    public static final int MAX_ZIP_LENGTH = 32;

    private RequestValues() {
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, field + " is required");
        }
        return value;
    }

    public static String requireText(String value, String field, int maxLength) {
        String text = requireText(value, field);
        if (text.length() > maxLength) {
            throw new ResponseStatusException(BAD_REQUEST, field + " must be at most " + maxLength + " characters");
        }
        return text;
    }

    public static long requireId(Long value, String field) {
        if (value == null) {
            throw new ResponseStatusException(BAD_REQUEST, field + " is required");
        }
        return value;
    }

    /**
     * Parses an ISO-8601 date-time into UTC. A value without an offset is read as UTC.
     */
    public static Instant requireUtcDateTime(String value, String field) {
        String raw = requireText(value, field).trim();
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid " + field + " timestamp: " + value);
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }
}
