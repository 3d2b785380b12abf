package com.teknorix.jobcatalog.catalog.model;

import java.time.Instant;

/**
 * Caller-supplied job fields for a create or a full-field update. {@code closingDate} is
 * already normalized to UTC.
 */
public record JobDraft(
    String title,
    String description,
    long locationId,
    long departmentId,
    Instant closingDate
) {
}
