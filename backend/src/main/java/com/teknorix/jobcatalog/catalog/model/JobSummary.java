package com.teknorix.jobcatalog.catalog.model;

import java.time.Instant;
import java.util.Optional;

/**
 * One row of a job listing. Titles of the joined location and department are {@code null}
 * when the reference dangles.
 */
public record JobSummary(
    long id,
    String code,
    String title,
    String locationTitle,
    String departmentTitle,
    Instant postedDate,
    Instant closingDate
) {
    public Optional<String> resolvedLocationTitle() {
        return Optional.ofNullable(locationTitle);
    }

    public Optional<String> resolvedDepartmentTitle() {
        return Optional.ofNullable(departmentTitle);
    }
}
