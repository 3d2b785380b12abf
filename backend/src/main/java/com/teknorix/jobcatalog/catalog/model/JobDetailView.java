package com.teknorix.jobcatalog.catalog.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A job joined with its location and department. Either relation is {@code null} when the
 * referenced row is missing.
 */
public record JobDetailView(
    long id,
    String code,
    String title,
    String description,
    long locationId,
    long departmentId,
    LocationView location,
    DepartmentView department,
    Instant postedDate,
    Instant closingDate
) {
    public Optional<LocationView> resolvedLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<DepartmentView> resolvedDepartment() {
        return Optional.ofNullable(department);
    }
}
