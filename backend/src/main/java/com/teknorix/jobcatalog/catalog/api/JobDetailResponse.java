package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.model.LocationView;

import java.time.Instant;

import static com.teknorix.jobcatalog.catalog.api.JobListResponse.UNRESOLVED;

public record JobDetailResponse(
    long id,
    String code,
    String title,
    String description,
    LocationView location,
    DepartmentView department,
    Instant postedDate,
    Instant closingDate
) {
    private static final LocationView MISSING_LOCATION =
        new LocationView(0, UNRESOLVED, UNRESOLVED, UNRESOLVED, UNRESOLVED, UNRESOLVED);
    private static final DepartmentView MISSING_DEPARTMENT = new DepartmentView(0, UNRESOLVED);

    static JobDetailResponse from(JobDetailView view) {
        return new JobDetailResponse(
            view.id(),
            view.code(),
            view.title(),
            view.description(),
            view.resolvedLocation().orElse(MISSING_LOCATION),
            view.resolvedDepartment().orElse(MISSING_DEPARTMENT),
            view.postedDate(),
            view.closingDate()
        );
    }
}
