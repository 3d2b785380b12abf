package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.catalog.model.JobPage;
import com.teknorix.jobcatalog.catalog.model.JobSummary;

import java.time.Instant;
import java.util.List;

public record JobListResponse(long total, List<Item> data) {
    static final String UNRESOLVED = "N/A";

    static JobListResponse from(JobPage page) {
        return new JobListResponse(page.total(), page.items().stream().map(Item::from).toList());
    }

    public record Item(
        long id,
        String code,
        String title,
        String location,
        String department,
        Instant postedDate,
        Instant closingDate
    ) {
        static Item from(JobSummary summary) {
            return new Item(
                summary.id(),
                summary.code(),
                summary.title(),
                summary.resolvedLocationTitle().orElse(UNRESOLVED),
                summary.resolvedDepartmentTitle().orElse(UNRESOLVED),
                summary.postedDate(),
                summary.closingDate()
            );
        }
    }
}
