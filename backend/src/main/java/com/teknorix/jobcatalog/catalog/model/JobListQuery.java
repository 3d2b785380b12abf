package com.teknorix.jobcatalog.catalog.model;

/**
 * Filter and page selection for a job listing. {@code query} is {@code null} when no free-text
 * filter applies; pagination values are validated before this record is built.
 */
public record JobListQuery(
    String query,
    Long locationId,
    Long departmentId,
    int pageNumber,
    int pageSize
) {
    public long offset() {
        return (long) (pageNumber - 1) * pageSize;
    }
}
