package com.teknorix.jobcatalog.catalog.api;

public record JobListRequest(
    String q,
    Integer pageNo,
    Integer pageSize,
    Long locationId,
    Long departmentId
) {
}
