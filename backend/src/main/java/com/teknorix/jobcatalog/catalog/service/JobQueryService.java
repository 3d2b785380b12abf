package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.JobListQuery;
import com.teknorix.jobcatalog.catalog.model.JobPage;
import com.teknorix.jobcatalog.catalog.model.JobSummary;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import com.teknorix.jobcatalog.config.CatalogProperties;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Filtered, paginated job listings, newest posting first.
 */
@Service
public class JobQueryService {
    private final CatalogJdbcRepository repository;
    private final CatalogProperties properties;

    public JobQueryService(CatalogJdbcRepository repository, CatalogProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /**
     * Lists jobs whose title or description contains {@code query} (case-insensitive) and
     * that match the optional location and department filters.
     *
     * <p>{@code total} counts every matching row regardless of the page. A page past the end
     * comes back empty with the same total. Missing page values fall back to page 1 and the
     * configured default page size.
     *
     * @throws ResponseStatusException with 400 when the page number or page size is below 1
     */
    public JobPage listJobs(String query, Long locationId, Long departmentId, Integer pageNumber, Integer pageSize) {
        JobListQuery listQuery = buildQuery(query, locationId, departmentId, pageNumber, pageSize);
        long total = repository.countJobs(listQuery);
        if (total == 0 || listQuery.offset() >= total) {
            return new JobPage(total, List.of());
        }
        List<JobSummary> items = repository.findJobsPage(listQuery);
        return new JobPage(total, items);
    }

    JobListQuery buildQuery(String query, Long locationId, Long departmentId, Integer pageNumber, Integer pageSize) {
        int safePage = pageNumber == null ? 1 : pageNumber;
        int safeSize = pageSize == null ? properties.getApi().getDefaultPageSize() : pageSize;
        if (safePage < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "pageNo must be at least 1");
        }
        if (safeSize < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "pageSize must be at least 1");
        }
        return new JobListQuery(normalizeQuery(query), locationId, departmentId, safePage, safeSize);
    }

    private String normalizeQuery(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        return query.trim();
    }
}
