package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.springframework.stereotype.Component;

/**
 * Reference and uniqueness checks run before a write reaches the store. The checks are not
 * atomic with the write that follows; the unique and foreign-key constraints in the schema
 * catch whatever slips through.
 */
@Component
public class IntegrityGuard {
    private final CatalogJdbcRepository repository;

    public IntegrityGuard(CatalogJdbcRepository repository) {
        this.repository = repository;
    }

    /**
     * Fails on the first missing reference, location before department.
     *
     * @throws MissingReferenceException naming the kind and id that does not resolve
     */
    public void validateJobReferences(long locationId, long departmentId) {
        if (!repository.exists(EntityKind.LOCATION, locationId)) {
            throw new MissingReferenceException(EntityKind.LOCATION, locationId);
        }
        if (!repository.exists(EntityKind.DEPARTMENT, departmentId)) {
            throw new MissingReferenceException(EntityKind.DEPARTMENT, departmentId);
        }
    }

    /**
     * @param excludeId the department being updated, or {@code null} on create
     * @throws DuplicateDepartmentTitleException when another department already has {@code title}
     */
    public void validateDepartmentTitleUnique(String title, Long excludeId) {
        if (repository.departmentTitleTaken(title, excludeId)) {
            throw new DuplicateDepartmentTitleException(title);
        }
    }
}
