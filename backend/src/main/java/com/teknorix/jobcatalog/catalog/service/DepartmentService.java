package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DepartmentService {
    private static final Logger log = LoggerFactory.getLogger(DepartmentService.class);
    private final CatalogJdbcRepository repository;
    private final IntegrityGuard integrityGuard;

    public DepartmentService(CatalogJdbcRepository repository, IntegrityGuard integrityGuard) {
        this.repository = repository;
        this.integrityGuard = integrityGuard;
    }

    public DepartmentView createDepartment(String title) {
        integrityGuard.validateDepartmentTitleUnique(title, null);
        long departmentId;
        try {
            departmentId = repository.insertDepartment(title);
        } catch (DuplicateKeyException e) {
            log.warn("Concurrent insert of department title '{}' caught by unique constraint", title);
            throw new DuplicateDepartmentTitleException(title);
        }
        log.info("Created department {} ({})", departmentId, title);
        return new DepartmentView(departmentId, title);
    }

    public void updateDepartment(long departmentId, String title) {
        if (!repository.exists(EntityKind.DEPARTMENT, departmentId)) {
            throw new CatalogEntryNotFoundException(EntityKind.DEPARTMENT, departmentId);
        }
        integrityGuard.validateDepartmentTitleUnique(title, departmentId);
        int updated;
        try {
            updated = repository.updateDepartment(departmentId, title);
        } catch (DuplicateKeyException e) {
            log.warn("Concurrent rename to department title '{}' caught by unique constraint", title);
            throw new DuplicateDepartmentTitleException(title);
        }
        if (updated == 0) {
            throw new CatalogEntryNotFoundException(EntityKind.DEPARTMENT, departmentId);
        }
        log.info("Updated department {}", departmentId);
    }

    public DepartmentView getDepartment(long departmentId) {
        DepartmentView view = repository.findDepartmentById(departmentId);
        if (view == null) {
            throw new CatalogEntryNotFoundException(EntityKind.DEPARTMENT, departmentId);
        }
        return view;
    }

    public List<DepartmentView> getDepartments() {
        return repository.findAllDepartments();
    }
}
