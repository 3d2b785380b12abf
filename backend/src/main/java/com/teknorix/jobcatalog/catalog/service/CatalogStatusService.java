package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.StatusResponse;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

@Service
public class CatalogStatusService {
    private static final Logger log = LoggerFactory.getLogger(CatalogStatusService.class);
    private final CatalogJdbcRepository repository;

    public CatalogStatusService(CatalogJdbcRepository repository) {
        this.repository = repository;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>());
        }
        return new StatusResponse(true, repository.tableCounts());
    }
}
