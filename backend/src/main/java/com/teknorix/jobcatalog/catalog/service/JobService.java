package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.model.JobDraft;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import com.teknorix.jobcatalog.catalog.util.JobCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Service
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);
    static final int MAX_CODE_ATTEMPTS = 3;
    private final CatalogJdbcRepository repository;
    private final IntegrityGuard integrityGuard;
    private final Clock clock;

    public JobService(CatalogJdbcRepository repository, IntegrityGuard integrityGuard, Clock clock) {
        this.repository = repository;
        this.integrityGuard = integrityGuard;
        this.clock = clock;
    }

    public JobDetailView createJob(JobDraft draft) {
        integrityGuard.validateJobReferences(draft.locationId(), draft.departmentId());

        Instant postedDate = clock.instant().truncatedTo(ChronoUnit.MICROS);
        for (int attempt = 1; ; attempt++) {
            String code = JobCodes.newCode();
            long jobId;
            try {
                jobId = repository.insertJob(draft, code, postedDate);
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_CODE_ATTEMPTS) {
                    throw e;
                }
                log.warn("Job code {} already taken, generating another (attempt {}/{})", code, attempt, MAX_CODE_ATTEMPTS);
                continue;
            } catch (DataIntegrityViolationException e) {
                log.warn("Job insert rejected by a store constraint (code={})", code, e);
                integrityGuard.validateJobReferences(draft.locationId(), draft.departmentId());
                throw e;
            }
            log.info("Created job {} ({}) at location {} in department {}", jobId, code, draft.locationId(), draft.departmentId());
            return getJob(jobId);
        }
    }

    public void updateJob(long jobId, JobDraft draft) {
        if (!repository.exists(EntityKind.JOB, jobId)) {
            throw new CatalogEntryNotFoundException(EntityKind.JOB, jobId);
        }
        integrityGuard.validateJobReferences(draft.locationId(), draft.departmentId());

        int updated;
        try {
            updated = repository.updateJob(jobId, draft);
        } catch (DataIntegrityViolationException e) {
            log.warn("Job update rejected by a store constraint (id={})", jobId, e);
            integrityGuard.validateJobReferences(draft.locationId(), draft.departmentId());
            throw e;
        }
        if (updated == 0) {
            throw new CatalogEntryNotFoundException(EntityKind.JOB, jobId);
        }
        log.info("Updated job {}", jobId);
    }

    public JobDetailView getJob(long jobId) {
        JobDetailView view = repository.findJobById(jobId);
        if (view == null) {
            throw new CatalogEntryNotFoundException(EntityKind.JOB, jobId);
        }
        return view;
    }
}
