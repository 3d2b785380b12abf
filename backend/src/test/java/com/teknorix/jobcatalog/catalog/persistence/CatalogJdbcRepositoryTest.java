package com.teknorix.jobcatalog.catalog.persistence;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.model.JobDraft;
import com.teknorix.jobcatalog.catalog.model.LocationDraft;
import com.teknorix.jobcatalog.catalog.util.JobCodes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogJdbcRepositoryTest {
    private static final Instant POSTED = Instant.parse("2026-10-01T12:30:45.123456Z");
    private static final Instant CLOSING = Instant.parse("2026-12-01T00:00:00Z");

    @Autowired
    private CatalogJdbcRepository repository;

    @Test
    void existsReflectsInsertedRows() {
        long locationId = repository.insertLocation(new LocationDraft("HQ", "Panaji", "Goa", "India", "403001"));

        assertTrue(repository.exists(EntityKind.LOCATION, locationId));
        assertFalse(repository.exists(EntityKind.LOCATION, locationId + 1000));
        assertFalse(repository.exists(EntityKind.DEPARTMENT, locationId + 1000));
    }

    @Test
    void departmentTitleCheckIsExactAndHonoursExclusion() {
        long engineering = repository.insertDepartment("Engineering");

        assertTrue(repository.departmentTitleTaken("Engineering", null));
        assertFalse(repository.departmentTitleTaken("engineering", null));
        assertFalse(repository.departmentTitleTaken("Engineering ", null));
        assertFalse(repository.departmentTitleTaken("Engineering", engineering));
        assertTrue(repository.departmentTitleTaken("Engineering", engineering + 1));
    }

    @Test
    void storeRejectsDuplicateDepartmentTitle() {
        repository.insertDepartment("Finance");

        assertThrows(DuplicateKeyException.class, () -> repository.insertDepartment("Finance"));
    }

    @Test
    void storeRejectsJobWithDanglingReference() {
        long departmentId = repository.insertDepartment("Operations");
        JobDraft draft = new JobDraft("Planner", "Plans things", 987654L, departmentId, CLOSING);

        assertThrows(
            DataIntegrityViolationException.class,
            () -> repository.insertJob(draft, JobCodes.newCode(), POSTED)
        );
        assertEquals(0L, repository.countTable("jobs"));
    }

    @Test
    void jobRoundTripsWithJoinedRelations() {
        long locationId = repository.insertLocation(new LocationDraft("HQ", "Panaji", "Goa", "India", "403001"));
        long departmentId = repository.insertDepartment("Engineering");
        String code = JobCodes.newCode();

        long jobId = repository.insertJob(
            new JobDraft("Backend Engineer", "Build APIs", locationId, departmentId, CLOSING),
            code,
            POSTED
        );
        JobDetailView view = repository.findJobById(jobId);

        assertNotNull(view);
        assertEquals(code, view.code());
        assertEquals(POSTED, view.postedDate());
        assertEquals(CLOSING, view.closingDate());
        assertEquals("Panaji", view.resolvedLocation().orElseThrow().city());
        assertEquals("Engineering", view.resolvedDepartment().orElseThrow().title());
        assertNull(repository.findJobById(jobId + 1000));
    }

    @Test
    void updateLeavesCodeAndPostedDateAlone() {
        long locationId = repository.insertLocation(new LocationDraft("HQ", "Panaji", "Goa", "India", "403001"));
        long otherLocation = repository.insertLocation(new LocationDraft("Branch", "Pune", "MH", "India", "411001"));
        long departmentId = repository.insertDepartment("Engineering");
        String code = JobCodes.newCode();
        long jobId = repository.insertJob(
            new JobDraft("Backend Engineer", "Build APIs", locationId, departmentId, CLOSING),
            code,
            POSTED
        );

        int updated = repository.updateJob(
            jobId,
            new JobDraft("Senior Backend Engineer", "Own APIs", otherLocation, departmentId, CLOSING.plusSeconds(86400))
        );

        assertEquals(1, updated);
        JobDetailView view = repository.findJobById(jobId);
        assertEquals(code, view.code());
        assertEquals(POSTED, view.postedDate());
        assertEquals("Senior Backend Engineer", view.title());
        assertEquals(otherLocation, view.locationId());
        assertEquals(0, repository.updateJob(jobId + 1000, new JobDraft("x", "y", locationId, departmentId, CLOSING)));
    }

    @Test
    void escapeLikeEscapesWildcardsAndEscapeCharacter() {
        assertEquals("100\\%", CatalogJdbcRepository.escapeLike("100%"));
        assertEquals("a\\_b", CatalogJdbcRepository.escapeLike("a_b"));
        assertEquals("c:\\\\temp", CatalogJdbcRepository.escapeLike("c:\\temp"));
        assertEquals("plain", CatalogJdbcRepository.escapeLike("plain"));
    }
}
