package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.model.JobDraft;
import com.teknorix.jobcatalog.catalog.model.JobPage;
import com.teknorix.jobcatalog.catalog.model.LocationDraft;
import com.teknorix.jobcatalog.catalog.model.LocationView;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogScenarioTest {

    @Autowired
    private LocationService locationService;

    @Autowired
    private DepartmentService departmentService;

    @Autowired
    private JobService jobService;

    @Autowired
    private JobQueryService jobQueryService;

    @Autowired
    private CatalogJdbcRepository repository;

    @Test
    void postAJobThenFindItBySearch() {
        LocationView hq = locationService.createLocation(new LocationDraft("HQ", "Panaji", "Goa", "India", "403001"));
        DepartmentView engineering = departmentService.createDepartment("Engineering");
        Instant before = Instant.now();

        JobDetailView job = jobService.createJob(new JobDraft(
            "Backend Engineer",
            "Build and run the catalog services",
            hq.id(),
            engineering.id(),
            before.plus(Duration.ofDays(30))
        ));

        assertTrue(job.code().matches("^JOB-[0-9A-F]{8}$"));
        assertTrue(Duration.between(before, job.postedDate()).abs().compareTo(Duration.ofSeconds(5)) < 0);
        assertEquals("HQ", job.resolvedLocation().orElseThrow().title());

        assertThrows(DuplicateDepartmentTitleException.class, () -> departmentService.createDepartment("Engineering"));

        JobPage page = jobQueryService.listJobs("Backend", null, null, 1, 10);
        assertEquals(1L, page.total());
        assertEquals("Backend Engineer", page.items().get(0).title());
    }

    @Test
    void rejectedJobLeavesNoRowBehind() {
        LocationView hq = locationService.createLocation(new LocationDraft("HQ", "Panaji", "Goa", "India", "403001"));
        long before = repository.countTable("jobs");

        MissingReferenceException ex = assertThrows(
            MissingReferenceException.class,
            () -> jobService.createJob(new JobDraft("Ghost", "No department", hq.id(), 31337L, Instant.now()))
        );

        assertEquals("Department with ID 31337 does not exist.", ex.getMessage());
        assertEquals(before, repository.countTable("jobs"));
    }

    @Test
    void renamingADepartmentToItsOwnTitleSucceeds() {
        DepartmentView finance = departmentService.createDepartment("Finance");
        departmentService.createDepartment("Legal");

        departmentService.updateDepartment(finance.id(), "Finance");
        assertThrows(DuplicateDepartmentTitleException.class, () -> departmentService.updateDepartment(finance.id(), "Legal"));
        assertEquals("Finance", departmentService.getDepartment(finance.id()).title());
    }
}
