package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.auth.RequiresAdministrator;
import com.teknorix.jobcatalog.catalog.model.JobDetailView;
import com.teknorix.jobcatalog.catalog.service.JobQueryService;
import com.teknorix.jobcatalog.catalog.service.JobService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class JobController {
    static final String JOBS_PATH = "/api/v1/jobs";

    private final JobService jobService;
    private final JobQueryService jobQueryService;

    public JobController(JobService jobService, JobQueryService jobQueryService) {
        this.jobService = jobService;
        this.jobQueryService = jobQueryService;
    }

    @RequiresAdministrator
    @PostMapping("/v1/jobs")
    public ResponseEntity<Void> createJob(@RequestBody JobWriteRequest request) {
        JobDetailView created = jobService.createJob(request.toDraft());
        return ResponseEntity.created(CreatedLocations.of(JOBS_PATH, created.id())).build();
    }

    @RequiresAdministrator
    @PutMapping("/v1/jobs/{id}")
    public ResponseEntity<Void> updateJob(@PathVariable("id") long jobId, @RequestBody JobWriteRequest request) {
        jobService.updateJob(jobId, request.toDraft());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/v1/jobs/{id}")
    public JobDetailResponse getJob(@PathVariable("id") long jobId) {
        return JobDetailResponse.from(jobService.getJob(jobId));
    }

    // the unversioned path predates /v1 and is kept for existing clients
    @PostMapping({"/v1/jobs/list", "/jobs/list"})
    public JobListResponse listJobs(@RequestBody(required = false) JobListRequest request) {
        JobListRequest safeRequest = request == null ? new JobListRequest(null, null, null, null, null) : request;
        return JobListResponse.from(jobQueryService.listJobs(
            safeRequest.q(),
            safeRequest.locationId(),
            safeRequest.departmentId(),
            safeRequest.pageNo(),
            safeRequest.pageSize()
        ));
    }
}
