package com.teknorix.jobcatalog.catalog.model;

import java.util.List;

public record JobPage(long total, List<JobSummary> items) {}
