package com.teknorix.jobcatalog.catalog.model;

import java.util.Map;

public record StatusResponse(boolean dbConnectivity, Map<String, Long> counts) {}
