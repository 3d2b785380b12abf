package com.teknorix.jobcatalog.catalog.api;

public record DepartmentWriteRequest(String title) {
}
