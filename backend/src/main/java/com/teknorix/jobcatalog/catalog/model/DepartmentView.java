package com.teknorix.jobcatalog.catalog.model;

public record DepartmentView(long id, String title) {}
