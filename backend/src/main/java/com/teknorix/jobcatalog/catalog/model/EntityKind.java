package com.teknorix.jobcatalog.catalog.model;

public enum EntityKind {
    LOCATION("Location", "locations"),
    DEPARTMENT("Department", "departments"),
    JOB("Job", "jobs");

    private final String label;
    private final String tableName;

    EntityKind(String label, String tableName) {
        this.label = label;
        this.tableName = tableName;
    }

    public String label() {
        return label;
    }

    public String tableName() {
        return tableName;
    }
}
