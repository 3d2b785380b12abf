package com.teknorix.jobcatalog.catalog.model;

public record LocationDraft(
    String title,
    String city,
    String state,
    String country,
    String zip
) {
}
