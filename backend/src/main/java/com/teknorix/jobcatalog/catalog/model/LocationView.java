package com.teknorix.jobcatalog.catalog.model;

public record LocationView(
    long id,
    String title,
    String city,
    String state,
    String country,
    String zip
) {
}
