package com.teknorix.jobcatalog.catalog.api;

import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;

final class CreatedLocations {
    private CreatedLocations() {
    }

    static URI of(String collectionPath, long id) {
        return ServletUriComponentsBuilder.fromCurrentContextPath()
            .path(collectionPath)
            .path("/{id}")
            .buildAndExpand(id)
            .toUri();
    }
}
