package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CatalogEntryNotFoundException extends RuntimeException {
    private final EntityKind kind;
    private final long id;

    public CatalogEntryNotFoundException(EntityKind kind, long id) {
        super(kind.label() + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }
}
