package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A write referenced a location or department that does not exist.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class MissingReferenceException extends RuntimeException {
    private final EntityKind kind;
    private final long id;

    public MissingReferenceException(EntityKind kind, long id) {
        super(kind.label() + " with ID " + id + " does not exist.");
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
