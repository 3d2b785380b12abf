package com.teknorix.jobcatalog.catalog.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateDepartmentTitleException extends RuntimeException {
    private final String title;

    public DuplicateDepartmentTitleException(String title) {
        super("Department with title '" + title + "' already exists.");
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
