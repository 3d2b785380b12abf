package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.catalog.model.JobDraft;

import static com.teknorix.jobcatalog.catalog.util.RequestValues.MAX_TEXT_LENGTH;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.requireId;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.requireText;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.requireUtcDateTime;

public record JobWriteRequest(
    String title,
    String description,
    Long locationId,
    Long departmentId,
    String closingDate
) {
    JobDraft toDraft() {
        return new JobDraft(
            requireText(title, "title", MAX_TEXT_LENGTH),
            requireText(description, "description"),
            requireId(locationId, "locationId"),
            requireId(departmentId, "departmentId"),
            requireUtcDateTime(closingDate, "closingDate")
        );
    }
}
