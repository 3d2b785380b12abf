package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.catalog.model.LocationDraft;

import static com.teknorix.jobcatalog.catalog.util.RequestValues.MAX_TEXT_LENGTH;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.MAX_ZIP_LENGTH;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.requireText;

public record LocationWriteRequest(
    String title,
    String city,
    String state,
    String country,
    String zip
) {
    LocationDraft toDraft() {
        return new LocationDraft(
            requireText(title, "title", MAX_TEXT_LENGTH),
            requireText(city, "city", MAX_TEXT_LENGTH),
            requireText(state, "state", MAX_TEXT_LENGTH),
            requireText(country, "country", MAX_TEXT_LENGTH),
            requireText(zip, "zip", MAX_ZIP_LENGTH)
        );
    }
}
