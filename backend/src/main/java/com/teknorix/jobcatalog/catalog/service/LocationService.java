package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.model.LocationDraft;
import com.teknorix.jobcatalog.catalog.model.LocationView;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LocationService {
    private static final Logger log = LoggerFactory.getLogger(LocationService.class);
    private final CatalogJdbcRepository repository;

    public LocationService(CatalogJdbcRepository repository) {
        this.repository = repository;
    }

    public LocationView createLocation(LocationDraft draft) {
        long locationId = repository.insertLocation(draft);
        log.info("Created location {} ({})", locationId, draft.title());
        return getLocation(locationId);
    }

    public void updateLocation(long locationId, LocationDraft draft) {
        if (repository.updateLocation(locationId, draft) == 0) {
            throw new CatalogEntryNotFoundException(EntityKind.LOCATION, locationId);
        }
        log.info("Updated location {}", locationId);
    }

    public LocationView getLocation(long locationId) {
        LocationView view = repository.findLocationById(locationId);
        if (view == null) {
            throw new CatalogEntryNotFoundException(EntityKind.LOCATION, locationId);
        }
        return view;
    }

    public List<LocationView> getLocations() {
        return repository.findAllLocations();
    }
}
