package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.auth.RequiresAdministrator;
import com.teknorix.jobcatalog.catalog.model.LocationView;
import com.teknorix.jobcatalog.catalog.service.LocationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping(LocationController.LOCATIONS_PATH)
public class LocationController {
    static final String LOCATIONS_PATH = "/api/v1/locations";

    private final LocationService locationService;

    public LocationController(LocationService locationService) {
        this.locationService = locationService;
    }

    @RequiresAdministrator
    @PostMapping
    public ResponseEntity<Void> createLocation(@RequestBody LocationWriteRequest request) {
        LocationView created = locationService.createLocation(request.toDraft());
        return ResponseEntity.created(CreatedLocations.of(LOCATIONS_PATH, created.id())).build();
    }

    @RequiresAdministrator
    @PutMapping("/{id}")
    public ResponseEntity<Void> updateLocation(
        @PathVariable("id") long locationId,
        @RequestBody LocationWriteRequest request
    ) {
        locationService.updateLocation(locationId, request.toDraft());
        return ResponseEntity.ok().build();
    }

    @GetMapping
    public List<LocationView> getLocations() {
        return locationService.getLocations();
    }

    @GetMapping("/{id}")
    public LocationView getLocation(@PathVariable("id") long locationId) {
        return locationService.getLocation(locationId);
    }
}
