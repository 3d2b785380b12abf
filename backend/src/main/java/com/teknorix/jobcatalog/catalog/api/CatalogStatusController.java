package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.catalog.model.StatusResponse;
import com.teknorix.jobcatalog.catalog.service.CatalogStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CatalogStatusController {
    private final CatalogStatusService statusService;

    public CatalogStatusController(CatalogStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return statusService.getStatus();
    }
}
