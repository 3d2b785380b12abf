package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.auth.RequiresAdministrator;
import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.service.DepartmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.teknorix.jobcatalog.catalog.util.RequestValues.MAX_TEXT_LENGTH;
import static com.teknorix.jobcatalog.catalog.util.RequestValues.requireText;

@RestController
@RequiresAdministrator
@RequestMapping(DepartmentController.DEPARTMENTS_PATH)
public class DepartmentController {
    static final String DEPARTMENTS_PATH = "/api/v1/departments";

    private final DepartmentService departmentService;

    public DepartmentController(DepartmentService departmentService) {
        this.departmentService = departmentService;
    }

    @PostMapping
    public ResponseEntity<Void> createDepartment(@RequestBody DepartmentWriteRequest request) {
        DepartmentView created = departmentService.createDepartment(requireText(request.title(), "title", MAX_TEXT_LENGTH));
        return ResponseEntity.created(CreatedLocations.of(DEPARTMENTS_PATH, created.id())).build();
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> updateDepartment(
        @PathVariable("id") long departmentId,
        @RequestBody DepartmentWriteRequest request
    ) {
        departmentService.updateDepartment(departmentId, requireText(request.title(), "title", MAX_TEXT_LENGTH));
        return ResponseEntity.ok().build();
    }

    @GetMapping
    public List<DepartmentView> getDepartments() {
        return departmentService.getDepartments();
    }

    @GetMapping("/{id}")
    public DepartmentView getDepartment(@PathVariable("id") long departmentId) {
        return departmentService.getDepartment(departmentId);
    }
}
