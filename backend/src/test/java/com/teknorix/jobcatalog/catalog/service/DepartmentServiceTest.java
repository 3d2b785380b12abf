package com.teknorix.jobcatalog.catalog.service;

import com.teknorix.jobcatalog.catalog.model.DepartmentView;
import com.teknorix.jobcatalog.catalog.model.EntityKind;
import com.teknorix.jobcatalog.catalog.persistence.CatalogJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DepartmentServiceTest {

    @Mock
    private CatalogJdbcRepository repository;

    private DepartmentService service;

    @BeforeEach
    void setUp() {
        service = new DepartmentService(repository, new IntegrityGuard(repository));
    }

    @Test
    void createsDepartmentWhenTitleIsFree() {
        when(repository.departmentTitleTaken("Engineering", null)).thenReturn(false);
        when(repository.insertDepartment("Engineering")).thenReturn(5L);

        DepartmentView created = service.createDepartment("Engineering");

        assertThat(created).isEqualTo(new DepartmentView(5L, "Engineering"));
    }

    @Test
    void duplicateTitleIsRejectedBeforeInsert() {
        when(repository.departmentTitleTaken("Engineering", null)).thenReturn(true);

        assertThatThrownBy(() -> service.createDepartment("Engineering"))
            .isInstanceOf(DuplicateDepartmentTitleException.class);
        verify(repository, never()).insertDepartment(anyString());
    }

    @Test
    void uniqueConstraintViolationSurfacesAsConflict() {
        when(repository.departmentTitleTaken("Engineering", null)).thenReturn(false);
        when(repository.insertDepartment("Engineering")).thenThrow(new DuplicateKeyException("departments_title_key"));

        assertThatThrownBy(() -> service.createDepartment("Engineering"))
            .isInstanceOf(DuplicateDepartmentTitleException.class)
            .hasMessageContaining("'Engineering'");
    }

    @Test
    void updatingUnknownDepartmentIsNotFound() {
        when(repository.exists(EntityKind.DEPARTMENT, 42L)).thenReturn(false);

        assertThatThrownBy(() -> service.updateDepartment(42L, "Finance"))
            .isInstanceOf(CatalogEntryNotFoundException.class);
        verify(repository, never()).updateDepartment(anyLong(), anyString());
    }

    @Test
    void renameKeepsOwnTitleAllowed() {
        when(repository.exists(EntityKind.DEPARTMENT, 3L)).thenReturn(true);
        when(repository.departmentTitleTaken("Engineering", 3L)).thenReturn(false);
        when(repository.updateDepartment(3L, "Engineering")).thenReturn(1);

        service.updateDepartment(3L, "Engineering");

        verify(repository).updateDepartment(3L, "Engineering");
    }

    @Test
    void renameOntoAnotherDepartmentsTitleConflicts() {
        when(repository.exists(EntityKind.DEPARTMENT, 3L)).thenReturn(true);
        when(repository.departmentTitleTaken("Finance", 3L)).thenReturn(true);

        assertThatThrownBy(() -> service.updateDepartment(3L, "Finance"))
            .isInstanceOf(DuplicateDepartmentTitleException.class);
        verify(repository, never()).updateDepartment(anyLong(), anyString());
    }
}
