package com.teknorix.jobcatalog.catalog.api;

import com.teknorix.jobcatalog.auth.InvalidCredentialsException;
import com.teknorix.jobcatalog.auth.TokenRejectedException;
import com.teknorix.jobcatalog.catalog.service.CatalogEntryNotFoundException;
import com.teknorix.jobcatalog.catalog.service.DuplicateDepartmentTitleException;
import com.teknorix.jobcatalog.catalog.service.MissingReferenceException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class CatalogExceptionHandler {

  @ExceptionHandler(CatalogEntryNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CatalogEntryNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(MissingReferenceException.class)
  public ResponseEntity<Map<String, String>> handleMissingReference(MissingReferenceException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "missing_reference", "message", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateDepartmentTitleException.class)
  public ResponseEntity<Map<String, String>> handleDuplicateTitle(DuplicateDepartmentTitleException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "duplicate_title", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<Map<String, String>> handleInvalidCredentials(InvalidCredentialsException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(Map.of("error", "unauthorized", "message", ex.getMessage()));
  }

  @ExceptionHandler(TokenRejectedException.class)
  public ResponseEntity<Map<String, String>> handleTokenRejected(TokenRejectedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
        .body(Map.of("error", "unauthorized", "message", ex.getMessage()));
  }
}
