package com.delta.searchsync.sync.api;

import com.delta.searchsync.sync.exec.BatchFailedException;
import com.delta.searchsync.sync.index.SearchIndexException;
import com.delta.searchsync.sync.service.ActiveSyncRunException;
import com.delta.searchsync.sync.service.UnknownIndexException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(SyncExceptionHandler.class);

  @ExceptionHandler(ActiveSyncRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveSyncRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_sync_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownIndexException.class)
  public ResponseEntity<Map<String, String>> handleUnknownIndex(UnknownIndexException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_index", "message", ex.getMessage()));
  }

  @ExceptionHandler(BatchFailedException.class)
  public ResponseEntity<Map<String, Object>> handleBatchFailed(BatchFailedException ex) {
    log.warn("Sync operation failed", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of(
            "error", "work_unit_failed",
            "message", ex.getMessage(),
            "failedUnits", ex.getFailedUnits(),
            "totalUnits", ex.getTotalUnits()));
  }

  @ExceptionHandler(SearchIndexException.class)
  public ResponseEntity<Map<String, Object>> handleSearchIndex(SearchIndexException ex) {
    log.warn("Search index request failed", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "search_index_error", "message", ex.getMessage(), "status", ex.getStatusCode()));
  }
}
