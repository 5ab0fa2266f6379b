package com.steadycrawl.crawl.api;

import com.steadycrawl.crawl.persistence.PersistenceException;
import com.steadycrawl.crawl.service.UnknownTaskException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CrawlExceptionHandler.class);

  @ExceptionHandler(UnknownTaskException.class)
  public ResponseEntity<Map<String, String>> handleUnknownTask(UnknownTaskException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<Map<String, String>> handlePersistence(PersistenceException ex) {
    log.error("State persistence failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "persistence_failure", "message", ex.getMessage()));
  }
}
