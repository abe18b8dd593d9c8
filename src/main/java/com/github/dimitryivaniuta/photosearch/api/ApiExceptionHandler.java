package com.github.dimitryivaniuta.photosearch.api;

import com.github.dimitryivaniuta.photosearch.session.SearchSessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", Objects.toString(e.getMessage(), e.getClass().getSimpleName())));
    }

    @ExceptionHandler(SearchSessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SearchSessionNotFoundException e) {
        log.debug("Unknown session: {}", e.getSessionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> unavailable(IllegalStateException e) {
        log.warn("Request refused: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", Objects.toString(e.getMessage(), e.getClass().getSimpleName())));
    }
}
