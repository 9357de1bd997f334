package org.learningjava.assessrec.infrastructure.adapter.in.web;

import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.learningjava.assessrec.domain.error.FetchException;
import org.learningjava.assessrec.domain.error.IndexNotFoundException;
import org.learningjava.assessrec.domain.error.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the recommender's typed failures to HTTP status codes with a {@code {"detail": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> invalidInput(InvalidInputException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        return detail(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidArgument(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return detail(HttpStatus.BAD_REQUEST, msg);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<Map<String, String>> fetch(FetchException e) {
        log.warn("JD fetch failed for {}: {}", e.url(), e.getMessage());
        return detail(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(IndexNotFoundException.class)
    public ResponseEntity<Map<String, String>> indexMissing(IndexNotFoundException e) {
        log.error("Index unavailable: {}", e.getMessage());
        return detail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Map<String, String>> embedding(EmbeddingException e) {
        log.error("Embedding unavailable: {}", e.getMessage(), e);
        return detail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message == null ? status.getReasonPhrase() : message));
    }
}
