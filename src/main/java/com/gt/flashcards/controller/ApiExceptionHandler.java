package com.gt.flashcards.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gt.flashcards.exception.*;
import com.gt.flashcards.model.CardStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

// Errors are reported as {"error": ..., "stats": ...}, stats only where the failure carries them
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return toResponse(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(StatsCarryingException.class)
    public ResponseEntity<ErrorResponse> handleNoCardAvailable(StatsCarryingException ex) {
        return toResponse(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getStats());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return toResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    // Request bodies whose rating is outside 1..4 fail while being read
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String msg = cause instanceof ValidationException ? cause.getMessage() : "Malformed request body";

        return toResponse(HttpStatus.BAD_REQUEST, msg, null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.error("Storage failure while handling request", ex);

        return toResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), null);
    }

    private static ResponseEntity<ErrorResponse> toResponse(HttpStatus status, String msg, CardStats stats) {
        return ResponseEntity.status(status).body(new ErrorResponse(msg, stats));
    }

    public record ErrorResponse(@JsonProperty("error") String error,
                                @JsonProperty("stats") @JsonInclude(JsonInclude.Include.NON_NULL) CardStats stats) { }
}
