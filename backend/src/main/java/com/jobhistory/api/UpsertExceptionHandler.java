package com.jobhistory.api;

import com.jobhistory.api.dto.UpsertResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures that escape the upsert pipeline to 500 with the standard error body.
 */
@RestControllerAdvice
@Slf4j
public class UpsertExceptionHandler {

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<UpsertResponse> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected failure processing notification: {}", ex.getMessage(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(UpsertResponse.error(status.value(), ex.getMessage()));
    }
}
