package com.jobhistory.history;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure of one stage of the upsert pipeline, already logged, with the status class reported to the caller.
 */
@Getter
public class UpsertFailedException extends RuntimeException {

    private final HttpStatus status;

    public UpsertFailedException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
