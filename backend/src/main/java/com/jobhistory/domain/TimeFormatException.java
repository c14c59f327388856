package com.jobhistory.domain;

/**
 * Thrown when a timestamp does not follow the ISO-8601 format used by notifications and records.
 */
public class TimeFormatException extends RuntimeException {

    public TimeFormatException(String message) {
        super(message);
    }

    public TimeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
