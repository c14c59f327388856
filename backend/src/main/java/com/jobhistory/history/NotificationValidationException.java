package com.jobhistory.history;

/**
 * Thrown when an inbound notification is empty, malformed or incomplete.
 */
public class NotificationValidationException extends RuntimeException {

    public NotificationValidationException(String message) {
        super(message);
    }

    public NotificationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
