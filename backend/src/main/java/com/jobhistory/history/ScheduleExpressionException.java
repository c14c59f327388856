package com.jobhistory.history;

/**
 * Thrown when a recurrence expression cannot be parsed or yields no occurrence.
 */
public class ScheduleExpressionException extends RuntimeException {

    public ScheduleExpressionException(String message) {
        super(message);
    }

    public ScheduleExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
