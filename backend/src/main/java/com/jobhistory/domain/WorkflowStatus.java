package com.jobhistory.domain;

import java.util.Locale;

/**
 * Canonical run status of a workflow execution. {@link #BLANK} marks a notification that carries no usable status.
 */
public enum WorkflowStatus {
    BLANK(""),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    /** Wire value stored in execution records and returned to callers. */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Case-insensitive normalization of a raw status. Unknown or missing values normalize to {@link #BLANK}.
     */
    public static WorkflowStatus normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        String s = raw.strip().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "in-progress", "in progress", "in_progress", "inprogress" -> IN_PROGRESS;
            case "completed" -> COMPLETED;
            case "failed" -> FAILED;
            default -> BLANK;
        };
    }
}
