package com.jobhistory.history;

import com.jobhistory.domain.JobExecution;

/**
 * Result of a successful upsert: either the updated execution record, or a skip for a blank-status notification.
 */
public record UpsertOutcome(JobExecution execution, boolean skipped) {

    public static UpsertOutcome skip() {
        return new UpsertOutcome(null, true);
    }

    public static UpsertOutcome updated(JobExecution execution) {
        return new UpsertOutcome(execution, false);
    }
}
