package com.jobhistory.history;

import com.jobhistory.domain.JobExecution;

/**
 * Execution record resolved for a notification, with its store key and whether it was seeded just now.
 */
public record LocatedExecution(String key, JobExecution record, boolean created) {
}
