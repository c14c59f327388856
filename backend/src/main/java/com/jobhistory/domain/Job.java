package com.jobhistory.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * Typed view of a job document: identity plus the recurrence fields owned by this service.
 * The job document itself may carry any number of other fields; those are never read into this type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class Job {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("schedule")
    private Schedule schedule;

    @JsonProperty("run_now")
    private boolean runNow;

    @JsonProperty("run_count")
    private long runCount;

    /** Expected total number of runs; 0 means unbounded. */
    @JsonProperty("total_recurrences")
    private long totalRecurrences;

    @JsonProperty("last_run")
    private Instant lastRun;

    @JsonProperty("next_run")
    private Instant nextRun;

    public Optional<Schedule> scheduleValue() {
        return Optional.ofNullable(schedule);
    }
}
