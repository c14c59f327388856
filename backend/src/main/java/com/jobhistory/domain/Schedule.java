package com.jobhistory.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Optional;

/**
 * Schedule attached to a job. Missing end means unbounded recurrence; missing time cycle means a one-shot job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class Schedule {

    @JsonProperty("start")
    private String start;

    @JsonProperty("end")
    private String end;

    /** Cron-style recurrence expression. */
    @JsonProperty("time_cycle")
    private String timeCycle;

    public Optional<String> endValue() {
        return blankToEmpty(end);
    }

    public Optional<String> timeCycleValue() {
        return blankToEmpty(timeCycle);
    }

    private static Optional<String> blankToEmpty(String s) {
        return s == null || s.isBlank() ? Optional.empty() : Optional.of(s);
    }
}
