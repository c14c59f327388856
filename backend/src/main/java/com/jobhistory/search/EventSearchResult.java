package com.jobhistory.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Events returned by a search, each an unordered map of (possibly prefixed) field names to values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventSearchResult(
        @JsonProperty("events") List<Map<String, Object>> events,
        @JsonProperty("job_url") String jobUrl) {

    public EventSearchResult {
        events = events != null ? events : List.of();
        jobUrl = jobUrl != null ? jobUrl : "";
    }
}
