package com.jobhistory.search;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Saved query name plus its parameters.
 */
public record EventSearchRequest(
        @JsonProperty("name") String searchName,
        @JsonProperty("parameters") Map<String, String> parameters) {
}
