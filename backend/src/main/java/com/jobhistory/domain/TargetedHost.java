package com.jobhistory.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a job execution on one host. Device id is not sourced from telemetry and is always empty.
 */
public record TargetedHost(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("status") String status) {

    public static TargetedHost of(String hostname, WorkflowStatus status) {
        return new TargetedHost(hostname, "", status.value());
    }
}
