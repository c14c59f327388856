package com.jobhistory.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound notification that a workflow execution changed state.
 * Definition names encode the job name after the first {@value #JOB_NAME_DELIMITER}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowNotification(
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("definition_name") String definitionName,
        @JsonProperty("status") String status,
        @JsonProperty("execution_timestamp") String executionTimestamp) {

    public static final String JOB_NAME_DELIMITER = "-";

    public WorkflowStatus normalizedStatus() {
        return WorkflowStatus.normalize(status);
    }

    /** Job name segment of the definition name, or empty when the definition name carries none. */
    public String jobName() {
        if (definitionName == null) {
            return "";
        }
        int idx = definitionName.indexOf(JOB_NAME_DELIMITER);
        if (idx < 0) {
            return "";
        }
        return definitionName.substring(idx + JOB_NAME_DELIMITER.length()).strip();
    }
}
