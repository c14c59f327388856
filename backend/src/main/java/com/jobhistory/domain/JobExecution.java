package com.jobhistory.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * History of one concrete run of a job, persisted in the job_executions collection under a composite key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class JobExecution {

    /** Owning job id, duplicated from job_id on records created here; older records may lack it. */
    @JsonProperty("id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String id;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("name")
    private String jobName;

    @JsonProperty("execution_id")
    private String executionId;

    @JsonProperty("run_date")
    private String runDate;

    /** Empty until a terminal status is first observed, then frozen. */
    @JsonProperty("end_date")
    private String endDate = "";

    /** HH:MM:SS, hours not wrapped at 24. */
    @JsonProperty("duration")
    private String duration = "";

    @JsonProperty("run_status")
    private String runStatus = "";

    @JsonProperty("targeted_hosts")
    private List<TargetedHost> targetedHosts = new ArrayList<>();

    @JsonProperty("num_hosts")
    private int numHosts;

    /** Event-search reference for this execution; only set when updating a record that already existed. */
    @JsonProperty("logscale_output")
    private String logscaleOutput = "";
}
