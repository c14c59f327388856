package com.jobhistory.history;

import com.jobhistory.config.JobHistoryProperties;
import com.jobhistory.domain.Job;
import com.jobhistory.domain.JobExecution;
import com.jobhistory.domain.TargetedHost;
import com.jobhistory.domain.TimeFormats;
import com.jobhistory.domain.WorkflowNotification;
import com.jobhistory.domain.WorkflowStatus;
import com.jobhistory.search.EventSearchClient;
import com.jobhistory.search.EventSearchRequest;
import com.jobhistory.search.EventSearchResult;
import com.jobhistory.store.CollectionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reconciles a workflow notification into the execution history: validates it, resolves the job, locates or
 * creates the execution record, enriches it (end date, duration, status, host outcomes), advances the job's
 * recurrence bookkeeping and writes both documents.
 *
 * <p>Writes are not transactional. The execution record is written first; if the job write then fails the
 * execution record stays as written and the failure is reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobExecutionUpsertService {

    static final String EXECUTION_ID_PARAM = "execution_id";

    private final WorkflowNotificationParser notificationParser;
    private final JobIdentityResolver jobIdentityResolver;
    private final CollectionStore collectionStore;
    private final JobDocumentMapper documentMapper;
    private final ExecutionRecordLocator executionRecordLocator;
    private final DurationCalculator durationCalculator;
    private final EventSearchClient eventSearchClient;
    private final HostOutcomeExtractor hostOutcomeExtractor;
    private final RecurrenceScheduler recurrenceScheduler;
    private final JobHistoryProperties properties;
    private final Clock clock;

    /**
     * @throws UpsertFailedException with BAD_REQUEST for an invalid notification, INTERNAL_SERVER_ERROR for
     *                               any downstream failure
     */
    public UpsertOutcome upsert(String body) {
        log.info("Received upsert request: {}", body);
        WorkflowNotification notification;
        try {
            notification = notificationParser.parse(body);
        } catch (NotificationValidationException e) {
            throw failure(HttpStatus.BAD_REQUEST, "failed to extract job information from request", e, null, null);
        }

        WorkflowStatus status = notification.normalizedStatus();
        if (status == WorkflowStatus.BLANK) {
            log.info("Received workflow notification with blank status - ignoring (execution_id={})",
                    notification.executionId());
            return UpsertOutcome.skip();
        }

        String jobName = notification.jobName();
        if (jobName.isEmpty()) {
            throw failure(HttpStatus.BAD_REQUEST, "bad job name provided",
                    new NotificationValidationException("definition name \"" + notification.definitionName()
                            + "\" does not contain job name"), null, null);
        }
        log.info("Received upsert request for job [job_name={}]", jobName);

        String jobId = stage("job ID could not be determined", jobName, null,
                () -> jobIdentityResolver.jobId(jobName));
        String jobsCollection = properties.getStore().getJobsCollection();

        Map<String, Object> jobDocument = stage("could not fetch job record", jobName, jobId,
                () -> collectionStore.fetch(jobsCollection, jobId));
        Job job = stage("could not distill job record from dictionary", jobName, jobId,
                () -> documentMapper.toJob(jobDocument));

        LocatedExecution located = stage("failed to fetch job execution record", jobName, jobId,
                () -> executionRecordLocator.locateOrCreate(jobId, jobName, notification));
        JobExecution execution = located.record();

        String endDate = execution.getEndDate();
        if (endDate == null || endDate.isEmpty()) {
            endDate = TimeFormats.format(clock.instant());
            if (status.isTerminal()) {
                execution.setEndDate(endDate);
            }
        }
        String end = endDate;
        String duration = stage("failed to compute job duration", jobName, jobId,
                () -> durationCalculator.duration(execution.getRunDate(), end, status));
        if (!duration.isEmpty()) {
            execution.setDuration(duration);
        }
        execution.setRunStatus(status.value());

        EventSearchResult events = stage("failed to execute event search", jobName, jobId,
                () -> eventSearchClient.search(new EventSearchRequest(
                        properties.getSearch().getExecutionQuery(),
                        Map.of(EXECUTION_ID_PARAM, notification.executionId()))));
        List<TargetedHost> hosts = hostOutcomeExtractor.extract(events.events());
        execution.setTargetedHosts(hosts);
        execution.setNumHosts(hosts.size());
        if (!located.created()) {
            execution.setLogscaleOutput(events.jobUrl());
        }

        Job updatedJob = stage("failed to update job record", jobName, jobId,
                () -> recurrenceScheduler.updateRunStats(job, status));
        Map<String, Object> mergedJob = stage("failed to map job instance to job document", jobName, jobId,
                () -> documentMapper.mergeRecurrence(updatedJob, jobDocument));

        String executionsCollection = properties.getStore().getExecutionsCollection();
        stage("failed to save execution record", jobName, jobId, () -> {
            collectionStore.put(executionsCollection, located.key(), documentMapper.toDocument(execution));
            return null;
        });
        stage("failed to save job record", jobName, jobId, () -> {
            collectionStore.put(jobsCollection, jobId, mergedJob);
            return null;
        });

        log.info("Upserted execution {} (status={}, hosts={}) [job_name={}, job_id={}]",
                located.key(), execution.getRunStatus(), execution.getNumHosts(), jobName, jobId);
        return UpsertOutcome.updated(execution);
    }

    private <T> T stage(String description, String jobName, String jobId, Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            throw failure(HttpStatus.INTERNAL_SERVER_ERROR, description, e, jobName, jobId);
        }
    }

    private static UpsertFailedException failure(HttpStatus status, String description, Exception cause,
                                                 String jobName, String jobId) {
        String message = description + ": " + cause.getMessage();
        log.error("{} [job_name={}, job_id={}]", message, jobName, jobId);
        return new UpsertFailedException(status, message, cause);
    }
}
