package com.jobhistory.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhistory.domain.Job;
import com.jobhistory.domain.JobExecution;
import com.jobhistory.domain.Schedule;
import com.jobhistory.store.SerializationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between stored documents and the typed job / execution views.
 * Job documents are merged, never rebuilt: fields not owned by this service are preserved as stored.
 */
@Component
@RequiredArgsConstructor
public class JobDocumentMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Job toJob(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            throw new SerializationException("empty job document", null);
        }
        try {
            return objectMapper.convertValue(document, Job.class);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("failed to parse job: " + e.getMessage(), e);
        }
    }

    public JobExecution toExecution(Map<String, Object> document) {
        try {
            return objectMapper.convertValue(document, JobExecution.class);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("failed to deserialize job execution record: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> toDocument(JobExecution execution) {
        try {
            return objectMapper.convertValue(execution, DOCUMENT_TYPE);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("failed to serialize job execution record: " + e.getMessage(), e);
        }
    }

    /**
     * Writes the recurrence fields of the job into its stored document. Mutates and returns the document.
     */
    public Map<String, Object> mergeRecurrence(Job job, Map<String, Object> document) {
        if (job.getLastRun() != null) {
            document.put("last_run", job.getLastRun().toString());
        }
        if (job.getNextRun() != null) {
            document.put("next_run", job.getNextRun().toString());
        }
        document.put("run_count", job.getRunCount());
        document.put("total_recurrences", job.getTotalRecurrences());
        document.put("schedule", mergeSchedule(job.getSchedule(), document.get("schedule")));
        return document;
    }

    private Map<String, Object> mergeSchedule(Schedule schedule, Object stored) {
        if (schedule == null) {
            return null;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (stored instanceof Map<?, ?> storedMap) {
            storedMap.forEach((k, v) -> merged.put(String.valueOf(k), v));
        }
        try {
            merged.putAll(objectMapper.convertValue(schedule, DOCUMENT_TYPE));
        } catch (IllegalArgumentException e) {
            throw new SerializationException("failed to serialize job schedule: " + e.getMessage(), e);
        }
        return merged;
    }
}
