package com.jobhistory.history;

import com.jobhistory.config.JobHistoryProperties;
import com.jobhistory.domain.JobExecution;
import com.jobhistory.domain.TimeFormats;
import com.jobhistory.domain.WorkflowNotification;
import com.jobhistory.store.CollectionStore;
import com.jobhistory.store.RecordNotFoundException;
import com.jobhistory.store.StoreFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Find-or-create for execution records: search by execution id, fetch the match, or seed a new record under
 * {@code <execution timestamp nanos>_<execution id>}.
 *
 * <p>The search is a plain read, not a lock. Two first notifications for the same execution id that race
 * can each create a record; closing that needs a conditional create in the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExecutionRecordLocator {

    static final String EXECUTION_ID_FIELD = "execution_id";

    private final CollectionStore collectionStore;
    private final JobDocumentMapper documentMapper;
    private final JobHistoryProperties properties;

    /**
     * @throws com.jobhistory.domain.TimeFormatException if the execution timestamp cannot be parsed
     * @throws com.jobhistory.store.StoreException        if searching or fetching fails
     */
    public LocatedExecution locateOrCreate(String jobId, String jobName, WorkflowNotification notification) {
        Instant executionTime = TimeFormats.parse(notification.executionTimestamp());
        String collection = properties.getStore().getExecutionsCollection();

        List<String> keys = collectionStore.searchKeys(collection,
                StoreFilter.eq(EXECUTION_ID_FIELD, notification.executionId()));
        if (keys.isEmpty()) {
            String key = newKey(executionTime, notification.executionId());
            return seed(key, jobId, jobName, notification);
        }
        if (keys.size() > 1) {
            log.warn("Found {} execution records for execution_id={}; using {}",
                    keys.size(), notification.executionId(), keys.get(0));
        }
        String key = keys.get(0);
        Map<String, Object> document;
        try {
            document = collectionStore.fetch(collection, key);
        } catch (RecordNotFoundException e) {
            return seed(key, jobId, jobName, notification);
        }
        return new LocatedExecution(key, documentMapper.toExecution(document), false);
    }

    static String newKey(Instant executionTime, String executionId) {
        return TimeFormats.epochNanos(executionTime) + "_" + executionId;
    }

    private LocatedExecution seed(String key, String jobId, String jobName, WorkflowNotification notification) {
        log.info("Job execution not found, creating: object_key={}, execution_id={}", key, notification.executionId());
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put(EXECUTION_ID_FIELD, notification.executionId());
        seed.put("id", jobId);
        seed.put("job_id", jobId);
        seed.put("name", jobName);
        seed.put("run_date", notification.executionTimestamp());
        JobExecution record = documentMapper.toExecution(seed);
        return new LocatedExecution(key, record, true);
    }
}
