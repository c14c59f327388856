package com.jobhistory.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Job history service configuration. Documented in application.yml under jobhistory.
 */
@ConfigurationProperties(prefix = "jobhistory")
@NoArgsConstructor
@Getter
@Setter
public class JobHistoryProperties {

    /**
     * Upper bound for processing one notification; the pipeline is cancelled when exceeded.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Zone of the service clock. Recurrence expressions are evaluated in this zone.
     */
    private String zone = "UTC";

    private StoreProperties store = new StoreProperties();

    private SearchProperties search = new SearchProperties();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class StoreProperties {

        /** Backing implementation of the collection store. */
        private StoreType type = StoreType.MONGO;

        /** Base URL of the remote collection-object API; only read when type=HTTP. */
        private String baseUrl = "http://localhost:8081/customobjects/v1";

        private String jobsCollection = "jobs";

        private String executionsCollection = "job_executions";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SearchProperties {

        /** Base URL of the event-search backend. */
        private String baseUrl = "http://localhost:8082/events/v1";

        /** Saved query that returns the telemetry events of one workflow execution. */
        private String executionQuery = "Query By WorkflowRootExecutionID";
    }

    public enum StoreType {
        MONGO,
        HTTP
    }
}
