package com.jobhistory.store;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class MongoCollectionStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    private MongoCollectionStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate.dropCollection("jobs");
        mongoTemplate.dropCollection("job_executions");
        store = new MongoCollectionStore(mongoTemplate);
    }

    @Test
    @DisplayName("put then fetch returns the document without the internal id")
    void putAndFetch() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", "j1");
        doc.put("owner", "secops");
        doc.put("schedule", Map.of("start", "2024-03-10T11:00:00Z", "time_cycle", "0 0 * * *"));

        store.put("jobs", "j1", doc);
        Map<String, Object> fetched = store.fetch("jobs", "j1");

        assertThat(fetched).doesNotContainKey("_id")
                .containsEntry("owner", "secops");
        assertThat(fetched.get("schedule")).asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("time_cycle", "0 0 * * *");
    }

    @Test
    @DisplayName("put replaces the document stored under the same key")
    void putReplaces() {
        store.put("jobs", "j1", Map.of("run_count", 1L));
        store.put("jobs", "j1", Map.of("run_count", 2L));

        assertThat(mongoTemplate.findAll(Document.class, "jobs")).hasSize(1);
        assertThat(store.fetch("jobs", "j1")).containsEntry("run_count", 2L);
    }

    @Test
    @DisplayName("fetch of an unknown key is a missing record")
    void fetchMissing() {
        assertThatThrownBy(() -> store.fetch("jobs", "nope")).isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    @DisplayName("searchKeys matches on field equality")
    void searchKeys() {
        store.put("job_executions", "100_exec-1", Map.of("execution_id", "exec-1"));
        store.put("job_executions", "200_exec-2", Map.of("execution_id", "exec-2"));

        List<String> keys = store.searchKeys("job_executions", StoreFilter.eq("execution_id", "exec-2"));

        assertThat(keys).containsExactly("200_exec-2");
        assertThat(store.searchKeys("job_executions", StoreFilter.eq("execution_id", "exec-9"))).isEmpty();
    }
}
