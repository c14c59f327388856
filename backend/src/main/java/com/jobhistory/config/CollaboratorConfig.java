package com.jobhistory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhistory.search.EventSearchClient;
import com.jobhistory.search.WebClientEventSearchClient;
import com.jobhistory.store.CollectionStore;
import com.jobhistory.store.HttpCollectionStore;
import com.jobhistory.store.MongoCollectionStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the external collaborators: the collection store (MongoDB or remote HTTP API, per jobhistory.store.type)
 * and the event-search client.
 */
@Configuration
@EnableConfigurationProperties(JobHistoryProperties.class)
public class CollaboratorConfig {

    @Bean
    public CollectionStore collectionStore(JobHistoryProperties properties,
                                           MongoTemplate mongoTemplate,
                                           WebClient.Builder webClientBuilder,
                                           ObjectMapper objectMapper) {
        if (properties.getStore().getType() == JobHistoryProperties.StoreType.HTTP) {
            return new HttpCollectionStore(webClientBuilder, properties.getStore().getBaseUrl(), objectMapper);
        }
        return new MongoCollectionStore(mongoTemplate);
    }

    @Bean
    public EventSearchClient eventSearchClient(JobHistoryProperties properties, WebClient.Builder webClientBuilder) {
        return new WebClientEventSearchClient(webClientBuilder, properties.getSearch().getBaseUrl());
    }
}
