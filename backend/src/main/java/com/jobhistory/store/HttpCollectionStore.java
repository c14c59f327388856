package com.jobhistory.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collection store backed by a remote collection-object API.
 * Fetched objects arrive base64-encoded JSON; objects are written as plain JSON.
 */
public class HttpCollectionStore implements CollectionStore {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public HttpCollectionStore(WebClient.Builder builder, String baseUrl, ObjectMapper objectMapper) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Object> fetch(String collection, String key) {
        byte[] body;
        try {
            body = webClient.get()
                    .uri("/collections/{collection}/objects/{key}", collection, key)
                    .accept(MediaType.APPLICATION_OCTET_STREAM, MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new RecordNotFoundException(collection, key);
            }
            throw new StoreException("failed to fetch " + collection + "/" + key + ": " + e.getMessage(), e);
        } catch (WebClientException | CodecException e) {
            throw new StoreException("failed to fetch " + collection + "/" + key + ": " + e.getMessage(), e);
        }
        if (body == null || body.length == 0) {
            throw new RecordNotFoundException(collection, key);
        }
        return decodeDocument(body);
    }

    @Override
    public void put(String collection, String key, Map<String, Object> document) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new SerializationException("failed to serialize " + collection + "/" + key, e);
        }
        try {
            webClient.put()
                    .uri("/collections/{collection}/objects/{key}", collection, key)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(json)
                    .retrieve()
                    .toBodilessEntity()
                    .block();
        } catch (WebClientException | CodecException e) {
            throw new StoreException("failed to save " + collection + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> searchKeys(String collection, StoreFilter filter) {
        JsonNode response;
        try {
            response = webClient.get()
                    .uri(b -> b.path("/collections/{collection}/objects")
                            .queryParam("filter", "{filter}")
                            .build(collection, filter.toExpression()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientException | CodecException e) {
            throw new StoreException("failed to search " + collection + " by " + filter.toExpression()
                    + ": " + e.getMessage(), e);
        }
        List<String> keys = new ArrayList<>();
        if (response == null) {
            return keys;
        }
        for (JsonNode resource : response.path("resources")) {
            String key = resource.path("object_key").asText("");
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    /**
     * Decodes a fetched object. The API returns base64 of the JSON document; plain JSON is accepted as well.
     */
    Map<String, Object> decodeDocument(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8).strip();
        byte[] json;
        if (text.startsWith("{")) {
            json = text.getBytes(StandardCharsets.UTF_8);
        } else {
            try {
                json = BaseEncoding.base64().decode(text);
            } catch (IllegalArgumentException e) {
                throw new SerializationException("failed to decode base64 record", e);
            }
        }
        try {
            LinkedHashMap<String, Object> doc = objectMapper.readValue(json, DOCUMENT_TYPE);
            if (doc == null) {
                throw new SerializationException("record is JSON null", null);
            }
            return doc;
        } catch (IOException e) {
            throw new SerializationException("failed to deserialize record: " + e.getMessage(), e);
        }
    }
}
