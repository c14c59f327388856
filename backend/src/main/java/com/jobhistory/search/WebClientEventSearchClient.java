package com.jobhistory.search;

import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * Event-search client using WebClient: POST {base}/searches/execute with the query name and parameters.
 */
public class WebClientEventSearchClient implements EventSearchClient {

    private final WebClient webClient;

    public WebClientEventSearchClient(WebClient.Builder builder, String baseUrl) {
        this.webClient = builder.baseUrl(baseUrl).build();
    }

    @Override
    public EventSearchResult search(EventSearchRequest request) {
        EventSearchResult result;
        try {
            result = webClient.post()
                    .uri("/searches/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(EventSearchResult.class)
                    .block();
        } catch (WebClientException | CodecException e) {
            throw new SearchException("search \"" + request.searchName() + "\" failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new SearchException("search \"" + request.searchName() + "\" returned no body");
        }
        return result;
    }
}
