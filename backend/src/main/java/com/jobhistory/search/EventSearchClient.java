package com.jobhistory.search;

/**
 * Runs named queries against the event-search backend.
 */
public interface EventSearchClient {

    /**
     * Execute a saved query and wait for its events.
     *
     * @return events plus a reference URL for the search job; events list is never null
     * @throws SearchException on HTTP or decoding failure
     */
    EventSearchResult search(EventSearchRequest request);
}
