package com.jobhistory.store;

import java.util.List;
import java.util.Map;

/**
 * Keyed JSON documents grouped in named collections. Implementations are blocking; callers run them off the
 * event loop.
 */
public interface CollectionStore {

    /**
     * Fetch the document stored under the key.
     *
     * @return the document as a mutable map; never null
     * @throws RecordNotFoundException if no document exists under the key
     * @throws StoreException          on any other store failure
     */
    Map<String, Object> fetch(String collection, String key);

    /**
     * Create or replace the document stored under the key (last writer wins).
     *
     * @throws StoreException on store failure
     */
    void put(String collection, String key, Map<String, Object> document);

    /**
     * Keys of the documents matching the filter, in store order; empty when nothing matches.
     *
     * @throws StoreException on store failure
     */
    List<String> searchKeys(String collection, StoreFilter filter);
}
