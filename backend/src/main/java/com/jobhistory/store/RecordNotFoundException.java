package com.jobhistory.store;

import lombok.Getter;

/**
 * Thrown when a collection holds no document under the requested key.
 * Fatal for job lookups; for execution records it selects the create path.
 */
@Getter
public class RecordNotFoundException extends RuntimeException {

    private final String collection;
    private final String key;

    public RecordNotFoundException(String collection, String key) {
        super("object not found: " + collection + "/" + key);
        this.collection = collection;
        this.key = key;
    }
}
