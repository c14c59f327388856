package com.jobhistory.store;

/**
 * Thrown when a document cannot be encoded to or decoded from its stored form.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
