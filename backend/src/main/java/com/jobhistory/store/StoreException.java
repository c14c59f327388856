package com.jobhistory.store;

/**
 * Thrown when the collection store fails for a reason other than a missing document.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
