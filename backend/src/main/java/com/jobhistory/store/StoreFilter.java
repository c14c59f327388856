package com.jobhistory.store;

/**
 * Equality filter on one document field.
 */
public record StoreFilter(String field, String value) {

    public static StoreFilter eq(String field, String value) {
        return new StoreFilter(field, value);
    }

    /** Filter expression understood by the remote collection API, e.g. {@code execution_id:'abc'}. */
    public String toExpression() {
        return field + ":'" + value.replace("'", "\\'") + "'";
    }
}
