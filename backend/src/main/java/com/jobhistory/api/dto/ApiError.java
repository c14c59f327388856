package com.jobhistory.api.dto;

/**
 * One error entry of an upsert response: HTTP status code and message.
 */
public record ApiError(int code, String message) {
}
