package com.jobhistory.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * POST /api/v1/job-executions response body: resources on success, a single error on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpsertResponse(List<?> resources, List<ApiError> errors) {

    public static UpsertResponse of(Object resource) {
        return new UpsertResponse(List.of(resource), null);
    }

    public static UpsertResponse error(int code, String message) {
        return new UpsertResponse(null, List.of(new ApiError(code, message)));
    }
}
