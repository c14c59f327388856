package com.jobhistory.api.dto;

/**
 * Resource returned when a notification is acknowledged without processing.
 */
public record StatusResource(String name, String status) {

    public static StatusResource ok() {
        return new StatusResource("", "ok");
    }
}
