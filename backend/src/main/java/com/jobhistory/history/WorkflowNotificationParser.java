package com.jobhistory.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhistory.domain.WorkflowNotification;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Parses and validates the notification body.
 */
@Component
@RequiredArgsConstructor
public class WorkflowNotificationParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws NotificationValidationException on empty body, malformed JSON, missing execution id or
     *                                         definition name, or a definition name without the job name delimiter
     */
    public WorkflowNotification parse(String body) {
        if (body == null || body.isBlank()) {
            throw new NotificationValidationException("empty request body");
        }
        WorkflowNotification notification;
        try {
            notification = objectMapper.readValue(body, WorkflowNotification.class);
        } catch (JsonProcessingException e) {
            throw new NotificationValidationException("malformed request body: " + e.getOriginalMessage(), e);
        }
        if (notification == null) {
            throw new NotificationValidationException("empty request body");
        }
        if (isEmpty(notification.executionId())) {
            throw new NotificationValidationException("missing execution ID");
        }
        if (isEmpty(notification.definitionName())) {
            throw new NotificationValidationException("missing definition name");
        }
        if (!notification.definitionName().contains(WorkflowNotification.JOB_NAME_DELIMITER)) {
            throw new NotificationValidationException("definition name does not contain job name");
        }
        return notification;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
