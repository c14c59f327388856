package com.jobhistory.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhistory.domain.TargetedHost;
import com.jobhistory.domain.WorkflowStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes per-host telemetry events into one outcome per host.
 *
 * <p>Two event shapes are recognized, matched by case-insensitive field-name suffix:
 * <ul>
 *   <li>install: hostname plus put-and-run stderr/stdout; stderr means failure, stdout alone means success</li>
 *   <li>remove: hostname plus file-exists pre-check, post-removal value and a JSON response whose
 *       {@code file_exists} overrides the post-removal value</li>
 * </ul>
 * Events are applied in the given order; a later event for the same host replaces an earlier one.
 * Result is sorted by hostname.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostOutcomeExtractor {

    static final String HOSTNAME_SUFFIX = "device.getdetails.hostname";
    static final String INSTALL_STDERR_SUFFIX = "rtr.putandrun.stderr";
    static final String INSTALL_STDOUT_SUFFIX = "rtr.putandrun.stdout";
    static final String REMOVE_CHECK_SUFFIX = "rtr.app_check_file_exist_rtr_2.file_exists";
    static final String REMOVE_RESULT_SUFFIX = "rtr.app_remove_file_rtr_2.file_exists";
    static final String REMOVE_RESPONSE_SUFFIX = "rtr.app_remove_file_rtr_2.response";

    private static final String TRUE = "true";
    private static final String FALSE = "false";

    private final ObjectMapper objectMapper;

    public List<TargetedHost> extract(List<Map<String, Object>> events) {
        if (events == null || events.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, HostOutcome> byHost = new LinkedHashMap<>();
        for (Map<String, Object> event : events) {
            Optional<HostOutcome> outcome = extractInstall(event);
            if (outcome.isEmpty()) {
                outcome = extractRemove(event);
            }
            outcome.ifPresent(o -> byHost.put(o.hostname(), o));
        }
        List<TargetedHost> hosts = new ArrayList<>(byHost.size());
        for (HostOutcome o : byHost.values()) {
            hosts.add(TargetedHost.of(o.hostname(), o.success() ? WorkflowStatus.COMPLETED : WorkflowStatus.FAILED));
        }
        hosts.sort(Comparator.comparing(TargetedHost::hostname));
        return hosts;
    }

    Optional<HostOutcome> extractInstall(Map<String, Object> event) {
        String hostname = "";
        String stderr = "";
        String stdout = "";
        for (Map.Entry<String, Object> e : event.entrySet()) {
            String key = lower(e.getKey());
            if (key.endsWith(HOSTNAME_SUFFIX)) {
                hostname = nonBlank(e.getValue(), hostname);
            } else if (key.endsWith(INSTALL_STDERR_SUFFIX)) {
                stderr = nonBlank(e.getValue(), stderr);
            } else if (key.endsWith(INSTALL_STDOUT_SUFFIX)) {
                stdout = nonBlank(e.getValue(), stdout);
            }
        }
        if (hostname.isEmpty()) {
            return Optional.empty();
        }
        if (!stderr.isEmpty()) {
            return Optional.of(new HostOutcome(hostname, false));
        }
        if (!stdout.isEmpty()) {
            return Optional.of(new HostOutcome(hostname, true));
        }
        return Optional.empty();
    }

    Optional<HostOutcome> extractRemove(Map<String, Object> event) {
        String hostname = "";
        String checked = "";
        String removed = "";
        String response = "";
        String responseKey = "";
        for (Map.Entry<String, Object> e : event.entrySet()) {
            String key = lower(e.getKey());
            if (key.endsWith(HOSTNAME_SUFFIX)) {
                hostname = nonBlank(e.getValue(), hostname);
            } else if (key.endsWith(REMOVE_CHECK_SUFFIX)) {
                checked = truthValue(e.getValue(), checked);
            } else if (key.endsWith(REMOVE_RESULT_SUFFIX)) {
                removed = truthValue(e.getValue(), removed);
            } else if (key.endsWith(REMOVE_RESPONSE_SUFFIX)) {
                response = nonBlank(e.getValue(), response);
                responseKey = e.getKey();
            }
        }
        if (!response.isEmpty()) {
            try {
                String fromResponse = fileExistsFromResponse(response);
                if (!fromResponse.isEmpty()) {
                    removed = fromResponse;
                }
            } catch (IllegalArgumentException e) {
                log.error("Skipping telemetry event: {} (key={})", e.getMessage(), responseKey);
                return Optional.empty();
            }
        }
        if (hostname.isEmpty()) {
            return Optional.empty();
        }
        String fileExists = removed.isEmpty() ? checked : removed;
        if (TRUE.equals(fileExists)) {
            return Optional.of(new HostOutcome(hostname, true));
        }
        if (FALSE.equals(fileExists)) {
            return Optional.of(new HostOutcome(hostname, false));
        }
        return Optional.empty();
    }

    /**
     * Reads {@code file_exists} from a removal response payload.
     *
     * @return "true", "false", or empty when the payload has no such key
     * @throws IllegalArgumentException if the payload is not a JSON object or the value is not a truth value
     */
    String fileExistsFromResponse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed removal response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("removal response is not a JSON object");
        }
        JsonNode exists = root.get("file_exists");
        if (exists == null) {
            return "";
        }
        if (exists.isBoolean()) {
            return exists.booleanValue() ? TRUE : FALSE;
        }
        if (exists.isTextual() && (TRUE.equals(exists.textValue()) || FALSE.equals(exists.textValue()))) {
            return exists.textValue();
        }
        throw new IllegalArgumentException("unknown truth value: " + exists);
    }

    private static String lower(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT);
    }

    private static String nonBlank(Object value, String current) {
        if (value instanceof String s && !s.isBlank()) {
            return s.strip();
        }
        return current;
    }

    // file_exists fields may arrive as JSON booleans.
    private static String truthValue(Object value, String current) {
        if (value instanceof Boolean b) {
            return b.toString();
        }
        return nonBlank(value, current);
    }

    record HostOutcome(String hostname, boolean success) {
    }
}
