package com.jobhistory.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhistory.domain.TargetedHost;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostOutcomeExtractorTest {

    private static final String HOST = "workflow.Device.GetDetails.Hostname";
    private static final String STDERR = "workflow.RTR.PutAndRun.stderr";
    private static final String STDOUT = "workflow.RTR.PutAndRun.stdout";
    private static final String CHECK = "workflow.rtr.app_check_file_exist_rtr_2.file_exists";
    private static final String REMOVED = "workflow.rtr.app_remove_file_rtr_2.file_exists";
    private static final String RESPONSE = "workflow.rtr.app_remove_file_rtr_2.response";

    private final HostOutcomeExtractor extractor = new HostOutcomeExtractor(new ObjectMapper());

    @Test
    @DisplayName("no events yields an empty mutable list")
    void noEvents() {
        List<TargetedHost> hosts = extractor.extract(List.of());

        assertThat(hosts).isNotNull().isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    @DisplayName("install: stdout only is success, stderr is failure")
    void installShape() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of(HOST, "alpha", STDOUT, "installed", STDERR, "  "),
                Map.of(HOST, "bravo", STDOUT, "partial", STDERR, "access denied")));

        assertThat(hosts).containsExactly(
                new TargetedHost("alpha", "", "completed"),
                new TargetedHost("bravo", "", "failed"));
    }

    @Test
    @DisplayName("install without stdout or stderr is not a match")
    void installWithoutOutput() {
        assertThat(extractor.extract(List.of(Map.of(HOST, "alpha", STDOUT, " ")))).isEmpty();
    }

    @Test
    @DisplayName("events without hostname are ignored")
    void missingHostname() {
        assertThat(extractor.extract(List.of(Map.of(STDOUT, "ok"), Map.of(HOST, "   ", REMOVED, "true")))).isEmpty();
    }

    @Test
    @DisplayName("remove: post-removal value overrides the pre-check")
    void removePrecedence() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of(HOST, "alpha", CHECK, "true", REMOVED, "false"),
                Map.of(HOST, "bravo", CHECK, "true")));

        assertThat(hosts).containsExactly(
                new TargetedHost("alpha", "", "failed"),
                new TargetedHost("bravo", "", "completed"));
    }

    @Test
    @DisplayName("remove: response file_exists overrides the raw post-removal field")
    void responseOverrides() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of(HOST, "alpha", REMOVED, "false", RESPONSE, "{\"file_exists\":\"true\"}"),
                Map.of(HOST, "bravo", REMOVED, "true", RESPONSE, "{\"file_exists\":false}"),
                Map.of(HOST, "charlie", REMOVED, "true", RESPONSE, "{\"status\":\"done\"}")));

        assertThat(hosts).containsExactly(
                new TargetedHost("alpha", "", "completed"),
                new TargetedHost("bravo", "", "failed"),
                new TargetedHost("charlie", "", "completed"));
    }

    @Test
    @DisplayName("remove: value other than true/false is not a match")
    void removeUnknownValue() {
        assertThat(extractor.extract(List.of(Map.of(HOST, "alpha", CHECK, "maybe")))).isEmpty();
    }

    @Test
    @DisplayName("malformed response skips only that event")
    void malformedResponse() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of(HOST, "alpha", REMOVED, "true", RESPONSE, "{not json"),
                Map.of(HOST, "bravo", REMOVED, "true")));

        assertThat(hosts).containsExactly(new TargetedHost("bravo", "", "completed"));
    }

    @Test
    @DisplayName("field names match case-insensitively by suffix")
    void suffixMatching() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of("A.B.DEVICE.GETDETAILS.HOSTNAME", "alpha", "x.RTR.PUTANDRUN.STDOUT", "ok")));

        assertThat(hosts).containsExactly(new TargetedHost("alpha", "", "completed"));
    }

    @Test
    @DisplayName("same host: later event wins")
    void laterEventWins() {
        Map<String, Object> install = Map.of(HOST, "H", STDOUT, "done", STDERR, "");
        Map<String, Object> remove = Map.of(HOST, "H", REMOVED, "false");

        assertThat(extractor.extract(List.of(install, remove)))
                .containsExactly(new TargetedHost("H", "", "failed"));
        assertThat(extractor.extract(List.of(remove, install)))
                .containsExactly(new TargetedHost("H", "", "completed"));
    }

    @Test
    @DisplayName("result is sorted by hostname whatever the input order")
    void sortedOutput() {
        List<Map<String, Object>> events = new ArrayList<>();
        for (String h : List.of("delta", "alpha", "charlie", "bravo", "echo")) {
            Map<String, Object> e = new HashMap<>();
            e.put(HOST, h);
            e.put(STDOUT, "ok");
            events.add(e);
        }
        Collections.shuffle(events);

        assertThat(extractor.extract(events))
                .extracting(TargetedHost::hostname)
                .containsExactly("alpha", "bravo", "charlie", "delta", "echo");
    }

    @Test
    @DisplayName("remove: file_exists fields accept JSON booleans")
    void removeBooleanFlags() {
        List<TargetedHost> hosts = extractor.extract(List.of(
                Map.of(HOST, "alpha", CHECK, true, REMOVED, false),
                Map.of(HOST, "bravo", CHECK, true)));

        assertThat(hosts).containsExactly(
                new TargetedHost("alpha", "", "failed"),
                new TargetedHost("bravo", "", "completed"));
    }

    @Test
    @DisplayName("non-string hostname or install output is ignored")
    void booleansOnlyForFileExists() {
        assertThat(extractor.extract(List.of(Map.of(HOST, true, STDOUT, "installed")))).isEmpty();
        assertThat(extractor.extract(List.of(Map.of(HOST, "alpha", STDERR, true)))).isEmpty();
        assertThat(extractor.extract(List.of(Map.of(HOST, "alpha", STDERR, true, STDOUT, "ok"))))
                .containsExactly(new TargetedHost("alpha", "", "completed"));
    }

    @Test
    @DisplayName("fileExistsFromResponse accepts strings and booleans, rejects other values")
    void responseParsing() {
        assertThat(extractor.fileExistsFromResponse("{\"file_exists\":true}")).isEqualTo("true");
        assertThat(extractor.fileExistsFromResponse("{\"file_exists\":\"false\"}")).isEqualTo("false");
        assertThat(extractor.fileExistsFromResponse("{}")).isEmpty();
        assertThatThrownBy(() -> extractor.fileExistsFromResponse("{\"file_exists\":\"yes\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown truth value");
        assertThatThrownBy(() -> extractor.fileExistsFromResponse("[1,2]"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
