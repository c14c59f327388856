package com.jobhistory.api;

import com.jobhistory.api.dto.StatusResource;
import com.jobhistory.api.dto.UpsertResponse;
import com.jobhistory.config.JobHistoryProperties;
import com.jobhistory.history.JobExecutionUpsertService;
import com.jobhistory.history.UpsertFailedException;
import com.jobhistory.history.UpsertOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.TimeoutException;

/**
 * POST /api/v1/job-executions: upsert the execution record for a workflow notification.
 * 200 with the record (or an ok resource for blank status), 400 for invalid notifications, 500 otherwise.
 */
@RestController
@RequestMapping("/api/v1/job-executions")
@RequiredArgsConstructor
@Slf4j
public class JobExecutionController {

    private final JobExecutionUpsertService upsertService;
    private final JobHistoryProperties properties;

    @PostMapping
    public Mono<ResponseEntity<UpsertResponse>> upsert(@RequestBody(required = false) String body) {
        return Mono.fromCallable(() -> upsertService.upsert(body))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getRequestTimeout())
                .map(JobExecutionController::toResponse)
                .onErrorResume(UpsertFailedException.class, e -> Mono.just(errorResponse(e.getStatus(), e.getMessage())))
                .onErrorResume(TimeoutException.class, e -> {
                    log.error("Upsert request timed out after {}", properties.getRequestTimeout());
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "request timed out"));
                });
    }

    private static ResponseEntity<UpsertResponse> toResponse(UpsertOutcome outcome) {
        if (outcome.skipped()) {
            return ResponseEntity.ok(UpsertResponse.of(StatusResource.ok()));
        }
        return ResponseEntity.ok(UpsertResponse.of(outcome.execution()));
    }

    private static ResponseEntity<UpsertResponse> errorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(UpsertResponse.error(status.value(), message));
    }
}
