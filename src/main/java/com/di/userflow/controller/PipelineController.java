package com.di.userflow.controller;

import com.di.userflow.metadata.PipelineRun;
import com.di.userflow.metadata.PipelineRunRepository;
import com.di.userflow.pipeline.PipelineTrigger;
import com.di.userflow.pipeline.RunOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Manual trigger, cancellation and run history.
 *
 * <pre>
 * POST /api/pipeline/runs?scheduleTimestamp=2024-01-01T00:00:00Z   run synchronously
 * POST /api/pipeline/runs/{runId}/cancel                           cancel the active run
 * GET  /api/pipeline/runs/{runId}                                  executions of a slot
 * GET  /api/pipeline/runs?status=FAILED&amp;limit=20                   history
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private static final int MAX_LIMIT = 500;

    private final PipelineTrigger       trigger;
    private final PipelineRunRepository runRepository;

    /**
     * Runs the pipeline and answers with its outcome: 200 when it succeeded, 500 otherwise.
     * 409 when another run is active.
     */
    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunOutcome> run(@RequestParam(name = "scheduleTimestamp", required = false) String scheduleTimestamp) {
        Instant slot = parseTimestamp(scheduleTimestamp);
        RunOutcome outcome = trigger.trigger(slot);
        HttpStatus status = outcome.isSucceeded() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(outcome);
    }

    @PostMapping(value = "/runs/{runId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("runId") String runId) {
        if (!trigger.cancel(runId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("runId", runId, "cancelled", false, "reason", "no active run with this id"));
        }
        return ResponseEntity.accepted().body(Map.of("runId", runId, "cancelled", true));
    }

    @GetMapping(value = "/runs/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<PipelineRun>> getRun(@PathVariable("runId") String runId) {
        List<PipelineRun> runs = runRepository.findByRunId(runId);
        return runs.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(runs);
    }

    @GetMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PipelineRun> listRuns(@RequestParam(name = "status", required = false) String status,
                                      @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (status != null && !status.isBlank()) {
            return runRepository.findByStatus(status.trim().toUpperCase());
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return runRepository.findRecent(limit);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "scheduleTimestamp must be an ISO-8601 instant (e.g. 2024-01-01T00:00:00Z), got '" + value + "'", e);
        }
    }
}
