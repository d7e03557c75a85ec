package com.di.userflow.metadata;

import com.di.userflow.support.H2Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineRunRepository Tests")
class PipelineRunRepositoryTest {

    private static final Instant SLOT = Instant.parse("2024-01-01T00:00:00Z");

    private PipelineRunRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PipelineRunRepository(H2Database.newJdbcTemplate());
        repository.createTableIfNotExists();
    }

    private PipelineRun started(String id, Instant startedAt) {
        PipelineRun run = PipelineRun.builder()
                .id(id)
                .runId("run_20240101T000000Z")
                .scheduleTimestamp(SLOT)
                .status("PENDING")
                .startedAt(startedAt)
                .build();
        repository.insert(run);
        return run;
    }

    @Test
    @DisplayName("Should record a run from start to finish")
    void testLifecycle() {
        started("a", SLOT.plusSeconds(1));
        repository.updateStatus("a", "LOADING");
        assertEquals("LOADING", repository.findById("a").orElseThrow().getStatus());

        repository.markFinished(PipelineRun.builder()
                .id("a")
                .status("FAILED")
                .failedStep("validate")
                .failureKind("VALIDATION_MISMATCH")
                .errorCategory("DATA_ERROR")
                .errorMessage("Row for key jdoe differs in column(s): country")
                .loadedKey("jdoe")
                .stagingRemoved(true)
                .attemptsJson("{\"gate\":1,\"validate\":3}")
                .finishedAt(SLOT.plusSeconds(90))
                .build());

        PipelineRun row = repository.findById("a").orElseThrow();
        assertEquals("FAILED", row.getStatus());
        assertEquals("validate", row.getFailedStep());
        assertEquals(Boolean.TRUE, row.getStagingRemoved());
        assertEquals(SLOT, row.getScheduleTimestamp());
        assertEquals(SLOT.plusSeconds(90), row.getFinishedAt());
    }

    @Test
    @DisplayName("Should keep every execution of a slot, newest first")
    void testReRuns() {
        started("first", SLOT.plusSeconds(1));
        started("second", SLOT.plusSeconds(600));

        List<PipelineRun> runs = repository.findByRunId("run_20240101T000000Z");

        assertEquals(List.of("second", "first"), runs.stream().map(PipelineRun::getId).toList());
        assertEquals(2, repository.findByStatus("PENDING").size());
        assertEquals(1, repository.findRecent(1).size());
    }

    @Test
    @DisplayName("Should return empty for unknown ids")
    void testUnknown() {
        assertEquals(Optional.empty(), repository.findById("missing"));
        assertTrue(repository.findByRunId("run_19700101T000000Z").isEmpty());
    }
}
