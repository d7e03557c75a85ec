package com.di.userflow.pipeline;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.exception.PipelineBusyException;
import com.di.userflow.staging.StagingRowCodec;
import com.di.userflow.staging.StagingWriter;
import com.di.userflow.support.RecordingSleeper;
import com.di.userflow.support.TestClock;
import com.di.userflow.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineTrigger Tests")
class PipelineTriggerTest {

    @TempDir
    Path dir;

    private PipelineProperties props;
    private TestClock          clock;
    private List<String>       runIds;
    private CountDownLatch     entered;
    private CountDownLatch     release;
    private PipelineTrigger    trigger;

    @BeforeEach
    void setUp() {
        props   = TestRecords.properties(dir);
        clock   = new TestClock(Instant.parse("2024-01-01T00:00:03.250Z"));
        runIds  = new CopyOnWriteArrayList<>();
        entered = new CountDownLatch(1);
        release = new CountDownLatch(0);

        PipelineStep record = new PipelineStep() {
            @Override
            public String name() {
                return "gate";
            }

            @Override
            public RunState state() {
                return RunState.GATING;
            }

            @Override
            public RetryPolicy retryPolicy() {
                return RetryPolicy.none();
            }

            @Override
            public StepResult<?> run(RunContext ctx) {
                runIds.add(ctx.getRunId());
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return StepResult.ok(true);
            }
        };
        PipelineRunner runner = new PipelineRunner(List.of(record),
                new StagingWriter(new StagingRowCodec(), props), null, null,
                new RecordingSleeper(), clock, null);
        trigger = new PipelineTrigger(runner, props, clock);
    }

    @Test
    @DisplayName("Should run the requested slot")
    void testTriggerSlot() {
        RunOutcome outcome = trigger.trigger(Instant.parse("2024-02-29T12:00:00Z"));

        assertEquals(RunState.SUCCEEDED, outcome.getStatus());
        assertEquals(List.of("run_20240229T120000Z"), runIds);
        assertFalse(trigger.isBusy());
    }

    @Test
    @DisplayName("Should use the current second when no slot is given")
    void testTriggerNow() {
        trigger.trigger(null);

        assertEquals(List.of("run_20240101T000003Z"), runIds);
    }

    @Test
    @DisplayName("Should reject a second run while one is active")
    void testBusy() throws Exception {
        release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RunOutcome> first = executor.submit(() -> trigger.trigger(Instant.parse("2024-01-01T00:00:00Z")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            PipelineBusyException ex = assertThrows(PipelineBusyException.class,
                    () -> trigger.trigger(Instant.parse("2024-01-02T00:00:00Z")));
            assertEquals("run_20240101T000000Z", ex.getActiveRunId());
            assertTrue(trigger.isBusy());

            release.countDown();
            assertEquals(RunState.SUCCEEDED, first.get(5, TimeUnit.SECONDS).getStatus());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertEquals(List.of("run_20240101T000000Z"), runIds);
    }

    @Test
    @DisplayName("Should do nothing on schedule while the built-in schedule is disabled")
    void testScheduleDisabled() {
        trigger.scheduledRun();

        assertTrue(runIds.isEmpty());
    }

    @Test
    @DisplayName("Should run the day's slot on schedule when enabled")
    void testScheduleEnabled() {
        props.getSchedule().setEnabled(true);

        trigger.scheduledRun();

        assertEquals(List.of("run_20240101T000000Z"), runIds);
    }
}
