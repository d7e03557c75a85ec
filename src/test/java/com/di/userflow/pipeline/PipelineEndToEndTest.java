package com.di.userflow.pipeline;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.load.DestinationRow;
import com.di.userflow.load.UserLoader;
import com.di.userflow.load.UserRowRepository;
import com.di.userflow.metadata.PipelineRunRepository;
import com.di.userflow.source.AvailabilityGate;
import com.di.userflow.source.UserExtractor;
import com.di.userflow.staging.StagingRowCodec;
import com.di.userflow.staging.StagingWriter;
import com.di.userflow.support.H2Database;
import com.di.userflow.support.RecordingSleeper;
import com.di.userflow.support.TestClock;
import com.di.userflow.support.TestRecords;
import com.di.userflow.validation.LoadValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * The real step chain wired as in production, against a stubbed source and an in-memory
 * destination.
 */
@DisplayName("Pipeline End-to-End Tests")
class PipelineEndToEndTest {

    private static final Instant SLOT   = Instant.parse("2024-01-01T00:00:00Z");
    private static final String  RUN_ID = "run_20240101T000000Z";

    @TempDir
    Path stagingDir;

    private MockRestServiceServer server;
    private PipelineProperties    props;
    private JdbcTemplate          jdbc;
    private UserRowRepository     users;
    private StagingWriter         staging;
    private RecordingSleeper      sleeper;
    private PipelineRunner        runner;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient client = builder.build();

        props   = TestRecords.properties(stagingDir);
        jdbc    = H2Database.newJdbcTemplate();
        users   = new UserRowRepository(jdbc, "users");
        users.createTableIfNotExists();
        PipelineRunRepository runs = new PipelineRunRepository(jdbc);
        runs.createTableIfNotExists();

        TestClock clock = new TestClock(SLOT);
        sleeper = new RecordingSleeper(clock);
        StagingRowCodec codec = new StagingRowCodec();
        staging = new StagingWriter(codec, props);

        runner = new PipelineRunner(
                List.of(new AvailabilityGate(client, props, clock, sleeper),
                        new UserExtractor(client, new ObjectMapper(), props),
                        staging,
                        new UserLoader(users, codec, props),
                        new LoadValidator(users, codec, props)),
                staging, runs, new PipelineMetrics(new SimpleMeterRegistry()), sleeper, clock, new ObjectMapper());
    }

    private void sourceAnswers(String body) {
        server.expect(ExpectedCount.manyTimes(), requestTo(TestRecords.SOURCE_URL))
              .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("Should load one row and leave no staging file")
    void testSuccess() throws Exception {
        sourceAnswers(TestRecords.JANE_JSON);

        RunOutcome outcome = runner.runPipeline(SLOT);

        assertEquals(RunState.SUCCEEDED, outcome.getStatus(), outcome::getMessage);
        assertEquals("jdoe", outcome.getLoadedKey());
        List<DestinationRow> rows = users.findByKey("jdoe");
        assertEquals(1, rows.size());
        assertEquals("Jane", rows.get(0).getFirstName());
        assertEquals("Doe", rows.get(0).getLastName());
        assertEquals("US", rows.get(0).getCountry());
        assertEquals("x", rows.get(0).getPassword());
        assertFalse(staging.exists(RUN_ID));
        try (var files = Files.list(stagingDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("Should be idempotent when the same slot runs twice")
    void testReRun() {
        sourceAnswers(TestRecords.JANE_JSON);

        RunOutcome first  = runner.runPipeline(SLOT);
        RunOutcome second = runner.runPipeline(SLOT);

        assertEquals(RunState.SUCCEEDED, first.getStatus());
        assertEquals(RunState.SUCCEEDED, second.getStatus());
        assertEquals(first.getRunId(), second.getRunId());
        assertEquals(1, users.countAll());
    }

    @Test
    @DisplayName("Should fail TIMED_OUT at the gate without attempting any later step")
    void testGateTimeout() {
        props.getGate().setTimeout(Duration.ofSeconds(1));
        server.expect(ExpectedCount.manyTimes(), requestTo(TestRecords.SOURCE_URL))
              .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        RunOutcome outcome = runner.runPipeline(SLOT);

        assertEquals(RunState.FAILED, outcome.getStatus());
        assertEquals("gate", outcome.getFailedStep());
        assertEquals(FailureKind.TIMED_OUT, outcome.getFailureKind());
        assertEquals(java.util.Map.of("gate", 1), outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeper.getSleeps());
        assertEquals(0, users.countAll());
    }

    @Test
    @DisplayName("Should fail extraction after all retries when a field is missing and leave the destination unchanged")
    void testMissingField() {
        jdbc.update("INSERT INTO users (username, first_name, last_name, country, password)"
                + " VALUES ('asmith','Ann','Smith','UK','y')");
        sourceAnswers("{\"first\":\"Jane\",\"last\":\"Doe\",\"username\":\"jdoe\",\"password\":\"x\"}");

        RunOutcome outcome = runner.runPipeline(SLOT);

        assertEquals(RunState.FAILED, outcome.getStatus());
        assertEquals("extract", outcome.getFailedStep());
        assertEquals(FailureKind.EXTRACTION_MALFORMED, outcome.getFailureKind());
        assertEquals(3, outcome.getAttempts().get("extract"));
        assertEquals(List.of(Duration.ofMinutes(5), Duration.ofMinutes(5)), sleeper.getSleeps());
        assertEquals(1, users.countAll());
        assertTrue(users.findByKey("jdoe").isEmpty());
        assertTrue(outcome.isStagingRemoved());
    }
}
