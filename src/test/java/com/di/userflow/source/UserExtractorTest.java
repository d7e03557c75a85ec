package com.di.userflow.source;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.pipeline.FailureKind;
import com.di.userflow.pipeline.RunContext;
import com.di.userflow.pipeline.StepResult;
import com.di.userflow.support.TestRecords;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("UserExtractor Tests")
class UserExtractorTest {

    @TempDir
    Path stagingDir;

    private MockRestServiceServer server;
    private PipelineProperties    props;
    private UserExtractor         extractor;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server    = MockRestServiceServer.bindTo(builder).build();
        props     = TestRecords.properties(stagingDir);
        extractor = new UserExtractor(builder.build(), new ObjectMapper(), props);
    }

    private void respond(String body) {
        server.expect(requestTo(TestRecords.SOURCE_URL))
              .andExpect(method(org.springframework.http.HttpMethod.GET))
              .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    // ============================================================================
    // Success
    // ============================================================================

    @Test
    @DisplayName("Should extract the canonical record and store it on the run")
    void testExtractFlatPayload() {
        respond(TestRecords.JANE_JSON);
        RunContext ctx = new RunContext(Instant.EPOCH, Instant.EPOCH);

        StepResult<CanonicalRecord> result = extractor.run(ctx);

        assertTrue(result.isSuccess());
        assertEquals(TestRecords.jane(), result.getValue());
        assertEquals(TestRecords.jane(), ctx.getRecord());
        server.verify();
    }

    @Test
    @DisplayName("Should normalize nested and alternative field names")
    void testExtractNestedPayload() {
        StepResult<CanonicalRecord> result = extractor.normalize("""
            {"name": {"first": " Jane ", "last": "Doe"},
             "location": {"country": "US"},
             "login": {"username": "jdoe", "password": "x"},
             "email": "ignored@example.org"}
            """);

        assertTrue(result.isSuccess());
        assertEquals(TestRecords.jane(), result.getValue());
    }

    @Test
    @DisplayName("Should honour a configured field mapping")
    void testConfiguredMapping() {
        props.getSource().getFieldMapping().put("country", List.of("/nation"));

        StepResult<CanonicalRecord> result = extractor.normalize(
                "{\"first\":\"Jane\",\"last\":\"Doe\",\"nation\":\"US\",\"username\":\"jdoe\",\"password\":\"x\"}");

        assertEquals("US", result.getValue().country());
    }

    // ============================================================================
    // Malformed payloads
    // ============================================================================

    @Test
    @DisplayName("Should fail as malformed when a required field is missing")
    void testMissingField() {
        StepResult<CanonicalRecord> result = extractor.normalize(
                "{\"first\":\"Jane\",\"last\":\"Doe\",\"username\":\"jdoe\",\"password\":\"x\"}");

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.EXTRACTION_MALFORMED, result.getFailure().getKind());
        assertTrue(result.getFailure().getMessage().contains("country"));
    }

    @Test
    @DisplayName("Should never default a blank field")
    void testBlankField() {
        StepResult<CanonicalRecord> result = extractor.normalize(
                "{\"first\":\"Jane\",\"last\":\"Doe\",\"country\":\"  \",\"username\":\"jdoe\",\"password\":\"x\"}");

        assertEquals(FailureKind.EXTRACTION_MALFORMED, result.getFailure().getKind());
    }

    @Test
    @DisplayName("Should reject a payload that is not a single object")
    void testArrayPayload() {
        StepResult<CanonicalRecord> result = extractor.normalize("[" + TestRecords.JANE_JSON + "]");

        assertEquals(FailureKind.EXTRACTION_MALFORMED, result.getFailure().getKind());
    }

    @Test
    @DisplayName("Should fail to decode invalid or empty bodies")
    void testUndecodable() {
        assertEquals(FailureKind.EXTRACTION_DECODE, extractor.normalize("<html>oops</html>").getFailure().getKind());
        assertEquals(FailureKind.EXTRACTION_DECODE, extractor.normalize("").getFailure().getKind());
        assertEquals(FailureKind.EXTRACTION_DECODE, extractor.normalize(null).getFailure().getKind());
    }

    // ============================================================================
    // Transport
    // ============================================================================

    @Test
    @DisplayName("Should report a non-2xx answer as a status failure")
    void testServerError() {
        server.expect(requestTo(TestRecords.SOURCE_URL)).andRespond(withServerError());

        StepResult<CanonicalRecord> result = extractor.extract();

        assertEquals(FailureKind.EXTRACTION_STATUS, result.getFailure().getKind());
        assertTrue(result.getFailure().getMessage().contains("500"));
    }

    @Test
    @DisplayName("Should report a refused connection as a transport failure")
    void testTransportError() {
        server.expect(requestTo(TestRecords.SOURCE_URL))
              .andRespond(withException(new ConnectException("Connection refused")));

        StepResult<CanonicalRecord> result = extractor.extract();

        assertEquals(FailureKind.EXTRACTION_TRANSPORT, result.getFailure().getKind());
        assertTrue(result.getFailure().isRetryable());
    }
}
