package com.di.userflow.source;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.pipeline.FailureKind;
import com.di.userflow.pipeline.PipelineStep;
import com.di.userflow.pipeline.RunContext;
import com.di.userflow.pipeline.RunState;
import com.di.userflow.pipeline.RetryPolicy;
import com.di.userflow.pipeline.StepResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches one user payload from the source and normalizes it into a {@link CanonicalRecord}.
 *
 * <h3>Field-name normalization</h3>
 * Each canonical field is looked up through its ordered JSON Pointer candidates
 * ({@code userflow.pipeline.source.field-mapping}); the first candidate that resolves to a
 * non-blank scalar wins and is trimmed. A field with no resolving candidate fails the
 * extraction as malformed; blanks are never defaulted.
 *
 * <h3>Failure kinds</h3>
 * <ul>
 *   <li>{@code EXTRACTION_TRANSPORT} – connection refused, timeout, DNS</li>
 *   <li>{@code EXTRACTION_STATUS} – non-2xx answer</li>
 *   <li>{@code EXTRACTION_DECODE} – empty body or invalid JSON</li>
 *   <li>{@code EXTRACTION_MALFORMED} – not a JSON object, or a required field missing/blank</li>
 * </ul>
 */
@Component
@Slf4j
public class UserExtractor implements PipelineStep {

    public static final String STEP_NAME = "extract";

    private final RestClient         restClient;
    private final ObjectMapper       objectMapper;
    private final PipelineProperties props;

    public UserExtractor(RestClient sourceRestClient,
                         ObjectMapper objectMapper,
                         PipelineProperties props) {
        this.restClient   = sourceRestClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    @Override
    public String name() {
        return STEP_NAME;
    }

    @Override
    public RunState state() {
        return RunState.EXTRACTING;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return props.retryPolicy();
    }

    @Override
    public StepResult<CanonicalRecord> run(RunContext ctx) {
        StepResult<CanonicalRecord> result = extract();
        if (result.isSuccess()) {
            ctx.setRecord(result.getValue());
        }
        return result;
    }

    public StepResult<CanonicalRecord> extract() {
        String url = props.getSource().getUrl();
        log.info("[EXTRACT] fetching {}", url);

        ResponseEntity<String> response;
        try {
            response = restClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .toEntity(String.class);
        } catch (RestClientResponseException e) {
            return StepResult.failed(FailureKind.EXTRACTION_STATUS,
                    "Source answered " + e.getStatusCode().value() + " for " + url, e);
        } catch (RestClientException e) {
            return StepResult.failed(FailureKind.EXTRACTION_TRANSPORT,
                    "Fetch from " + url + " failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            return StepResult.failed(FailureKind.EXTRACTION_STATUS,
                    "Source answered " + response.getStatusCode().value() + " for " + url);
        }
        return normalize(response.getBody());
    }

    /**
     * Decodes a raw payload and maps it to the canonical shape.
     */
    public StepResult<CanonicalRecord> normalize(String body) {
        if (body == null || body.isBlank()) {
            return StepResult.failed(FailureKind.EXTRACTION_DECODE, "Source returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return StepResult.failed(FailureKind.EXTRACTION_DECODE,
                    "Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            return StepResult.failed(FailureKind.EXTRACTION_MALFORMED,
                    "Expected a single JSON object, got " + (root == null ? "nothing" : root.getNodeType()));
        }

        Map<String, String> values  = new LinkedHashMap<>();
        List<String>        missing = new ArrayList<>();
        for (String field : CanonicalRecord.FIELDS) {
            String value = resolve(root, candidatesFor(field));
            if (value == null) {
                missing.add(field);
            } else {
                values.put(field, value);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("[EXTRACT] payload missing required field(s) {}", missing);
            return StepResult.failed(FailureKind.EXTRACTION_MALFORMED,
                    "Payload missing required field(s): " + String.join(", ", missing));
        }

        CanonicalRecord record = new CanonicalRecord(
                values.get("firstName"),
                values.get("lastName"),
                values.get("country"),
                values.get("username"),
                values.get("password"));
        log.info("[EXTRACT] extracted {}", record);
        return StepResult.ok(record);
    }

    private List<String> candidatesFor(String field) {
        List<String> configured = props.getSource().getFieldMapping().get(field);
        return configured == null || configured.isEmpty() ? List.of("/" + field) : configured;
    }

    private static String resolve(JsonNode root, List<String> pointers) {
        for (String pointer : pointers) {
            JsonNode node = root.at(pointer.trim());
            if (node.isValueNode() && !node.isNull()) {
                String text = node.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
