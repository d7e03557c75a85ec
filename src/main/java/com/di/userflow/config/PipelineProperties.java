package com.di.userflow.config;

import com.di.userflow.load.ConflictPolicy;
import com.di.userflow.pipeline.RetryPolicy;
import com.di.userflow.util.InputValidator;
import com.fasterxml.jackson.core.JsonPointer;
import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single binding for all pipeline configuration.
 *
 * <pre>
 * userflow:
 *   pipeline:
 *     source:
 *       url: https://example.org/fakeuser.json
 *       health-url:              # empty = probe source.url
 *       connect-timeout: 10s
 *       read-timeout: 30s
 *       field-mapping:
 *         country: /country,/location/country
 *     gate:
 *       timeout: 5m
 *       poll-interval: 10s
 *     retry:
 *       max-retries: 2
 *       delay: 5m
 *     staging:
 *       directory: /var/tmp/userflow-staging
 *     destination:
 *       table: users
 *       conflict-policy: IGNORE
 *       create-schema: true
 *     schedule:
 *       enabled: false
 *       cron: "0 0 0 * * *"
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "userflow.pipeline")
public class PipelineProperties {

    @Valid private Source      source      = new Source();
    @Valid private Gate        gate        = new Gate();
    @Valid private Retry       retry       = new Retry();
    @Valid private Staging     staging     = new Staging();
    @Valid private Destination destination = new Destination();
    @Valid private Schedule    schedule    = new Schedule();

    /**
     * Fails startup on values the pipeline cannot run with.
     */
    @PostConstruct
    public void validate() {
        if (source.getUrl() == null || source.getUrl().isBlank()) {
            throw new IllegalArgumentException("userflow.pipeline.source.url must be set");
        }
        InputValidator.validatePositive(source.getConnectTimeout(), "source.connect-timeout");
        InputValidator.validatePositive(source.getReadTimeout(), "source.read-timeout");
        InputValidator.validatePositive(gate.getTimeout(), "gate.timeout");
        InputValidator.validatePositive(gate.getPollInterval(), "gate.poll-interval");
        retryPolicy();
        InputValidator.validateTableName(destination.getTable());
        if (staging.getDirectory() == null || staging.getDirectory().isBlank()) {
            throw new IllegalArgumentException("userflow.pipeline.staging.directory must be set");
        }
        source.getFieldMapping().forEach((field, pointers) ->
                pointers.forEach(JsonPointer::compile));
    }

    /** Policy applied to every retryable step. */
    public RetryPolicy retryPolicy() {
        return RetryPolicy.fixed(retry.getMaxRetries(), retry.getDelay());
    }

    // ------------------------------------------------------------------ //

    @Data
    public static class Source {

        @NotBlank
        private String   url = "https://raw.githubusercontent.com/marclamberti/datasets/refs/heads/main/fakeuser.json";

        /** Lightweight availability probe; blank = {@link #url}. */
        private String   healthUrl;

        @NotNull private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull private Duration readTimeout    = Duration.ofSeconds(30);

        /**
         * Canonical field name → JSON Pointer candidates, tried in order. The first candidate
         * resolving to a non-blank scalar wins.
         */
        private Map<String, List<String>> fieldMapping = defaultFieldMapping();

        public String effectiveHealthUrl() {
            return healthUrl == null || healthUrl.isBlank() ? url : healthUrl;
        }

        private static Map<String, List<String>> defaultFieldMapping() {
            Map<String, List<String>> m = new LinkedHashMap<>();
            m.put("firstName", List.of("/first", "/firstName", "/first_name", "/personalInfo/firstName", "/name/first"));
            m.put("lastName",  List.of("/last", "/lastName", "/last_name", "/personalInfo/lastName", "/name/last"));
            m.put("country",   List.of("/country", "/location/country", "/personalInfo/country", "/address/country"));
            m.put("username",  List.of("/username", "/login/username", "/personalInfo/username"));
            m.put("password",  List.of("/password", "/login/password", "/personalInfo/password"));
            return m;
        }
    }

    @Data
    public static class Gate {
        @NotNull private Duration timeout      = Duration.ofMinutes(5);
        @NotNull private Duration pollInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class Retry {
        /** Additional attempts after the first; 0 disables retry. */
        @Min(0) @Max(100)
        private int      maxRetries = 2;
        @NotNull
        private Duration delay      = Duration.ofMinutes(5);
    }

    @Data
    public static class Staging {
        @NotBlank
        private String directory = System.getProperty("java.io.tmpdir") + "/userflow-staging";
    }

    @Data
    public static class Destination {
        @NotBlank
        private String         table          = "users";
        @NotNull
        private ConflictPolicy conflictPolicy = ConflictPolicy.IGNORE;
        /** Run the idempotent CREATE TABLE IF NOT EXISTS at startup. */
        private boolean        createSchema   = true;
    }

    @Data
    public static class Schedule {
        /** Built-in daily trigger; off when an external scheduler drives runs. */
        private boolean enabled = false;
        private String  cron    = "0 0 0 * * *";
    }
}
