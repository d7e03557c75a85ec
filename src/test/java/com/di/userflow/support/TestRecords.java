package com.di.userflow.support;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.model.CanonicalRecord;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Shared fixtures.
 */
public final class TestRecords {

    public static final String SOURCE_URL = "http://source.test/fakeuser.json";

    public static final String JANE_JSON =
            "{\"first\":\"Jane\",\"last\":\"Doe\",\"country\":\"US\",\"username\":\"jdoe\",\"password\":\"x\"}";

    private TestRecords() {}

    public static CanonicalRecord jane() {
        return new CanonicalRecord("Jane", "Doe", "US", "jdoe", "x");
    }

    public static PipelineProperties properties(Path stagingDir) {
        PipelineProperties props = new PipelineProperties();
        props.getSource().setUrl(SOURCE_URL);
        props.getGate().setTimeout(Duration.ofMinutes(5));
        props.getGate().setPollInterval(Duration.ofSeconds(10));
        props.getRetry().setMaxRetries(2);
        props.getRetry().setDelay(Duration.ofMinutes(5));
        props.getStaging().setDirectory(stagingDir.toString());
        return props;
    }
}
