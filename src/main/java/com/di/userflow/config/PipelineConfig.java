package com.di.userflow.config;

import com.di.userflow.load.UserLoader;
import com.di.userflow.metadata.PipelineRunRepository;
import com.di.userflow.pipeline.PipelineMetrics;
import com.di.userflow.pipeline.PipelineRunner;
import com.di.userflow.pipeline.Sleeper;
import com.di.userflow.source.AvailabilityGate;
import com.di.userflow.source.UserExtractor;
import com.di.userflow.staging.StagingWriter;
import com.di.userflow.validation.LoadValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for the step chain and its collaborators.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    /** HTTP client for the source; used by both the gate probe and the extractor. */
    @Bean
    public RestClient sourceRestClient(RestClient.Builder builder, PipelineProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.getSource().getConnectTimeout());
        factory.setReadTimeout(props.getSource().getReadTimeout());
        return builder.requestFactory(factory).build();
    }

    /**
     * The chain order is fixed here: gate, extract, stage, load, validate.
     */
    @Bean
    public PipelineRunner pipelineRunner(AvailabilityGate gate,
                                         UserExtractor extractor,
                                         StagingWriter stagingWriter,
                                         UserLoader loader,
                                         LoadValidator validator,
                                         PipelineRunRepository runRepository,
                                         PipelineMetrics metrics,
                                         Sleeper sleeper,
                                         Clock clock,
                                         ObjectMapper objectMapper) {
        PipelineRunner runner = new PipelineRunner(
                List.of(gate, extractor, stagingWriter, loader, validator),
                stagingWriter, runRepository, metrics, sleeper, clock, objectMapper);
        log.info("[CONFIG] pipeline steps {}", runner.stepNames());
        return runner;
    }
}
