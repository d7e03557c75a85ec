package com.di.userflow.config;

import com.di.userflow.load.UserRowRepository;
import com.di.userflow.metadata.PipelineRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Creates the destination and audit tables once at startup, never per run. Both statements
 * are {@code CREATE TABLE IF NOT EXISTS}, so restarts are harmless.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class DestinationSchemaInitializer implements ApplicationRunner {

    private final UserRowRepository     userRowRepository;
    private final PipelineRunRepository runRepository;
    private final PipelineProperties    props;

    @Override
    public void run(ApplicationArguments args) {
        runRepository.createTableIfNotExists();
        if (!props.getDestination().isCreateSchema()) {
            log.info("[SCHEMA] create-schema=false; expecting table {} to exist", userRowRepository.getTable());
            return;
        }
        userRowRepository.createTableIfNotExists();
    }
}
