package com.di.userflow.load;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.error.ErrorCategory;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.pipeline.FailureKind;
import com.di.userflow.pipeline.PipelineStep;
import com.di.userflow.pipeline.RetryPolicy;
import com.di.userflow.pipeline.RunContext;
import com.di.userflow.pipeline.RunState;
import com.di.userflow.pipeline.StepResult;
import com.di.userflow.staging.StagingArtifact;
import com.di.userflow.staging.StagingRowCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * Reads the staged row and upserts it into the destination table.
 *
 * <p>This is the step that makes re-runs safe: loading the same artifact twice leaves one
 * row. The expected key conflict is absorbed by {@link UserRowRepository#upsert}; any other
 * constraint violation is reported as {@code LOAD_CONSTRAINT}, every other database error
 * as {@code LOAD_CONNECTION}.
 */
@Component
@Slf4j
public class UserLoader implements PipelineStep {

    public static final String STEP_NAME = "load";

    private final UserRowRepository  repository;
    private final StagingRowCodec    codec;
    private final PipelineProperties props;

    public UserLoader(UserRowRepository repository, StagingRowCodec codec, PipelineProperties props) {
        this.repository = repository;
        this.codec      = codec;
        this.props      = props;
    }

    @Override
    public String name() {
        return STEP_NAME;
    }

    @Override
    public RunState state() {
        return RunState.LOADING;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return props.retryPolicy();
    }

    @Override
    public StepResult<LoadResult> run(RunContext ctx) {
        StagingArtifact artifact = ctx.getArtifact();
        if (artifact == null) {
            return StepResult.failed(FailureKind.LOAD_MALFORMED, "No staging artifact for run " + ctx.getRunId());
        }
        StepResult<LoadResult> result = load(artifact);
        if (result.isSuccess()) {
            ctx.setLoadResult(result.getValue());
        }
        return result;
    }

    public StepResult<LoadResult> load(StagingArtifact artifact) {
        CanonicalRecord record;
        try {
            record = codec.read(artifact.toPath());
        } catch (NoSuchFileException e) {
            return StepResult.failed(FailureKind.LOAD_MALFORMED,
                    "Staging artifact " + artifact.path() + " does not exist", e);
        } catch (IOException e) {
            return StepResult.failed(FailureKind.LOAD_MALFORMED,
                    "Staging artifact " + artifact.path() + " unreadable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            return StepResult.failed(FailureKind.LOAD_MALFORMED,
                    "Staging artifact " + artifact.path() + " malformed: " + e.getMessage(), e);
        }

        ConflictPolicy policy = props.getDestination().getConflictPolicy();
        LoadAction action;
        try {
            action = repository.upsert(record, policy);
        } catch (DataAccessException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            FailureKind kind = category == ErrorCategory.CONSTRAINT_VIOLATION
                    ? FailureKind.LOAD_CONSTRAINT
                    : FailureKind.LOAD_CONNECTION;
            return StepResult.failed(kind,
                    "Upsert of key " + record.key() + " into " + repository.getTable() + " failed: "
                    + e.getMostSpecificCause().getMessage(), e);
        }

        log.info("[LOAD] runId={} key={} table={} policy={} → {}",
                 artifact.runId(), record.key(), repository.getTable(), policy, action);
        return StepResult.ok(new LoadResult(record.key(), action));
    }
}
