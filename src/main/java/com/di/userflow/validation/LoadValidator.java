package com.di.userflow.validation;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.load.DestinationRow;
import com.di.userflow.load.UserRowRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Post-load check: re-queries the destination for the loaded key and compares the row with
 * the record held in the staging artifact (still on disk; cleanup runs after this step).
 *
 * <p>Read-only. Mismatch reports name the differing columns but never their values.
 */
@Component
@Slf4j
public class LoadValidator implements PipelineStep {

    public static final String STEP_NAME = "validate";

    private final UserRowRepository  repository;
    private final StagingRowCodec    codec;
    private final PipelineProperties props;

    public LoadValidator(UserRowRepository repository, StagingRowCodec codec, PipelineProperties props) {
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
        return RunState.VALIDATING;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return props.retryPolicy();
    }

    @Override
    public StepResult<ValidationReport> run(RunContext ctx) {
        CanonicalRecord expected = expectedRecord(ctx);
        if (expected == null) {
            return StepResult.failed(FailureKind.VALIDATION_MISSING,
                    "Nothing was loaded in run " + ctx.getRunId() + "; no record to validate");
        }
        String key = ctx.getLoadResult() != null ? ctx.getLoadResult().key() : expected.key();
        return validate(key, expected);
    }

    /**
     * Confirms exactly one destination row exists for {@code key} and equals {@code expected}.
     */
    public StepResult<ValidationReport> validate(String key, CanonicalRecord expected) {
        List<DestinationRow> rows;
        long total;
        try {
            rows  = repository.findByKey(key);
            total = repository.countAll();
        } catch (DataAccessException e) {
            return StepResult.failed(FailureKind.VALIDATION_QUERY,
                    "Could not query " + repository.getTable() + " for key " + key + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }

        if (rows.isEmpty()) {
            return StepResult.failed(FailureKind.VALIDATION_MISSING,
                    "No row for key " + key + " in " + repository.getTable());
        }
        if (rows.size() > 1) {
            return StepResult.failed(FailureKind.VALIDATION_DUPLICATE,
                    rows.size() + " rows for key " + key + " in " + repository.getTable());
        }

        DestinationRow actual = rows.get(0);
        List<String> mismatched = diff(DestinationRow.of(expected), actual);
        if (!mismatched.isEmpty()) {
            return StepResult.failed(FailureKind.VALIDATION_MISMATCH,
                    "Row for key " + key + " differs in column(s): " + String.join(", ", mismatched));
        }

        log.info("[VALIDATE] key={} PASS, table {} now holds {} row(s); row loaded at {}",
                 key, repository.getTable(), total, actual.getLoadedAt());
        return StepResult.ok(new ValidationReport(key, total, actual.getLoadedAt()));
    }

    private CanonicalRecord expectedRecord(RunContext ctx) {
        StagingArtifact artifact = ctx.getArtifact();
        if (artifact != null) {
            try {
                return codec.read(artifact.toPath());
            } catch (IOException | RuntimeException e) {
                log.warn("[VALIDATE] runId={} could not re-read {} ({}); using in-memory record",
                         ctx.getRunId(), artifact.path(), e.getMessage());
            }
        }
        return ctx.getRecord();
    }

    private static List<String> diff(DestinationRow expected, DestinationRow actual) {
        List<String> cols = new ArrayList<>();
        if (!Objects.equals(expected.getUsername(), actual.getUsername()))   cols.add("username");
        if (!Objects.equals(expected.getFirstName(), actual.getFirstName())) cols.add("first_name");
        if (!Objects.equals(expected.getLastName(), actual.getLastName()))   cols.add("last_name");
        if (!Objects.equals(expected.getCountry(), actual.getCountry()))     cols.add("country");
        if (!Objects.equals(expected.getPassword(), actual.getPassword()))   cols.add("password");
        return cols;
    }
}
