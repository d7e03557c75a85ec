package com.di.userflow.staging;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.pipeline.FailureKind;
import com.di.userflow.pipeline.PipelineStep;
import com.di.userflow.pipeline.RetryPolicy;
import com.di.userflow.pipeline.RunContext;
import com.di.userflow.pipeline.RunState;
import com.di.userflow.pipeline.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Persists the canonical record as {@code <staging-dir>/user_<runId>.csv}.
 *
 * <p>The file is written to a sibling temp file and moved into place, so a second write for
 * the same run replaces the file instead of appending, and a reader never sees half a row.
 * Deleting the file is the runner's job ({@link #delete(String)}), not this step's.
 */
@Component
@Slf4j
public class StagingWriter implements PipelineStep {

    public static final String STEP_NAME = "stage";

    private static final String PREFIX     = "user_";
    private static final String SUFFIX     = ".csv";
    private static final String TMP_SUFFIX = ".tmp";

    private final StagingRowCodec    codec;
    private final PipelineProperties props;

    public StagingWriter(StagingRowCodec codec, PipelineProperties props) {
        this.codec = codec;
        this.props = props;
    }

    @Override
    public String name() {
        return STEP_NAME;
    }

    @Override
    public RunState state() {
        return RunState.STAGING;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return props.retryPolicy();
    }

    @Override
    public StepResult<StagingArtifact> run(RunContext ctx) {
        CanonicalRecord record = ctx.getRecord();
        if (record == null) {
            return StepResult.failed(FailureKind.STAGING_IO, "No extracted record to stage");
        }
        StepResult<StagingArtifact> result = write(record, ctx.getRunId());
        if (result.isSuccess()) {
            ctx.setArtifact(result.getValue());
        }
        return result;
    }

    public StepResult<StagingArtifact> write(CanonicalRecord record, String runId) {
        Path target = resolve(runId);
        Path tmp    = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            codec.write(record, tmp);
            moveIntoPlace(tmp, target);
        } catch (IOException | UncheckedIOException e) {
            deleteQuietly(tmp);
            return StepResult.failed(FailureKind.STAGING_IO,
                    "Could not write staging file " + target + ": " + e.getMessage(), e);
        }

        log.info("[STAGE] runId={} staged key={} → {}", runId, record.key(), target);
        return StepResult.ok(new StagingArtifact(target.toString(), runId, StagingArtifact.FORMAT_CSV));
    }

    /** Location of the staging file for a run; the file may not exist. */
    public Path resolve(String runId) {
        if (runId == null || runId.isBlank() || runId.contains("/") || runId.contains("\\") || runId.contains("..")) {
            throw new IllegalArgumentException("Invalid runId for staging: " + runId);
        }
        return Paths.get(props.getStaging().getDirectory()).toAbsolutePath().resolve(PREFIX + runId + SUFFIX);
    }

    /**
     * Removes the staging file of a run and any temp file left by an interrupted write.
     *
     * @return true when nothing for the run remains on disk
     */
    public boolean delete(String runId) {
        Path target = resolve(runId);
        Path tmp    = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        boolean removed = true;
        for (Path p : new Path[] {target, tmp}) {
            try {
                if (Files.deleteIfExists(p)) {
                    log.debug("[STAGE] deleted {}", p);
                }
            } catch (IOException e) {
                log.error("[STAGE] runId={} could not delete {}: {}", runId, p, e.getMessage(), e);
                removed = false;
            }
        }
        return removed;
    }

    public boolean exists(String runId) {
        return Files.exists(resolve(runId));
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("[STAGE] could not remove temp file {}: {}", p, e.getMessage());
        }
    }
}
