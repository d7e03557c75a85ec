package com.di.userflow.staging;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Handle to the staging file of one run.
 *
 * @param path   absolute location of the file
 * @param runId  run that owns the file
 * @param format encoding of the file; always {@link #FORMAT_CSV}
 */
public record StagingArtifact(String path, String runId, String format) {

    public static final String FORMAT_CSV = "delimited-row/csv";

    public Path toPath() {
        return Paths.get(path);
    }
}
