package com.di.userflow.validation;

import java.time.Instant;

/**
 * Successful validation summary.
 *
 * @param key       validated destination key
 * @param totalRows row count of the whole destination table after the load
 * @param loadedAt  creation time of the validated row, null when the column is empty
 */
public record ValidationReport(String key, long totalRows, Instant loadedAt) {
}
