package com.di.userflow.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the {@code pipeline_runs} table.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PipelineRunRepository {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<PipelineRun> ROW_MAPPER = (rs, n) -> {
        PipelineRun r = new PipelineRun();
        r.setId(rs.getString("id"));
        r.setRunId(rs.getString("run_id"));
        r.setScheduleTimestamp(toInstant(rs.getTimestamp("schedule_ts")));
        r.setStatus(rs.getString("status"));
        r.setFailedStep(rs.getString("failed_step"));
        r.setFailureKind(rs.getString("failure_kind"));
        r.setErrorCategory(rs.getString("error_category"));
        r.setErrorMessage(rs.getString("error_message"));
        r.setLoadedKey(rs.getString("loaded_key"));
        boolean removed = rs.getBoolean("staging_removed");
        r.setStagingRemoved(rs.wasNull() ? null : removed);
        r.setAttemptsJson(rs.getString("attempts_json"));
        r.setStartedAt(toInstant(rs.getTimestamp("started_at")));
        r.setFinishedAt(toInstant(rs.getTimestamp("finished_at")));
        return r;
    };

    // ------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------

    public void createTableIfNotExists() {
        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs (
              id              VARCHAR(64)   PRIMARY KEY,
              run_id          VARCHAR(64)   NOT NULL,
              schedule_ts     TIMESTAMP     NOT NULL,
              status          VARCHAR(32)   NOT NULL,
              failed_step     VARCHAR(64),
              failure_kind    VARCHAR(64),
              error_category  VARCHAR(64),
              error_message   VARCHAR(4000),
              loaded_key      VARCHAR(255),
              staging_removed BOOLEAN,
              attempts_json   VARCHAR(1000),
              started_at      TIMESTAMP     NOT NULL,
              finished_at     TIMESTAMP
            )
            """);
        log.info("[SCHEMA] audit table pipeline_runs ready");
    }

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    public void insert(PipelineRun run) {
        jdbc.update("""
            INSERT INTO pipeline_runs
              (id, run_id, schedule_ts, status, started_at)
            VALUES (?,?,?,?,?)
            """,
            run.getId(), run.getRunId(), Timestamp.from(run.getScheduleTimestamp()),
            run.getStatus(), Timestamp.from(run.getStartedAt()));
    }

    public void updateStatus(String id, String status) {
        jdbc.update("UPDATE pipeline_runs SET status = ? WHERE id = ?", status, id);
    }

    public void markFinished(PipelineRun run) {
        jdbc.update("""
            UPDATE pipeline_runs
               SET status = ?, failed_step = ?, failure_kind = ?, error_category = ?,
                   error_message = ?, loaded_key = ?, staging_removed = ?, attempts_json = ?,
                   finished_at = ?
             WHERE id = ?
            """,
            run.getStatus(), run.getFailedStep(), run.getFailureKind(), run.getErrorCategory(),
            truncate(run.getErrorMessage(), 4000), run.getLoadedKey(), run.getStagingRemoved(),
            run.getAttemptsJson(),
            run.getFinishedAt() == null ? null : Timestamp.from(run.getFinishedAt()),
            run.getId());
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<PipelineRun> findById(String id) {
        List<PipelineRun> rows = jdbc.query(
                "SELECT * FROM pipeline_runs WHERE id = ?", ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** All executions of a schedule slot, newest first. */
    public List<PipelineRun> findByRunId(String runId) {
        return jdbc.query(
                "SELECT * FROM pipeline_runs WHERE run_id = ? ORDER BY started_at DESC",
                ROW_MAPPER, runId);
    }

    public List<PipelineRun> findByStatus(String status) {
        return jdbc.query(
                "SELECT * FROM pipeline_runs WHERE status = ? ORDER BY started_at DESC",
                ROW_MAPPER, status);
    }

    public List<PipelineRun> findRecent(int limit) {
        return jdbc.query(
                "SELECT * FROM pipeline_runs ORDER BY started_at DESC LIMIT ?",
                ROW_MAPPER, limit);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
