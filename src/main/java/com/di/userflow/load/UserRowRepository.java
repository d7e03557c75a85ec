package com.di.userflow.load;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * JDBC repository for the destination user table.
 *
 * <p>The table name comes from configuration and is validated as a plain identifier; every
 * field value is bound as a statement parameter.
 *
 * <p>The upsert is written as plain UPDATE / INSERT statements so it behaves the same on
 * every database: a unique-key collision on INSERT is the expected conflict and is resolved
 * by the {@link ConflictPolicy}, never surfaced as an error.
 */
@Repository
@Slf4j
public class UserRowRepository {

    private final JdbcTemplate jdbc;
    private final String       table;

    private final String insertSql;
    private final String updateSql;
    private final String selectByKeySql;

    @Autowired
    public UserRowRepository(JdbcTemplate jdbc, PipelineProperties props) {
        this(jdbc, props.getDestination().getTable());
    }

    public UserRowRepository(JdbcTemplate jdbc, String table) {
        this.jdbc  = jdbc;
        this.table = InputValidator.validateTableName(table);

        this.insertSql = "INSERT INTO " + this.table
                + " (username, first_name, last_name, country, password) VALUES (?,?,?,?,?)";
        this.updateSql = "UPDATE " + this.table
                + " SET first_name = ?, last_name = ?, country = ?, password = ? WHERE username = ?";
        this.selectByKeySql = "SELECT username, first_name, last_name, country, password, loaded_at FROM "
                + this.table + " WHERE username = ?";
    }

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<DestinationRow> ROW_MAPPER = (rs, n) -> {
        DestinationRow r = new DestinationRow();
        r.setUsername(rs.getString("username"));
        r.setFirstName(rs.getString("first_name"));
        r.setLastName(rs.getString("last_name"));
        r.setCountry(rs.getString("country"));
        r.setPassword(rs.getString("password"));
        Timestamp ts = rs.getTimestamp("loaded_at");
        r.setLoadedAt(ts == null ? null : ts.toInstant());
        return r;
    };

    // ------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------

    /** Idempotent; safe to call on every start. */
    public void createTableIfNotExists() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                + " username   VARCHAR(255) PRIMARY KEY,"
                + " first_name VARCHAR(255) NOT NULL,"
                + " last_name  VARCHAR(255) NOT NULL,"
                + " country    VARCHAR(255) NOT NULL,"
                + " password   VARCHAR(255) NOT NULL,"
                + " loaded_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP"
                + ")");
        log.info("[SCHEMA] destination table {} ready", table);
    }

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /**
     * Writes the record keyed by username. Repeating the call with the same record leaves
     * exactly one row.
     */
    public LoadAction upsert(CanonicalRecord record, ConflictPolicy policy) {
        if (policy == ConflictPolicy.OVERWRITE) {
            if (update(record) > 0) {
                return LoadAction.UPDATED;
            }
            try {
                insert(record);
                return LoadAction.INSERTED;
            } catch (DuplicateKeyException raced) {
                log.debug("[LOAD] key {} appeared between UPDATE and INSERT; updating", record.key());
                update(record);
                return LoadAction.UPDATED;
            }
        }

        try {
            insert(record);
            return LoadAction.INSERTED;
        } catch (DuplicateKeyException exists) {
            return LoadAction.IGNORED;
        }
    }

    private void insert(CanonicalRecord r) {
        jdbc.update(insertSql, r.username(), r.firstName(), r.lastName(), r.country(), r.password());
    }

    private int update(CanonicalRecord r) {
        return jdbc.update(updateSql, r.firstName(), r.lastName(), r.country(), r.password(), r.username());
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public List<DestinationRow> findByKey(String username) {
        return jdbc.query(selectByKeySql, ROW_MAPPER, username);
    }

    public long countAll() {
        Long cnt = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return cnt == null ? 0L : cnt;
    }

    public String getTable() {
        return table;
    }
}
