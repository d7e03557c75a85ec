package com.di.userflow.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories attached to every step failure for logging and metrics.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The cause chain is walked first for a {@link SQLException} so that Spring's
 * {@code DataAccessException} wrappers are classified by the driver's SQLState.
 * To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or unknown table/column"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    HTTP_STATUS_ERROR("HTTP status error", "Remote endpoint answered with a non-success status"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    DECODE_ERROR("Decode error", "Payload could not be decoded"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation"),
    STORAGE_ERROR("Storage error", "Local file system failure"),
    DATA_ERROR("Data error", "Record content is missing, malformed or inconsistent"),
    CANCELLED("Cancelled", "Run was cancelled or the worker thread interrupted"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isCancelled, CANCELLED);
        MATCHERS.put(t -> t instanceof DataIntegrityViolationException, CONSTRAINT_VIOLATION);
        MATCHERS.put(t -> t instanceof DataAccessResourceFailureException, CONNECTION_ERROR);
        MATCHERS.put(t -> t instanceof RestClientResponseException, HTTP_STATUS_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isDecodeError, DECODE_ERROR);
        MATCHERS.put(t -> t instanceof java.nio.file.AccessDeniedException, PERMISSION_ERROR);
        MATCHERS.put(ErrorCategory::isStorageError, STORAGE_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isDataError, DATA_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key", "not null")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "57", CONNECTION_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isCancelled(Throwable t) {
        return t instanceof InterruptedException
                || t instanceof java.nio.channels.ClosedByInterruptException
                || t instanceof java.util.concurrent.CancellationException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || (t instanceof ResourceAccessException && t.getCause() instanceof java.net.SocketTimeoutException)
                || messageContains(t, "timed out", "timeout");
    }

    private static boolean isDecodeError(Throwable t) {
        return t instanceof JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException
                || t instanceof com.univocity.parsers.common.TextParsingException;
    }

    private static boolean isStorageError(Throwable t) {
        return t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.io.UncheckedIOException && t.getCause() instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space", "disk full"));
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof ResourceAccessException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof java.io.IOException;
    }

    private static boolean isDataError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
