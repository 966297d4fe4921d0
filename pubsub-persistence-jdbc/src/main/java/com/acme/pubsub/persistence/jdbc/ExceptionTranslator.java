package com.acme.pubsub.persistence.jdbc;

import com.acme.pubsub.core.PermanentException;
import com.acme.pubsub.core.StorageUnavailableException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Maps a SQLException onto the broker's error taxonomy. Connection, lock and pool problems
 * become {@link StorageUnavailableException} so callers may retry; schema, constraint and data
 * errors become {@link PermanentException}. Unclassified errors are treated as unavailable storage.
 */
public final class ExceptionTranslator {

    private static final List<String> TRANSIENT_HINTS = List.of(
            "timeout", "connection refused", "connection reset", "deadlock",
            "too many connections", "pool exhausted");

    private static final List<String> PERMANENT_HINTS = List.of(
            "syntax error", "not found", "does not exist", "constraint violation",
            "unique constraint", "foreign key", "type mismatch", "invalid column");

    private ExceptionTranslator() {
    }

    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        String detail = String.format("%s: %s", operation, originalException.getMessage());
        if (isTransientError(originalException)) {
            return new StorageUnavailableException("Storage unavailable during " + detail, originalException);
        }
        if (isPermanentError(originalException)) {
            return new PermanentException("Storage error during " + detail, originalException);
        }
        return new StorageUnavailableException("Storage error during " + detail, originalException);
    }

    static boolean isTransientError(SQLException exception) {
        if (mentions(exception, TRANSIENT_HINTS)) {
            return true;
        }
        String sqlState = exception.getSQLState();
        // 08 connection exception, 40 transaction rollback, 57P0x operator intervention
        if (sqlState != null
                && (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.startsWith("57P0"))) {
            return true;
        }
        int code = exception.getErrorCode();
        // H2: 90008 general timeout, 50200 lock timeout, 90067 connection broken
        return code == 90008 || code == 50200 || code == 90067;
    }

    static boolean isPermanentError(SQLException exception) {
        if (mentions(exception, PERMANENT_HINTS)) {
            return true;
        }
        String sqlState = exception.getSQLState();
        // 22 data exception, 23 integrity constraint, 42 syntax or access rule, 3D/3F catalog and schema
        if (sqlState != null
                && (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                || sqlState.startsWith("3D") || sqlState.startsWith("3F"))) {
            return true;
        }
        int code = exception.getErrorCode();
        // H2: 42102 table not found, 42122 column not found, 90007 parameter count mismatch
        return code == 42102 || code == 42122 || code == 90007;
    }

    private static boolean mentions(SQLException exception, List<String> hints) {
        String message = exception.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return hints.stream().anyMatch(lower::contains);
    }
}
