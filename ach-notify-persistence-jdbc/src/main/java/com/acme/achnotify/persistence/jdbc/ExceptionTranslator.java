package com.acme.achnotify.persistence.jdbc;

import com.acme.achnotify.core.PermanentException;
import com.acme.achnotify.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates SQLException into the job's PermanentException or TransientException.
 * Unknown failures are treated as transient.
 */
public class ExceptionTranslator {

    // 08 connection, 40 transaction rollback, 57P03 server starting up
    private static final List<String> TRANSIENT_STATE_PREFIXES = List.of("08", "40", "57P03");

    // 22 data, 23 integrity constraint, 42 syntax or access, 3D catalog, 3F schema
    private static final List<String> PERMANENT_STATE_PREFIXES = List.of("22", "23", "42", "3D", "3F");

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "timeout", "connection refused", "deadlock", "too many connections", "pool exhausted");

    private static final List<String> PERMANENT_MARKERS = List.of(
            "syntax error", "not found", "does not exist", "constraint violation",
            "unique constraint", "foreign key", "type mismatch", "invalid column");

    // PostgreSQL 40001/8003/8006, H2 90008
    private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(40001, 8003, 8006, 90008);

    // PostgreSQL 42703/23505/23503, H2 90002/90007/42122/42102/23505
    private static final Set<Integer> PERMANENT_VENDOR_CODES =
            Set.of(42703, 23505, 23503, 90002, 90007, 42122, 42102);

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Logs the failure and returns the exception to throw.
     *
     * @param operation description of the failed operation, used in the message
     * @return PermanentException for errors a retry cannot fix, TransientException otherwise
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }
        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /** True for a duplicate key, i.e. another writer inserted the same row first. */
    public static boolean isUniqueViolation(SQLException exception) {
        return "23505".equals(exception.getSQLState()) || exception.getErrorCode() == 23505;
    }

    private static boolean isTransientError(SQLException exception) {
        return containsAny(message(exception), TRANSIENT_MARKERS)
                || startsWithAny(exception.getSQLState(), TRANSIENT_STATE_PREFIXES)
                || TRANSIENT_VENDOR_CODES.contains(exception.getErrorCode());
    }

    private static boolean isPermanentError(SQLException exception) {
        return containsAny(message(exception), PERMANENT_MARKERS)
                || startsWithAny(exception.getSQLState(), PERMANENT_STATE_PREFIXES)
                || PERMANENT_VENDOR_CODES.contains(exception.getErrorCode());
    }

    private static String message(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String message, List<String> markers) {
        return markers.stream().anyMatch(message::contains);
    }

    private static boolean startsWithAny(String sqlState, List<String> prefixes) {
        return sqlState != null && prefixes.stream().anyMatch(sqlState::startsWith);
    }
}
