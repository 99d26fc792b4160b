package com.ownding.telemetry.retention;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.util.Set;

/**
 * Sorts storage exceptions raised during an enforcement attempt into {@link EnforcementFailure} kinds.
 * SQLite reports most errors as uncategorized SQL exceptions, so its primary result codes are checked too.
 */
final class StorageFailures {

    enum Phase {
        RANKING_READ("ranking read"),
        DELETE("delete"),
        TRANSACTION("transaction");

        private final String description;

        Phase(String description) {
            this.description = description;
        }
    }

    private static final Set<Integer> LOCK_CONTENTION_CODES = Set.of(
            SQLiteErrorCode.SQLITE_BUSY.code,
            SQLiteErrorCode.SQLITE_LOCKED.code);

    private static final Set<Integer> UNAVAILABLE_CODES = Set.of(
            SQLiteErrorCode.SQLITE_ERROR.code,
            SQLiteErrorCode.SQLITE_READONLY.code,
            SQLiteErrorCode.SQLITE_IOERR.code,
            SQLiteErrorCode.SQLITE_CORRUPT.code,
            SQLiteErrorCode.SQLITE_FULL.code,
            SQLiteErrorCode.SQLITE_CANTOPEN.code,
            SQLiteErrorCode.SQLITE_NOTADB.code);

    private StorageFailures() {
    }

    static EnforcementException translate(SeriesKey key, Phase phase, RuntimeException ex) {
        if (ex instanceof EnforcementException enforcement) {
            return enforcement;
        }
        String message = phase.description + " failed for series " + key + ": " + ex.getMessage();
        if (isLockContention(ex)) {
            return new EnforcementException(EnforcementFailure.DELETE_CONFLICT, message, ex);
        }
        if (isUnavailable(ex)) {
            return new EnforcementException(EnforcementFailure.STORAGE_UNAVAILABLE, message, ex);
        }
        if (phase == Phase.RANKING_READ) {
            return new EnforcementException(EnforcementFailure.RANKING_READ, message, ex);
        }
        if (ex instanceof TransientDataAccessException) {
            return new EnforcementException(EnforcementFailure.DELETE_CONFLICT, message, ex);
        }
        return new EnforcementException(EnforcementFailure.STORAGE_UNAVAILABLE, message, ex);
    }

    private static boolean isLockContention(RuntimeException ex) {
        if (ex instanceof ConcurrencyFailureException) {
            return true;
        }
        Integer code = sqlitePrimaryCode(ex);
        return code != null && LOCK_CONTENTION_CODES.contains(code);
    }

    private static boolean isUnavailable(RuntimeException ex) {
        if (ex instanceof DataAccessResourceFailureException
                || ex instanceof InvalidDataAccessResourceUsageException
                || ex instanceof CannotCreateTransactionException) {
            return true;
        }
        Integer code = sqlitePrimaryCode(ex);
        return code != null && UNAVAILABLE_CODES.contains(code);
    }

    private static Integer sqlitePrimaryCode(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof SQLiteException sqlite) {
                // extended codes carry the primary code in the low byte
                return sqlite.getResultCode().code & 0xFF;
            }
        }
        return null;
    }
}
