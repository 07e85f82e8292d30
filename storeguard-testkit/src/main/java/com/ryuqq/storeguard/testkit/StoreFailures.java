package com.ryuqq.storeguard.testkit;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLSyntaxErrorException;

/**
 * Canned store failures for tests.
 *
 * <p>Messages follow what an embedded single-writer store's JDBC driver reports.
 * Each call returns a fresh instance so identity assertions stay meaningful.</p>
 *
 * @author StoreGuard Team
 * @since 1.0.0
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    /** Another writer holds the database lock. */
    public static SQLException databaseLocked() {
        return new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)");
    }

    /** A table is locked by a concurrent statement. */
    public static SQLException tableLocked() {
        return new SQLException("[SQLITE_LOCKED] A table in the database is locked (database table is locked)");
    }

    /** A transaction is already open on the connection. */
    public static SQLException nestedTransaction() {
        return new SQLException("cannot start a transaction within a transaction");
    }

    public static SQLException noSuchTable(String table) {
        return new SQLException("[SQLITE_ERROR] SQL error or missing database (no such table: " + table + ")");
    }

    public static SQLException noSuchColumn(String column) {
        return new SQLException("[SQLITE_ERROR] SQL error or missing database (no such column: " + column + ")");
    }

    public static SQLException syntaxError(String near) {
        return new SQLException("[SQLITE_ERROR] SQL error or missing database (near \"" + near + "\": syntax error)");
    }

    /** Operational failure matching neither contention nor fatal phrases. */
    public static SQLException diskIoError() {
        return new SQLException("[SQLITE_IOERR] Some kind of disk I/O error occurred (disk I/O error)");
    }

    public static SQLIntegrityConstraintViolationException uniqueViolation(String column) {
        return new SQLIntegrityConstraintViolationException("UNIQUE constraint failed: " + column);
    }

    /** Driver-level syntax rejection, outside the operational category. */
    public static SQLSyntaxErrorException driverSyntaxError() {
        return new SQLSyntaxErrorException("syntax error at or near \"SELEC\"");
    }

    /** A logic error that must never be retried. */
    public static IllegalStateException logicError() {
        return new IllegalStateException("content hash must be validated before lookup");
    }
}
