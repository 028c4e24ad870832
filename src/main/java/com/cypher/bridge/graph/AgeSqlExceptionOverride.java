package com.cypher.bridge.graph;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * Keeps HikariCP from evicting a pooled connection because a Cypher statement failed.
 *
 * <p>Syntax errors, schema mismatches, data errors and AGE internal errors are
 * statement-level failures; the connection stays healthy after a rollback.</p>
 */
public class AgeSqlExceptionOverride implements SQLExceptionOverride {

    /** SQLSTATE classes that never indicate a broken connection. */
    static final Set<String> STATEMENT_ERROR_CLASSES = Set.of("42", "22", "XX", "0A", "P0");

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }
        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.length() >= 2
                && STATEMENT_ERROR_CLASSES.contains(sqlState.substring(0, 2))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
