package com.sqlbridge.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps HikariCP from evicting pooled connections for statement-level errors.
 *
 * <p>Gateway callers send arbitrary SQL, so syntax errors, missing objects, constraint
 * violations and data errors are routine and say nothing about the connection. Everything
 * else is left to Hikari's own connection-fatal detection.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return Override.CONTINUE_EVICT;
        }

        switch (sqlState.substring(0, 2)) {
            case "0A": // feature not supported
            case "22": // data exception
            case "23": // integrity constraint violation
            case "42": // syntax error or access rule violation, includes missing objects
                return Override.DO_NOT_EVICT;
            default:
                return Override.CONTINUE_EVICT;
        }
    }
}
