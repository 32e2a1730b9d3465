package com.sqlbridge.service;

import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.Locale;
import java.util.Set;

/**
 * Turns driver exceptions into the error text returned to clients.
 */
@Component
public class BackendErrorTranslator {

    static final String MISSING_OBJECT_PREFIX = "Object does not exist: ";

    private static final Set<String> MISSING_OBJECT_STATES = Set.of("42S02", "42S04", "42P01");

    // SQL Server 208, Oracle ORA-00942, MySQL 1146, H2 table/view and column-not-found
    private static final Set<Integer> MISSING_OBJECT_VENDOR_CODES = Set.of(208, 942, 1146, 42102, 42104);

    public String describe(SQLException e, long timeoutMs) {
        String message = driverMessage(e);
        if (e instanceof SQLTimeoutException) {
            return "Query timed out after " + timeoutMs + " ms: " + message;
        }
        if (isMissingObject(e)) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (!lower.contains("invalid object") && !lower.contains("not exist")) {
                return MISSING_OBJECT_PREFIX + message;
            }
        }
        return message;
    }

    static boolean isMissingObject(SQLException e) {
        String state = e.getSQLState();
        if (state != null && MISSING_OBJECT_STATES.contains(state)) {
            return true;
        }
        return MISSING_OBJECT_VENDOR_CODES.contains(e.getErrorCode());
    }

    private static String driverMessage(SQLException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName()
                    + (e.getSQLState() != null ? " (SQLState " + e.getSQLState() + ")" : "");
        }
        return message;
    }
}
