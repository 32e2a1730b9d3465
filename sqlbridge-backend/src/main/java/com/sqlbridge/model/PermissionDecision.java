package com.sqlbridge.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of checking one SQL text against a server profile's mode.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PermissionDecision {
    boolean allowed;
    StatementClass statementClass;
    String reason;

    public static PermissionDecision allow(StatementClass statementClass) {
        return new PermissionDecision(true, statementClass, null);
    }

    public static PermissionDecision deny(StatementClass statementClass, String reason) {
        return new PermissionDecision(false, statementClass, reason);
    }
}
