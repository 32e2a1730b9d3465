package com.sqlbridge.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running SQL against a backend.
 *
 * <p>Either a success carrying statement outcomes or a failure carrying a non-empty error
 * message; the factories are the only way to build one, so the two never mix.
 */
@Getter
@ToString
public final class QueryResult {
    private final boolean success;
    private final List<StatementOutcome> statements;
    private final long executionMs;
    private final String error;

    private QueryResult(boolean success, List<StatementOutcome> statements, long executionMs, String error) {
        this.success = success;
        this.statements = statements;
        this.executionMs = executionMs;
        this.error = error;
    }

    public static QueryResult success(StatementOutcome outcome, long executionMs) {
        return new QueryResult(true, List.of(outcome), executionMs, null);
    }

    public static QueryResult success(List<StatementOutcome> outcomes, long executionMs) {
        return new QueryResult(true, List.copyOf(outcomes), executionMs, null);
    }

    public static QueryResult failure(String error, long executionMs) {
        String message = error == null || error.isBlank() ? "Unknown backend error" : error;
        return new QueryResult(false, List.of(), executionMs, message);
    }

    /**
     * Rows of the first statement, empty on failure.
     */
    public List<Map<String, Object>> getRecordset() {
        return statements.isEmpty() ? List.of() : statements.get(0).getRecordset();
    }

    public List<Integer> getRowsAffected() {
        return statements.isEmpty() ? List.of() : statements.get(0).getRowsAffected();
    }

    public int getRowCount() {
        return getRecordset().size();
    }
}
