package com.sqlbridge.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows and update counts produced by one executed statement.
 */
@Value
public class StatementOutcome {
    List<Map<String, Object>> recordset;
    List<Integer> rowsAffected;

    public StatementOutcome(List<Map<String, Object>> recordset, List<Integer> rowsAffected) {
        this.recordset = recordset != null
                ? Collections.unmodifiableList(new ArrayList<>(recordset))
                : List.of();
        this.rowsAffected = rowsAffected != null ? List.copyOf(rowsAffected) : List.of();
    }

    public int getRowCount() {
        return recordset.size();
    }
}
