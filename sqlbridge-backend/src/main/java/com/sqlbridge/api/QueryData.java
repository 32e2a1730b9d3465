package com.sqlbridge.api;

import com.sqlbridge.model.StatementOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class QueryData {
    private List<Map<String, Object>> recordset;
    private List<Integer> rowsAffected;
    private int rowCount;

    public static QueryData from(StatementOutcome outcome) {
        return new QueryData(outcome.getRecordset(), outcome.getRowsAffected(), outcome.getRowCount());
    }
}
