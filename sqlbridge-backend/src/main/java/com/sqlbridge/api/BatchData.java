package com.sqlbridge.api;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class BatchData {
    private List<QueryData> results;
    private boolean transactionCommitted;
}
