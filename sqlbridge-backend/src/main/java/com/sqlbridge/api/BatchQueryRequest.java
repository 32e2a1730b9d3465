package com.sqlbridge.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class BatchQueryRequest {
    @Valid
    @NotEmpty(message = "Missing required field: queries")
    private List<BatchStatement> queries = new ArrayList<>();

    private String server;

    private String database;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchStatement {
        @NotBlank(message = "Missing required field: sql")
        private String sql;
    }
}
