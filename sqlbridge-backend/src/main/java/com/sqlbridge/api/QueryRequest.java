package com.sqlbridge.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    @NotBlank(message = "Missing required field: sql")
    private String sql;

    /**
     * Server profile name; the default profile when absent.
     */
    private String server;

    /**
     * Database context for this request; the profile's default when absent.
     */
    private String database;
}
