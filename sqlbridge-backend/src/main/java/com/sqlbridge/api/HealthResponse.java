package com.sqlbridge.api;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@AllArgsConstructor
public class HealthResponse {
    private String status;
    private OffsetDateTime timestamp;
}
