package com.sqlbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ServerHealth {
    private String name;
    private boolean connected;
    private boolean healthy;
    private String lastError;
    private OffsetDateTime lastCheckedAt;
}
