package com.sqlbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope shared by every {@code /v1} response.
 *
 * <p>{@code execution_ms} is only set once a request actually reached a database.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse<T> {
    private boolean success;
    private String db;
    private T data;
    private String error;
    private String code;

    @JsonProperty("execution_ms")
    private Long executionMs;

    @JsonProperty("trace_id")
    private String traceId;

    public static <T> GatewayResponse<T> ok(T data) {
        return GatewayResponse.<T>builder().success(true).data(data).build();
    }

    public static <T> GatewayResponse<T> failure(String code, String error, String traceId) {
        return GatewayResponse.<T>builder().success(false).code(code).error(error).traceId(traceId).build();
    }
}
