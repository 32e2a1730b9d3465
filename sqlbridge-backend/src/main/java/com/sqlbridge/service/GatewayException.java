package com.sqlbridge.service;

/**
 * Base for failures detected before a statement reaches a backend.
 */
public abstract class GatewayException extends RuntimeException {
    private final String code;

    protected GatewayException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected GatewayException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
