package com.sqlbridge.service;

public class AuthException extends GatewayException {
    private final boolean misconfigured;

    public AuthException(String message) {
        this(message, false);
    }

    public AuthException(String message, boolean misconfigured) {
        super(misconfigured ? "SERVER_MISCONFIGURED" : "UNAUTHORIZED", message);
        this.misconfigured = misconfigured;
    }

    /**
     * True when the gateway itself has no API token configured.
     */
    public boolean isMisconfigured() {
        return misconfigured;
    }
}
