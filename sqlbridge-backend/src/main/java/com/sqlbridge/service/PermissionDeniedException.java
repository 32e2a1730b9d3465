package com.sqlbridge.service;

public class PermissionDeniedException extends GatewayException {
    public PermissionDeniedException(String reason) {
        super("PERMISSION_DENIED", reason);
    }
}
