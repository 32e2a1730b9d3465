package com.sqlbridge.service;

public class GatewayBusyException extends GatewayException {
    public GatewayBusyException(String profileName, long waitedMs) {
        super("SERVER_BUSY", "Server '" + profileName + "' is busy: no execution slot became free within "
                + waitedMs + " ms");
    }
}
