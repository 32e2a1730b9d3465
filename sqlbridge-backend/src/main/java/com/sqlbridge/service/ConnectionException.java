package com.sqlbridge.service;

/**
 * A session for a server profile could not be established.
 */
public class ConnectionException extends GatewayException {
    private final String profileName;

    public ConnectionException(String profileName, String reason, Throwable cause) {
        super("CONNECTION_FAILED", "Failed to connect to server '" + profileName + "': " + reason, cause);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
