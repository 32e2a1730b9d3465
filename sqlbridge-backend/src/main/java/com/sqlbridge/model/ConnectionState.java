package com.sqlbridge.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Point-in-time connectivity view of one server profile.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionState {
    String profileName;
    boolean connected;
    boolean healthy;
    String lastError;
    OffsetDateTime lastCheckedAt;

    public static ConnectionState initial(String profileName) {
        return ConnectionState.builder()
                .profileName(profileName)
                .connected(false)
                .healthy(false)
                .build();
    }
}
