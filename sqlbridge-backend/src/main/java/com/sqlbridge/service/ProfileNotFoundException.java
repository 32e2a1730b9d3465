package com.sqlbridge.service;

import java.util.Collection;

public class ProfileNotFoundException extends GatewayException {
    private final String profileName;

    public ProfileNotFoundException(String profileName, Collection<String> available) {
        super("PROFILE_NOT_FOUND", buildMessage(profileName, available));
        this.profileName = profileName;
    }

    private static String buildMessage(String profileName, Collection<String> available) {
        String list = available == null || available.isEmpty() ? "(none)" : String.join(", ", available);
        if (profileName == null || profileName.isBlank()) {
            return "No server specified and no default server profile is configured. Available: " + list;
        }
        return "Server profile '" + profileName + "' not found. Available: " + list;
    }

    public String getProfileName() {
        return profileName;
    }
}
