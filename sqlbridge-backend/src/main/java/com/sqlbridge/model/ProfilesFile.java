package com.sqlbridge.model;

import com.sqlbridge.config.GatewayProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape of the optional YAML profiles file ({@code sqlbridge.profiles-file}).
 *
 * <pre>
 * defaultServer: SERVER_PROFILE_1
 * servers:
 *   SERVER_PROFILE_1:
 *     dbType: sqlserver
 *     host: 10.0.0.5
 *     readOnly: false
 * </pre>
 */
@Data
public class ProfilesFile {
    private String defaultServer;
    private Map<String, GatewayProperties.ServerProperties> servers = new LinkedHashMap<>();
}
