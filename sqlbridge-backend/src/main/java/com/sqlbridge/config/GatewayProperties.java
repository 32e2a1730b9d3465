package com.sqlbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway settings bound from {@code sqlbridge.*}.
 *
 * <p>Server profiles declared under {@code sqlbridge.servers} are only one of the catalog
 * sources; see {@link com.sqlbridge.service.ServerProfileLoader}.
 */
@Data
@ConfigurationProperties(prefix = "sqlbridge")
public class GatewayProperties {

    /**
     * Shared secret expected in the {@code x-api-key} header.
     */
    private String apiToken;

    /**
     * Profile used when a request does not name a server.
     */
    private String defaultServer;

    private long queryTimeoutMs = 30_000;
    private long connectionTimeoutMs = 15_000;

    /**
     * How long a request waits for an execution slot on a busy server before it is rejected.
     */
    private long queueTimeoutMs = 10_000;

    /**
     * Interval of the background health probe; 0 disables it.
     */
    private long healthCheckIntervalMs = 60_000;
    private long healthCheckTimeoutMs = 5_000;

    /**
     * Connect and probe every profile at startup.
     */
    private boolean warmUp = true;

    /**
     * Optional YAML file with additional server profiles.
     */
    private String profilesFile;

    private Map<String, ServerProperties> servers = new LinkedHashMap<>();

    @Data
    public static class ServerProperties {
        private String dbType = "sqlserver";
        private String host;
        private Integer port;
        private String username;
        private String password;
        private String database;
        private boolean readOnly = false;
        private boolean encrypt = false;
        private boolean trustServerCertificate = true;

        /**
         * Full JDBC URL; overrides host, port and database when set.
         */
        private String jdbcUrl;
        private int maxPoolSize = 10;
        private int minIdle = 1;
    }
}
