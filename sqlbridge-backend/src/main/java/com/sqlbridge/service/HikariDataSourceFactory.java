package com.sqlbridge.service;

import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.util.JdbcConnectionInfo;
import com.sqlbridge.util.JdbcConnectionInfoResolver;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

/**
 * Creates the HikariCP pool behind one server profile.
 */
@Component
public class HikariDataSourceFactory {

    private static final long IDLE_TIMEOUT_MS = 60_000;

    private final JdbcConnectionInfoResolver jdbcConnectionInfoResolver;
    private final GatewayProperties properties;

    public HikariDataSourceFactory(JdbcConnectionInfoResolver jdbcConnectionInfoResolver, GatewayProperties properties) {
        this.jdbcConnectionInfoResolver = jdbcConnectionInfoResolver;
        this.properties = properties;
    }

    /**
     * Build and start a pool. Hikari connects eagerly, so an unreachable backend fails here.
     *
     * @param profile server profile
     * @return started data source
     */
    public HikariDataSource create(ServerProfile profile) {
        return new HikariDataSource(buildHikariConfig(profile));
    }

    HikariConfig buildHikariConfig(ServerProfile profile) {
        JdbcConnectionInfo info = jdbcConnectionInfoResolver.resolve(profile);

        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        config.setUsername(info.getUsername());
        config.setPassword(info.getPassword());
        if (info.getDriverClassName() != null) {
            config.setDriverClassName(info.getDriverClassName());
        }
        if (info.getDataSourceProperties() != null) {
            info.getDataSourceProperties().forEach(config::addDataSourceProperty);
        }

        config.setConnectionTimeout(Math.max(250, properties.getConnectionTimeoutMs()));
        // One connection above the execution permits is kept for health probes.
        config.setMaximumPoolSize(profile.getMaxPoolSize() + 1);
        config.setMinimumIdle(Math.min(profile.getMinIdle(), profile.getMaxPoolSize()));
        config.setIdleTimeout(IDLE_TIMEOUT_MS);
        config.setPoolName("sqlbridge-" + profile.getName());
        return config;
    }
}
