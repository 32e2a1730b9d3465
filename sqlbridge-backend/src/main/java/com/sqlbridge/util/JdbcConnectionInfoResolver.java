package com.sqlbridge.util;

import com.sqlbridge.model.ServerProfile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a server profile into a JDBC connection configuration.
 *
 * <p>An explicit {@code jdbcUrl} on the profile wins; otherwise the URL is built from host,
 * port and default database using the dialect's URL shape.
 */
@Component
public class JdbcConnectionInfoResolver {

    static final String APPLICATION_NAME = "sqlbridge";

    /**
     * Resolve a profile into JDBC connection info.
     *
     * @param profile server profile
     * @return jdbc connection info
     * @throws IllegalArgumentException if no URL can be built for the profile
     */
    public JdbcConnectionInfo resolve(ServerProfile profile) {
        SqlDialect dialect = profile.dialect();
        Map<String, String> props = new LinkedHashMap<>();

        String url = profile.getJdbcUrl();
        if (url == null || url.isBlank()) {
            url = buildUrl(profile, dialect, props);
        }

        return JdbcConnectionInfo.builder()
                .url(url)
                .username(profile.getUsername())
                .password(profile.getPassword())
                .dbType(dialect.getDbType())
                .driverClassName(driverClassName(dialect))
                .dataSourceProperties(props)
                .build();
    }

    private String buildUrl(ServerProfile profile, SqlDialect dialect, Map<String, String> props) {
        String host = profile.getHost();
        int port = profile.getPort() > 0 ? profile.getPort() : dialect.getDefaultPort();
        String database = profile.getDefaultDatabase() != null ? profile.getDefaultDatabase() : "";

        switch (dialect) {
            case SQLSERVER:
                requireHost(profile);
                StringBuilder sb = new StringBuilder("jdbc:sqlserver://").append(host).append(':').append(port);
                if (!database.isBlank()) {
                    sb.append(";databaseName=").append(database);
                }
                sb.append(";encrypt=").append(profile.isEncrypt());
                sb.append(";trustServerCertificate=").append(profile.isTrustServerCertificate());
                sb.append(";applicationName=").append(APPLICATION_NAME);
                return sb.toString();
            case POSTGRES:
                requireHost(profile);
                props.put("ApplicationName", APPLICATION_NAME);
                return "jdbc:postgresql://" + host + ":" + port + "/" + database;
            case MYSQL:
                requireHost(profile);
                return "jdbc:mysql://" + host + ":" + port + "/" + database;
            case ORACLE:
                requireHost(profile);
                props.put("v$session.program", APPLICATION_NAME);
                return "jdbc:oracle:thin:@//" + host + ":" + port + "/" + database;
            case H2:
                if (host == null || host.isBlank()) {
                    String name = database.isBlank() ? profile.getName().toLowerCase(Locale.ROOT) : database;
                    return "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1";
                }
                return "jdbc:h2:tcp://" + host + ":" + port + "/" + database;
            default:
                throw new IllegalArgumentException(
                        "jdbcUrl is required for dbType: " + profile.getDbType() + " (server " + profile.getName() + ")");
        }
    }

    private void requireHost(ServerProfile profile) {
        if (profile.getHost() == null || profile.getHost().isBlank()) {
            throw new IllegalArgumentException("Host is required for server " + profile.getName());
        }
    }

    private String driverClassName(SqlDialect dialect) {
        return switch (dialect) {
            case SQLSERVER -> "com.microsoft.sqlserver.jdbc.SQLServerDriver";
            case POSTGRES -> "org.postgresql.Driver";
            case MYSQL -> "com.mysql.cj.jdbc.Driver";
            case ORACLE -> "oracle.jdbc.OracleDriver";
            case H2 -> "org.h2.Driver";
            default -> null;
        };
    }
}
