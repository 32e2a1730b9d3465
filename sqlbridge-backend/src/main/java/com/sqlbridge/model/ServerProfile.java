package com.sqlbridge.model;

import com.sqlbridge.util.SqlDialect;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A named backend database server. Immutable once loaded into the registry.
 */
@Value
@Builder(toBuilder = true)
public class ServerProfile {
    String name;
    String dbType;
    String host;
    int port;
    String username;
    @ToString.Exclude
    String password;
    String defaultDatabase;
    boolean readOnly;
    boolean encrypt;
    boolean trustServerCertificate;
    String jdbcUrl;
    @Builder.Default
    int maxPoolSize = 10;
    @Builder.Default
    int minIdle = 1;

    public SqlDialect dialect() {
        return SqlDialect.of(dbType);
    }
}
