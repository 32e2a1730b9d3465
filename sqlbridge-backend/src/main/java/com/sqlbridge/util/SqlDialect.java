package com.sqlbridge.util;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Backend-specific behavior the gateway needs: defaults, probes, catalog queries and how a
 * connection switches its database context.
 */
public enum SqlDialect {
    SQLSERVER("sqlserver", 1433, "SELECT 1",
            "SELECT name FROM sys.databases WHERE state = 0 ORDER BY name") {
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setCatalog(database);
        }
    },
    POSTGRES("postgres", 5432, "SELECT 1",
            "SELECT datname FROM pg_database WHERE datistemplate = false ORDER BY datname") {
        // A PostgreSQL connection is bound to one database; the name selects a schema instead.
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setSchema(database);
        }
    },
    MYSQL("mysql", 3306, "SELECT 1", "SHOW DATABASES") {
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setCatalog(database);
        }
    },
    ORACLE("oracle", 1521, "SELECT 1 FROM DUAL", "SELECT username FROM all_users ORDER BY username") {
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setSchema(database);
        }
    },
    H2("h2", 9092, "SELECT 1",
            "SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA ORDER BY SCHEMA_NAME") {
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setSchema(database);
        }
    },
    GENERIC("generic", 0, "SELECT 1",
            "SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA ORDER BY SCHEMA_NAME") {
        @Override
        public void switchDatabase(Connection conn, String database) throws SQLException {
            conn.setCatalog(database);
        }
    };

    private final String dbType;
    private final int defaultPort;
    private final String validationQuery;
    private final String listDatabasesQuery;

    SqlDialect(String dbType, int defaultPort, String validationQuery, String listDatabasesQuery) {
        this.dbType = dbType;
        this.defaultPort = defaultPort;
        this.validationQuery = validationQuery;
        this.listDatabasesQuery = listDatabasesQuery;
    }

    public static SqlDialect of(String dbType) {
        String normalized = DbTypeNormalizer.normalize(dbType);
        for (SqlDialect dialect : values()) {
            if (dialect.dbType.equals(normalized)) {
                return dialect;
            }
        }
        return GENERIC;
    }

    /**
     * Point the connection at another database (or schema, where the backend has no
     * per-connection database switch). Callers switch back before the connection returns to
     * the pool.
     */
    public abstract void switchDatabase(Connection conn, String database) throws SQLException;

    /**
     * Current database context of the connection, as {@link #switchDatabase} would set it.
     */
    public String currentDatabase(Connection conn) throws SQLException {
        return switch (this) {
            case POSTGRES, ORACLE, H2 -> conn.getSchema();
            default -> conn.getCatalog();
        };
    }

    public String getDbType() {
        return dbType;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public String getValidationQuery() {
        return validationQuery;
    }

    public String getListDatabasesQuery() {
        return listDatabasesQuery;
    }
}
