package com.sqlbridge.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes configured dbType values (and aliases) into canonical dbType strings.
 */
public final class DbTypeNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("mssql", "sqlserver"),
            Map.entry("sql server", "sqlserver"),
            Map.entry("sqlserver", "sqlserver"),
            Map.entry("postgresql", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("mariadb", "mysql"),
            Map.entry("mysql", "mysql"),
            Map.entry("oracle", "oracle"),
            Map.entry("h2", "h2")
    );

    private DbTypeNormalizer() {
    }

    /**
     * Normalize dbType.
     *
     * <p>ODBC driver names such as {@code ODBC Driver 17 for SQL Server} are mapped by the
     * product they name.
     *
     * @param dbType incoming dbType
     * @return normalized dbType (lowercased + alias mapping), empty for blank input
     */
    public static String normalize(String dbType) {
        if (dbType == null) {
            return "";
        }
        String v = dbType.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        if (v.startsWith("odbc driver") && v.contains("sql server")) {
            return "sqlserver";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
