package com.sqlbridge.service;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Converts JDBC result sets into ordered rows of JSON-safe values.
 *
 * <p>Strings are passed through exactly as the driver returned them. A column holding JSON
 * text stays a string and is never decoded or re-encoded.
 */
@Component
public class ResultNormalizer {
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";
    private static final int MAX_NESTED_DEPTH = 3;

    /**
     * Reads every remaining row of the result set.
     *
     * @param rs result set positioned before the first row
     * @return rows keyed by column label, in column order
     * @throws SQLException on JDBC errors while iterating
     */
    public List<Map<String, Object>> normalize(ResultSet rs) throws SQLException {
        ResultSetMetaData metadata = rs.getMetaData();
        String[] labels = columnLabels(metadata);
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(labels.length * 2);
            for (int i = 0; i < labels.length; i++) {
                row.put(labels[i], readValue(rs, i + 1));
            }
            rows.add(row);
        }
        return rows;
    }

    static String[] columnLabels(ResultSetMetaData metadata) throws SQLException {
        int count = metadata.getColumnCount();
        String[] labels = new String[count];
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= count; i++) {
            String label = metadata.getColumnLabel(i);
            if (label == null || label.isEmpty()) {
                label = metadata.getColumnName(i);
            }
            if (label == null) {
                label = "";
            }
            String unique = label;
            int suffix = 2;
            while (!seen.add(unique)) {
                unique = label + "_" + suffix++;
            }
            labels[i - 1] = unique;
        }
        return labels;
    }

    /**
     * Reads one column and converts it, falling back to a placeholder for values the driver
     * cannot materialize.
     */
    Object readValue(ResultSet rs, int columnIndex) {
        Object v;
        try {
            v = rs.getObject(columnIndex);
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        return toJsonSafe(v);
    }

    public Object toJsonSafe(Object v) {
        try {
            return sanitize(v, 0);
        } catch (SQLException | IOException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private Object sanitize(Object v, int depth) throws SQLException, IOException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }

        String driverValue = readDriverSpecificValue(v);
        if (driverValue != null) {
            return driverValue;
        }

        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof Character) {
            return v.toString();
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }

        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            List<Object> out = new ArrayList<>();
            if (attrs != null) {
                for (Object attr : attrs) {
                    out.add(sanitize(attr, depth + 1));
                }
            }
            return out;
        }

        if (v instanceof java.sql.Array arr) {
            return sanitizeArray(arr.getArray(), depth);
        }
        if (v instanceof Object[] objects) {
            return sanitizeArray(objects, depth);
        }

        if (v instanceof Ref ref) {
            return ref.getBaseTypeName();
        }

        return String.valueOf(v);
    }

    private Object sanitizeArray(Object arrayValue, int depth) throws SQLException, IOException {
        if (arrayValue instanceof Object[] objectArray) {
            List<Object> out = new ArrayList<>(objectArray.length);
            for (Object elem : objectArray) {
                out.add(sanitize(elem, depth + 1));
            }
            return out;
        }
        return String.valueOf(arrayValue);
    }

    /**
     * Driver types that are not plain JDBC values but carry a readable text form.
     */
    private String readDriverSpecificValue(Object v) {
        String className = v.getClass().getName();

        // PostgreSQL json/jsonb/custom types
        if ("org.postgresql.util.PGobject".equals(className)) {
            Object value = invokeNoArg(v, "getValue");
            return value != null ? value.toString() : "";
        }

        if (className.startsWith("oracle.sql.TIMESTAMP")) {
            Object ts = invokeNoArg(v, "timestampValue");
            return ts != null ? ts.toString() : null;
        }

        if ("microsoft.sql.DateTimeOffset".equals(className)) {
            return v.toString();
        }

        return null;
    }

    private static Object invokeNoArg(Object target, String method) {
        try {
            return target.getClass().getMethod(method).invoke(target);
        } catch (ReflectiveOperationException e) {
            return null;
        }
    }

    private static String readClob(Clob clob) throws SQLException, IOException {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[8192];
            int n;
            while ((n = reader.read(buf)) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        long length = blob.length();
        if (length <= 0) {
            return "";
        }
        if (length > Integer.MAX_VALUE) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) length));
    }
}
