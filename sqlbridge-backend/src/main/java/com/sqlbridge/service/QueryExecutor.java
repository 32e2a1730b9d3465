package com.sqlbridge.service;

import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.model.QueryResult;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.model.StatementOutcome;
import com.sqlbridge.util.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs SQL text on a profile session and packages the outcome.
 *
 * <p>Backend failures are returned as {@link QueryResult#failure}. A busy rejection or a pool
 * that cannot hand out a connection happens before the backend is reached and escapes as an
 * exception.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final GatewayProperties properties;
    private final ResultNormalizer normalizer;
    private final BackendErrorTranslator errorTranslator;
    private final ConnectionManager connectionManager;

    public QueryExecutor(GatewayProperties properties,
                         ResultNormalizer normalizer,
                         BackendErrorTranslator errorTranslator,
                         ConnectionManager connectionManager) {
        this.properties = properties;
        this.normalizer = normalizer;
        this.errorTranslator = errorTranslator;
        this.connectionManager = connectionManager;
    }

    /**
     * Execute one SQL text, which may itself contain several statements.
     *
     * @param session  session of the target profile
     * @param sql      SQL text
     * @param database database context to switch to, or null for the profile default
     * @return the outcome; never null
     * @throws GatewayBusyException if no execution slot is free within the queue timeout
     * @throws ConnectionException  if no connection could be borrowed from the pool
     */
    public QueryResult execute(ProfileSession session, String sql, String database) {
        ServerProfile profile = session.getProfile();
        long startTime = System.currentTimeMillis();
        try {
            StatementOutcome outcome = borrow(session, conn -> inDatabase(conn, profile, database, c -> {
                try (Statement stmt = c.createStatement()) {
                    applyTimeout(stmt);
                    return collect(stmt, stmt.execute(sql));
                }
            }));
            long duration = System.currentTimeMillis() - startTime;
            log.debug("Executed on {} in {} ms ({} rows)", profile.getName(), duration, outcome.getRowCount());
            return QueryResult.success(outcome, duration);
        } catch (SQLException e) {
            return fail(profile, e, startTime);
        }
    }

    /**
     * Execute several statements on one connection as one transaction. Commits only when
     * every statement succeeded; otherwise rolls back and reports the first failure.
     */
    public QueryResult executeBatch(ProfileSession session, List<String> statements, String database) {
        ServerProfile profile = session.getProfile();
        long startTime = System.currentTimeMillis();
        try {
            List<StatementOutcome> outcomes = borrow(session, conn -> inDatabase(conn, profile, database, c -> {
                boolean autoCommit = c.getAutoCommit();
                c.setAutoCommit(false);
                try {
                    List<StatementOutcome> results = new ArrayList<>(statements.size());
                    for (int i = 0; i < statements.size(); i++) {
                        try (Statement stmt = c.createStatement()) {
                            applyTimeout(stmt);
                            results.add(collect(stmt, stmt.execute(statements.get(i))));
                        } catch (SQLException e) {
                            throw new BatchStatementException(i + 1, e);
                        }
                    }
                    c.commit();
                    return results;
                } catch (SQLException | RuntimeException e) {
                    rollback(c, profile);
                    throw e;
                } finally {
                    c.setAutoCommit(autoCommit);
                }
            }));
            long duration = System.currentTimeMillis() - startTime;
            log.info("Batch of {} statement(s) committed on {} in {} ms", outcomes.size(), profile.getName(), duration);
            return QueryResult.success(outcomes, duration);
        } catch (BatchStatementException e) {
            long duration = System.currentTimeMillis() - startTime;
            SQLException cause = e.getSqlCause();
            connectionManager.reportFailure(profile, cause);
            String message = "Statement " + e.getIndex() + " failed, transaction rolled back: "
                    + errorTranslator.describe(cause, properties.getQueryTimeoutMs());
            log.warn("Batch failed on {}: {}", profile.getName(), message);
            return QueryResult.failure(message, duration);
        } catch (SQLException e) {
            return fail(profile, e, startTime);
        }
    }

    /**
     * Names of the databases (or schemas) visible on the profile's server.
     *
     * @throws SQLException if the catalog query fails
     */
    public List<String> listDatabases(ProfileSession session) throws SQLException {
        SqlDialect dialect = session.getProfile().dialect();
        return borrow(session, conn -> {
            List<String> names = new ArrayList<>();
            try (Statement stmt = conn.createStatement()) {
                applyTimeout(stmt);
                try (ResultSet rs = stmt.executeQuery(dialect.getListDatabasesQuery())) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
            } catch (SQLException e) {
                connectionManager.reportFailure(session.getProfile(), e);
                throw e;
            }
            return names;
        });
    }

    private <T> T borrow(ProfileSession session, ProfileSession.ConnectionCallback<T> work) throws SQLException {
        try {
            return session.withConnection(work);
        } catch (ConnectionException e) {
            connectionManager.reportUnreachable(session.getProfile(), e.getCause());
            throw e;
        }
    }

    /**
     * Run work with the connection flagged read-only where the profile is, and pointed at the
     * requested database. The previous database context is restored before the connection
     * goes back to the pool.
     */
    private <T> T inDatabase(Connection conn, ServerProfile profile, String database,
                             ProfileSession.ConnectionCallback<T> work) throws SQLException {
        if (profile.isReadOnly()) {
            conn.setReadOnly(true);
        }
        if (database == null || database.isBlank()) {
            return work.doInConnection(conn);
        }
        SqlDialect dialect = profile.dialect();
        String target = database.trim();
        String original = dialect.currentDatabase(conn);
        if (target.equalsIgnoreCase(original)) {
            return work.doInConnection(conn);
        }
        dialect.switchDatabase(conn, target);
        try {
            return work.doInConnection(conn);
        } finally {
            if (original != null) {
                try {
                    dialect.switchDatabase(conn, original);
                } catch (SQLException e) {
                    log.warn("Could not restore database {} on {}: {}", original, profile.getName(), e.getMessage());
                }
            }
        }
    }

    private void applyTimeout(Statement stmt) throws SQLException {
        long timeoutMs = properties.getQueryTimeoutMs();
        if (timeoutMs > 0) {
            stmt.setQueryTimeout((int) Math.max(1, (timeoutMs + 999) / 1000));
        }
    }

    /**
     * Walk every result the statement produced. The first result set is kept as the
     * recordset; later result sets are drained.
     */
    private StatementOutcome collect(Statement stmt, boolean isResultSet) throws SQLException {
        List<Map<String, Object>> recordset = null;
        List<Integer> rowsAffected = new ArrayList<>();
        while (true) {
            if (isResultSet) {
                try (ResultSet rs = stmt.getResultSet()) {
                    List<Map<String, Object>> rows = normalizer.normalize(rs);
                    if (recordset == null) {
                        recordset = rows;
                    }
                }
            } else {
                int updateCount = stmt.getUpdateCount();
                if (updateCount == -1) {
                    break;
                }
                rowsAffected.add(updateCount);
            }
            isResultSet = stmt.getMoreResults();
        }
        return new StatementOutcome(recordset, rowsAffected);
    }

    private QueryResult fail(ServerProfile profile, SQLException e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        connectionManager.reportFailure(profile, e);
        String message = errorTranslator.describe(e, properties.getQueryTimeoutMs());
        log.warn("Query failed on {} (SQLState: {}, Error Code: {}): {}",
                profile.getName(), e.getSQLState(), e.getErrorCode(), message);
        return QueryResult.failure(message, duration);
    }

    private static void rollback(Connection conn, ServerProfile profile) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed on {}: {}", profile.getName(), e.getMessage());
        }
    }

    /**
     * Carries the 1-based position of the batch statement that failed.
     */
    private static final class BatchStatementException extends SQLException {
        private final int index;

        private BatchStatementException(int index, SQLException cause) {
            super(cause.getMessage(), cause.getSQLState(), cause.getErrorCode(), cause);
            this.index = index;
        }

        int getIndex() {
            return index;
        }

        SQLException getSqlCause() {
            return (SQLException) getCause();
        }
    }
}
