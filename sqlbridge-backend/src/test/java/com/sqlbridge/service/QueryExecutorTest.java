package com.sqlbridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.model.QueryResult;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.util.JdbcConnectionInfoResolver;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryExecutorTest {

    private final GatewayProperties properties = new GatewayProperties();
    private ConnectionManager manager;
    private QueryExecutor executor;
    private ProfileSession session;

    @BeforeEach
    void setUp() {
        properties.setWarmUp(false);
        properties.setHealthCheckIntervalMs(0);
        properties.setQueryTimeoutMs(1000);
        HikariDataSourceFactory factory = new HikariDataSourceFactory(new JdbcConnectionInfoResolver(), properties);
        ServerProfileRegistry registry = mock(ServerProfileRegistry.class);
        manager = new ConnectionManager(properties, registry, factory);
        executor = new QueryExecutor(properties, new ResultNormalizer(), new BackendErrorTranslator(), manager);

        ServerProfile profile = ServerProfile.builder()
                .name("EXEC")
                .dbType("h2")
                .defaultDatabase("exec_" + UUID.randomUUID().toString().replace("-", ""))
                .username("sa")
                .password("")
                .maxPoolSize(2)
                .minIdle(0)
                .build();
        when(registry.find(anyString())).thenReturn(Optional.of(profile));
        session = manager.acquire(profile);

        assertThat(executor.execute(session,
                "CREATE TABLE ORDERS (ID INT PRIMARY KEY, NOTE VARCHAR(200))", null).isSuccess()).isTrue();
        assertThat(executor.execute(session, "CREATE SCHEMA REPORTING", null).isSuccess()).isTrue();
        assertThat(executor.execute(session,
                "CREATE TABLE REPORTING.SUMMARY (TOTAL INT)", null).isSuccess()).isTrue();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void shouldReturnRowsAndTiming() {
        executor.execute(session, "INSERT INTO ORDERS VALUES (1, 'first'), (2, 'second')", null);

        QueryResult result = executor.execute(session, "SELECT ID, NOTE FROM ORDERS ORDER BY ID", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getError()).isNull();
        assertThat(result.getExecutionMs()).isGreaterThanOrEqualTo(0);
        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getRecordset()).extracting(r -> r.get("NOTE")).containsExactly("first", "second");
    }

    @Test
    void shouldReportRowsAffectedForWrites() {
        QueryResult result = executor.execute(session, "INSERT INTO ORDERS VALUES (10, 'a'), (11, 'b')", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowsAffected()).containsExactly(2);
        assertThat(result.getRecordset()).isEmpty();
    }

    @Test
    void shouldRoundTripJsonTextByteForByte() {
        String json = "{\"k\":[1,2,{\"n\":null}],\"s\":\" x \"}";
        executor.execute(session, "INSERT INTO ORDERS VALUES (5, '" + json + "')", null);

        QueryResult first = executor.execute(session, "SELECT NOTE FROM ORDERS WHERE ID = 5", null);
        QueryResult second = executor.execute(session, "SELECT NOTE FROM ORDERS WHERE ID = 5", null);

        assertThat(first.getRecordset().get(0).get("NOTE")).isEqualTo(json);
        assertThat(second.getRecordset()).isEqualTo(first.getRecordset());
    }

    @Test
    void shouldReturnMissingObjectAsFailure() {
        QueryResult result = executor.execute(session, "SELECT * FROM NOPE", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().toLowerCase()).contains("not exist");
        assertThat(result.getRecordset()).isEmpty();
    }

    @Test
    void shouldKeepSessionUsableAfterBackendError() {
        executor.execute(session, "SELEC broken", null);

        assertThat(executor.execute(session, "SELECT 1 AS ONE", null).isSuccess()).isTrue();
        assertThat(session.isClosed()).isFalse();
    }

    @Test
    void shouldSwitchDatabaseContextPerRequest() {
        QueryResult inSchema = executor.execute(session, "SELECT COUNT(*) AS C FROM SUMMARY", "REPORTING");
        QueryResult withoutSchema = executor.execute(session, "SELECT COUNT(*) AS C FROM SUMMARY", null);

        assertThat(inSchema.isSuccess()).isTrue();
        assertThat(withoutSchema.isSuccess()).isFalse();
        QueryResult current = executor.execute(session, "SELECT CURRENT_SCHEMA AS S", null);
        assertThat(current.getRecordset().get(0).get("S")).isEqualTo("PUBLIC");
    }

    @Test
    void shouldFailForUnknownDatabase() {
        QueryResult result = executor.execute(session, "SELECT 1", "NO_SUCH_SCHEMA");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isNotBlank();
    }

    @Test
    void shouldCancelStatementsPastTheTimeout() {
        QueryResult result = executor.execute(session,
                "SELECT COUNT(*) FROM SYSTEM_RANGE(1, 100000) A, SYSTEM_RANGE(1, 100000) B WHERE A.X + B.X < 0",
                null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("timed out");
    }

    @Test
    void shouldCommitBatchWhenAllStatementsSucceed() {
        QueryResult result = executor.executeBatch(session, List.of(
                "INSERT INTO ORDERS VALUES (20, 'x')",
                "UPDATE ORDERS SET NOTE = 'y' WHERE ID = 20",
                "SELECT NOTE FROM ORDERS WHERE ID = 20"), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatements()).hasSize(3);
        assertThat(result.getStatements().get(1).getRowsAffected()).containsExactly(1);
        assertThat(result.getStatements().get(2).getRecordset()).containsExactly(Map.of("NOTE", "y"));
    }

    @Test
    void shouldRollBackBatchOnFirstFailure() {
        QueryResult result = executor.executeBatch(session, List.of(
                "INSERT INTO ORDERS VALUES (30, 'kept?')",
                "INSERT INTO MISSING_TABLE VALUES (1)",
                "INSERT INTO ORDERS VALUES (31, 'never')"), null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Statement 2 failed");

        QueryResult check = executor.execute(session, "SELECT COUNT(*) AS C FROM ORDERS WHERE ID IN (30, 31)", null);
        assertThat(check.getRecordset().get(0).get("C")).isEqualTo(0L);
    }

    @Test
    void shouldListSchemasOnH2() throws SQLException {
        List<String> databases = executor.listDatabases(session);

        assertThat(databases).contains("PUBLIC", "REPORTING");
    }

    @Test
    void shouldRaiseConnectionFailureWhenPoolCannotLendConnection() throws SQLException {
        ServerProfile down = ServerProfile.builder()
                .name("DOWN")
                .dbType("h2")
                .jdbcUrl("jdbc:h2:tcp://127.0.0.1:1/nothing")
                .username("sa")
                .password("")
                .build();
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(
                new SQLTransientConnectionException("Connection is not available, request timed out after 30000ms."));
        ProfileSession broken = new ProfileSession(down, dataSource, 200);

        assertThatThrownBy(() -> executor.execute(broken, "SELECT 1", null))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("DOWN")
                .hasMessageContaining("Connection is not available");

        assertThat(manager.status(down).isHealthy()).isFalse();
        assertThat(manager.status(down).getLastError()).isNotBlank();
        assertThat(broken.availablePermits()).isEqualTo(1);
    }
}
