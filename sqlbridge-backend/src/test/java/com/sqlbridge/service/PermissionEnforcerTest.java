package com.sqlbridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sqlbridge.model.PermissionDecision;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.model.StatementClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class PermissionEnforcerTest {

    private final PermissionEnforcer enforcer = new PermissionEnforcer();

    private final ServerProfile readOnly = ServerProfile.builder()
            .name("SERVER_PROFILE_2").dbType("sqlserver").host("db2").port(1433).readOnly(true).build();
    private final ServerProfile readWrite = readOnly.toBuilder().name("SERVER_PROFILE_1").readOnly(false).build();

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM orders",
            "  select top 10 * from HR_EMPLOYEE",
            "-- leading comment\nSELECT 1",
            "/* header */ WITH t AS (SELECT 1 AS x) SELECT x FROM t",
            "SELECT REPLACE(name, 'a', 'b') FROM users",
            "SELECT 'DELETE FROM orders' AS txt",
            "SELECT 1; SELECT 2;",
            "SELECT created_at AS updated_at FROM audit"
    })
    void shouldClassifyReadsAsRead(String sql) {
        assertThat(enforcer.classify(sql)).isEqualTo(StatementClass.READ);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO t VALUES (1)",
            "update t set a = 1",
            "DELETE FROM t",
            "CREATE TABLE x (id INT)",
            "DROP TABLE x",
            "TRUNCATE TABLE x",
            "SELECT * INTO backup FROM orders",
            "WITH d AS (DELETE FROM t RETURNING *) SELECT * FROM d",
            "SELECT 1; DELETE FROM t",
            "EXEC sp_who",
            "EXECUTE dbo.cleanup",
            "SET NOCOUNT ON",
            "USE master",
            "BEGIN TRANSACTION",
            "SELECT * FROM t FOR UPDATE",
            "SELECT * FROM OPENROWSET('SQLNCLI', 'x', 'SELECT 1')",
            "SELECT 'unterminated",
            "SELECT E'\\''; DROP TABLE accounts; -- '",
            "SELECT '\\''; DELETE FROM accounts; -- '",
            "",
            "   ",
            "-- nothing but a comment"
    })
    void shouldClassifyEverythingElseAsWrite(String sql) {
        assertThat(enforcer.classify(sql)).isEqualTo(StatementClass.WRITE);
    }

    @Test
    void shouldDenyWritesOnReadOnlyProfile() {
        PermissionDecision decision = enforcer.check(readOnly, "INSERT INTO dbo.test (id) VALUES (1)");

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getStatementClass()).isEqualTo(StatementClass.WRITE);
        assertThat(decision.getReason())
                .isEqualTo("Access denied: Server 'SERVER_PROFILE_2' is READ-ONLY. Only SELECT queries are allowed.");
    }

    @Test
    void shouldDenyBackslashEscapedLiteralOnReadOnlyPostgresProfile() {
        ServerProfile postgres = readOnly.toBuilder().name("PG_RO").dbType("postgresql").port(5432).build();

        PermissionDecision decision = enforcer.check(postgres, "SELECT E'\\''; DROP TABLE accounts; -- '");

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getReason()).contains("READ-ONLY");
    }

    @Test
    void shouldAllowReadsOnReadOnlyProfile() {
        assertThat(enforcer.check(readOnly, "SELECT 1").isAllowed()).isTrue();
    }

    @Test
    void shouldAllowWritesOnReadWriteProfile() {
        PermissionDecision decision = enforcer.check(readWrite, "CREATE TABLE dbo.test (id INT)");

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getStatementClass()).isEqualTo(StatementClass.WRITE);
    }

    @Test
    void shouldThrowOnEnforceWhenDenied() {
        assertThatThrownBy(() -> enforcer.enforce(readOnly, "DROP TABLE x"))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessageContaining("READ-ONLY");
    }
}
