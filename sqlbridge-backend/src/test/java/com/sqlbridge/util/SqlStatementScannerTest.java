package com.sqlbridge.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SqlStatementScannerTest {

    @Test
    void shouldUppercaseKeywordsPerStatement() {
        SqlStatementScanner.ScanResult scan = SqlStatementScanner.scan("select a from t; Delete from t where id = 1");

        assertThat(scan.isComplete()).isTrue();
        assertThat(scan.getStatements()).hasSize(2);
        assertThat(scan.getStatements().get(0)).containsExactly("SELECT", "A", "FROM", "T");
        assertThat(scan.getStatements().get(1)).startsWith("DELETE", "FROM", "T");
    }

    @Test
    void shouldSkipCommentsAndLiterals() {
        String sql = "-- DROP TABLE x\n/* DELETE /* nested */ still comment */ SELECT 'DROP; it''s' AS \"INSERT\", [UPDATE] FROM t";

        SqlStatementScanner.ScanResult scan = SqlStatementScanner.scan(sql);

        assertThat(scan.isComplete()).isTrue();
        assertThat(scan.getStatements()).hasSize(1);
        assertThat(scan.getStatements().get(0)).containsExactly("SELECT", "AS", "FROM", "T");
    }

    @Test
    void shouldFlagBackslashInsideStringLiteral() {
        SqlStatementScanner.ScanResult escaped = SqlStatementScanner.scan("SELECT E'\\''; DROP TABLE accounts; -- '");
        SqlStatementScanner.ScanResult plain = SqlStatementScanner.scan("SELECT 'it''s' FROM t");

        assertThat(escaped.isComplete()).isTrue();
        assertThat(escaped.isAmbiguous()).isTrue();
        assertThat(plain.isAmbiguous()).isFalse();
    }

    @Test
    void shouldSkipDollarQuotedBodiesButNotParameters() {
        SqlStatementScanner.ScanResult body = SqlStatementScanner.scan("SELECT $fn$ DELETE FROM t $fn$");
        SqlStatementScanner.ScanResult param = SqlStatementScanner.scan("SELECT * FROM t WHERE id = $1");

        assertThat(body.getStatements().get(0)).containsExactly("SELECT");
        assertThat(param.isComplete()).isTrue();
        assertThat(param.getStatements().get(0)).containsExactly("SELECT", "FROM", "T", "WHERE", "ID");
    }

    @Test
    void shouldReportUnterminatedText() {
        assertThat(SqlStatementScanner.scan("SELECT 'abc").isComplete()).isFalse();
        assertThat(SqlStatementScanner.scan("SELECT 1 /* open").isComplete()).isFalse();
        assertThat(SqlStatementScanner.scan("SELECT [col").isComplete()).isFalse();
    }

    @Test
    void shouldIgnoreEmptyStatements() {
        SqlStatementScanner.ScanResult scan = SqlStatementScanner.scan(" ;; SELECT 1 ; ; ");

        assertThat(scan.getStatements()).hasSize(1);
        assertThat(SqlStatementScanner.scan(null).getStatements()).isEmpty();
        assertThat(SqlStatementScanner.scan("  -- only a comment").getStatements()).isEmpty();
    }

    @Test
    void shouldKeepVariablesAndTempTablesAsWords() {
        SqlStatementScanner.ScanResult scan = SqlStatementScanner.scan("SELECT @id, x FROM #tmp");

        assertThat(scan.getStatements().get(0)).containsExactly("SELECT", "@ID", "X", "FROM", "#TMP");
    }
}
