package com.sqlbridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.zaxxer.hikari.SQLExceptionOverride;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import org.junit.jupiter.api.Test;

class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void shouldKeepConnectionOnStatementErrors() {
        assertThat(override.adjudicate(new SQLException("Invalid object name 'x'", "42S02", 208)))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("duplicate key", "23505")))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLFeatureNotSupportedException("nope")))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
    }

    @Test
    void shouldEvictOnConnectionErrors() {
        assertThat(override.adjudicate(new SQLException("Connection reset", "08S01")))
                .isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
        assertThat(override.adjudicate(new SQLException("no state")))
                .isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
    }
}
