package com.sqlbridge.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sqlbridge.model.ServerProfile;
import org.junit.jupiter.api.Test;

class JdbcConnectionInfoResolverTest {

    private final JdbcConnectionInfoResolver resolver = new JdbcConnectionInfoResolver();

    @Test
    void shouldBuildSqlServerUrl() {
        ServerProfile profile = ServerProfile.builder()
                .name("SERVER_PROFILE_1").dbType("sqlserver").host("10.0.0.5").port(1433)
                .username("sa").password("pw").defaultDatabase("master")
                .encrypt(false).trustServerCertificate(true)
                .build();

        JdbcConnectionInfo info = resolver.resolve(profile);

        assertThat(info.getUrl()).isEqualTo("jdbc:sqlserver://10.0.0.5:1433;databaseName=master;encrypt=false;"
                + "trustServerCertificate=true;applicationName=sqlbridge");
        assertThat(info.getDriverClassName()).isEqualTo("com.microsoft.sqlserver.jdbc.SQLServerDriver");
        assertThat(info.getUsername()).isEqualTo("sa");
        assertThat(info.toString()).doesNotContain("pw");
    }

    @Test
    void shouldBuildPostgresUrlWithApplicationName() {
        ServerProfile profile = ServerProfile.builder()
                .name("PG").dbType("postgres").host("pg").port(5432).defaultDatabase("app").build();

        JdbcConnectionInfo info = resolver.resolve(profile);

        assertThat(info.getUrl()).isEqualTo("jdbc:postgresql://pg:5432/app");
        assertThat(info.getDataSourceProperties()).containsEntry("ApplicationName", "sqlbridge");
    }

    @Test
    void shouldBuildInMemoryH2UrlWithoutHost() {
        ServerProfile profile = ServerProfile.builder().name("LOCAL").dbType("h2").build();

        assertThat(resolver.resolve(profile).getUrl()).isEqualTo("jdbc:h2:mem:local;DB_CLOSE_DELAY=-1");
    }

    @Test
    void shouldPreferExplicitJdbcUrl() {
        ServerProfile profile = ServerProfile.builder()
                .name("X").dbType("mysql").host("ignored").port(3306).jdbcUrl("jdbc:mysql://other:3307/db").build();

        JdbcConnectionInfo info = resolver.resolve(profile);

        assertThat(info.getUrl()).isEqualTo("jdbc:mysql://other:3307/db");
        assertThat(info.getDriverClassName()).isEqualTo("com.mysql.cj.jdbc.Driver");
    }

    @Test
    void shouldRejectUnknownTypeWithoutUrl() {
        ServerProfile profile = ServerProfile.builder().name("X").dbType("sybase").host("h").port(5000).build();

        assertThatThrownBy(() -> resolver.resolve(profile))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jdbcUrl is required");
    }
}
