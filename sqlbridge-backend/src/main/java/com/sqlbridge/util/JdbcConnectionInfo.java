package com.sqlbridge.util;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    @ToString.Exclude
    private String password;
    private String dbType;
    private String driverClassName;
    private Map<String, String> dataSourceProperties;
}
