package com.sqlbridge.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ServerInfo {
    private String name;
    private String host;
    private int port;
    private String dbType;
    private String defaultDatabase;
    private boolean connected;
    private boolean healthy;
    private boolean readOnly;
}
