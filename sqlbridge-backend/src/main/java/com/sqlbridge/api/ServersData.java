package com.sqlbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ServersData {
    private List<ServerInfo> servers;

    // Reported as null when the catalog is empty.
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String defaultServer;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> warnings;
}
