package com.sqlbridge.controller;

import com.sqlbridge.api.BatchData;
import com.sqlbridge.api.BatchQueryRequest;
import com.sqlbridge.api.DatabasesData;
import com.sqlbridge.api.GatewayResponse;
import com.sqlbridge.api.QueryData;
import com.sqlbridge.api.QueryRequest;
import com.sqlbridge.api.ServerHealth;
import com.sqlbridge.api.ServerInfo;
import com.sqlbridge.api.ServersData;
import com.sqlbridge.model.ConnectionState;
import com.sqlbridge.model.ProfileCatalog;
import com.sqlbridge.model.QueryResult;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.model.StatementOutcome;
import com.sqlbridge.service.ConnectionManager;
import com.sqlbridge.service.PermissionEnforcer;
import com.sqlbridge.service.ProfileSession;
import com.sqlbridge.service.QueryExecutor;
import com.sqlbridge.service.ServerProfileLoader;
import com.sqlbridge.service.ServerProfileRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway endpoints under {@code /v1}. The API key is checked by {@code ApiKeyAuthFilter}
 * before any of these run.
 *
 * <p>Every query goes resolve, permission check, acquire, execute, in that order, so a request
 * that fails an earlier stage never reaches a backend.
 */
@RestController
@RequestMapping("/v1")
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    private static final String DEFAULT_DB = "default";

    private final ServerProfileRegistry registry;
    private final PermissionEnforcer permissionEnforcer;
    private final ConnectionManager connectionManager;
    private final QueryExecutor queryExecutor;

    public GatewayController(
            ServerProfileRegistry registry,
            PermissionEnforcer permissionEnforcer,
            ConnectionManager connectionManager,
            QueryExecutor queryExecutor
    ) {
        this.registry = registry;
        this.permissionEnforcer = permissionEnforcer;
        this.connectionManager = connectionManager;
        this.queryExecutor = queryExecutor;
    }

    /**
     * List configured server profiles with their last known connection state.
     *
     * GET /v1/servers
     */
    @GetMapping("/servers")
    public ResponseEntity<GatewayResponse<ServersData>> servers() {
        return ResponseEntity.ok(GatewayResponse.ok(serversData(registry.snapshot(), null)));
    }

    /**
     * Probe one server profile.
     *
     * GET /v1/servers/{name}/health
     */
    @GetMapping("/servers/{name}/health")
    public ResponseEntity<GatewayResponse<ServerHealth>> serverHealth(@PathVariable("name") String name) {
        ServerProfile profile = registry.resolve(name);
        ConnectionState state = connectionManager.healthCheck(profile);
        ServerHealth health = ServerHealth.builder()
                .name(profile.getName())
                .connected(state.isConnected())
                .healthy(state.isHealthy())
                .lastError(state.getLastError())
                .lastCheckedAt(state.getLastCheckedAt())
                .build();
        return ResponseEntity.ok(GatewayResponse.ok(health));
    }

    /**
     * Re-read the profile sources and swap in the new catalog. Sessions of removed or changed
     * profiles are closed.
     *
     * POST /v1/servers/reload
     */
    @PostMapping("/servers/reload")
    public ResponseEntity<GatewayResponse<ServersData>> reload() {
        ServerProfileLoader.LoadResult result = registry.reload();
        List<ServerProfile> profiles = result.getCatalog().list();
        connectionManager.retain(profiles);
        log.info("Server profiles reloaded: {} profile(s), trace_id={}", profiles.size(), MDC.get("trace_id"));
        return ResponseEntity.ok(GatewayResponse.ok(serversData(result.getCatalog(), result.getWarnings())));
    }

    /**
     * List databases on a server.
     *
     * GET /v1/databases?server=NAME
     */
    @GetMapping("/databases")
    public ResponseEntity<GatewayResponse<DatabasesData>> databases(
            @RequestParam(value = "server", required = false) String server) {
        ServerProfile profile = registry.resolve(server);
        ProfileSession session = connectionManager.acquire(profile);
        try {
            List<String> databases = queryExecutor.listDatabases(session);
            return ResponseEntity.ok(GatewayResponse.ok(new DatabasesData(databases, databases.size())));
        } catch (SQLException e) {
            log.error("Failed to list databases on {}: {}", profile.getName(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(GatewayResponse.failure(
                    "DATABASE_ERROR", "Failed to list databases: " + e.getMessage(), MDC.get("trace_id")));
        }
    }

    /**
     * Execute SQL against a server profile.
     *
     * POST /v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<GatewayResponse<QueryData>> query(@Valid @RequestBody QueryRequest request) {
        ServerProfile profile = registry.resolve(request.getServer());
        permissionEnforcer.enforce(profile, request.getSql());
        ProfileSession session = connectionManager.acquire(profile);

        QueryResult result = queryExecutor.execute(session, request.getSql(), request.getDatabase());
        QueryData data = result.isSuccess()
                ? new QueryData(result.getRecordset(), result.getRowsAffected(), result.getRowCount())
                : null;
        return ResponseEntity.ok(envelope(result, request.getDatabase(), data));
    }

    /**
     * Execute several statements in one transaction. All are permission-checked before the
     * first one runs.
     *
     * POST /v1/query/batch
     */
    @PostMapping("/query/batch")
    public ResponseEntity<GatewayResponse<BatchData>> batch(@Valid @RequestBody BatchQueryRequest request) {
        ServerProfile profile = registry.resolve(request.getServer());
        List<String> statements = new ArrayList<>(request.getQueries().size());
        for (BatchQueryRequest.BatchStatement query : request.getQueries()) {
            permissionEnforcer.enforce(profile, query.getSql());
            statements.add(query.getSql());
        }
        ProfileSession session = connectionManager.acquire(profile);

        QueryResult result = queryExecutor.executeBatch(session, statements, request.getDatabase());
        BatchData data = null;
        if (result.isSuccess()) {
            List<QueryData> results = new ArrayList<>(result.getStatements().size());
            for (StatementOutcome outcome : result.getStatements()) {
                results.add(QueryData.from(outcome));
            }
            data = new BatchData(results, true);
        }
        return ResponseEntity.ok(envelope(result, request.getDatabase(), data));
    }

    private <T> GatewayResponse<T> envelope(QueryResult result, String database, T data) {
        return GatewayResponse.<T>builder()
                .success(result.isSuccess())
                .db(database == null || database.isBlank() ? DEFAULT_DB : database.trim())
                .data(data)
                .error(result.getError())
                .executionMs(result.getExecutionMs())
                .build();
    }

    private ServersData serversData(ProfileCatalog catalog, List<String> warnings) {
        List<ServerInfo> servers = new ArrayList<>(catalog.size());
        for (ServerProfile profile : catalog.list()) {
            ConnectionState state = connectionManager.status(profile);
            servers.add(ServerInfo.builder()
                    .name(profile.getName())
                    .host(profile.getHost())
                    .port(profile.getPort())
                    .dbType(profile.getDbType())
                    .defaultDatabase(profile.getDefaultDatabase())
                    .connected(state.isConnected())
                    .healthy(state.isHealthy())
                    .readOnly(profile.isReadOnly())
                    .build());
        }
        return new ServersData(servers, catalog.getDefaultServer().orElse(null), warnings);
    }
}
