package com.sqlbridge.service;

import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.model.ConnectionState;
import com.sqlbridge.model.ServerProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one connection pool per server profile.
 *
 * <p>Each profile has its own slot guarded by its own lock, so establishing a session for one
 * profile never waits on another. Health state lives in the slot and is only changed here.
 */
@Slf4j
@Service
public class ConnectionManager {

    private static final int MAX_WARM_UP_THREADS = 8;

    private final Map<String, ProfileSlot> slots = new ConcurrentHashMap<>();

    private final GatewayProperties properties;
    private final ServerProfileRegistry registry;
    private final HikariDataSourceFactory dataSourceFactory;
    private final ScheduledExecutorService scheduler;

    public ConnectionManager(GatewayProperties properties,
                             ServerProfileRegistry registry,
                             HikariDataSourceFactory dataSourceFactory) {
        this.properties = properties;
        this.registry = registry;
        this.dataSourceFactory = dataSourceFactory;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "sqlbridge-health");
            t.setDaemon(true);
            return t;
        });
    }

    private static final class ProfileSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean probePending = new AtomicBoolean(false);
        private volatile ProfileSession session;
        private volatile ConnectionState state;
        // set once the profile left the catalog; a retired slot never publishes a session
        private volatile boolean retired;

        private ProfileSlot(String name) {
            this.state = ConnectionState.initial(name);
        }
    }

    @PostConstruct
    public void start() {
        if (properties.isWarmUp()) {
            warmUp();
        }
        long interval = properties.getHealthCheckIntervalMs();
        if (interval > 0) {
            scheduler.scheduleWithFixedDelay(this::checkAll, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Connect and probe every configured profile. Failures are logged, never thrown.
     */
    public void warmUp() {
        List<ServerProfile> profiles = registry.list();
        if (profiles.isEmpty()) {
            return;
        }
        log.info("Pre-warming {} server pool(s)...", profiles.size());
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(profiles.size(), MAX_WARM_UP_THREADS));
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (ServerProfile profile : profiles) {
                futures.add(CompletableFuture.runAsync(() -> {
                    ConnectionState state = healthCheck(profile);
                    if (state.isHealthy()) {
                        log.info("{}: connected & healthy", profile.getName());
                    } else {
                        log.warn("{}: {}", profile.getName(), state.getLastError());
                    }
                }, pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }
        log.info("Connection warm-up complete");
    }

    /**
     * Return the profile's session, establishing it on first use.
     *
     * <p>Establishment is serialized per profile; a session whose profile definition changed
     * since it was created is replaced. A session marked unhealthy is probed under the slot
     * lock before it is handed out again.
     *
     * @throws ConnectionException      if the backend cannot be reached
     * @throws ProfileNotFoundException if the profile was removed from the catalog
     */
    public ProfileSession acquire(ServerProfile profile) {
        ProfileSlot slot = slot(profile.getName());
        ProfileSession current = slot.session;
        if (isUsable(current, profile) && slot.state.isHealthy()) {
            return current;
        }

        slot.lock.lock();
        try {
            if (slot.retired || registry.find(profile.getName()).isEmpty()) {
                retire(key(profile.getName()), slot);
                throw new ProfileNotFoundException(profile.getName(), configuredNames());
            }
            current = slot.session;
            if (isUsable(current, profile)) {
                if (slot.state.isHealthy() || probe(slot, current, profile)) {
                    return current;
                }
                log.info("Re-creating session for {} after a failed probe", profile.getName());
            } else if (current != null) {
                log.info("Replacing session for {}", profile.getName());
                slot.session = null;
                closeQuietly(current);
            }

            DataSource dataSource = null;
            try {
                dataSource = dataSourceFactory.create(profile);
                validate(dataSource, profile);
            } catch (Exception e) {
                closeQuietly(dataSource, profile.getName());
                String reason = rootMessage(e);
                slot.state = slot.state.toBuilder()
                        .connected(false)
                        .healthy(false)
                        .lastError(reason)
                        .lastCheckedAt(OffsetDateTime.now())
                        .build();
                log.error("Connection failed for {} ({}:{}): {}",
                        profile.getName(), profile.getHost(), profile.getPort(), reason);
                throw new ConnectionException(profile.getName(), reason, e);
            }

            ProfileSession session = new ProfileSession(profile, dataSource, properties.getQueueTimeoutMs());
            slot.session = session;
            slot.state = ConnectionState.builder()
                    .profileName(profile.getName())
                    .connected(true)
                    .healthy(true)
                    .lastCheckedAt(OffsetDateTime.now())
                    .build();
            log.info("Connected: {} -> {}:{} (db: {}, readOnly: {})", profile.getName(), profile.getHost(),
                    profile.getPort(), profile.getDefaultDatabase(), profile.isReadOnly());
            return session;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Probe the profile with the dialect's trivial query.
     *
     * <p>Without a session this attempts to establish one. A failed probe on an existing
     * session closes it so the next {@link #acquire} starts fresh.
     */
    public ConnectionState healthCheck(ServerProfile profile) {
        ProfileSlot slot = slot(profile.getName());
        ProfileSession session = slot.session;
        if (!isUsable(session, profile)) {
            try {
                acquire(profile);
            } catch (ConnectionException | ProfileNotFoundException e) {
                log.debug("Health check could not connect {}: {}", profile.getName(), e.getMessage());
            }
            return slot.state;
        }
        probe(slot, session, profile);
        return slot.state;
    }

    private boolean probe(ProfileSlot slot, ProfileSession session, ServerProfile profile) {
        try (Connection conn = session.openProbeConnection();
             Statement st = conn.createStatement()) {
            st.setQueryTimeout(toSeconds(properties.getHealthCheckTimeoutMs()));
            st.execute(profile.dialect().getValidationQuery());
            slot.state = slot.state.toBuilder()
                    .connected(true)
                    .healthy(true)
                    .lastError(null)
                    .lastCheckedAt(OffsetDateTime.now())
                    .build();
            return true;
        } catch (SQLException e) {
            log.error("Health check failed for {}: {}", profile.getName(), e.getMessage());
            discard(slot, session, rootMessage(e));
            return false;
        }
    }

    /**
     * Called by the executor after a statement failed. Connection-class failures and timeouts
     * mark the profile unhealthy and queue a probe before the session is trusted again.
     */
    public void reportFailure(ServerProfile profile, SQLException e) {
        if (isConnectionFailure(e)) {
            markUnhealthy(profile, rootMessage(e));
        }
    }

    /**
     * Called when the pool of an established session could not hand out a connection.
     */
    public void reportUnreachable(ServerProfile profile, Throwable cause) {
        markUnhealthy(profile, cause != null ? rootMessage(cause) : "Connection unavailable");
    }

    private void markUnhealthy(ServerProfile profile, String reason) {
        ProfileSlot slot = slot(profile.getName());
        slot.state = slot.state.toBuilder()
                .healthy(false)
                .lastError(reason)
                .lastCheckedAt(OffsetDateTime.now())
                .build();
        if (slot.probePending.compareAndSet(false, true)) {
            scheduler.execute(() -> {
                try {
                    healthCheck(profile);
                } finally {
                    slot.probePending.set(false);
                }
            });
        }
    }

    public ConnectionState status(ServerProfile profile) {
        ProfileSlot slot = slots.get(key(profile.getName()));
        return slot != null ? slot.state : ConnectionState.initial(profile.getName());
    }

    /**
     * Close sessions of profiles that are no longer configured or whose definition changed.
     */
    public void retain(Collection<ServerProfile> profiles) {
        Map<String, ServerProfile> byKey = new HashMap<>();
        for (ServerProfile p : profiles) {
            byKey.put(key(p.getName()), p);
        }
        for (Map.Entry<String, ProfileSlot> entry : slots.entrySet()) {
            ProfileSlot slot = entry.getValue();
            ServerProfile next = byKey.get(entry.getKey());
            if (next == null) {
                retire(entry.getKey(), slot);
                continue;
            }
            ProfileSession session = slot.session;
            if (session != null && !session.getProfile().equals(next)) {
                discard(slot, session, "Server profile definition changed");
            }
        }
    }

    private void retire(String key, ProfileSlot slot) {
        slot.lock.lock();
        try {
            slot.retired = true;
            slots.remove(key, slot);
            ProfileSession session = slot.session;
            slot.session = null;
            if (session != null) {
                log.info("Closing session for removed server {}", key);
                closeQuietly(session);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private List<String> configuredNames() {
        List<String> names = new ArrayList<>();
        for (ServerProfile p : registry.list()) {
            names.add(p.getName());
        }
        return names;
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        log.info("Closing {} connection pool(s)...", slots.size());
        for (ProfileSlot slot : slots.values()) {
            ProfileSession session = slot.session;
            if (session != null) {
                closeQuietly(session);
            }
        }
        slots.clear();
    }

    private void checkAll() {
        try {
            for (ServerProfile profile : registry.list()) {
                healthCheck(profile);
            }
        } catch (RuntimeException e) {
            log.error("Periodic health check failed", e);
        }
    }

    private void discard(ProfileSlot slot, ProfileSession session, String reason) {
        slot.lock.lock();
        try {
            if (slot.session != null && slot.session != session) {
                // a newer session owns the slot state
                return;
            }
            if (slot.session == session) {
                slot.session = null;
                closeQuietly(session);
            }
            slot.state = slot.state.toBuilder()
                    .connected(false)
                    .healthy(false)
                    .lastError(reason)
                    .lastCheckedAt(OffsetDateTime.now())
                    .build();
        } finally {
            slot.lock.unlock();
        }
    }

    private void validate(DataSource dataSource, ServerProfile profile) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(toSeconds(properties.getHealthCheckTimeoutMs()))) {
                throw new SQLException("Connection to " + profile.getName() + " is not valid");
            }
        }
    }

    private ProfileSlot slot(String name) {
        return slots.computeIfAbsent(key(name), k -> new ProfileSlot(name));
    }

    private static boolean isUsable(ProfileSession session, ServerProfile profile) {
        return session != null && !session.isClosed() && session.getProfile().equals(profile);
    }

    static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTimeoutException
                || e instanceof SQLRecoverableException
                || e instanceof SQLNonTransientConnectionException
                || e instanceof SQLTransientConnectionException) {
            return true;
        }
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    private static int toSeconds(long millis) {
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    private void closeQuietly(ProfileSession session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("Failed to close pool for {}: {}", session.getProfile().getName(), e.getMessage());
        }
    }

    private void closeQuietly(DataSource dataSource, String name) {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close pool for {}: {}", name, e.getMessage());
            }
        }
    }
}
