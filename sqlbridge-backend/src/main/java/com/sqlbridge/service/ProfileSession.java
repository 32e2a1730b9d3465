package com.sqlbridge.service;

import com.sqlbridge.model.ServerProfile;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Live connection resource of one server profile, handed out by {@link ConnectionManager}.
 *
 * <p>Statement execution is bounded by a fair semaphore sized to the profile's pool; callers
 * beyond that wait for at most the queue timeout and are then turned away.
 */
public class ProfileSession {

    private final ServerProfile profile;
    private final DataSource dataSource;
    private final Semaphore permits;
    private final long queueTimeoutMs;
    private volatile boolean closed;

    public ProfileSession(ServerProfile profile, DataSource dataSource, long queueTimeoutMs) {
        this.profile = profile;
        this.dataSource = dataSource;
        this.permits = new Semaphore(Math.max(1, profile.getMaxPoolSize()), true);
        this.queueTimeoutMs = queueTimeoutMs;
    }

    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doInConnection(Connection conn) throws SQLException;
    }

    /**
     * Run work on a pooled connection while holding an execution permit.
     *
     * @throws GatewayBusyException if no permit frees up within the queue timeout
     * @throws ConnectionException  if the pool cannot hand out a connection; the callback
     *                              has not run
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(queueTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for an execution slot on " + profile.getName(), e);
        }
        if (!acquired) {
            throw new GatewayBusyException(profile.getName(), queueTimeoutMs);
        }
        try (Connection conn = borrowConnection()) {
            return callback.doInConnection(conn);
        } finally {
            permits.release();
        }
    }

    private Connection borrowConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException(profile.getName(), e.getMessage(), e);
        }
    }

    /**
     * Connection for health probes; does not take an execution permit.
     */
    Connection openProbeConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public ServerProfile getProfile() {
        return profile;
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public boolean isClosed() {
        return closed;
    }

    void close() throws IOException {
        closed = true;
        if (dataSource instanceof Closeable closeable) {
            closeable.close();
        }
    }
}
