package com.pinotchat.mcp.pinot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single driver connection used by the fallback query path.
 *
 * <p>The handle is created lazily and probed with {@code SELECT 1} before every hand-out. A handle
 * that fails its probe is closed and replaced. Check-then-create runs entirely under one lock, so
 * concurrent callers never open two connections for the same empty slot.
 *
 * <p>Query callers share the handle through {@link #acquire()} and {@link #release(Connection)}.
 * A handle that is invalidated or replaced while leased is retired: it stops being handed out but
 * is only closed once its last lease is released, so one caller's failure never closes the
 * connection under another caller's running statement.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    static final String PROBE_QUERY = "SELECT 1";

    private final ConnectionFactory connectionFactory;
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection; // guarded by lock
    private final Map<Connection, Integer> leases = new IdentityHashMap<>(); // guarded by lock
    private final Set<Connection> retired = Collections.newSetFromMap(new IdentityHashMap<>()); // guarded by lock

    public ConnectionManager(ConnectionFactory connectionFactory) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("Connection factory cannot be null");
        }
        this.connectionFactory = connectionFactory;
    }

    /**
     * Returns a live connection, creating or replacing the held one as needed.
     *
     * @return A connection that has just passed its liveness probe
     * @throws PinotConnectionException if a new connection cannot be created or fails its first probe
     */
    public Connection get() throws PinotConnectionException {
        lock.lock();
        try {
            if (connection != null) {
                try {
                    probe(connection);
                    return connection;
                } catch (SQLException e) {
                    logger.warn("Connection test failed, creating new connection: {}", e.getMessage());
                    retireOrClose(connection);
                    connection = null;
                }
            }
            connection = createAndProbe();
            return connection;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #get()}, but records a lease on the returned handle. Every successful call must be
     * paired with {@link #release(Connection)}.
     *
     * @return A live connection that will not be closed until it is released
     * @throws PinotConnectionException if a new connection cannot be created or fails its first probe
     */
    public Connection acquire() throws PinotConnectionException {
        lock.lock();
        try {
            Connection leased = get();
            leases.merge(leased, 1, Integer::sum);
            return leased;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends a lease taken with {@link #acquire()}. Closes the handle if it was retired and this was
     * its last lease.
     */
    public void release(Connection leased) {
        boolean closeNow = false;
        lock.lock();
        try {
            Integer count = leases.get(leased);
            if (count == null) {
                logger.warn("Release of a connection that holds no lease");
                return;
            }
            if (count > 1) {
                leases.put(leased, count - 1);
            } else {
                leases.remove(leased);
                closeNow = retired.remove(leased);
            }
        } finally {
            lock.unlock();
        }
        if (closeNow) {
            logger.debug("Closing retired driver connection after its last lease");
            closeHandle(leased);
        }
    }

    /**
     * Drops the held connection so the next {@link #get()} starts from scratch. The handle is closed
     * now, or when its last lease is released.
     */
    public void invalidate() {
        Connection stale;
        lock.lock();
        try {
            stale = connection;
            connection = null;
            if (stale != null && leases.containsKey(stale)) {
                retired.add(stale);
                logger.debug("Driver connection retired while leased");
                return;
            }
        } finally {
            lock.unlock();
        }
        if (stale != null) {
            logger.debug("Invalidating driver connection");
            closeHandle(stale);
        }
    }

    /**
     * Drops {@code failed} if it is still the held connection. A handle that was already replaced
     * is left alone, so a late failure never discards its successor.
     */
    public void invalidate(Connection failed) {
        lock.lock();
        try {
            if (failed == null || failed != connection) {
                return;
            }
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasConnection() {
        lock.lock();
        try {
            return connection != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        invalidate();
    }

    // Caller holds the lock.
    private void retireOrClose(Connection stale) {
        if (leases.containsKey(stale)) {
            retired.add(stale);
        } else {
            closeHandle(stale);
        }
    }

    private Connection createAndProbe() throws PinotConnectionException {
        Connection created;
        try {
            created = connectionFactory.create();
        } catch (SQLException e) {
            logger.error("Failed to create Pinot connection: {}", e.getMessage());
            throw new PinotConnectionException("Failed to create Pinot connection: " + e.getMessage(), e);
        }

        try {
            probe(created);
        } catch (SQLException e) {
            closeHandle(created);
            logger.error("New Pinot connection failed its liveness probe: {}", e.getMessage());
            throw new PinotConnectionException("New Pinot connection failed liveness probe: " + e.getMessage(), e);
        }
        logger.info("Pinot driver connection established");
        return created;
    }

    static void probe(Connection dbConn) throws SQLException {
        try (Statement probeStmt = dbConn.createStatement();
             ResultSet resultSet = probeStmt.executeQuery(PROBE_QUERY)) {
            resultSet.next();
        }
    }

    private static void closeHandle(Connection dbConn) {
        try {
            dbConn.close();
        } catch (SQLException e) {
            logger.warn("Error closing driver connection: {}", e.getMessage(), e);
        }
    }
}
