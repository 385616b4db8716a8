package io.github.yok.bucketdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.bucketdblink.db.ConnectionFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns at most one open connection per target database for the duration of a run.
 *
 * <p>
 * The first request for a database makes sure it exists (through the administrative database),
 * then opens a connection to it with autocommit off. Later requests reuse that connection.
 * {@link #close()} closes every connection exactly once; use it in try-with-resources so that it
 * also runs when a group fails.
 * </p>
 *
 * <p>
 * Not thread-safe; a run is single-threaded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    private final ConnectionFactory connectionFactory;
    private final String adminDatabase;
    private final TableProvisioner provisioner;

    // database name → open connection, in opening order
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private boolean closed;

    /**
     * Creates a manager with no open connections.
     *
     * @param connectionFactory opens connections to the server
     * @param adminDatabase database used to create missing databases
     * @param provisioner creates missing databases
     */
    public ConnectionManager(ConnectionFactory connectionFactory, String adminDatabase,
            TableProvisioner provisioner) {
        this.connectionFactory = connectionFactory;
        this.adminDatabase = adminDatabase;
        this.provisioner = provisioner;
    }

    /**
     * Returns the connection for a database, creating the database and the connection on first
     * use.
     *
     * @param database target database name
     * @return open connection with autocommit off
     * @throws SQLException if the server cannot be reached or the database cannot be created
     * @throws IllegalStateException if the manager is closed
     */
    public Connection connectionFor(String database) throws SQLException {
        Preconditions.checkState(!closed, "ConnectionManager is already closed");
        Connection existing = connections.get(database);
        if (existing != null) {
            return existing;
        }

        try (Connection admin = connectionFactory.open(adminDatabase)) {
            provisioner.ensureDatabase(admin, database);
        }

        Connection connection = connectionFactory.open(database);
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }
        connections.put(database, connection);
        log.info("[{}] Connection opened", database);
        return connection;
    }

    /**
     * Returns the number of connections currently held.
     *
     * @return open connection count
     */
    public int openCount() {
        return connections.size();
    }

    /**
     * Closes every held connection. A failure to close one connection is logged and does not
     * prevent closing the others. Calling this more than once has no further effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            try {
                entry.getValue().close();
                log.info("[{}] Connection closed", entry.getKey());
            } catch (SQLException e) {
                log.warn("[{}] Failed to close connection: {}", entry.getKey(), e.getMessage(),
                        e);
            }
        }
        connections.clear();
    }
}
