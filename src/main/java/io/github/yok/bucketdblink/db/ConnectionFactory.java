package io.github.yok.bucketdblink.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections to a database of the configured server.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection. The caller owns and closes it.
     *
     * @param database database name
     * @return open connection
     * @throws SQLException if the server cannot be reached or refuses the login
     */
    Connection open(String database) throws SQLException;
}
