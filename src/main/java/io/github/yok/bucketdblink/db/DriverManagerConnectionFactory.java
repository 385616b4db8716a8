package io.github.yok.bucketdblink.db;

import io.github.yok.bucketdblink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link ConnectionFactory} that connects through {@link DriverManager}.
 *
 * <p>
 * When a driver class name is configured it is loaded explicitly on construction; when it is
 * blank, JDBC 4 auto-loading is relied upon.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DriverManagerConnectionFactory implements ConnectionFactory {

    private final ConnectionConfig config;

    /**
     * Creates a factory.
     *
     * @param config server connection settings
     * @throws IllegalStateException if the configured driver class cannot be found
     */
    public DriverManagerConnectionFactory(ConnectionConfig config) {
        this.config = config;
        if (StringUtils.isNotBlank(config.getDriverClass())) {
            try {
                Class.forName(config.getDriverClass());
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException(
                        "JDBC driver class not found: " + config.getDriverClass(), e);
            }
        }
    }

    @Override
    public Connection open(String database) throws SQLException {
        String url = config.jdbcUrl(database);
        log.debug("Opening connection: {}", url);
        return DriverManager.getConnection(url, config.getUser(), config.getPassword());
    }
}
