package io.github.yok.bucketdblink.config;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.ToString;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the target PostgreSQL server, bound from the {@code database.*}
 * properties of {@code application.yml}.
 *
 * <pre>
 * database:
 *   host: localhost
 *   port: 5432
 *   user: loader
 *   password: secret
 *   admin-database: postgres
 *   driver-class: org.postgresql.Driver
 * </pre>
 *
 * <p>
 * One server hosts every target database; the database name is chosen per group from the object
 * path, so only the database part of the JDBC URL varies. Instances are immutable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@ConfigurationProperties(prefix = "database")
public class ConnectionConfig {

    // Server host name
    String host;
    // Server port
    int port;
    // Login user shared by every target database
    String user;
    // Login password
    @ToString.Exclude
    String password;
    // Database used for catalog lookups and CREATE DATABASE (e.g., "postgres")
    String adminDatabase;
    // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
    String driverClass;

    /**
     * Creates connection settings.
     *
     * @param host server host name
     * @param port server port
     * @param user login user
     * @param password login password
     * @param adminDatabase administrative database name
     * @param driverClass JDBC driver class name, or blank
     */
    public ConnectionConfig(@DefaultValue("localhost") String host,
            @DefaultValue("5432") int port, String user, String password,
            @DefaultValue("postgres") String adminDatabase,
            @DefaultValue("org.postgresql.Driver") String driverClass) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.adminDatabase = adminDatabase;
        this.driverClass = driverClass;
    }

    /**
     * Builds the JDBC URL for the given database on the configured server.
     *
     * @param database database name (URL-encoded into the path)
     * @return JDBC URL such as {@code jdbc:postgresql://localhost:5432/salesdb}
     */
    public String jdbcUrl(String database) {
        String encoded = URLEncoder.encode(database, StandardCharsets.UTF_8).replace("+", "%20");
        return "jdbc:postgresql://" + host + ":" + port + "/" + encoded;
    }
}
