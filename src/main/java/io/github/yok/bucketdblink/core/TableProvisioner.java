package io.github.yok.bucketdblink.core;

import io.github.yok.bucketdblink.db.SqlIdentifiers;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates target databases, schemas and tables when they are absent.
 *
 * <p>
 * Every operation is idempotent: existing objects are left untouched and never altered, so
 * calling it on every run is safe. Column sets are not compared with an existing table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableProvisioner {

    // Fixed layout of image metadata tables
    static final String IMAGE_TABLE_COLUMNS =
            "id SERIAL PRIMARY KEY, file_name TEXT NOT NULL, url TEXT NOT NULL UNIQUE";

    /**
     * Creates the database if the server catalog does not list it.
     *
     * <p>
     * {@code CREATE DATABASE} cannot run inside a transaction block, so the administrative
     * connection is switched to autocommit.
     * </p>
     *
     * @param admin connection to the administrative database
     * @param database database to ensure
     * @throws SQLException on catalog lookup or creation failure
     */
    public void ensureDatabase(Connection admin, String database) throws SQLException {
        admin.setAutoCommit(true);
        try (PreparedStatement ps =
                admin.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
            ps.setString(1, database);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    log.info("Database '{}' already exists.", database);
                    return;
                }
            }
        }
        try (Statement st = admin.createStatement()) {
            st.execute("CREATE DATABASE " + SqlIdentifiers.quote(database));
        }
        log.info("Database '{}' created successfully.", database);
    }

    /**
     * Creates the schema and a table with the inferred columns, then commits.
     *
     * @param connection connection to the group's database (autocommit off)
     * @param key target location
     * @param columns inferred columns in dataset order
     * @throws SQLException on DDL failure; the transaction is rolled back first
     */
    public void ensureTable(Connection connection, GroupKey key, List<InferredColumn> columns)
            throws SQLException {
        String definitions =
                columns.stream().map(InferredColumn::definition).collect(Collectors.joining(", "));
        createTable(connection, key, definitions, true);
    }

    /**
     * Creates the schema and the fixed image metadata table without committing. The statements
     * stay in the open transaction and are committed together with the image rows by
     * {@link DataLoader#loadImages}.
     *
     * @param connection connection to the group's database (autocommit off)
     * @param key target location
     * @throws SQLException on DDL failure; the transaction is rolled back first
     */
    public void ensureImageTable(Connection connection, GroupKey key) throws SQLException {
        createTable(connection, key, IMAGE_TABLE_COLUMNS, false);
    }

    private void createTable(Connection connection, GroupKey key, String definitions,
            boolean commit) throws SQLException {
        String schemaSql = "CREATE SCHEMA IF NOT EXISTS " + SqlIdentifiers.quote(key.getSchema());
        String tableSql = "CREATE TABLE IF NOT EXISTS "
                + SqlIdentifiers.qualified(key.getSchema(), key.getTable()) + " (" + definitions
                + ")";
        try (Statement st = connection.createStatement()) {
            st.execute(schemaSql);
            st.execute(tableSql);
            if (commit) {
                connection.commit();
            }
            log.info("[{}] Table ensured: {}", key, tableSql);
        } catch (SQLException e) {
            Transactions.rollback(connection, key, e);
            throw e;
        }
    }
}
