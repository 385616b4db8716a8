package io.github.yok.bucketdblink.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import io.github.yok.bucketdblink.db.SqlIdentifiers;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Bulk-inserts merged rows and image metadata into provisioned tables.
 *
 * <p>
 * Rows are sent as multi-row {@code INSERT ... VALUES (...), (...) ON CONFLICT DO NOTHING}
 * statements of at most {@code pageSize} rows each, fewer for wide tables so that one statement
 * stays within the driver's bind parameter limit. All pages of a group share one transaction
 * that is committed once at the end; on failure it is rolled back and the exception propagates.
 * </p>
 *
 * <p>
 * Tabular tables carry no unique constraint, so the conflict clause never fires for them and a
 * second run inserts every row again. Image tables are unique on {@code url}, so a second run
 * inserts nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataLoader {

    /**
     * Binds one item to consecutive parameters of an INSERT statement.
     *
     * @param <T> item type
     */
    @FunctionalInterface
    interface RowBinder<T> {

        /**
         * Binds an item.
         *
         * @param ps statement
         * @param index first parameter index to use
         * @param item item to bind
         * @return next free parameter index
         * @throws SQLException on bind failure
         */
        int bind(PreparedStatement ps, int index, T item) throws SQLException;
    }

    // Bind parameter limit of one PostgreSQL statement (16-bit count in the wire protocol)
    static final int MAX_BIND_PARAMETERS = 65535;

    private final int pageSize;

    /**
     * Creates a loader.
     *
     * @param pageSize maximum rows per INSERT statement
     */
    public DataLoader(int pageSize) {
        Preconditions.checkArgument(pageSize > 0, "pageSize must be positive: %s", pageSize);
        this.pageSize = pageSize;
    }

    /**
     * Inserts the rows of a merged dataset.
     *
     * @param connection connection to the group's database (autocommit off)
     * @param key target table
     * @param dataset merged rows
     * @param columns inferred columns, same order as {@code dataset}
     * @return number of rows inserted
     * @throws SQLException on insert failure; the transaction is rolled back first
     */
    public int loadRows(Connection connection, GroupKey key, MergedDataset dataset,
            List<InferredColumn> columns) throws SQLException {
        List<String> names =
                columns.stream().map(InferredColumn::getName).collect(Collectors.toList());
        String head = "INSERT INTO " + SqlIdentifiers.qualified(key.getSchema(), key.getTable())
                + " (" + SqlIdentifiers.quoteAll(names) + ") VALUES ";
        return insertPaged(connection, key, head, " ON CONFLICT DO NOTHING", columns.size(),
                dataset.getRows(), (ps, index, row) -> {
                    int p = index;
                    for (int i = 0; i < columns.size(); i++) {
                        ColumnType type = columns.get(i).getType();
                        String cell = row.get(i);
                        if (cell == null) {
                            ps.setNull(p++, type.getJdbcType());
                        } else {
                            ps.setObject(p++, type.toSqlValue(cell));
                        }
                    }
                    return p;
                });
    }

    /**
     * Inserts image metadata rows, skipping URLs already present.
     *
     * @param connection connection to the group's database (autocommit off)
     * @param key target table
     * @param records image rows
     * @return number of rows inserted
     * @throws SQLException on insert failure; the transaction is rolled back first
     */
    public int loadImages(Connection connection, GroupKey key, List<ImageRecord> records)
            throws SQLException {
        String head = "INSERT INTO " + SqlIdentifiers.qualified(key.getSchema(), key.getTable())
                + " (file_name, url) VALUES ";
        return insertPaged(connection, key, head, " ON CONFLICT (url) DO NOTHING", 2, records,
                (ps, index, record) -> {
                    ps.setString(index, record.getFileName());
                    ps.setString(index + 1, record.getUrl());
                    return index + 2;
                });
    }

    private <T> int insertPaged(Connection connection, GroupKey key, String head, String tail,
            int width, List<T> items, RowBinder<T> binder) throws SQLException {
        int inserted = 0;
        try {
            for (List<T> page : Lists.partition(items, rowsPerPage(pageSize, width))) {
                try (PreparedStatement ps =
                        connection.prepareStatement(insertSql(head, tail, width, page.size()))) {
                    int index = 1;
                    for (T item : page) {
                        index = binder.bind(ps, index, item);
                    }
                    inserted += ps.executeUpdate();
                }
            }
            connection.commit();
        } catch (SQLException e) {
            Transactions.rollback(connection, key, e);
            throw e;
        }
        log.info("[{}] Table[{}] submitted={}, inserted={}, skipped={}", key.getDatabase(),
                key.getSchema() + "." + key.getTable(), items.size(), inserted,
                items.size() - inserted);
        return inserted;
    }

    /**
     * Returns the rows per INSERT statement for a table of the given width.
     *
     * @param pageSize configured maximum rows per statement
     * @param width bind parameters per row
     * @return {@code pageSize}, reduced so that {@code rows * width} does not exceed
     *         {@link #MAX_BIND_PARAMETERS}; at least 1
     */
    static int rowsPerPage(int pageSize, int width) {
        return Math.max(1, Math.min(pageSize, MAX_BIND_PARAMETERS / Math.max(1, width)));
    }

    /**
     * Builds a multi-row INSERT with {@code rows} placeholder tuples.
     *
     * @param head statement up to and including {@code VALUES }
     * @param tail conflict clause
     * @param width placeholders per tuple
     * @param rows number of tuples
     * @return SQL text
     */
    static String insertSql(String head, String tail, int width, int rows) {
        String tuple = "(" + String.join(", ", Collections.nCopies(width, "?")) + ")";
        return head + String.join(", ", Collections.nCopies(rows, tuple)) + tail;
    }
}
