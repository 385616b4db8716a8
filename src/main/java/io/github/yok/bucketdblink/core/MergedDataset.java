package io.github.yok.bucketdblink.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Rows of all shards of one group, concatenated.
 *
 * <p>
 * Cells are raw CSV strings; {@code null} marks a missing value. Every row has exactly
 * {@link #columnCount()} cells.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class MergedDataset {

    // column names in order
    private final List<String> columns;
    // rows in order, each padded to the column count
    private final List<List<String>> rows;

    /**
     * Creates a dataset. Rows must already be padded to the column count.
     *
     * @param columns column names in order
     * @param rows rows in order
     * @throws IllegalArgumentException if a row width differs from the column count
     */
    public MergedDataset(List<String> columns, List<List<String>> rows) {
        this.columns = List.copyOf(columns);
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row width " + row.size()
                        + " does not match column count " + columns.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns all values of one column, top to bottom.
     *
     * @param index zero-based column index
     * @return column values; may contain {@code null}
     */
    public List<String> column(int index) {
        return rows.stream().map(r -> r.get(index)).collect(Collectors.toList());
    }
}
