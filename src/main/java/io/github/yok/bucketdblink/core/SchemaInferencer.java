package io.github.yok.bucketdblink.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Infers a {@link ColumnType} for each column of a merged dataset.
 *
 * <p>
 * The classification runs over the whole merged column, so a single non-numeric value in any
 * shard makes the column {@link ColumnType#TEXT}:
 * </p>
 * <ul>
 * <li>{@link ColumnType#INTEGER}: no missing values and every value is a 64-bit integer
 * literal</li>
 * <li>{@link ColumnType#REAL}: every present value is a decimal number; missing values count as
 * floating NaN, so an integer column with gaps, or a column whose values are all missing, is
 * REAL</li>
 * <li>{@link ColumnType#TEXT}: anything else, including a column without rows</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaInferencer {

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_LITERAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Infers the columns of a dataset.
     *
     * @param dataset merged dataset
     * @return one column per dataset column, in order
     */
    public List<InferredColumn> infer(MergedDataset dataset) {
        List<InferredColumn> columns = new ArrayList<>(dataset.columnCount());
        for (int i = 0; i < dataset.columnCount(); i++) {
            columns.add(new InferredColumn(dataset.getColumns().get(i),
                    classify(dataset.column(i))));
        }
        log.debug("Inferred columns: {}", columns);
        return columns;
    }

    /**
     * Classifies one column.
     *
     * @param values all values of the column; {@code null} marks a missing value
     * @return inferred type
     */
    public static ColumnType classify(List<String> values) {
        if (values.isEmpty()) {
            return ColumnType.TEXT;
        }
        boolean integral = true;
        for (String value : values) {
            if (value == null) {
                integral = false;
                continue;
            }
            String v = value.trim();
            if (integral && !isLong(v)) {
                integral = false;
            }
            if (!integral && !DECIMAL_LITERAL.matcher(v).matches()) {
                return ColumnType.TEXT;
            }
        }
        return integral ? ColumnType.INTEGER : ColumnType.REAL;
    }

    private static boolean isLong(String v) {
        if (!INTEGER_LITERAL.matcher(v).matches()) {
            return false;
        }
        try {
            Long.parseLong(v);
            return true;
        } catch (NumberFormatException e) {
            // outside the 64-bit range
            return false;
        }
    }
}
