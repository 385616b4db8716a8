package io.github.yok.bucketdblink.core;

import java.sql.Types;
import lombok.Getter;

/**
 * Relational type assigned to a merged column.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ColumnType {

    INTEGER("INTEGER", Types.INTEGER) {
        @Override
        public Object toSqlValue(String cell) {
            return Long.valueOf(cell.trim());
        }
    },

    REAL("REAL", Types.REAL) {
        @Override
        public Object toSqlValue(String cell) {
            return Double.valueOf(cell.trim());
        }
    },

    TEXT("TEXT", Types.VARCHAR) {
        @Override
        public Object toSqlValue(String cell) {
            return cell;
        }
    };

    // Type name used in CREATE TABLE
    private final String sqlName;
    // JDBC type used when binding NULL
    private final int jdbcType;

    ColumnType(String sqlName, int jdbcType) {
        this.sqlName = sqlName;
        this.jdbcType = jdbcType;
    }

    /**
     * Converts a non-missing cell into the value bound to the INSERT statement.
     *
     * @param cell raw CSV value, never {@code null}
     * @return {@link Long}, {@link Double} or {@link String}
     */
    public abstract Object toSqlValue(String cell);
}
