package io.github.yok.bucketdblink.core;

import io.github.yok.bucketdblink.db.SqlIdentifiers;
import lombok.Value;

/**
 * Column name with its inferred type.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class InferredColumn {

    String name;
    ColumnType type;

    /**
     * Renders the column definition used in CREATE TABLE.
     *
     * @return e.g. {@code "amount" REAL}
     */
    public String definition() {
        return SqlIdentifiers.quote(name) + " " + type.getSqlName();
    }
}
