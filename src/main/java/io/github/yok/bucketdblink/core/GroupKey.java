package io.github.yok.bucketdblink.core;

import java.util.Comparator;
import lombok.Value;

/**
 * Target location of a group of objects: database, schema and table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class GroupKey implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator.comparing(GroupKey::getDatabase)
            .thenComparing(GroupKey::getSchema).thenComparing(GroupKey::getTable);

    String database;
    String schema;
    String table;

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * Renders the key as {@code database.schema.table} for logs.
     *
     * @return dotted key
     */
    @Override
    public String toString() {
        return database + "." + schema + "." + table;
    }
}
